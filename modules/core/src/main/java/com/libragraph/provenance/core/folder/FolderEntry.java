package com.libragraph.provenance.core.folder;

import com.libragraph.provenance.types.EntryType;

import java.util.Objects;

/**
 * An immediate child of a {@link Folder}: its name and what kind of entry it is.
 */
public record FolderEntry(String name, EntryType type) {

    public FolderEntry {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(type, "type cannot be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("name cannot be empty");
        }
    }

    public static FolderEntry file(String name) {
        return new FolderEntry(name, EntryType.FILE);
    }

    public static FolderEntry directory(String name) {
        return new FolderEntry(name, EntryType.DIRECTORY);
    }

    public static FolderEntry other(String name) {
        return new FolderEntry(name, EntryType.OTHER);
    }
}

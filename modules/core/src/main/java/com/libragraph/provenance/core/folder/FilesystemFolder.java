package com.libragraph.provenance.core.folder;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * {@link Folder} backed by a directory on the local filesystem.
 *
 * <p>Symbolic links are followed. A directory link that resolves to one of
 * the enclosing folders fails with {@link FolderReadException}. Entries that
 * are neither regular files nor directories (sockets, device nodes, dangling
 * links) are listed as {@link com.libragraph.provenance.types.EntryType#OTHER}.
 */
public final class FilesystemFolder implements Folder {

    private final Path root;
    // real paths of the enclosing folders
    private final Set<Path> ancestors;

    public FilesystemFolder(Path root) {
        this(Objects.requireNonNull(root, "root cannot be null").toAbsolutePath().normalize(), Set.of());
    }

    private FilesystemFolder(Path root, Set<Path> ancestors) {
        this.root = root;
        this.ancestors = ancestors;
    }

    public static FilesystemFolder of(Path root) {
        return new FilesystemFolder(root);
    }

    @Override
    public List<FolderEntry> list() {
        if (!Files.isDirectory(root)) {
            throw new FolderReadException("Not a directory: " + root);
        }
        try (DirectoryStream<Path> children = Files.newDirectoryStream(root)) {
            List<FolderEntry> entries = new ArrayList<>();
            for (Path child : children) {
                String name = child.getFileName().toString();
                if (Files.isRegularFile(child)) {
                    entries.add(FolderEntry.file(name));
                } else if (Files.isDirectory(child)) {
                    entries.add(FolderEntry.directory(name));
                } else {
                    entries.add(FolderEntry.other(name));
                }
            }
            return entries;
        } catch (IOException e) {
            throw new FolderReadException("Failed to list folder: " + root, e);
        }
    }

    @Override
    public InputStream open(String name) {
        Path file = resolveChild(name);
        try {
            return Files.newInputStream(file);
        } catch (IOException e) {
            throw new FolderReadException("Failed to read file: " + file, e);
        }
    }

    @Override
    public Folder subfolder(String name) {
        Path dir = resolveChild(name);
        if (!Files.isDirectory(dir)) {
            throw new FolderReadException("Not a directory: " + dir);
        }
        Set<Path> enclosing = new HashSet<>(ancestors);
        try {
            enclosing.add(root.toRealPath());
            if (enclosing.contains(dir.toRealPath())) {
                throw new FolderReadException("Directory link cycle: " + dir);
            }
        } catch (IOException e) {
            throw new FolderReadException("Failed to resolve directory: " + dir, e);
        }
        return new FilesystemFolder(dir, Set.copyOf(enclosing));
    }

    private Path resolveChild(String name) {
        Objects.requireNonNull(name, "name cannot be null");
        if (name.isEmpty() || name.equals(".") || name.equals("..")) {
            throw new IllegalArgumentException("Not an immediate child name: " + name);
        }
        Path child = root.resolve(name);
        if (!root.equals(child.getParent())) {
            throw new IllegalArgumentException("Not an immediate child name: " + name);
        }
        return child;
    }

    @Override
    public String toString() {
        return "FilesystemFolder[" + root + "]";
    }
}

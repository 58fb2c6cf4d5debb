package com.libragraph.provenance.core.folder;

import java.io.InputStream;
import java.util.List;

/**
 * Read-only view of a directory tree whose content can be hashed.
 *
 * <p>The folder's own name is not visible through this interface: only
 * the names and content of what it contains.
 */
public interface Folder {

    /**
     * Lists the immediate children, in no particular order. Children that
     * cannot be hashed are listed as {@link com.libragraph.provenance.types.EntryType#OTHER}
     * rather than failing the listing.
     *
     * @throws FolderReadException if the folder cannot be listed
     */
    List<FolderEntry> list();

    /**
     * Opens a file child for streaming. The caller closes the stream.
     *
     * @throws FolderReadException if the file cannot be opened
     */
    InputStream open(String name);

    /**
     * Returns a sub-folder child.
     *
     * @throws FolderReadException if {@code name} is not a directory
     */
    Folder subfolder(String name);
}

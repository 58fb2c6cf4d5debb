package com.libragraph.provenance.core.folder;

/**
 * Wraps checked I/O exceptions from folder listing and file reads.
 */
public class FolderReadException extends RuntimeException {

    public FolderReadException(String message, Throwable cause) {
        super(message, cause);
    }

    public FolderReadException(String message) {
        super(message);
    }
}

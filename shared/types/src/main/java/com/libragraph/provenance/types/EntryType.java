package com.libragraph.provenance.types;

/**
 * Kind of a folder entry. OTHER covers anything that has no content to hash:
 * sockets, FIFOs, device nodes and dangling links.
 */
public enum EntryType {
    FILE,
    DIRECTORY,
    OTHER
}

package com.libragraph.provenance.core.hash;

import java.nio.charset.StandardCharsets;

/**
 * Semantic tags bound into every leaf digest as BLAKE2b personalization.
 *
 * <p>Labels are part of the digest format: renaming one changes every hash
 * that contains a value of that category.
 */
public enum LeafTag {
    STR("str"),
    BOOL("bool"),
    NONE("none"),
    INT("int"),
    FLOAT("float"),
    COMPLEX("complex"),
    LIST_OPEN("list("),
    SET_OPEN("set("),
    DICT_OPEN("dict("),
    ODICT_OPEN("odict("),
    DATETIME("datetime"),
    UUID("uuid"),
    FOLDER("folder"),
    FILE_NAME("fname"),
    FILE_CONTENT("fcontent"),
    DIR_OPEN("dir("),
    CLOSE(")");

    private final byte[] personalization;

    LeafTag(String label) {
        this.personalization = label.getBytes(StandardCharsets.US_ASCII);
    }

    byte[] personalization() {
        return personalization.clone();
    }
}

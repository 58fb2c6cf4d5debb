package com.libragraph.provenance.core.hash;

import java.util.Collection;
import java.util.Objects;
import java.util.Set;

/**
 * Knobs for {@link CanonicalHasher}.
 *
 * @param floatPrecision             significant digits kept when rendering reals, complex
 *                                   components and timestamps
 * @param treatOrderedMapAsUnordered hash {@link com.libragraph.provenance.types.OrderedMapping}
 *                                   values as plain unordered mappings, nested ones included
 * @param folderIgnoreNames          entry names skipped at every level of a folder walk
 */
public record HashOptions(
        int floatPrecision,
        boolean treatOrderedMapAsUnordered,
        Set<String> folderIgnoreNames
) {
    /** System-wide float precision. */
    public static final int DEFAULT_FLOAT_PRECISION = 14;

    private static final HashOptions DEFAULTS =
            new HashOptions(DEFAULT_FLOAT_PRECISION, false, Set.of());

    public HashOptions {
        if (floatPrecision < 1) {
            throw new IllegalArgumentException("floatPrecision must be >= 1, got: " + floatPrecision);
        }
        Objects.requireNonNull(folderIgnoreNames, "folderIgnoreNames cannot be null");
        folderIgnoreNames = Set.copyOf(folderIgnoreNames);
    }

    public static HashOptions defaults() {
        return DEFAULTS;
    }

    public HashOptions withFloatPrecision(int floatPrecision) {
        return new HashOptions(floatPrecision, treatOrderedMapAsUnordered, folderIgnoreNames);
    }

    public HashOptions withOrderedMapAsUnordered(boolean treatOrderedMapAsUnordered) {
        return new HashOptions(floatPrecision, treatOrderedMapAsUnordered, folderIgnoreNames);
    }

    public HashOptions withFolderIgnoreNames(Collection<String> names) {
        return new HashOptions(floatPrecision, treatOrderedMapAsUnordered, Set.copyOf(names));
    }
}

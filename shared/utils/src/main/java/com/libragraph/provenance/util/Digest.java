package com.libragraph.provenance.util;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Represents a 32-byte canonical digest (BLAKE2b-256, tree mode).
 * Immutable value object that can be used as a map key or a cache key.
 *
 * <p>Ordering is unsigned lexicographic over the bytes, the same order
 * used to sort set elements and mapping keys during hashing.
 */
public record Digest(byte[] bytes) implements Comparable<Digest> {
    public static final int LENGTH = 32;
    private static final HexFormat HEX_FORMAT = HexFormat.of();

    public Digest {
        Objects.requireNonNull(bytes, "Digest bytes cannot be null");
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException(
                "Digest must be 32 bytes, got: " + bytes.length
            );
        }
        bytes = Arrays.copyOf(bytes, bytes.length);
    }

    /**
     * Creates Digest from hex string (64 characters, either case).
     */
    public static Digest fromHex(String hex) {
        Objects.requireNonNull(hex, "hex string cannot be null");
        if (hex.length() != LENGTH * 2) {
            throw new IllegalArgumentException(
                "Digest hex string must be 64 characters, got: " + hex.length()
            );
        }
        try {
            return new Digest(HEX_FORMAT.parseHex(hex));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid hex string: " + hex, e);
        }
    }

    @Override
    public byte[] bytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    /**
     * Returns lowercase hex representation (64 characters).
     */
    public String toHex() {
        return HEX_FORMAT.formatHex(bytes);
    }

    @Override
    public int compareTo(Digest other) {
        return Arrays.compareUnsigned(bytes, other.bytes);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Digest other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}

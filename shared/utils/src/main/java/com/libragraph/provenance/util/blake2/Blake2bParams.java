package com.libragraph.provenance.util.blake2;

import java.util.Arrays;

/**
 * BLAKE2b parameter block (RFC 7693 section 2.8, plus the tree-hashing fields
 * from the BLAKE2 paper).
 *
 * <p>Keyed hashing is not supported, so the key length byte is always zero.
 * Salt and personalization shorter than 16 bytes are zero padded.
 */
public record Blake2bParams(
        int digestLength,
        int fanout,
        int depth,
        long leafLength,
        long nodeOffset,
        int nodeDepth,
        int innerLength,
        byte[] salt,
        byte[] personal,
        boolean lastNode
) {
    private static final byte[] NONE = new byte[0];

    public Blake2bParams {
        if (digestLength < 1 || digestLength > Blake2b.MAX_DIGEST_BYTES) {
            throw new IllegalArgumentException("digestLength must be in [1, 64], got: " + digestLength);
        }
        checkByte("fanout", fanout);
        checkByte("depth", depth);
        if (depth < 1) {
            throw new IllegalArgumentException("depth must be >= 1, got: " + depth);
        }
        if (leafLength < 0 || leafLength > 0xFFFFFFFFL) {
            throw new IllegalArgumentException("leafLength must fit in 32 bits, got: " + leafLength);
        }
        checkByte("nodeDepth", nodeDepth);
        if (innerLength < 0 || innerLength > Blake2b.MAX_DIGEST_BYTES) {
            throw new IllegalArgumentException("innerLength must be in [0, 64], got: " + innerLength);
        }
        salt = padded("salt", salt);
        personal = padded("personal", personal);
    }

    /**
     * Sequential-mode parameters (fanout 1, depth 1) for the given digest length.
     */
    public static Blake2bParams sequential(int digestLength) {
        return new Blake2bParams(digestLength, 1, 1, 0, 0, 0, 0, NONE, NONE, false);
    }

    public Blake2bParams withTree(int fanout, int depth, int innerLength) {
        return new Blake2bParams(digestLength, fanout, depth, leafLength, nodeOffset,
                nodeDepth, innerLength, salt, personal, lastNode);
    }

    public Blake2bParams withNodeDepth(int nodeDepth) {
        return new Blake2bParams(digestLength, fanout, depth, leafLength, nodeOffset,
                nodeDepth, innerLength, salt, personal, lastNode);
    }

    public Blake2bParams withSalt(byte[] salt) {
        return new Blake2bParams(digestLength, fanout, depth, leafLength, nodeOffset,
                nodeDepth, innerLength, salt, personal, lastNode);
    }

    public Blake2bParams withPersonal(byte[] personal) {
        return new Blake2bParams(digestLength, fanout, depth, leafLength, nodeOffset,
                nodeDepth, innerLength, salt, personal, lastNode);
    }

    public Blake2bParams withLastNode(boolean lastNode) {
        return new Blake2bParams(digestLength, fanout, depth, leafLength, nodeOffset,
                nodeDepth, innerLength, salt, personal, lastNode);
    }

    @Override
    public byte[] salt() {
        return salt.clone();
    }

    @Override
    public byte[] personal() {
        return personal.clone();
    }

    /**
     * Packs the parameter block into the eight words XORed into the IV.
     */
    long[] toWords() {
        long[] words = new long[8];
        words[0] = (digestLength & 0xFFL)
                | ((long) fanout & 0xFF) << 16
                | ((long) depth & 0xFF) << 24
                | (leafLength & 0xFFFFFFFFL) << 32;
        words[1] = nodeOffset;
        words[2] = (nodeDepth & 0xFFL) | ((long) innerLength & 0xFF) << 8;
        words[3] = 0L;
        words[4] = Blake2b.loadLong(salt, 0);
        words[5] = Blake2b.loadLong(salt, 8);
        words[6] = Blake2b.loadLong(personal, 0);
        words[7] = Blake2b.loadLong(personal, 8);
        return words;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Blake2bParams other)) return false;
        return digestLength == other.digestLength
                && fanout == other.fanout
                && depth == other.depth
                && leafLength == other.leafLength
                && nodeOffset == other.nodeOffset
                && nodeDepth == other.nodeDepth
                && innerLength == other.innerLength
                && lastNode == other.lastNode
                && Arrays.equals(salt, other.salt)
                && Arrays.equals(personal, other.personal);
    }

    @Override
    public int hashCode() {
        int h = Integer.hashCode(digestLength);
        h = 31 * h + fanout;
        h = 31 * h + depth;
        h = 31 * h + Long.hashCode(leafLength);
        h = 31 * h + Long.hashCode(nodeOffset);
        h = 31 * h + nodeDepth;
        h = 31 * h + innerLength;
        h = 31 * h + Boolean.hashCode(lastNode);
        h = 31 * h + Arrays.hashCode(salt);
        h = 31 * h + Arrays.hashCode(personal);
        return h;
    }

    @Override
    public String toString() {
        return "Blake2bParams[digestLength=" + digestLength
                + ", fanout=" + fanout
                + ", depth=" + depth
                + ", nodeDepth=" + nodeDepth
                + ", innerLength=" + innerLength
                + ", lastNode=" + lastNode + "]";
    }

    private static void checkByte(String name, int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException(name + " must be in [0, 255], got: " + value);
        }
    }

    private static byte[] padded(String name, byte[] value) {
        if (value == null) {
            return new byte[16];
        }
        if (value.length > 16) {
            throw new IllegalArgumentException(name + " must be at most 16 bytes, got: " + value.length);
        }
        return Arrays.copyOf(value, 16);
    }
}

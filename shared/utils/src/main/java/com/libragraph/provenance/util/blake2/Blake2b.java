package com.libragraph.provenance.util.blake2;

import java.util.Arrays;
import java.util.Objects;

/**
 * BLAKE2b message digest with the full parameter block, including the
 * tree-hashing fields (fanout, depth, node depth, inner length, last node).
 *
 * <p>Not thread-safe. An instance produces exactly one digest; create a new
 * one per message.
 */
public final class Blake2b {

    public static final int BLOCK_BYTES = 128;
    public static final int MAX_DIGEST_BYTES = 64;

    private static final int ROUNDS = 12;

    private static final long[] IV = {
            0x6a09e667f3bcc908L, 0xbb67ae8584caa73bL,
            0x3c6ef372fe94f82bL, 0xa54ff53a5f1d36f1L,
            0x510e527fade682d1L, 0x9b05688c2b3e6c1fL,
            0x1f83d9abfb41bd6bL, 0x5be0cd19137e2179L
    };

    private static final byte[][] SIGMA = {
            {0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15},
            {14, 10, 4, 8, 9, 15, 13, 6, 1, 12, 0, 2, 11, 7, 5, 3},
            {11, 8, 12, 0, 5, 2, 15, 13, 10, 14, 3, 6, 7, 1, 9, 4},
            {7, 9, 3, 1, 13, 12, 11, 14, 2, 6, 5, 10, 4, 0, 15, 8},
            {9, 0, 5, 7, 2, 4, 10, 15, 14, 1, 11, 12, 6, 8, 3, 13},
            {2, 12, 6, 10, 0, 11, 8, 3, 4, 13, 7, 5, 15, 14, 1, 9},
            {12, 5, 1, 15, 14, 13, 4, 10, 0, 7, 6, 3, 9, 2, 8, 11},
            {13, 11, 7, 14, 12, 1, 3, 9, 5, 0, 15, 4, 8, 6, 2, 10},
            {6, 15, 14, 9, 11, 3, 0, 8, 12, 2, 13, 7, 1, 4, 10, 5},
            {10, 2, 8, 4, 7, 6, 1, 5, 15, 11, 9, 14, 3, 12, 13, 0}
    };

    private final int digestLength;
    private final boolean lastNode;
    private final long[] h = new long[8];
    private final long[] v = new long[16];
    private final long[] m = new long[16];
    private final byte[] buffer = new byte[BLOCK_BYTES];
    private int bufferLength;
    private long t0;
    private long t1;
    private boolean finished;

    public Blake2b(Blake2bParams params) {
        Objects.requireNonNull(params, "params cannot be null");
        this.digestLength = params.digestLength();
        this.lastNode = params.lastNode();
        long[] words = params.toWords();
        for (int i = 0; i < 8; i++) {
            h[i] = IV[i] ^ words[i];
        }
    }

    /**
     * Hashes {@code data} in one call.
     */
    public static byte[] digest(Blake2bParams params, byte[] data) {
        return new Blake2b(params).update(data).digest();
    }

    public Blake2b update(byte[] data) {
        return update(data, 0, data.length);
    }

    public Blake2b update(byte[] data, int offset, int length) {
        Objects.checkFromIndexSize(offset, length, data.length);
        if (finished) {
            throw new IllegalStateException("digest() already called");
        }
        while (length > 0) {
            // The final block is compressed in digest(), so a full buffer is
            // only flushed once more input arrives.
            if (bufferLength == BLOCK_BYTES) {
                incrementCounter(BLOCK_BYTES);
                compress(buffer, false);
                bufferLength = 0;
            }
            int n = Math.min(length, BLOCK_BYTES - bufferLength);
            System.arraycopy(data, offset, buffer, bufferLength, n);
            bufferLength += n;
            offset += n;
            length -= n;
        }
        return this;
    }

    /**
     * Finishes the computation and returns the digest.
     *
     * @throws IllegalStateException if called twice
     */
    public byte[] digest() {
        if (finished) {
            throw new IllegalStateException("digest() already called");
        }
        finished = true;
        incrementCounter(bufferLength);
        Arrays.fill(buffer, bufferLength, BLOCK_BYTES, (byte) 0);
        compress(buffer, true);

        byte[] out = new byte[digestLength];
        for (int i = 0; i < digestLength; i++) {
            out[i] = (byte) (h[i >>> 3] >>> (8 * (i & 7)));
        }
        return out;
    }

    private void incrementCounter(int n) {
        t0 += n;
        if (Long.compareUnsigned(t0, n) < 0) {
            t1++;
        }
    }

    private void compress(byte[] block, boolean finalBlock) {
        for (int i = 0; i < 16; i++) {
            m[i] = loadLong(block, i * 8);
        }
        System.arraycopy(h, 0, v, 0, 8);
        System.arraycopy(IV, 0, v, 8, 8);
        v[12] ^= t0;
        v[13] ^= t1;
        if (finalBlock) {
            v[14] = ~v[14];
            if (lastNode) {
                v[15] = ~v[15];
            }
        }

        for (int r = 0; r < ROUNDS; r++) {
            byte[] s = SIGMA[r % 10];
            mix(0, 4, 8, 12, m[s[0]], m[s[1]]);
            mix(1, 5, 9, 13, m[s[2]], m[s[3]]);
            mix(2, 6, 10, 14, m[s[4]], m[s[5]]);
            mix(3, 7, 11, 15, m[s[6]], m[s[7]]);
            mix(0, 5, 10, 15, m[s[8]], m[s[9]]);
            mix(1, 6, 11, 12, m[s[10]], m[s[11]]);
            mix(2, 7, 8, 13, m[s[12]], m[s[13]]);
            mix(3, 4, 9, 14, m[s[14]], m[s[15]]);
        }

        for (int i = 0; i < 8; i++) {
            h[i] ^= v[i] ^ v[i + 8];
        }
    }

    private void mix(int a, int b, int c, int d, long x, long y) {
        v[a] = v[a] + v[b] + x;
        v[d] = Long.rotateRight(v[d] ^ v[a], 32);
        v[c] = v[c] + v[d];
        v[b] = Long.rotateRight(v[b] ^ v[c], 24);
        v[a] = v[a] + v[b] + y;
        v[d] = Long.rotateRight(v[d] ^ v[a], 16);
        v[c] = v[c] + v[d];
        v[b] = Long.rotateRight(v[b] ^ v[c], 63);
    }

    static long loadLong(byte[] b, int off) {
        return (b[off] & 0xFFL)
                | (b[off + 1] & 0xFFL) << 8
                | (b[off + 2] & 0xFFL) << 16
                | (b[off + 3] & 0xFFL) << 24
                | (b[off + 4] & 0xFFL) << 32
                | (b[off + 5] & 0xFFL) << 40
                | (b[off + 6] & 0xFFL) << 48
                | (b[off + 7] & 0xFFL) << 56;
    }
}

package com.libragraph.provenance.core.hash;

import com.libragraph.provenance.core.folder.Folder;
import com.libragraph.provenance.core.folder.FolderEntry;
import com.libragraph.provenance.core.folder.FolderReadException;
import com.libragraph.provenance.types.ComplexNumber;
import com.libragraph.provenance.types.OrderedMapping;
import com.libragraph.provenance.util.Digest;
import com.libragraph.provenance.util.FloatText;
import com.libragraph.provenance.util.blake2.Blake2b;
import com.libragraph.provenance.util.blake2.Blake2bParams;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Deterministic structural hash over nested values.
 *
 * <p>Hashing happens in two levels. Walking the value produces a flat sequence
 * of 32-byte leaf digests, one per scalar, container bracket or folder entry,
 * each computed with its {@link LeafTag} as BLAKE2b personalization. The
 * sequence is then folded into one digest by a BLAKE2b accumulator in
 * unlimited-fanout tree mode (node depth 1, last node), closed by an empty
 * last-node leaf.
 *
 * <p>Sets and {@link Map}s are canonicalised by sorting on digests, never on the
 * elements themselves, so any key or element type works and iteration order
 * is irrelevant. Lists, arrays and {@link OrderedMapping}s keep their order.
 *
 * <p>Supported types, checked in this order:
 * <ol>
 *   <li>{@code CharSequence}, {@code Character}, {@code byte[]} (UTF-8; text and its bytes collide by design)</li>
 *   <li>{@code Boolean}</li>
 *   <li>{@code null}</li>
 *   <li>{@code Byte}, {@code Short}, {@code Integer}, {@code Long}, {@code BigInteger},
 *       {@code AtomicInteger}, {@code AtomicLong}</li>
 *   <li>{@code Float}, {@code Double}, {@code BigDecimal}</li>
 *   <li>{@link ComplexNumber}</li>
 *   <li>{@code List} and arrays</li>
 *   <li>{@code Set}</li>
 *   <li>{@code Map} (unordered) and {@link OrderedMapping}</li>
 *   <li>{@code Instant}, {@code OffsetDateTime}, {@code ZonedDateTime},
 *       {@code LocalDateTime} (taken as UTC), {@code java.util.Date}</li>
 *   <li>{@code UUID}</li>
 *   <li>{@link Folder}</li>
 * </ol>
 * Anything else raises {@link UnhashableTypeException}.
 *
 * <p>With {@link HashOptions#treatOrderedMapAsUnordered()} set, every option keeps
 * applying below the top-level mapping, so nested {@link OrderedMapping}s also hash
 * as {@code dict(} and nested reals use the configured precision. Fingerprints
 * computed with options reset below the top-level mapping differ in that case.
 *
 * <p>File content is streamed, so folder files of any size are hashed in full.
 *
 * <p>Stateless and thread-safe.
 */
public final class CanonicalHasher {

    private static final Blake2bParams LEAF_PARAMS =
            Blake2bParams.sequential(Digest.LENGTH).withTree(0, 2, 64);

    private static final Blake2bParams ROOT_PARAMS =
            LEAF_PARAMS.withNodeDepth(1).withLastNode(true);

    private static final byte[] CLOSING_LEAF =
            Blake2b.digest(LEAF_PARAMS.withLastNode(true), new byte[0]);

    private static final byte[] EMPTY = new byte[0];

    private static final int READ_CHUNK_BYTES = 64 * 1024;

    private static final byte[] END = singleDigest(LeafTag.CLOSE, EMPTY);

    private static final Comparator<List<byte[]>> DIGEST_SEQUENCE_ORDER = (a, b) -> {
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            int c = Arrays.compareUnsigned(a.get(i), b.get(i));
            if (c != 0) return c;
        }
        return Integer.compare(a.size(), b.size());
    };

    private CanonicalHasher() {
    }

    public static Digest hash(Object value) {
        return hash(value, HashOptions.defaults());
    }

    /**
     * Computes the canonical digest of {@code value}.
     *
     * @throws UnhashableTypeException if {@code value} or anything nested in it has no hashing rule
     * @throws com.libragraph.provenance.core.folder.FolderReadException if a folder cannot be read
     */
    public static Digest hash(Object value, HashOptions options) {
        Blake2b root = new Blake2b(ROOT_PARAMS);
        for (byte[] leaf : leafDigests(value, options)) {
            root.update(leaf);
        }
        root.update(CLOSING_LEAF);
        return new Digest(root.digest());
    }

    public static String hashHex(Object value) {
        return hash(value).toHex();
    }

    public static String hashHex(Object value, HashOptions options) {
        return hash(value, options).toHex();
    }

    /**
     * Returns the leaf digest sequence that {@link #hash(Object, HashOptions)} folds.
     */
    public static List<byte[]> leafDigests(Object value, HashOptions options) {
        List<byte[]> out = new ArrayList<>();
        new Walker(options).emit(value, out);
        return out;
    }

    /**
     * One-shot leaf digest: BLAKE2b-256 of {@code payload} at node depth 0,
     * personalised with the tag label.
     */
    public static byte[] singleDigest(LeafTag tag, byte[] payload) {
        return Blake2b.digest(LEAF_PARAMS.withPersonal(tag.personalization()), payload);
    }

    /**
     * Orders names by Unicode code point, independent of UTF-16 surrogate layout.
     */
    static int compareCodePoints(String a, String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            int ca = a.codePointAt(i);
            int cb = b.codePointAt(j);
            if (ca != cb) {
                return Integer.compare(ca, cb);
            }
            i += Character.charCount(ca);
            j += Character.charCount(cb);
        }
        return Integer.compare(a.length() - i, b.length() - j);
    }

    private static final class Walker {

        private final HashOptions options;

        Walker(HashOptions options) {
            this.options = options;
        }

        void emit(Object value, List<byte[]> out) {
            if (value instanceof CharSequence || value instanceof Character) {
                out.add(singleDigest(LeafTag.STR, utf8(value.toString())));
            } else if (value instanceof byte[] bytes) {
                out.add(singleDigest(LeafTag.STR, bytes));
            } else if (value instanceof Boolean b) {
                out.add(singleDigest(LeafTag.BOOL, new byte[]{(byte) (b ? 1 : 0)}));
            } else if (value == null) {
                out.add(singleDigest(LeafTag.NONE, EMPTY));
            } else if (isIntegral(value)) {
                out.add(singleDigest(LeafTag.INT, utf8(value.toString())));
            } else if (value instanceof Double || value instanceof Float) {
                double d = ((Number) value).doubleValue();
                out.add(singleDigest(LeafTag.FLOAT, utf8(FloatText.format(d, options.floatPrecision()))));
            } else if (value instanceof BigDecimal dec) {
                out.add(singleDigest(LeafTag.FLOAT, utf8(FloatText.format(dec, options.floatPrecision()))));
            } else if (value instanceof ComplexNumber c) {
                String text = FloatText.format(c.real(), options.floatPrecision())
                        + "!" + FloatText.format(c.imaginary(), options.floatPrecision());
                out.add(singleDigest(LeafTag.COMPLEX, utf8(text)));
            } else if (value instanceof List<?> list) {
                emitSequence(list, out);
            } else if (value.getClass().isArray()) {
                emitSequence(arrayElements(value), out);
            } else if (value instanceof Set<?> set) {
                emitSet(set, out);
            } else if (value instanceof Map<?, ?> map) {
                emitUnorderedMapping(map, out);
            } else if (value instanceof OrderedMapping mapping) {
                if (options.treatOrderedMapAsUnordered()) {
                    emitUnorderedMapping(mapping.asMap(), out);
                } else {
                    emitOrderedMapping(mapping, out);
                }
            } else if (isTimestamp(value)) {
                String seconds = FloatText.format(epochSeconds(value), options.floatPrecision());
                out.add(singleDigest(LeafTag.DATETIME, utf8(seconds)));
            } else if (value instanceof UUID uuid) {
                out.add(singleDigest(LeafTag.UUID, uuidBytes(uuid)));
            } else if (value instanceof Folder folder) {
                out.add(singleDigest(LeafTag.FOLDER, EMPTY));
                emitFolderContent(folder, out);
            } else {
                throw new UnhashableTypeException(value.getClass());
            }
        }

        private void emitSequence(List<?> elements, List<byte[]> out) {
            out.add(singleDigest(LeafTag.LIST_OPEN, EMPTY));
            for (Object element : elements) {
                emit(element, out);
            }
            out.add(END);
        }

        private void emitSet(Set<?> set, List<byte[]> out) {
            List<List<byte[]>> elements = new ArrayList<>(set.size());
            for (Object element : set) {
                elements.add(digestsOf(element));
            }
            elements.sort(DIGEST_SEQUENCE_ORDER);

            out.add(singleDigest(LeafTag.SET_OPEN, EMPTY));
            for (List<byte[]> element : elements) {
                out.addAll(element);
            }
            out.add(END);
        }

        private void emitUnorderedMapping(Map<?, ?> map, List<byte[]> out) {
            record KeyedValue(List<byte[]> keyDigests, Object value) {}

            List<KeyedValue> entries = new ArrayList<>(map.size());
            for (Map.Entry<?, ?> e : map.entrySet()) {
                entries.add(new KeyedValue(digestsOf(e.getKey()), e.getValue()));
            }
            // stable: keys with identical digests (e.g. "a" and its UTF-8 bytes) keep map order
            entries.sort(Comparator.comparing(KeyedValue::keyDigests, DIGEST_SEQUENCE_ORDER));

            out.add(singleDigest(LeafTag.DICT_OPEN, EMPTY));
            for (KeyedValue entry : entries) {
                out.addAll(entry.keyDigests());
                emit(entry.value(), out);
            }
            out.add(END);
        }

        private void emitOrderedMapping(OrderedMapping mapping, List<byte[]> out) {
            out.add(singleDigest(LeafTag.ODICT_OPEN, EMPTY));
            for (Map.Entry<Object, Object> e : mapping.asMap().entrySet()) {
                emit(e.getKey(), out);
                emit(e.getValue(), out);
            }
            out.add(END);
        }

        private void emitFolderContent(Folder folder, List<byte[]> out) {
            List<FolderEntry> entries = new ArrayList<>(folder.list());
            entries.sort(Comparator.comparing(FolderEntry::name, CanonicalHasher::compareCodePoints));

            for (FolderEntry entry : entries) {
                String name = entry.name();
                if (options.folderIgnoreNames().contains(name)) {
                    continue;
                }
                switch (entry.type()) {
                    case FILE -> {
                        out.add(singleDigest(LeafTag.FILE_NAME, utf8(name)));
                        out.add(fileContentDigest(folder, name));
                    }
                    case DIRECTORY -> {
                        out.add(singleDigest(LeafTag.DIR_OPEN, utf8(name)));
                        emitFolderContent(folder.subfolder(name), out);
                        out.add(END);
                    }
                    default -> throw new FolderReadException(
                            "Unsupported folder entry: " + name + " in " + folder);
                }
            }
        }

        private List<byte[]> digestsOf(Object value) {
            List<byte[]> digests = new ArrayList<>();
            emit(value, digests);
            return digests;
        }
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Integer
                || value instanceof Long
                || value instanceof BigInteger
                || value instanceof Short
                || value instanceof Byte
                || value instanceof AtomicInteger
                || value instanceof AtomicLong;
    }

    private static boolean isTimestamp(Object value) {
        return value instanceof Instant
                || value instanceof OffsetDateTime
                || value instanceof ZonedDateTime
                || value instanceof LocalDateTime
                || value instanceof Date;
    }

    /**
     * Seconds since 1970-01-01T00:00:00Z, rounded once to the nearest double.
     */
    private static double epochSeconds(Object value) {
        Instant instant;
        if (value instanceof Instant i) {
            instant = i;
        } else if (value instanceof OffsetDateTime odt) {
            instant = odt.toInstant();
        } else if (value instanceof ZonedDateTime zdt) {
            instant = zdt.toInstant();
        } else if (value instanceof LocalDateTime ldt) {
            instant = ldt.toInstant(ZoneOffset.UTC);
        } else {
            instant = ((Date) value).toInstant();
        }
        return BigDecimal.valueOf(instant.getEpochSecond())
                .add(BigDecimal.valueOf(instant.getNano(), 9))
                .doubleValue();
    }

    private static byte[] fileContentDigest(Folder folder, String name) {
        Blake2b digest = new Blake2b(LEAF_PARAMS.withPersonal(LeafTag.FILE_CONTENT.personalization()));
        try (InputStream in = folder.open(name)) {
            byte[] chunk = new byte[READ_CHUNK_BYTES];
            int n;
            while ((n = in.read(chunk)) != -1) {
                digest.update(chunk, 0, n);
            }
        } catch (IOException e) {
            throw new FolderReadException("Failed to read file: " + name + " in " + folder, e);
        }
        return digest.digest();
    }

    /**
     * Boxes the elements of any array except {@code byte[]}, which hashes as text.
     */
    private static List<?> arrayElements(Object array) {
        if (array instanceof Object[] objects) {
            return Arrays.asList(objects);
        } else if (array instanceof int[] ints) {
            return Arrays.stream(ints).boxed().toList();
        } else if (array instanceof long[] longs) {
            return Arrays.stream(longs).boxed().toList();
        } else if (array instanceof double[] doubles) {
            return Arrays.stream(doubles).boxed().toList();
        }
        List<Object> elements = new ArrayList<>();
        if (array instanceof short[] shorts) {
            for (short v : shorts) elements.add(v);
        } else if (array instanceof float[] floats) {
            for (float v : floats) elements.add(v);
        } else if (array instanceof boolean[] flags) {
            for (boolean v : flags) elements.add(v);
        } else {
            for (char v : (char[]) array) elements.add(v);
        }
        return elements;
    }

    private static byte[] uuidBytes(UUID uuid) {
        return ByteBuffer.allocate(16)
                .putLong(uuid.getMostSignificantBits())
                .putLong(uuid.getLeastSignificantBits())
                .array();
    }

    private static byte[] utf8(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}

/**
 * Canonical structural hashing of nested values.
 *
 * <p>{@link com.libragraph.provenance.core.hash.CanonicalHasher} turns scalars, containers,
 * timestamps, UUIDs and folder trees into a 32-byte
 * {@link com.libragraph.provenance.util.Digest}. Equal content always gives the same digest,
 * across runs and regardless of container iteration order; the digest is the
 * fingerprint used to decide whether a computation can be reused.
 */
package com.libragraph.provenance.core.hash;

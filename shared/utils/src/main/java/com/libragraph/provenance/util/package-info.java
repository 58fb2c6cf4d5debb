/**
 * Shared utilities for all provenance modules.
 *
 * <p>Contains {@link com.libragraph.provenance.util.Digest} (32-byte canonical digest),
 * {@link com.libragraph.provenance.util.FloatText} (significant-digit rendering of reals)
 * and the {@link com.libragraph.provenance.util.blake2 BLAKE2b engine}.
 * No framework dependencies, pure Java.
 */
package com.libragraph.provenance.util;

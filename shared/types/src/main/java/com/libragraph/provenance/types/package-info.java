/**
 * Pure Java value types shared across all provenance modules.
 *
 * <p>{@link com.libragraph.provenance.types.ComplexNumber} and
 * {@link com.libragraph.provenance.types.OrderedMapping} fill gaps in the JDK's
 * value vocabulary so that callers can express every category the canonical
 * hasher understands. No framework dependencies.
 */
package com.libragraph.provenance.types;

/**
 * Read-only folder trees for content hashing.
 */
package com.libragraph.provenance.core.folder;

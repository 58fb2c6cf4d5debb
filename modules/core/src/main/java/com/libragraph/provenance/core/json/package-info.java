/**
 * Jackson adapters feeding JSON attribute documents to the canonical hasher.
 */
package com.libragraph.provenance.core.json;

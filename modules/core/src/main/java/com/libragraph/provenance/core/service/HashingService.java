package com.libragraph.provenance.core.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.libragraph.provenance.core.folder.FilesystemFolder;
import com.libragraph.provenance.core.hash.CanonicalHasher;
import com.libragraph.provenance.core.hash.HashOptions;
import com.libragraph.provenance.core.json.JsonValues;
import com.libragraph.provenance.util.Digest;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Computes node fingerprints with the platform-wide hashing defaults.
 *
 * <p>Defaults come from {@code provenance.hash.*} configuration. The digest is
 * persisted by the node store under {@link #HASH_EXTRA_KEY}; callers compare a
 * fresh digest against the stored one with {@link #matches(Object, String)} to
 * decide whether an earlier result can be reused.
 */
@ApplicationScoped
public class HashingService {

    /** Extras key under which the node store keeps a node's hex digest. */
    public static final String HASH_EXTRA_KEY = "_aiida_hash";

    private static final Logger log = Logger.getLogger(HashingService.class);

    @ConfigProperty(name = "provenance.hash.float-precision",
            defaultValue = "" + HashOptions.DEFAULT_FLOAT_PRECISION)
    int floatPrecision;

    @ConfigProperty(name = "provenance.hash.odict-as-unordered", defaultValue = "false")
    boolean odictAsUnordered;

    @ConfigProperty(name = "provenance.hash.ignored-folder-content")
    Optional<List<String>> ignoredFolderContent;

    private HashOptions defaults;

    /** CDI constructor; options are resolved from configuration in {@link #init()}. */
    public HashingService() {
    }

    public HashingService(HashOptions defaults) {
        this.defaults = Objects.requireNonNull(defaults, "defaults cannot be null");
    }

    @PostConstruct
    void init() {
        defaults = new HashOptions(
                floatPrecision,
                odictAsUnordered,
                Set.copyOf(ignoredFolderContent.orElse(List.of())));
        log.infof("Hashing defaults: floatPrecision=%d, odictAsUnordered=%b, ignoredFolderContent=%s",
                defaults.floatPrecision(), defaults.treatOrderedMapAsUnordered(),
                defaults.folderIgnoreNames());
    }

    public HashOptions defaultOptions() {
        return defaults;
    }

    public Digest hash(Object value) {
        return CanonicalHasher.hash(value, defaults);
    }

    public Digest hash(Object value, HashOptions options) {
        return CanonicalHasher.hash(value, options);
    }

    /**
     * Hashes the content of a directory. The directory's own name does not contribute.
     */
    public Digest hashFolder(Path dir) {
        long start = System.nanoTime();
        Digest digest = CanonicalHasher.hash(FilesystemFolder.of(dir), defaults);
        log.debugf("Hashed folder %s in %d ms: %s", dir, (System.nanoTime() - start) / 1_000_000, digest);
        return digest;
    }

    public Digest hashJson(JsonNode document) {
        return CanonicalHasher.hash(JsonValues.toHashable(document), defaults);
    }

    /**
     * Checks a value against a previously stored hex digest.
     *
     * @return {@code false} when nothing was stored
     * @throws IllegalArgumentException if {@code storedHex} is not a valid digest
     */
    public boolean matches(Object value, String storedHex) {
        if (storedHex == null) {
            return false;
        }
        Digest stored = Digest.fromHex(storedHex);
        Digest current = hash(value);
        if (!current.equals(stored)) {
            log.debugf("Digest mismatch: stored=%s current=%s", stored, current);
            return false;
        }
        return true;
    }
}

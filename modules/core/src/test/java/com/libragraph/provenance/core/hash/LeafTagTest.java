package com.libragraph.provenance.core.hash;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

class LeafTagTest {

    @Test
    void shouldFitInBlake2Personalization() {
        for (LeafTag tag : LeafTag.values()) {
            assertThat(tag.personalization().length).as(tag.name()).isBetween(1, 16);
        }
    }

    @Test
    void shouldHaveUniquePersonalizations() {
        assertThat(Arrays.stream(LeafTag.values())
                .map(t -> new String(t.personalization(), StandardCharsets.US_ASCII))
                .distinct()
                .count())
                .isEqualTo(LeafTag.values().length);
    }

    @Test
    void shouldUseWireLabels() {
        assertThat(LeafTag.ODICT_OPEN.personalization()).isEqualTo("odict(".getBytes(StandardCharsets.US_ASCII));
        assertThat(LeafTag.CLOSE.personalization()).isEqualTo(")".getBytes(StandardCharsets.US_ASCII));
        assertThat(LeafTag.FILE_CONTENT.personalization()).isEqualTo("fcontent".getBytes(StandardCharsets.US_ASCII));
    }

    @Test
    void shouldBindTagIntoLeafDigest() {
        byte[] payload = {'1'};

        assertThat(CanonicalHasher.singleDigest(LeafTag.STR, payload))
                .isNotEqualTo(CanonicalHasher.singleDigest(LeafTag.INT, payload));
    }
}

package com.libragraph.provenance.util.blake2;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.HexFormat;

import static org.assertj.core.api.Assertions.*;

class Blake2bTest {

    private static final HexFormat HEX = HexFormat.of();

    private static final Blake2bParams TREE_LEAF =
            Blake2bParams.sequential(32).withTree(0, 2, 64);

    private static String hex(byte[] bytes) {
        return HEX.formatHex(bytes);
    }

    private static byte[] ascii(String s) {
        return s.getBytes(StandardCharsets.US_ASCII);
    }

    @Test
    void shouldMatchRfc7693AbcVector() {
        byte[] digest = Blake2b.digest(Blake2bParams.sequential(64), ascii("abc"));

        assertThat(hex(digest)).isEqualTo(
                "ba80a53f981c4d0d6a2797b69f12f6e94c212f14685ac4b74b12bb6fdbffa2d1"
                        + "7d87c5392aab792dc252d5de4533cc9518d38aa8dbf1925ab92386edd4009923");
    }

    @Test
    void shouldHashEmptyMessage() {
        assertThat(hex(Blake2b.digest(Blake2bParams.sequential(64), new byte[0]))).isEqualTo(
                "786a02f742015903c6c6fd852552d272912f4740e15847618a86e217f71f5419"
                        + "d25e1031afee585313896444934eb04b903a685b1448b755d56f701afe9be2ce");
        assertThat(hex(Blake2b.digest(Blake2bParams.sequential(32), new byte[0])))
                .isEqualTo("0e5751c026e543b2e8ab2eb06099daa1d1e5df47778f7787faab45cdf12fe3a8");
    }

    @Test
    void shouldHashAcrossBlockBoundaries() {
        byte[] data = new byte[512];
        for (int i = 0; i < data.length; i++) {
            data[i] = (byte) i;
        }
        String expected = "540b20132d8aeae54057cb69c24f95d26a1c472cc700dd450defe9bb796d4f14";

        assertThat(hex(Blake2b.digest(Blake2bParams.sequential(32), data))).isEqualTo(expected);

        // same message fed in uneven chunks, including an exact block boundary
        Blake2b incremental = new Blake2b(Blake2bParams.sequential(32));
        incremental.update(data, 0, 1);
        incremental.update(data, 1, 127);
        incremental.update(data, 128, 200);
        incremental.update(data, 328, 184);
        assertThat(hex(incremental.digest())).isEqualTo(expected);
    }

    @Test
    void shouldApplySaltAndPersonalization() {
        Blake2bParams params = Blake2bParams.sequential(32)
                .withSalt(ascii("saltsalt"))
                .withPersonal(ascii("me"));

        assertThat(hex(Blake2b.digest(params, ascii("abc"))))
                .isEqualTo("8244d3f1b5cc35dd10b2b1dc351af1f451c08a57df0994f31a372f40d5454d94");
    }

    @Test
    void shouldApplyTreeParameters() {
        byte[] personalised = Blake2b.digest(TREE_LEAF.withPersonal(ascii("str")), ascii("abc"));
        assertThat(hex(personalised))
                .isEqualTo("7b6d3b9826238a4b0a2467edcd20a9cb6b8b644150aaa731682968c8135ebd47");

        byte[] lastNode = Blake2b.digest(TREE_LEAF.withLastNode(true), new byte[0]);
        assertThat(hex(lastNode))
                .isEqualTo("5cdf18df7b09008616c528fcf6cd6733ad43c5dab4cf9280f2a0e581aeead840");
    }

    @Test
    void shouldDistinguishNodeDepth() {
        byte[] depth0 = Blake2b.digest(TREE_LEAF, ascii("x"));
        byte[] depth1 = Blake2b.digest(TREE_LEAF.withNodeDepth(1), ascii("x"));

        assertThat(depth0).isNotEqualTo(depth1);
    }

    @Test
    void shouldRefuseSecondDigest() {
        Blake2b blake = new Blake2b(Blake2bParams.sequential(32));
        blake.digest();

        assertThatIllegalStateException().isThrownBy(blake::digest);
        assertThatIllegalStateException().isThrownBy(() -> blake.update(new byte[1]));
    }

    @Test
    void shouldValidateParameters() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> Blake2bParams.sequential(0));
        assertThatIllegalArgumentException()
                .isThrownBy(() -> Blake2bParams.sequential(65));
        assertThatIllegalArgumentException()
                .isThrownBy(() -> Blake2bParams.sequential(32).withPersonal(new byte[17]))
                .withMessageContaining("personal");
        assertThatIllegalArgumentException()
                .isThrownBy(() -> Blake2bParams.sequential(32).withTree(256, 2, 64));
    }

    @Test
    void shouldPadPersonalizationWithZeros() {
        Blake2bParams shortPersonal = Blake2bParams.sequential(32).withPersonal(ascii("me"));
        byte[] padded = new byte[16];
        padded[0] = 'm';
        padded[1] = 'e';

        assertThat(shortPersonal.personal()).isEqualTo(padded);
        assertThat(shortPersonal).isEqualTo(Blake2bParams.sequential(32).withPersonal(padded));
    }
}

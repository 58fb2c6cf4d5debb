package com.libragraph.provenance.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.*;

class FloatTextTest {

    @ParameterizedTest
    @CsvSource({
            "1.0, 14, 1",
            "2.5, 14, 2.5",
            "0.1, 14, 0.1",
            "100.0, 14, 100",
            "0.0001, 14, 0.0001",
            "1.5e-5, 14, 1.5e-05",
            "1e16, 14, 1e+16",
            "1e14, 14, 1e+14",
            "1e13, 14, 10000000000000",
            "123456789012345.0, 14, 1.2345678901234e+14",
            "99999999999999.98, 14, 1e+14",
            "1551443415.25, 14, 1551443415.25",
            "1e-300, 14, 1e-300",
            "4.9e-324, 14, 4.9406564584125e-324",
            "1.7976931348623157e308, 14, 1.7976931348623e+308",
            "-42.125, 14, -42.125",
            "123456.789, 6, 123457",
            "1551443415.25, 6, 1.55144e+09",
            "1.0000000001, 6, 1",
            "1.0000000001, 12, 1.0000000001",
            "100.0, 1, 1e+02",
            "2.5, 1, 2",
            "1.5e-5, 1, 2e-05"
    })
    void shouldRenderLikeGeneralFormat(double value, int digits, String expected) {
        assertThat(FloatText.format(value, digits)).isEqualTo(expected);
    }

    @Test
    void shouldRenderSpecials() {
        assertThat(FloatText.format(Double.NaN, 14)).isEqualTo("nan");
        assertThat(FloatText.format(Double.POSITIVE_INFINITY, 14)).isEqualTo("inf");
        assertThat(FloatText.format(Double.NEGATIVE_INFINITY, 14)).isEqualTo("-inf");
        assertThat(FloatText.format(0.0, 14)).isEqualTo("0");
        assertThat(FloatText.format(-0.0, 14)).isEqualTo("-0");
    }

    @Test
    void shouldRenderBigDecimalWithoutBinaryNoise() {
        assertThat(FloatText.format(new BigDecimal("0.1"), 14)).isEqualTo("0.1");
        assertThat(FloatText.format(new BigDecimal("12345678901234567890"), 14))
                .isEqualTo("1.2345678901235e+19");
        assertThat(FloatText.format(BigDecimal.ZERO, 14)).isEqualTo("0");
    }

    @Test
    void shouldNeverEmitDelimiterCharacters() {
        double[] samples = {Math.PI, -Math.E, 1e-9, 6.02214076e23, Double.MIN_VALUE, Double.NaN};
        for (double sample : samples) {
            assertThat(FloatText.format(sample, 14)).matches("-?(inf|nan|[0-9.]+(e[+-][0-9]+)?)");
        }
    }

    @Test
    void shouldRejectNonPositivePrecision() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> FloatText.format(1.0, 0))
                .withMessageContaining(">= 1");
    }
}

package io.cryojob4j.utils;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertEquals;

class FlagValuesTest {

    @Test
    void formatShouldDropFractionForIntegralValues() {
        assertEquals("1", FlagValues.format(1.0));
        assertEquals("-1", FlagValues.format(-1));
        assertEquals("5000", FlagValues.format(5000.0));
        assertEquals("0", FlagValues.format(0.0));
    }

    @Test
    void formatShouldUseShortestPlainDecimal() {
        assertEquals("0.75", FlagValues.format(0.75));
        assertEquals("2.5", FlagValues.format(2.5f));
        assertEquals("4.75", FlagValues.format(new BigDecimal("4.7500")));
        assertEquals("0.1", FlagValues.format(0.1));
        assertEquals("0.0000001", FlagValues.format(1e-7));
    }

    @Test
    void labelCodeShouldReadTrailingCode() {
        assertEquals(1, FlagValues.labelCode("90 degrees (1)", s -> -1));
        assertEquals(0, FlagValues.labelCode("No rotation (0)", s -> -1));
        assertEquals(2, FlagValues.labelCode("Flip left to right (2)", s -> -1));
    }

    @Test
    void labelCodeShouldAcceptBareIntegersAndNumbers() {
        assertEquals(3, FlagValues.labelCode("3", s -> -1));
        assertEquals(2, FlagValues.labelCode(2, s -> -1));
        assertEquals(0, FlagValues.labelCode(null, s -> -1));
    }

    @Test
    void labelCodeShouldUseKeywordFallbackWithLowercasedLabel() {
        assertEquals(2, FlagValues.labelCode("180 Degrees", s -> s.contains("180") ? 2 : 0));
        assertEquals(1, FlagValues.labelCode("Flip Upside down", s -> s.contains("upside") ? 1 : 0));
    }

    @Test
    void labelCodeShouldFallBackToZeroWhenCodeOverflows() {
        assertEquals(0, FlagValues.labelCode("99999999999", s -> -1));
        assertEquals(0, FlagValues.labelCode("x (99999999999)", s -> -1));
        assertEquals(0, FlagValues.labelCode("-999999999999999999999", s -> -1));
        assertEquals(0, FlagValues.labelCode(99999999999L, s -> -1));
    }
}

package com.pivotcalc.backend.utils;

import java.math.BigDecimal;
import java.util.Locale;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PivotNumericTest {

    private final PivotNumeric us = new PivotNumeric(Locale.US);
    private final PivotNumeric german = new PivotNumeric(Locale.GERMANY);

    @Test
    public void testNumbers() {
        assertEquals(3.0, us.toDouble(3));
        assertEquals(2.5, us.toDouble(2.5f));
        assertEquals(1.25, us.toDouble(new BigDecimal("1.25")));
        assertNull(us.toDouble(Double.NaN));
        assertNull(us.toDouble(Double.POSITIVE_INFINITY));
        assertNull(us.toDouble(null));
    }

    @Test
    public void testStrings() {
        assertEquals(12.5, us.toDouble(" 12.5 "));
        assertEquals(1e3, us.toDouble("1e3"));
        assertEquals(1234.5, us.toDouble("1,234.5"));
        assertEquals(0.5, us.toDouble("50%"));
        assertNull(us.toDouble("12abc"));
        assertNull(us.toDouble(""));
        assertNull(us.toDouble("%"));
        assertNull(us.toDouble("NaN"));
        assertNull(us.toDouble("Infinity"));
    }

    @Test
    public void testJavaLiteralSuffixesAreText() {
        assertNull(us.toDouble("5d"));
        assertNull(us.toDouble("1f"));
        assertNull(us.toDouble("2.5D"));
        assertNull(us.toDouble("0x1p3"));
        assertNull(us.toDouble("5d%"));
        assertEquals(-0.5, us.toDouble("-.5"));
        assertEquals(1000.0, us.toDouble("+1E3"));
    }

    @Test
    public void testLocalizedStrings() {
        assertEquals(1234.5, german.toDouble("1.234,5"));
        // 固定格式优先
        assertEquals(1.5, german.toDouble("1.5"));
        assertEquals(0.125, german.toDouble("12,5 %"));
    }

    @Test
    public void testNonNumericTypes() {
        assertNull(us.toDouble(true));
        assertNull(us.toDouble('7'));
        assertFalse(us.isNumber(new Object()));
        assertTrue(us.isNumber("-4"));
    }
}

package org.typeset.lite.pretty;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the Printer text sink and its number formatting.
 */
class PrinterTest {

    @Test
    @DisplayName("Floats use the shortest plain decimal form")
    void testFormatFloat() {
        assertEquals("2.5", Printer.formatFloat(2.50));
        assertEquals("100", Printer.formatFloat(1e2));
        assertEquals("0.001", Printer.formatFloat(10e-4));
        assertEquals("0.1", Printer.formatFloat(0.1));
        assertEquals("-3.75", Printer.formatFloat(-3.75));
        assertEquals("1000000000000000000000", Printer.formatFloat(1e21));
        assertEquals("0.0000001", Printer.formatFloat(1e-7));
    }

    @Test
    @DisplayName("Floats whose nearest double is not exact still print the shortest digits")
    void testFormatFloatShortestDigits() {
        assertEquals("100000000000000000000000", Printer.formatFloat(1e23));
        assertEquals("200000000000000000000000", Printer.formatFloat(2e23));
        assertEquals("8410000000000000000000", Printer.formatFloat(8.41e21));
        assertEquals("-100000000000000000000000", Printer.formatFloat(-1e23));
        assertEquals("0." + "0".repeat(323) + "5", Printer.formatFloat(Double.MIN_VALUE));
        assertEquals("0.30000000000000004", Printer.formatFloat(0.1 + 0.2));
    }

    @Test
    @DisplayName("Formatted floats read back as the same value")
    void testFormatFloatRoundTrips() {
        double[] values = {1e23, 2e23, 8.41e21, Double.MIN_VALUE, Double.MAX_VALUE, 0.1 + 0.2, 1.0 / 3, 123.456};
        for (double value : values) {
            assertEquals(value, Double.parseDouble(Printer.formatFloat(value)), "Round trip of " + value);
        }
    }

    @Test
    @DisplayName("Special float values")
    void testFormatSpecialFloats() {
        assertEquals("0", Printer.formatFloat(0.0));
        assertEquals("-0", Printer.formatFloat(-0.0));
        assertEquals("NaN", Printer.formatFloat(Double.NaN));
        assertEquals("inf", Printer.formatFloat(Double.POSITIVE_INFINITY));
        assertEquals("-inf", Printer.formatFloat(Double.NEGATIVE_INFINITY));
    }

    @Test
    @DisplayName("join separates items but does not trail")
    void testJoin() {
        Printer p = new Printer();
        p.push('(').join(List.of(1, 2, 3), ", ", i -> p.pushInt(i * 10)).push(')');

        assertEquals("(10, 20, 30)", p.finish());
    }

    @Test
    @DisplayName("join over nothing pushes nothing")
    void testJoinEmpty() {
        Printer p = new Printer();
        p.join(List.<String>of(), ", ", p::push);

        assertEquals("", p.finish());
    }
}

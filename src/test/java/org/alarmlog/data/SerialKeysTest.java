package org.alarmlog.data;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class SerialKeysTest {

    @Test
    void numericSerialsShareOneKey() {
        assertEquals("1", SerialKeys.canonical("1"));
        assertEquals("1", SerialKeys.canonical("1.0"));
        assertEquals("1", SerialKeys.canonical(" 1.00 "));
        assertEquals("0", SerialKeys.canonical("0.0"));
        assertEquals("100", SerialKeys.canonical("1E+2"));
        assertEquals("SN-7", SerialKeys.canonical("SN-7"));
        assertNull(SerialKeys.canonical("  "));
    }

    @Test
    void hugeExponentKeepsRawText() {
        assertEquals("1e999999999", SerialKeys.canonical(" 1e999999999 "));
        assertEquals("1E-999999999", SerialKeys.canonical("1E-999999999"));
        assertEquals("12000", SerialKeys.canonical("1.2e4"));
    }

    @Test
    void ordersNumbersBeforeText() {
        List<String> keys = new ArrayList<>(Arrays.asList("b", "10", "a", "9"));
        keys.sort(SerialKeys.ORDER);
        assertEquals(List.of("9", "10", "a", "b"), keys);
    }
}

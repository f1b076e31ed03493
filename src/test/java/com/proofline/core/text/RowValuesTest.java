package com.proofline.core.text;

import com.proofline.core.model.TaskValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class RowValuesTest {

    @Test
    @DisplayName("driver id types normalise to long")
    void remoteIdConversions() {
        assertEquals(7L, RowValues.toRemoteId(7));
        assertEquals(7L, RowValues.toRemoteId(7L));
        assertEquals(7L, RowValues.toRemoteId(new BigDecimal("7.000")));
        assertEquals(7L, RowValues.toRemoteId(" 7 "));
        assertNull(RowValues.toRemoteId(null));
        assertNull(RowValues.toRemoteId(""));
    }

    @Test
    @DisplayName("fractional or non-numeric ids are rejected")
    void nonIntegralIds() {
        assertThrows(TaskValidationException.class, () -> RowValues.toRemoteId(7.5));
        assertThrows(TaskValidationException.class, () -> RowValues.toRemoteId("abc"));
    }

    @Test
    @DisplayName("null text becomes empty")
    void nullText() {
        assertEquals("", RowValues.toText(null));
        assertEquals("a", RowValues.toText("a"));
    }

    @Test
    @DisplayName("flatten replaces line breaks and trims")
    void flatten() {
        assertEquals("one  two three", RowValues.flatten("  one\r\ntwo\nthree\n"));
        assertEquals("", RowValues.flatten(null));
    }
}

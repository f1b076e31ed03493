package com.proofline.core.text;

import com.proofline.core.model.TaskValidationException;

import java.math.BigDecimal;

/**
 * Normalises loosely typed driver values into the fixed source row shape.
 */
public final class RowValues {

    private RowValues() {}

    /**
     * Converts a source id column value to a long. Drivers hand back integers,
     * decimals or strings depending on the dialect.
     *
     * @return the id, or {@code null} when the value is SQL NULL
     * @throws TaskValidationException when the value is not an integral number
     */
    public static Long toRemoteId(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        try {
            if (value instanceof BigDecimal decimal) {
                return decimal.longValueExact();
            }
            if (value instanceof Number number) {
                return new BigDecimal(number.toString()).longValueExact();
            }
            String text = value.toString().trim();
            if (text.isEmpty()) {
                return null;
            }
            return new BigDecimal(text).longValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            throw new TaskValidationException("Source id is not an integral value: " + value, e);
        }
    }

    /**
     * Text column value with SQL NULL mapped to the empty string, so hashes stay defined.
     */
    public static String toText(String value) {
        return value == null ? "" : value;
    }

    /**
     * Collapses carriage returns and line feeds to spaces and trims, for one-line prompt entries.
     */
    public static String flatten(String text) {
        if (text == null) {
            return "";
        }
        return text.replace('\r', ' ').replace('\n', ' ').trim();
    }
}

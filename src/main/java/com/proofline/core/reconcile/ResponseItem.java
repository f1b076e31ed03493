package com.proofline.core.reconcile;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;

/**
 * One element of a parsed model reply. Identifiers are canonical strings
 * ({@code 7}, {@code 7.0} and {@code "7"} all become {@code "7"}) or null when absent.
 *
 * @param remoteId      {@code remote_id}
 * @param taskItemId    {@code id_task_item}
 * @param id            {@code id}
 * @param textCorrected {@code text_corrected}, null when missing
 * @throws ResponseFormatException from {@link #fromJson} when {@code text_corrected} is not a string
 */
public record ResponseItem(String remoteId, String taskItemId, String id, String textCorrected) {

    public static ResponseItem fromJson(JsonNode node) {
        return new ResponseItem(
                canonicalIdentifier(node.get("remote_id")),
                canonicalIdentifier(node.get("id_task_item")),
                canonicalIdentifier(node.get("id")),
                text(node.get("text_corrected")));
    }

    static String canonicalIdentifier(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        String raw = value.isNumber() ? value.numberValue().toString() : value.asText().trim();
        if (raw.isEmpty()) {
            return null;
        }
        try {
            BigDecimal number = new BigDecimal(raw);
            BigDecimal stripped = number.stripTrailingZeros();
            if (stripped.scale() <= 0) {
                return stripped.toBigIntegerExact().toString();
            }
            return raw;
        } catch (NumberFormatException | ArithmeticException e) {
            return raw;
        }
    }

    private static String text(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new ResponseFormatException("text_corrected must be a string, got " + value.getNodeType());
        }
        return value.textValue();
    }
}

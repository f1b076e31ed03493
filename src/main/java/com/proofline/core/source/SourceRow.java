package com.proofline.core.source;

/**
 * One source record: numeric identifier and its text, never null.
 */
public record SourceRow(long remoteId, String textValue) {
}

package com.proofline.core.sync;

/**
 * Result of one resync pass.
 *
 * @param batches pages committed
 * @param rows    source rows compared
 * @param updated local rows whose text changed at the source
 */
public record ResyncOutcome(int batches, long rows, long updated) {
}

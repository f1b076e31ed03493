package com.proofline.core.sync;

import com.proofline.core.lifecycle.ProgressSummary;

/**
 * Result of one fetch pass.
 *
 * @param batches  pages committed
 * @param rows     source rows read
 * @param inserted rows that were new to the local store
 * @param markerId fetch cursor after the pass
 * @param progress counters after the final recount
 */
public record FetchOutcome(int batches, long rows, long inserted, long markerId, ProgressSummary progress) {
}

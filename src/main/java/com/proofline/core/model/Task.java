package com.proofline.core.model;

/**
 * One long-lived synchronisation and correction unit of work.
 *
 * @param id                   task id
 * @param stage                lifecycle stage
 * @param status               claim state
 * @param databaseConnectionId source connection reference
 * @param tableName            source table
 * @param idColumnName         source id column
 * @param columnName           source text column
 * @param hashMethod           content hash algorithm name (e.g. "sha256")
 * @param markerId             fetch cursor: last source id fully applied locally
 * @param resyncMarkerId       resync cursor: last source id re-checked by the resync pass
 * @param markerMaxId          max source id observed when the stage began
 * @param recordsTotal         source row count
 * @param recordsFetched       local item count
 * @param recordsNew           items inserted for the first time
 * @param recordsUpdated       items refreshed by resync
 * @param recordsProcessed     items with a correction outcome
 * @param syncProgress         fetched / total in percent
 * @param aiProgress           processed / total in percent
 * @param aiModelId            assigned AI model reference, may be null
 * @param aiUserRules          free-form correction rules, may be null
 * @param description          append-only progress notes
 * @param errorLog             append-only error messages
 */
public record Task(
    long id,
    TaskStage stage,
    TaskRunStatus status,
    Long databaseConnectionId,
    String tableName,
    String idColumnName,
    String columnName,
    String hashMethod,
    long markerId,
    long resyncMarkerId,
    long markerMaxId,
    long recordsTotal,
    long recordsFetched,
    long recordsNew,
    long recordsUpdated,
    long recordsProcessed,
    double syncProgress,
    double aiProgress,
    Long aiModelId,
    String aiUserRules,
    String description,
    String errorLog
) {

    public static final String DEFAULT_HASH_METHOD = "sha256";

    public String hashMethodOrDefault() {
        return hashMethod == null || hashMethod.isBlank() ? DEFAULT_HASH_METHOD : hashMethod;
    }
}

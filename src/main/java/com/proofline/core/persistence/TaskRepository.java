package com.proofline.core.persistence;

import com.proofline.core.model.Task;
import com.proofline.core.model.TaskRunStatus;
import com.proofline.core.model.TaskStage;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static com.proofline.core.persistence.JdbcRows.nullableLong;
import static com.proofline.core.persistence.JdbcRows.timestamp;

/**
 * JDBC access to the {@code task} table.
 * <p>
 * Counters and markers are only ever written here; the fetch and resync
 * engines call these methods inside their batch transactions.
 */
@Repository
public class TaskRepository {

    private static final String COLUMNS = """
            id_task, stage, status, id_database_connection, table_name, id_column_name, column_name,
            hash_method, marker_id, resync_marker_id, marker_max_id, records_total, records_fetched,
            records_new, records_updated, records_processed, sync_progress, ai_progress,
            id_ai_model, ai_user_rules, description, error_log""";

    private static final String SELECT_BY_ID_SQL = "SELECT " + COLUMNS + " FROM task WHERE id_task = ?";

    private static final String SELECT_ALL_SQL = "SELECT " + COLUMNS + " FROM task ORDER BY id_task";

    private static final String SELECT_BY_TOKEN_SQL = "SELECT " + COLUMNS + " FROM task WHERE claim_token = ?";

    // The inner select picks the candidate, the repeated outer guard makes the
    // update a no-op when another runner claimed it in between.
    private static final String CLAIM_SQL = """
            UPDATE task
               SET status = 'running', claim_token = ?, claimed_at = ?
             WHERE id_task = (SELECT id_task FROM task
                               WHERE stage IN (%s)
                                 AND (status <> 'running' OR claimed_at IS NULL OR claimed_at < ?)
                               ORDER BY id_task
                               LIMIT 1)
               AND (status <> 'running' OR claimed_at IS NULL OR claimed_at < ?)""";

    private static final String RELEASE_SQL = """
            UPDATE task
               SET status = ?, claim_token = NULL, claimed_at = NULL
             WHERE id_task = ? AND claim_token = ?""";

    // Batch writes below only land while the caller still holds the claim, and
    // each one pushes claimed_at forward so a long pass does not go stale.
    private static final String START_FETCH_SQL = """
            UPDATE task
               SET records_total = ?, marker_max_id = ?, stage = 'fetch', claimed_at = ?
             WHERE id_task = ? AND claim_token = ? AND stage IN ('new', 'fetch')""";

    private static final String RECORD_FETCH_BATCH_SQL = """
            UPDATE task
               SET marker_id = CASE WHEN ? > marker_id THEN ? ELSE marker_id END,
                   records_fetched = records_fetched + ?,
                   records_new = records_new + ?,
                   claimed_at = ?
             WHERE id_task = ? AND claim_token = ?""";

    private static final String RECORD_RESYNC_BATCH_SQL = """
            UPDATE task
               SET resync_marker_id = ?,
                   records_updated = records_updated + ?,
                   claimed_at = ?
             WHERE id_task = ? AND claim_token = ?""";

    private static final String FINISH_RESYNC_SQL = """
            UPDATE task
               SET stage = 'fetch', resync_marker_id = ?
             WHERE id_task = ? AND claim_token = ? AND stage = 'resync'""";

    private static final String HOLDS_CLAIM_SQL = "SELECT COUNT(*) FROM task WHERE id_task = ? AND claim_token = ?";

    private static final String REQUEST_RESYNC_SQL = """
            UPDATE task
               SET stage = 'resync', resync_marker_id = 0
             WHERE id_task = ? AND stage IN (%s)""";

    private static final String UPDATE_PROGRESS_SQL = """
            UPDATE task
               SET records_fetched = ?, records_processed = ?,
                   sync_progress = ?, ai_progress = ?, stage = ?
             WHERE id_task = ?""";

    private static final String APPEND_SQL = """
            UPDATE task
               SET %1$s = CASE WHEN %1$s IS NULL OR %1$s = '' THEN ? ELSE %1$s || ? END
             WHERE id_task = ?""";

    private static final RowMapper<Task> TASK_MAPPER = TaskRepository::mapTask;

    private final JdbcTemplate jdbc;

    public TaskRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<Task> findById(long taskId) {
        return jdbc.query(SELECT_BY_ID_SQL, TASK_MAPPER, taskId).stream().findFirst();
    }

    public List<Task> findAll() {
        return jdbc.query(SELECT_ALL_SQL, TASK_MAPPER);
    }

    /**
     * Atomically claims the oldest task in one of the given stages that is not
     * held by another runner, or whose claim went stale before {@code staleBefore}.
     *
     * @return the claimed task, empty when nothing is eligible
     */
    public Optional<Task> claimOldest(Set<TaskStage> stages, String claimToken, Instant now, Instant staleBefore) {
        if (stages.isEmpty()) {
            return Optional.empty();
        }
        String stageList = stages.stream()
                .map(stage -> "'" + stage.dbValue() + "'")
                .sorted()
                .collect(Collectors.joining(", "));
        int claimed = jdbc.update(CLAIM_SQL.formatted(stageList),
                claimToken, timestamp(now), timestamp(staleBefore), timestamp(staleBefore));
        if (claimed == 0) {
            return Optional.empty();
        }
        return jdbc.query(SELECT_BY_TOKEN_SQL, TASK_MAPPER, claimToken).stream().findFirst();
    }

    /**
     * Drops a claim. Only the holder of {@code claimToken} can release it.
     */
    public boolean release(long taskId, String claimToken, TaskRunStatus status) {
        return jdbc.update(RELEASE_SQL, status.dbValue(), taskId, claimToken) == 1;
    }

    /**
     * Records the source size at the start of a fetch pass and moves the task
     * into {@code fetch}.
     *
     * @return false when the claim was lost or the task left {@code new}/{@code fetch},
     *         e.g. because a resync was requested meanwhile
     */
    public boolean startFetch(long taskId, String claimToken, Instant now, long recordsTotal, long markerMaxId) {
        return jdbc.update(START_FETCH_SQL, recordsTotal, markerMaxId, timestamp(now), taskId, claimToken) == 1;
    }

    /**
     * Advances the fetch cursor, never backwards, and adds the page's counts.
     *
     * @return false when {@code claimToken} no longer holds the task
     */
    public boolean recordFetchBatch(long taskId, String claimToken, Instant now,
                                    long markerId, long fetched, long inserted) {
        return jdbc.update(RECORD_FETCH_BATCH_SQL, markerId, markerId, fetched, inserted, timestamp(now),
                taskId, claimToken) == 1;
    }

    /**
     * @return false when {@code claimToken} no longer holds the task
     */
    public boolean recordResyncBatch(long taskId, String claimToken, Instant now, long resyncMarkerId, long updated) {
        return jdbc.update(RECORD_RESYNC_BATCH_SQL, resyncMarkerId, updated, timestamp(now),
                taskId, claimToken) == 1;
    }

    public boolean finishResync(long taskId, String claimToken, long resyncMarkerId) {
        return jdbc.update(FINISH_RESYNC_SQL, resyncMarkerId, taskId, claimToken) == 1;
    }

    public boolean holdsClaim(long taskId, String claimToken) {
        Integer count = jdbc.queryForObject(HOLDS_CLAIM_SQL, Integer.class, taskId, claimToken);
        return count != null && count > 0;
    }

    /**
     * Moves a task back into the resync stage with a fresh resync cursor.
     *
     * @return false when the task does not exist or is in a stage that cannot be resynced
     */
    public boolean requestResync(long taskId) {
        String stageList = TaskStage.RESYNC_REQUESTABLE.stream()
                .map(stage -> "'" + stage.dbValue() + "'")
                .sorted()
                .collect(Collectors.joining(", "));
        return jdbc.update(REQUEST_RESYNC_SQL.formatted(stageList), taskId) == 1;
    }

    public void updateProgress(long taskId, long recordsFetched, long recordsProcessed,
                               double syncProgress, double aiProgress, TaskStage stage) {
        jdbc.update(UPDATE_PROGRESS_SQL, recordsFetched, recordsProcessed, syncProgress, aiProgress,
                stage.dbValue(), taskId);
    }

    public void appendDescription(long taskId, String message) {
        append("description", taskId, message);
    }

    public void appendError(long taskId, String message) {
        append("error_log", taskId, message);
    }

    private void append(String column, long taskId, String message) {
        String text = message == null ? "" : message;
        jdbc.update(APPEND_SQL.formatted(column), text, "\n" + text, taskId);
    }

    private static Task mapTask(ResultSet rs, int rowNum) throws SQLException {
        return new Task(
                rs.getLong("id_task"),
                TaskStage.fromDb(rs.getString("stage")),
                TaskRunStatus.fromDb(rs.getString("status")),
                nullableLong(rs, "id_database_connection"),
                rs.getString("table_name"),
                rs.getString("id_column_name"),
                rs.getString("column_name"),
                rs.getString("hash_method"),
                rs.getLong("marker_id"),
                rs.getLong("resync_marker_id"),
                rs.getLong("marker_max_id"),
                rs.getLong("records_total"),
                rs.getLong("records_fetched"),
                rs.getLong("records_new"),
                rs.getLong("records_updated"),
                rs.getLong("records_processed"),
                rs.getDouble("sync_progress"),
                rs.getDouble("ai_progress"),
                nullableLong(rs, "id_ai_model"),
                rs.getString("ai_user_rules"),
                rs.getString("description"),
                rs.getString("error_log"));
    }
}

package com.proofline.core.persistence;

import com.proofline.core.model.IdentifierScheme;
import com.proofline.core.model.TaskItem;
import com.proofline.core.model.TaskItemStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.proofline.core.persistence.JdbcRows.instant;
import static com.proofline.core.persistence.JdbcRows.nullableDouble;
import static com.proofline.core.persistence.JdbcRows.nullableInt;
import static com.proofline.core.persistence.JdbcRows.nullableLong;
import static com.proofline.core.persistence.JdbcRows.timestamp;

/**
 * JDBC access to the {@code task_item} table.
 */
@Repository
public class TaskItemRepository {

    /**
     * Source row prepared for writing: id, text and the hash of the text.
     */
    public record HashedRow(long remoteId, String text, String hash) {
    }

    // Re-fetching a known row refreshes its text and hash but never touches status.
    private static final String UPSERT_SQL = """
            INSERT INTO task_item (id_task, remote_id, text_original, original_hash, status, fetched_at)
            VALUES (?, ?, ?, ?, 'pending', ?)
            ON CONFLICT (id_task, remote_id)
            DO UPDATE SET text_original = EXCLUDED.text_original,
                          original_hash = EXCLUDED.original_hash,
                          fetched_at = EXCLUDED.fetched_at""";

    private static final String REFRESH_TEXT_SQL = """
            UPDATE task_item
               SET text_original = ?, original_hash = ?, fetched_at = ?
             WHERE id_task = ? AND remote_id = ?""";

    private static final String EXISTING_IDS_SQL = """
            SELECT remote_id FROM task_item
             WHERE id_task = :taskId AND remote_id IN (:remoteIds)""";

    private static final String HASHES_SQL = """
            SELECT remote_id, original_hash FROM task_item
             WHERE id_task = :taskId AND remote_id IN (:remoteIds)""";

    private static final String COUNT_SQL = "SELECT COUNT(*) FROM task_item WHERE id_task = ?";

    private static final String COUNT_BY_STATUS_SQL = """
            SELECT status, COUNT(*) AS item_count FROM task_item
             WHERE id_task = ?
             GROUP BY status""";

    private static final String PENDING_CHUNK_SQL = """
            SELECT id_task_item, id_task, remote_id, text_original
              FROM task_item
             WHERE id_task = ? AND status = 'pending' AND id_task_item > ?
             ORDER BY id_task_item
             LIMIT ?""";

    private static final String ORIGINAL_TEXT_SQL = """
            SELECT text_original FROM task_item
             WHERE id_task = ? AND %s = ?""";

    private static final String MARK_CHANGED_SQL = """
            UPDATE task_item
               SET text_corrected = ?, status = 'changed', similarity_score = ?,
                   tokens_input = ?, tokens_output = ?, ai_model = ?, finish_reason = ?, processed_at = ?
             WHERE id_task = ? AND %s = ?""";

    private static final String MARK_UNCHANGED_SQL = """
            UPDATE task_item
               SET text_corrected = text_original, status = 'unchanged', similarity_score = 100,
                   tokens_input = ?, tokens_output = ?, ai_model = ?, finish_reason = ?, processed_at = ?
             WHERE id_task = ? AND %s = ?""";

    private static final String SELECT_FOR_TASK_SQL = """
            SELECT id_task_item, id_task, remote_id, text_original, original_hash, text_corrected, status,
                   similarity_score, tokens_input, tokens_output, ai_model, finish_reason, fetched_at, processed_at
              FROM task_item
             WHERE id_task = ?
             ORDER BY id_task_item""";

    private final JdbcTemplate jdbc;
    private final NamedParameterJdbcTemplate named;

    public TaskItemRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.named = new NamedParameterJdbcTemplate(jdbc);
    }

    /**
     * Inserts new rows as pending and refreshes text, hash and fetch time of known ones.
     */
    public void upsert(long taskId, List<HashedRow> rows, Instant fetchedAt) {
        if (rows.isEmpty()) {
            return;
        }
        List<Object[]> args = new ArrayList<>(rows.size());
        for (HashedRow row : rows) {
            args.add(new Object[]{taskId, row.remoteId(), row.text(), row.hash(), timestamp(fetchedAt)});
        }
        jdbc.batchUpdate(UPSERT_SQL, args);
    }

    /**
     * Overwrites text and hash of already fetched rows, leaving status and corrections alone.
     */
    public void refreshText(long taskId, List<HashedRow> rows, Instant fetchedAt) {
        if (rows.isEmpty()) {
            return;
        }
        List<Object[]> args = new ArrayList<>(rows.size());
        for (HashedRow row : rows) {
            args.add(new Object[]{row.text(), row.hash(), timestamp(fetchedAt), taskId, row.remoteId()});
        }
        jdbc.batchUpdate(REFRESH_TEXT_SQL, args);
    }

    public Set<Long> existingRemoteIds(long taskId, Collection<Long> remoteIds) {
        if (remoteIds.isEmpty()) {
            return Set.of();
        }
        var params = new MapSqlParameterSource("taskId", taskId).addValue("remoteIds", remoteIds);
        return new HashSet<>(named.queryForList(EXISTING_IDS_SQL, params, Long.class));
    }

    /**
     * Stored hashes keyed by source id, for the rows of {@code remoteIds} already fetched.
     */
    public Map<Long, String> hashesByRemoteId(long taskId, Collection<Long> remoteIds) {
        Map<Long, String> hashes = new HashMap<>();
        if (remoteIds.isEmpty()) {
            return hashes;
        }
        var params = new MapSqlParameterSource("taskId", taskId).addValue("remoteIds", remoteIds);
        named.query(HASHES_SQL, params, rs -> {
            hashes.put(rs.getLong("remote_id"), rs.getString("original_hash"));
        });
        return hashes;
    }

    public long countForTask(long taskId) {
        Long count = jdbc.queryForObject(COUNT_SQL, Long.class, taskId);
        return count == null ? 0L : count;
    }

    public Map<TaskItemStatus, Long> countByStatus(long taskId) {
        Map<TaskItemStatus, Long> counts = new EnumMap<>(TaskItemStatus.class);
        for (TaskItemStatus status : TaskItemStatus.values()) {
            counts.put(status, 0L);
        }
        jdbc.query(COUNT_BY_STATUS_SQL, rs -> {
            counts.merge(TaskItemStatus.fromDb(rs.getString("status")), rs.getLong("item_count"), Long::sum);
        }, taskId);
        return counts;
    }

    /**
     * Pending items in local id order, read {@code chunkSize} at a time until
     * {@code maxItems} are collected or none are left.
     */
    public List<TaskItem> findPending(long taskId, int chunkSize, int maxItems) {
        List<TaskItem> items = new ArrayList<>();
        long lastId = 0L;
        while (items.size() < maxItems) {
            int limit = Math.min(chunkSize, maxItems - items.size());
            List<TaskItem> chunk = jdbc.query(PENDING_CHUNK_SQL,
                    (rs, rowNum) -> TaskItem.pending(
                            rs.getLong("id_task_item"),
                            rs.getLong("id_task"),
                            nullableLong(rs, "remote_id"),
                            rs.getString("text_original")),
                    taskId, lastId, limit);
            if (chunk.isEmpty()) {
                break;
            }
            items.addAll(chunk);
            lastId = chunk.get(chunk.size() - 1).id();
            if (chunk.size() < limit) {
                break;
            }
        }
        return items;
    }

    public Optional<String> findOriginalText(long taskId, IdentifierScheme scheme, long identifier) {
        return jdbc.queryForList(ORIGINAL_TEXT_SQL.formatted(scheme.column()), String.class, taskId, identifier)
                .stream()
                .findFirst();
    }

    /**
     * @return affected row count
     */
    public int markChanged(long taskId, IdentifierScheme scheme, long identifier, String textCorrected,
                           double similarityScore, long tokensInput, long tokensOutput,
                           String aiModel, String finishReason, Instant processedAt) {
        return jdbc.update(MARK_CHANGED_SQL.formatted(scheme.column()),
                textCorrected, similarityScore, tokensInput, tokensOutput, aiModel, finishReason,
                timestamp(processedAt), taskId, identifier);
    }

    /**
     * Records that no correction was needed: corrected text becomes the original, score 100.
     *
     * @return affected row count
     */
    public int markUnchanged(long taskId, IdentifierScheme scheme, long identifier,
                             long tokensInput, long tokensOutput,
                             String aiModel, String finishReason, Instant processedAt) {
        return jdbc.update(MARK_UNCHANGED_SQL.formatted(scheme.column()),
                tokensInput, tokensOutput, aiModel, finishReason, timestamp(processedAt), taskId, identifier);
    }

    public List<TaskItem> findByTask(long taskId) {
        return jdbc.query(SELECT_FOR_TASK_SQL, TaskItemRepository::mapItem, taskId);
    }

    private static TaskItem mapItem(ResultSet rs, int rowNum) throws SQLException {
        return new TaskItem(
                rs.getLong("id_task_item"),
                rs.getLong("id_task"),
                nullableLong(rs, "remote_id"),
                rs.getString("text_original"),
                rs.getString("original_hash"),
                rs.getString("text_corrected"),
                TaskItemStatus.fromDb(rs.getString("status")),
                nullableDouble(rs, "similarity_score"),
                nullableInt(rs, "tokens_input"),
                nullableInt(rs, "tokens_output"),
                rs.getString("ai_model"),
                rs.getString("finish_reason"),
                instant(rs, "fetched_at"),
                instant(rs, "processed_at"));
    }
}

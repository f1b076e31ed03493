package com.proofline.core.source;

import com.proofline.core.model.TaskValidationException;
import com.proofline.core.text.RowValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Read-only view of one source table over an open JDBC connection.
 * Owns the connection and closes it with {@link #close()}.
 */
public class SourceReader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SourceReader.class);

    private final Connection connection;
    private final SourceQueryBuilder queries;

    public SourceReader(Connection connection, SourceQueryBuilder queries) {
        this.connection = connection;
        this.queries = queries;
    }

    public SourceDialect dialect() {
        return queries.dialect();
    }

    /**
     * Reads the first row and checks that its id is usable.
     *
     * @return the first row, or {@code null} for an empty table
     * @throws TaskValidationException when the id column value is absent
     */
    public SourceRow probe() {
        try (PreparedStatement statement = connection.prepareStatement(queries.probe());
             ResultSet rs = statement.executeQuery()) {
            if (!rs.next()) {
                return null;
            }
            Long id = RowValues.toRemoteId(rs.getObject(SourceQueryBuilder.ID_ALIAS));
            if (id == null) {
                throw new TaskValidationException("Id column value is missing in the source table");
            }
            return new SourceRow(id, RowValues.toText(rs.getString(SourceQueryBuilder.TEXT_ALIAS)));
        } catch (SQLException e) {
            throw new SourceAccessException("Source probe failed: " + e.getMessage(), e);
        }
    }

    public long count() {
        try (PreparedStatement statement = connection.prepareStatement(queries.count());
             ResultSet rs = statement.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            throw new SourceAccessException("Source count failed: " + e.getMessage(), e);
        }
    }

    /** Largest source id, 0 for an empty table. */
    public long maxId() {
        try (PreparedStatement statement = connection.prepareStatement(queries.maxId());
             ResultSet rs = statement.executeQuery()) {
            if (!rs.next()) {
                return 0L;
            }
            Long max = RowValues.toRemoteId(rs.getObject(1));
            return max == null ? 0L : max;
        } catch (SQLException e) {
            throw new SourceAccessException("Source max id query failed: " + e.getMessage(), e);
        }
    }

    /**
     * Rows with {@code afterId < id <= ceiling}, ascending, at most {@code batchSize}.
     * Rows whose id is NULL are skipped.
     */
    public List<SourceRow> page(long afterId, long ceiling, int batchSize) {
        List<SourceRow> rows = new ArrayList<>();
        try (PreparedStatement statement = connection.prepareStatement(queries.page(batchSize))) {
            statement.setLong(1, afterId);
            statement.setLong(2, ceiling);
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    Long id = RowValues.toRemoteId(rs.getObject(SourceQueryBuilder.ID_ALIAS));
                    if (id == null) {
                        continue;
                    }
                    rows.add(new SourceRow(id, RowValues.toText(rs.getString(SourceQueryBuilder.TEXT_ALIAS))));
                }
            }
        } catch (SQLException e) {
            throw new SourceAccessException("Source page query failed after id " + afterId + ": " + e.getMessage(), e);
        }
        return rows;
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close source connection: {}", e.getMessage());
        }
    }
}

package com.proofline.core.source;

import com.proofline.core.text.SqlIdentifiers;

/**
 * Builds the four statements a pass issues against a source table.
 * <p>
 * Table and column names are validated once at construction and then
 * interpolated; cursor values are always bound as {@code ?} parameters.
 * Result columns are aliased to {@link #ID_ALIAS} and {@link #TEXT_ALIAS}
 * so the reader does not depend on source naming.
 */
public class SourceQueryBuilder {

    public static final String ID_ALIAS = "remote_id";
    public static final String TEXT_ALIAS = "text_value";

    private final SourceDialect dialect;
    private final String table;
    private final String idColumn;
    private final String textColumn;

    public SourceQueryBuilder(SourceDialect dialect, String table, String idColumn, String textColumn) {
        this.dialect = dialect;
        this.table = SqlIdentifiers.requireValid(table);
        this.idColumn = SqlIdentifiers.requireValid(idColumn);
        this.textColumn = SqlIdentifiers.requireValid(textColumn);
    }

    public SourceDialect dialect() {
        return dialect;
    }

    /** First row by id, used to check that the id column exists and is filled. */
    public String probe() {
        return select(1, null);
    }

    public String count() {
        return "SELECT COUNT(*) AS total_count FROM " + table;
    }

    public String maxId() {
        return "SELECT MAX(" + idColumn + ") AS max_id FROM " + table;
    }

    /**
     * Next page after a cursor, capped at a ceiling. Binds two parameters:
     * the exclusive lower bound and the inclusive upper bound.
     */
    public String page(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        return select(batchSize, "WHERE " + idColumn + " > ? AND " + idColumn + " <= ?");
    }

    private String select(int limit, String where) {
        StringBuilder sql = new StringBuilder("SELECT ");
        if (dialect.usesTop()) {
            sql.append("TOP ").append(limit).append(' ');
        }
        sql.append(idColumn).append(" AS ").append(ID_ALIAS).append(", ")
                .append(textColumn).append(" AS ").append(TEXT_ALIAS)
                .append(" FROM ").append(table);
        if (where != null) {
            sql.append(' ').append(where);
        }
        sql.append(" ORDER BY ").append(idColumn).append(" ASC");
        if (!dialect.usesTop()) {
            sql.append(" LIMIT ").append(limit);
        }
        return sql.toString();
    }
}

package com.proofline.core.source;

import com.proofline.core.model.TaskValidationException;

import java.util.Locale;

/**
 * SQL dialects a source database may speak. Only the row-limiting clause and
 * the JDBC URL differ between them.
 */
public enum SourceDialect {
    MYSQL("mysql", 3306),
    MSSQL("mssql", 1433),
    PGSQL("pgsql", 5432),
    SQLITE("sqlite", 0);

    private final String dbValue;
    private final int defaultPort;

    SourceDialect(String dbValue, int defaultPort) {
        this.dbValue = dbValue;
        this.defaultPort = defaultPort;
    }

    public String dbValue() {
        return dbValue;
    }

    public int defaultPort() {
        return defaultPort;
    }

    /** {@code TOP n} goes after SELECT instead of a trailing {@code LIMIT n}. */
    public boolean usesTop() {
        return this == MSSQL;
    }

    public static SourceDialect fromDb(String value) {
        if (value == null) {
            throw new TaskValidationException("Database type is not set");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "mysql", "mariadb" -> MYSQL;
            case "mssql", "sqlserver" -> MSSQL;
            case "pgsql", "postgres", "postgresql" -> PGSQL;
            case "sqlite" -> SQLITE;
            default -> throw new TaskValidationException("Unsupported database type: " + value);
        };
    }
}

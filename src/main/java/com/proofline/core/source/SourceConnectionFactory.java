package com.proofline.core.source;

import com.proofline.core.model.DatabaseConnection;
import com.proofline.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/**
 * Opens read-only JDBC connections to task sources.
 */
@Component
public class SourceConnectionFactory {

    private static final Logger log = LoggerFactory.getLogger(SourceConnectionFactory.class);

    /**
     * Connects to the task's source and prepares the statements for its table.
     *
     * @throws SourceAccessException when the database cannot be reached
     */
    public SourceReader open(DatabaseConnection database, Task task) {
        SourceQueryBuilder queries = new SourceQueryBuilder(
                database.dialect(), task.tableName(), task.idColumnName(), task.columnName());
        String url = jdbcUrl(database);
        log.info("Connecting to {} source {} (connection {})", database.dialect().dbValue(),
                database.databaseName(), database.id());
        try {
            Connection connection = DriverManager.getConnection(url, credentials(database));
            // sqlite-jdbc refuses to toggle read-only after the connection is open
            if (database.dialect() != SourceDialect.SQLITE) {
                connection.setReadOnly(true);
            }
            return new SourceReader(connection, queries);
        } catch (SQLException e) {
            throw new SourceAccessException("Cannot connect to source database " + database.id()
                    + " (" + database.dialect().dbValue() + "): " + e.getMessage(), e);
        }
    }

    static String jdbcUrl(DatabaseConnection database) {
        SourceDialect dialect = database.dialect();
        if (dialect == SourceDialect.SQLITE) {
            return "jdbc:sqlite:" + database.databaseName();
        }
        String host = database.host() == null || database.host().isBlank() ? "localhost" : database.host();
        int port = database.port() == null || database.port() <= 0 ? dialect.defaultPort() : database.port();
        return switch (dialect) {
            case MYSQL -> "jdbc:mysql://" + host + ":" + port + "/" + database.databaseName()
                    + "?characterEncoding=UTF-8";
            case MSSQL -> "jdbc:sqlserver://" + host + ":" + port + ";databaseName=" + database.databaseName()
                    + ";encrypt=true;trustServerCertificate=true";
            case PGSQL -> "jdbc:postgresql://" + host + ":" + port + "/" + database.databaseName();
            case SQLITE -> throw new IllegalStateException("unreachable");
        };
    }

    private static Properties credentials(DatabaseConnection database) {
        Properties properties = new Properties();
        if (database.user() != null) {
            properties.setProperty("user", database.user());
        }
        if (database.password() != null) {
            properties.setProperty("password", database.password());
        }
        return properties;
    }
}

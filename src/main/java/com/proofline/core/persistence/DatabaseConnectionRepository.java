package com.proofline.core.persistence;

import com.proofline.core.model.DatabaseConnection;
import com.proofline.core.source.SourceDialect;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Optional;

import static com.proofline.core.persistence.JdbcRows.nullableInt;

@Repository
public class DatabaseConnectionRepository {

    private static final String SELECT_BY_ID_SQL = """
            SELECT id_database, db_type, host, port, db_name, db_user, db_password
              FROM database_connection
             WHERE id_database = ?""";

    private final JdbcTemplate jdbc;

    public DatabaseConnectionRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<DatabaseConnection> findById(long id) {
        return jdbc.query(SELECT_BY_ID_SQL, (rs, rowNum) -> new DatabaseConnection(
                        rs.getLong("id_database"),
                        SourceDialect.fromDb(rs.getString("db_type")),
                        rs.getString("host"),
                        nullableInt(rs, "port"),
                        rs.getString("db_name"),
                        rs.getString("db_user"),
                        rs.getString("db_password")), id)
                .stream()
                .findFirst();
    }
}

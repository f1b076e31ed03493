package com.proofline.core.source;

import com.proofline.core.model.TaskValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SourceQueryBuilderTest {

    @Nested
    @DisplayName("LIMIT dialects")
    class LimitDialects {

        private final SourceQueryBuilder queries =
                new SourceQueryBuilder(SourceDialect.MYSQL, "articles", "id", "body");

        @Test
        @DisplayName("probe selects the first row with LIMIT 1")
        void probe() {
            assertEquals("SELECT id AS remote_id, body AS text_value FROM articles ORDER BY id ASC LIMIT 1",
                    queries.probe());
        }

        @Test
        @DisplayName("page binds lower and upper bound and limits to the batch size")
        void page() {
            assertEquals("SELECT id AS remote_id, body AS text_value FROM articles "
                            + "WHERE id > ? AND id <= ? ORDER BY id ASC LIMIT 500",
                    queries.page(500));
        }

        @Test
        @DisplayName("count and max")
        void countAndMax() {
            assertEquals("SELECT COUNT(*) AS total_count FROM articles", queries.count());
            assertEquals("SELECT MAX(id) AS max_id FROM articles", queries.maxId());
        }
    }

    @Nested
    @DisplayName("mssql")
    class SqlServer {

        private final SourceQueryBuilder queries =
                new SourceQueryBuilder(SourceDialect.MSSQL, "Articles", "ArticleId", "Body");

        @Test
        @DisplayName("uses TOP instead of LIMIT")
        void top() {
            assertEquals("SELECT TOP 1 ArticleId AS remote_id, Body AS text_value FROM Articles ORDER BY ArticleId ASC",
                    queries.probe());
            String page = queries.page(10);
            assertTrue(page.startsWith("SELECT TOP 10 "));
            assertFalse(page.contains("LIMIT"));
            assertTrue(page.contains("WHERE ArticleId > ? AND ArticleId <= ?"));
        }
    }

    @Test
    @DisplayName("invalid identifiers are rejected before any SQL is built")
    void rejectsInjection() {
        assertThrows(TaskValidationException.class,
                () -> new SourceQueryBuilder(SourceDialect.PGSQL, "articles; DROP TABLE x", "id", "body"));
        assertThrows(TaskValidationException.class,
                () -> new SourceQueryBuilder(SourceDialect.PGSQL, "articles", "id", "body text"));
    }

    @Test
    @DisplayName("non-positive batch size is refused")
    void batchSize() {
        var queries = new SourceQueryBuilder(SourceDialect.SQLITE, "articles", "id", "body");
        assertThrows(IllegalArgumentException.class, () -> queries.page(0));
    }

    @Test
    @DisplayName("dialect names from the connection table")
    void dialectNames() {
        assertEquals(SourceDialect.MYSQL, SourceDialect.fromDb("mysql"));
        assertEquals(SourceDialect.MSSQL, SourceDialect.fromDb(" MSSQL "));
        assertEquals(SourceDialect.PGSQL, SourceDialect.fromDb("postgresql"));
        assertEquals(SourceDialect.SQLITE, SourceDialect.fromDb("sqlite"));
        assertThrows(TaskValidationException.class, () -> SourceDialect.fromDb("oracle"));
    }
}

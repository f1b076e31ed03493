package com.proofline.core.persistence;

import com.proofline.core.model.AiModelConfig;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Optional;

import static com.proofline.core.persistence.JdbcRows.nullableDouble;
import static com.proofline.core.persistence.JdbcRows.nullableInt;

/**
 * Reads model configurations. Inactive models are invisible to the engine.
 */
@Repository
public class AiModelRepository {

    private static final String SELECT_ACTIVE_SQL = """
            SELECT id_ai_model, provider, model_name, api_key_encrypted, base_url,
                   temperature, max_tokens, max_char_input
              FROM ai_model
             WHERE id_ai_model = ? AND is_active = 1""";

    private final JdbcTemplate jdbc;

    public AiModelRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<AiModelConfig> findActiveById(long id) {
        return jdbc.query(SELECT_ACTIVE_SQL, (rs, rowNum) -> new AiModelConfig(
                        rs.getLong("id_ai_model"),
                        rs.getString("provider"),
                        rs.getString("model_name"),
                        rs.getString("api_key_encrypted"),
                        rs.getString("base_url"),
                        nullableDouble(rs, "temperature"),
                        nullableInt(rs, "max_tokens"),
                        nullableInt(rs, "max_char_input")), id)
                .stream()
                .findFirst();
    }
}

package com.proofline;

import com.proofline.core.llm.ProviderRegistry;
import com.proofline.dispatch.cli.CliRunner;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "spring.datasource.url=jdbc:sqlite:${java.io.tmpdir}/proofline-context-test.db",
        "spring.datasource.driver-class-name=org.sqlite.JDBC",
        "spring.sql.init.platform=sqlite",
        "spring.sql.init.mode=always"
})
class ProoflineApplicationTest {

    @Autowired
    ProviderRegistry providers;

    @Autowired
    CliRunner cliRunner;

    @Test
    @DisplayName("context starts against an SQLite store with all providers registered")
    void contextLoads() {
        assertEquals(Set.of("Anthropic", "DeepSeek", "Google", "OpenAI"), providers.names());
        assertEquals(0, cliRunner.getExitCode());
    }
}

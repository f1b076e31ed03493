package com.proofline.core.health;

import com.proofline.core.llm.ProviderRegistry;
import com.proofline.core.model.Task;
import com.proofline.core.model.TaskRunStatus;
import com.proofline.core.persistence.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Checks behind {@code proofline health}: the local store answers, providers
 * are registered and no task is stuck in {@code error}. The task check needs
 * the store, so it is skipped when the store is down.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final DataSource dataSource;
    private final TaskRepository tasks;
    private final ProviderRegistry providers;

    public HealthCheckService(DataSource dataSource, TaskRepository tasks, ProviderRegistry providers) {
        this.dataSource = dataSource;
        this.tasks = tasks;
        this.providers = providers;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        HealthStatus database = checkDatabase();
        results.add(database);
        results.add(checkProviders());
        if (database.status() == HealthStatus.Status.UP) {
            results.add(checkTasks());
        }
        return results;
    }

    private HealthStatus checkDatabase() {
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return HealthStatus.up("database", "Local store connection valid",
                        Map.of("product", conn.getMetaData().getDatabaseProductName()));
            }
            return HealthStatus.down("database", "Local store connection invalid");
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return HealthStatus.down("database", "Database error: " + e.getMessage());
        }
    }

    private HealthStatus checkProviders() {
        var names = providers.names();
        if (names.isEmpty()) {
            return HealthStatus.down("ai-providers", "No AI providers registered");
        }
        return HealthStatus.up("ai-providers", "Registered: " + String.join(", ", names), Map.of());
    }

    private HealthStatus checkTasks() {
        try {
            List<Task> all = tasks.findAll();
            long failed = all.stream().filter(task -> task.status() == TaskRunStatus.ERROR).count();
            long running = all.stream().filter(task -> task.status() == TaskRunStatus.RUNNING).count();
            var metadata = Map.of(
                    "total", String.valueOf(all.size()),
                    "running", String.valueOf(running),
                    "error", String.valueOf(failed));
            if (failed > 0) {
                return HealthStatus.degraded("tasks",
                        failed + " of " + all.size() + " tasks ended their last run with an error", metadata);
            }
            return HealthStatus.up("tasks", all.size() + " tasks, " + running + " running", metadata);
        } catch (Exception e) {
            log.warn("Task health check failed: {}", e.getMessage());
            return HealthStatus.down("tasks", "Task table error: " + e.getMessage());
        }
    }
}

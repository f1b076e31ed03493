package com.proofline.core.lifecycle;

import com.proofline.core.config.ProoflineProperties;
import com.proofline.core.model.Task;
import com.proofline.core.model.TaskRunStatus;
import com.proofline.core.model.TaskStage;
import com.proofline.core.persistence.TaskRepository;
import com.proofline.support.TestDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class TaskLifecycleTest {

    @Nested
    @DisplayName("nextStage")
    class NextStage {

        @Test
        @DisplayName("fetch completes when every source row is stored")
        void fetchToAi() {
            assertEquals(TaskStage.AI, TaskLifecycle.nextStage(TaskStage.FETCH, 3, 3, 0));
            assertEquals(TaskStage.AI, TaskLifecycle.nextStage(TaskStage.NEW, 3, 3, 0));
            assertEquals(TaskStage.FETCH, TaskLifecycle.nextStage(TaskStage.FETCH, 3, 2, 0));
        }

        @Test
        @DisplayName("correction completes when every stored row has an outcome")
        void aiToExport() {
            assertEquals(TaskStage.EXPORT, TaskLifecycle.nextStage(TaskStage.AI, 3, 3, 3));
            assertEquals(TaskStage.AI, TaskLifecycle.nextStage(TaskStage.AI, 3, 3, 2));
        }

        @Test
        @DisplayName("an empty source never leaves fetch")
        void emptySource() {
            assertEquals(TaskStage.FETCH, TaskLifecycle.nextStage(TaskStage.FETCH, 0, 0, 0));
        }

        @Test
        @DisplayName("resync, export and done are left alone")
        void otherStages() {
            assertEquals(TaskStage.RESYNC, TaskLifecycle.nextStage(TaskStage.RESYNC, 3, 3, 3));
            assertEquals(TaskStage.EXPORT, TaskLifecycle.nextStage(TaskStage.EXPORT, 3, 3, 3));
            assertEquals(TaskStage.DONE, TaskLifecycle.nextStage(TaskStage.DONE, 3, 3, 3));
        }
    }

    @Nested
    @DisplayName("Claims")
    class Claims {

        @TempDir
        Path dir;

        private TestDatabase db;
        private TaskRepository tasks;
        private TaskLifecycle lifecycle;

        @BeforeEach
        void setUp() {
            db = TestDatabase.create(dir);
            tasks = new TaskRepository(db.jdbc);
            Clock clock = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
            lifecycle = new TaskLifecycle(tasks, new ProoflineProperties(), clock);
        }

        @Test
        @DisplayName("sync and correction claim disjoint stages")
        void disjointStages() {
            long syncTask = db.insertTask(TaskStage.FETCH);
            long aiTask = db.insertTask(TaskStage.AI);

            assertEquals(syncTask, lifecycle.claimForSync().orElseThrow().task().id());
            assertEquals(aiTask, lifecycle.claimForCorrection().orElseThrow().task().id());
            assertTrue(lifecycle.claimForSync().isEmpty());
        }

        @Test
        @DisplayName("release after failure marks the task as error")
        void releaseFailed() {
            long id = db.insertTask(TaskStage.NEW);
            TaskLifecycle.Claim claim = lifecycle.claimForSync().orElseThrow();

            lifecycle.release(claim, true);

            assertEquals(TaskRunStatus.ERROR, tasks.findById(id).orElseThrow().status());
        }

        @Test
        @DisplayName("resync request is noted in the description")
        void resyncRequest() {
            long id = db.insertTask(TaskStage.AI);

            assertTrue(lifecycle.requestResync(id));

            Task task = tasks.findById(id).orElseThrow();
            assertEquals(TaskStage.RESYNC, task.stage());
            assertEquals("Resync requested", task.description());
        }
    }
}

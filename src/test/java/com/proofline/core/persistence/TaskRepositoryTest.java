package com.proofline.core.persistence;

import com.proofline.core.model.Task;
import com.proofline.core.model.TaskRunStatus;
import com.proofline.core.model.TaskStage;
import com.proofline.support.TestDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TaskRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path dir;

    private TestDatabase db;
    private TaskRepository tasks;

    @BeforeEach
    void setUp() {
        db = TestDatabase.create(dir);
        tasks = new TaskRepository(db.jdbc);
    }

    @Nested
    @DisplayName("Claiming")
    class Claiming {

        @Test
        @DisplayName("claims the oldest eligible task and marks it running")
        void claimsOldest() {
            db.insertTask(TaskStage.AI);
            long first = db.insertTask(TaskStage.FETCH);
            db.insertTask(TaskStage.NEW);

            Optional<Task> claimed = tasks.claimOldest(TaskStage.SYNC_ELIGIBLE, "t1", NOW, NOW.minusSeconds(1800));

            assertTrue(claimed.isPresent());
            assertEquals(first, claimed.get().id());
            assertEquals(TaskRunStatus.RUNNING, claimed.get().status());
        }

        @Test
        @DisplayName("two invocations never own the same task")
        void claimExclusivity() {
            long only = db.insertTask(TaskStage.NEW);

            Optional<Task> a = tasks.claimOldest(TaskStage.SYNC_ELIGIBLE, "a", NOW, NOW.minusSeconds(1800));
            Optional<Task> b = tasks.claimOldest(TaskStage.SYNC_ELIGIBLE, "b", NOW, NOW.minusSeconds(1800));

            assertEquals(only, a.orElseThrow().id());
            assertTrue(b.isEmpty(), "second claim must not see a running task");
        }

        @Test
        @DisplayName("a second invocation picks the next task instead")
        void secondClaimTakesNext() {
            long first = db.insertTask(TaskStage.NEW);
            long second = db.insertTask(TaskStage.RESYNC);

            assertEquals(first, tasks.claimOldest(TaskStage.SYNC_ELIGIBLE, "a", NOW, NOW.minusSeconds(60))
                    .orElseThrow().id());
            assertEquals(second, tasks.claimOldest(TaskStage.SYNC_ELIGIBLE, "b", NOW, NOW.minusSeconds(60))
                    .orElseThrow().id());
        }

        @Test
        @DisplayName("a stale claim can be taken over")
        void staleClaim() {
            long id = db.insertTask(TaskStage.FETCH);
            Instant earlier = NOW.minus(Duration.ofHours(2));
            tasks.claimOldest(TaskStage.SYNC_ELIGIBLE, "crashed", earlier, earlier.minusSeconds(1800));

            Optional<Task> takeover = tasks.claimOldest(TaskStage.SYNC_ELIGIBLE, "new", NOW, NOW.minusSeconds(1800));

            assertEquals(id, takeover.orElseThrow().id());
            assertFalse(tasks.release(id, "crashed", TaskRunStatus.IDLE), "old token no longer owns the task");
            assertTrue(tasks.release(id, "new", TaskRunStatus.IDLE));
        }

        @Test
        @DisplayName("release clears the claim and records the outcome")
        void release() {
            long id = db.insertTask(TaskStage.AI);
            tasks.claimOldest(TaskStage.AI_ELIGIBLE, "tok", NOW, NOW.minusSeconds(60));

            assertTrue(tasks.release(id, "tok", TaskRunStatus.ERROR));

            Task task = tasks.findById(id).orElseThrow();
            assertEquals(TaskRunStatus.ERROR, task.status());
            // error status does not block the next run
            assertTrue(tasks.claimOldest(TaskStage.AI_ELIGIBLE, "tok2", NOW, NOW.minusSeconds(60)).isPresent());
        }
    }

    @Test
    @DisplayName("description and error log are append-only, newline separated")
    void appendLogs() {
        long id = db.insertTask(TaskStage.NEW);

        tasks.appendDescription(id, "first");
        tasks.appendDescription(id, "second");
        tasks.appendError(id, "boom");

        Task task = tasks.findById(id).orElseThrow();
        assertEquals("first\nsecond", task.description());
        assertEquals("boom", task.errorLog());
    }

    @Test
    @DisplayName("fetch batch counters accumulate and the cursor moves")
    void fetchCounters() {
        long id = db.insertTask(TaskStage.NEW);
        tasks.claimOldest(TaskStage.SYNC_ELIGIBLE, "tok", NOW, NOW.minusSeconds(60));

        assertTrue(tasks.startFetch(id, "tok", NOW, 10, 42));
        assertTrue(tasks.recordFetchBatch(id, "tok", NOW, 20, 5, 5));
        assertTrue(tasks.recordFetchBatch(id, "tok", NOW, 42, 5, 3));

        Task task = tasks.findById(id).orElseThrow();
        assertEquals(TaskStage.FETCH, task.stage());
        assertEquals(10, task.recordsTotal());
        assertEquals(42, task.markerMaxId());
        assertEquals(42, task.markerId());
        assertEquals(10, task.recordsFetched());
        assertEquals(8, task.recordsNew());
    }

    @Nested
    @DisplayName("Resync requests")
    class ResyncRequests {

        @Test
        @DisplayName("moves a fetched task to resync and resets the resync cursor")
        void fromDone() {
            long id = db.insertTask(TaskStage.DONE);
            db.setTaskColumn(id, "resync_marker_id", 17);

            assertTrue(tasks.requestResync(id));

            Task task = tasks.findById(id).orElseThrow();
            assertEquals(TaskStage.RESYNC, task.stage());
            assertEquals(0, task.resyncMarkerId());
        }

        @Test
        @DisplayName("refused for new tasks and unknown ids")
        void refused() {
            long id = db.insertTask(TaskStage.NEW);
            assertFalse(tasks.requestResync(id));
            assertFalse(tasks.requestResync(999));
        }

        @Test
        @DisplayName("finishing resync returns the task to fetch with the cursor at the ceiling")
        void finish() {
            long id = db.insertTask(TaskStage.RESYNC);
            tasks.claimOldest(TaskStage.SYNC_ELIGIBLE, "tok", NOW, NOW.minusSeconds(60));

            assertTrue(tasks.finishResync(id, "tok", 99));

            Task task = tasks.findById(id).orElseThrow();
            assertEquals(TaskStage.FETCH, task.stage());
            assertEquals(99, task.resyncMarkerId());
        }
    }

    @Nested
    @DisplayName("Batch writes under a claim")
    class ClaimGuard {

        @Test
        @DisplayName("a runner whose stale claim was taken over cannot move the cursor back")
        void takeoverDuringFetch() {
            long id = db.insertTask(TaskStage.FETCH);
            Instant start = NOW.minus(Duration.ofMinutes(31));
            tasks.claimOldest(TaskStage.SYNC_ELIGIBLE, "runner-a", start, start.minusSeconds(1800));
            tasks.claimOldest(TaskStage.SYNC_ELIGIBLE, "runner-b", NOW, NOW.minusSeconds(1800));

            assertTrue(tasks.recordFetchBatch(id, "runner-b", NOW, 10, 10, 10));
            assertFalse(tasks.recordFetchBatch(id, "runner-a", NOW, 5, 5, 5));
            assertFalse(tasks.recordResyncBatch(id, "runner-a", NOW, 5, 1));

            Task task = tasks.findById(id).orElseThrow();
            assertEquals(10, task.markerId());
            assertEquals(10, task.recordsFetched());
            assertEquals(0, task.recordsUpdated());
            assertTrue(tasks.holdsClaim(id, "runner-b"));
            assertFalse(tasks.holdsClaim(id, "runner-a"));
        }

        @Test
        @DisplayName("the fetch cursor never moves backwards")
        void monotonicMarker() {
            long id = db.insertTask(TaskStage.FETCH);
            tasks.claimOldest(TaskStage.SYNC_ELIGIBLE, "tok", NOW, NOW.minusSeconds(60));

            tasks.recordFetchBatch(id, "tok", NOW, 20, 5, 5);
            tasks.recordFetchBatch(id, "tok", NOW, 15, 5, 0);

            assertEquals(20, tasks.findById(id).orElseThrow().markerId());
        }

        @Test
        @DisplayName("each batch renews the claim so a long pass is not taken over")
        void batchRenewsClaim() {
            long id = db.insertTask(TaskStage.FETCH);
            Instant start = NOW.minus(Duration.ofMinutes(45));
            tasks.claimOldest(TaskStage.SYNC_ELIGIBLE, "runner-a", start, start.minusSeconds(1800));

            assertTrue(tasks.recordFetchBatch(id, "runner-a", NOW, 5, 5, 5));

            assertTrue(tasks.claimOldest(TaskStage.SYNC_ELIGIBLE, "runner-b", NOW.plusSeconds(60),
                    NOW.minusSeconds(1740)).isEmpty());
            assertTrue(tasks.holdsClaim(id, "runner-a"));
        }

        @Test
        @DisplayName("starting a fetch does not overwrite a resync request")
        void resyncRequestWins() {
            long id = db.insertTask(TaskStage.FETCH);
            tasks.claimOldest(TaskStage.SYNC_ELIGIBLE, "tok", NOW, NOW.minusSeconds(60));
            assertTrue(tasks.requestResync(id));

            assertFalse(tasks.startFetch(id, "tok", NOW, 10, 42));

            Task task = tasks.findById(id).orElseThrow();
            assertEquals(TaskStage.RESYNC, task.stage());
            assertEquals(0, task.markerMaxId());
            assertTrue(tasks.holdsClaim(id, "tok"));
        }
    }

    @Test
    @DisplayName("the legacy 'resynch' spelling is read as resync")
    void legacyStage() {
        long id = db.insertTask(TaskStage.NEW);
        db.setTaskColumn(id, "stage", "resynch");
        assertEquals(TaskStage.RESYNC, tasks.findById(id).orElseThrow().stage());
    }
}

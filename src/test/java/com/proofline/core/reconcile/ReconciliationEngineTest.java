package com.proofline.core.reconcile;

import com.proofline.core.metrics.PipelineMetrics;
import com.proofline.core.model.TaskItem;
import com.proofline.core.model.TaskItemStatus;
import com.proofline.core.model.TaskStage;
import com.proofline.core.model.TaskValidationException;
import com.proofline.core.persistence.TaskItemRepository;
import com.proofline.core.persistence.TaskRepository;
import com.proofline.support.TestDatabase;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ReconciliationEngineTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @TempDir
    Path dir;

    private TestDatabase db;
    private TaskRepository tasks;
    private TaskItemRepository items;
    private SimpleMeterRegistry registry;
    private ReconciliationEngine engine;
    private long taskId;
    private List<TaskItem> prompted;

    @BeforeEach
    void setUp() {
        db = TestDatabase.create(dir);
        tasks = new TaskRepository(db.jdbc);
        items = new TaskItemRepository(db.jdbc);
        registry = new SimpleMeterRegistry();
        engine = new ReconciliationEngine(tasks, items, db.transactions, new PipelineMetrics(registry),
                Clock.fixed(NOW, ZoneOffset.UTC));
        taskId = db.insertTask(TaskStage.AI);
        db.insertItem(taskId, 1L, "ok", "pending");
        db.insertItem(taskId, 2L, "bad txt", "pending");
        db.insertItem(taskId, 3L, "fine", "pending");
        prompted = items.findPending(taskId, 10, 20);
    }

    private int reconcile(List<ResponseItem> response, long tokensIn, long tokensOut) {
        OriginalTexts originals = OriginalTexts.of(prompted);
        return engine.reconcile(taskId, response, originals.expectedIdentifiers(), tokensIn, tokensOut,
                originals, "gpt-4o-2024-08-06", "gpt-4o", "stop");
    }

    private static ResponseItem remote(String id, String text) {
        return new ResponseItem(id, null, null, text);
    }

    @Test
    @DisplayName("unchanged, changed and unchanged items are written with scores and tokens")
    void endToEnd() {
        int updated = reconcile(List.of(remote("1", ""), remote("2", "bad text"), remote("3", "")), 10, 7);

        assertEquals(3, updated);
        List<TaskItem> stored = items.findByTask(taskId);
        assertEquals(TaskItemStatus.UNCHANGED, stored.get(0).status());
        assertEquals("ok", stored.get(0).textCorrected());
        assertEquals(100.0, stored.get(0).similarityScore());

        TaskItem changed = stored.get(1);
        assertEquals(TaskItemStatus.CHANGED, changed.status());
        assertEquals("bad text", changed.textCorrected());
        assertEquals(93.33, changed.similarityScore());
        assertEquals("gpt-4o-2024-08-06", changed.aiModel());
        assertEquals("stop", changed.finishReason());
        assertEquals(NOW, changed.processedAt());

        // 10 / 3 and 7 / 3 by floor division
        assertTrue(stored.stream().allMatch(item -> item.tokensInput() == 3 && item.tokensOutput() == 2));
        assertEquals(3.0, registry.find("proofline.reconcile.items").counter().count());
    }

    @Test
    @DisplayName("the configured model name is recorded when the reply has none")
    void configuredModelFallback() {
        OriginalTexts originals = OriginalTexts.of(prompted);
        engine.reconcile(taskId, List.of(remote("1", "")), originals.expectedIdentifiers(), 0, 0,
                originals, null, "gpt-4o", null);

        assertEquals("gpt-4o", items.findByTask(taskId).get(0).aiModel());
    }

    @Test
    @DisplayName("local ids are accepted through id_task_item or id")
    void localIdentifiers() {
        long localId = prompted.get(1).id();
        OriginalTexts originals = OriginalTexts.of(prompted);
        int updated = engine.reconcile(taskId,
                List.of(new ResponseItem(null, String.valueOf(localId), null, "bad text")),
                Set.of(), 0, 0, originals, "m", "m", null);

        assertEquals(1, updated);
        assertEquals(93.33, items.findByTask(taskId).get(1).similarityScore());
    }

    @Test
    @DisplayName("an empty reply updates nothing")
    void emptyReply() {
        assertEquals(0, reconcile(List.of(), 10, 10));
        assertEquals(3L, items.countByStatus(taskId).get(TaskItemStatus.PENDING));
    }

    @Nested
    @DisplayName("Rejected replies roll back completely")
    class Rejected {

        private void assertAllPending() {
            assertEquals(3L, items.countByStatus(taskId).get(TaskItemStatus.PENDING));
        }

        @Test
        @DisplayName("duplicate identifier")
        void duplicate() {
            TaskValidationException e = assertThrows(TaskValidationException.class,
                    () -> reconcile(List.of(remote("1", ""), remote("2", "x"), remote("1", "y")), 0, 0));

            assertEquals("Response element 1 appears more than once", e.getMessage());
            assertAllPending();
            assertEquals("AI response rejected: Response element 1 appears more than once",
                    tasks.findById(taskId).orElseThrow().errorLog());
            assertEquals(1.0, registry.find("proofline.reconcile.rejected").counter().count());
        }

        @Test
        @DisplayName("identifier that was not in the prompt")
        void unexpected() {
            assertThrows(TaskValidationException.class,
                    () -> reconcile(List.of(remote("1", ""), remote("42", "x")), 0, 0));
            assertAllPending();
        }

        @Test
        @DisplayName("element without an identifier")
        void noIdentifier() {
            assertThrows(TaskValidationException.class,
                    () -> reconcile(List.of(remote("1", ""), new ResponseItem(null, null, null, "x")), 0, 0));
            assertAllPending();
        }

        @Test
        @DisplayName("element without text_corrected")
        void noText() {
            assertThrows(TaskValidationException.class,
                    () -> reconcile(List.of(remote("1", ""), remote("2", null)), 0, 0));
            assertAllPending();
        }

        @Test
        @DisplayName("non-numeric identifier")
        void nonNumeric() {
            OriginalTexts originals = OriginalTexts.of(prompted);
            assertThrows(TaskValidationException.class, () -> engine.reconcile(taskId,
                    List.of(remote("abc", "x")), Set.of(), 0, 0, originals, "m", "m", null));
            assertAllPending();
        }
    }
}

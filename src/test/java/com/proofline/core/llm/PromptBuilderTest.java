package com.proofline.core.llm;

import com.proofline.core.model.TaskItem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PromptBuilderTest {

    private final PromptBuilder builder = new PromptBuilder();

    private static TaskItem item(Long id, Long remoteId, String text) {
        return TaskItem.pending(id, 1L, remoteId, text);
    }

    @Test
    @DisplayName("numbers each input line with the source id and flattens newlines")
    void inputLines() {
        String prompt = builder.buildPrompt(List.of(
                item(10L, 1L, "ok"),
                item(11L, 2L, "bad\ntxt")), null);

        assertTrue(prompt.contains("<INPUT>\n1. ok\n2. bad txt\n</INPUT>"), prompt);
        assertTrue(prompt.endsWith("</INPUT>"));
    }

    @Test
    @DisplayName("falls back to the local id when the source id is missing")
    void localIdFallback() {
        assertEquals("7", PromptBuilder.identifierOf(item(7L, null, "x")));
        assertEquals("?", PromptBuilder.identifierOf(item(null, null, "x")));
        assertEquals("3", PromptBuilder.identifierOf(item(7L, 3L, "x")));
    }

    @Test
    @DisplayName("user rules become one extra rule line")
    void userRules() {
        String withRules = builder.buildPrompt(List.of(item(1L, 1L, "a")), "  keep British spelling ");
        String without = builder.buildPrompt(List.of(item(1L, 1L, "a")), "   ");

        assertTrue(withRules.contains("- keep British spelling\n</RULES>"));
        assertFalse(without.contains("- \n"));
        assertTrue(withRules.indexOf("<RULES>") < withRules.indexOf("<OUTPUT_FORMAT>"));
    }

    @Test
    @DisplayName("input limit drops trailing items but keeps at least one")
    void inputLimit() {
        List<TaskItem> items = List.of(
                item(1L, 1L, "first text"),
                item(2L, 2L, "second text"),
                item(3L, 3L, "third text"));
        int twoItems = builder.buildPrompt(items.subList(0, 2), null).length();

        assertEquals(2, builder.fitToInputLimit(items, null, twoItems).size());
        assertEquals(1, builder.fitToInputLimit(items, null, 10).size());
        assertEquals(3, builder.fitToInputLimit(items, null, null).size());
        assertEquals(3, builder.fitToInputLimit(items, null, 0).size());
    }
}

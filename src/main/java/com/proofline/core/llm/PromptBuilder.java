package com.proofline.core.llm;

import com.proofline.core.model.TaskItem;
import com.proofline.core.text.RowValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders the correction prompt for a batch of pending items.
 * <p>
 * Each item becomes one numbered input line. The number is the item's source
 * id, or its local id when the source id is unknown, and the model is told
 * to echo it back as {@code remote_id}.
 */
@Component
public class PromptBuilder {

    private static final Logger log = LoggerFactory.getLogger(PromptBuilder.class);

    private static final String HEAD = """
            <SYSTEM>
            Keep the output strictly in JSON format and do not add any comments or text outside the JSON.
            </SYSTEM>
            <TASK>
            For every element of the <INPUT> list, correct spelling, grammar, punctuation and style where needed.
            Do not remove words; only correct the text.
            If an element needs no correction, return "text_corrected" as an empty string "".
            </TASK>
            <RULES>
            - Every <INPUT> element must appear in the JSON array described in <OUTPUT_FORMAT>.
            - Do not change the meaning of any sentence.
            - Every entry must have a "remote_id" key equal to the number of its input line.
            - Do not add any comments or text outside the JSON.
            - Treat every input line as a separate unit.
            - If an element would be returned unchanged, return "text_corrected" as an empty string.
            """;

    private static final String TAIL = """
            </RULES>
            <OUTPUT_FORMAT>
            [
              {"remote_id": 1, "text_corrected": "corrected text or empty string"}
            ]
            </OUTPUT_FORMAT>
            <INPUT>
            """;

    private static final String END = "</INPUT>";

    public String buildPrompt(List<TaskItem> items, String userRules) {
        StringBuilder prompt = new StringBuilder(HEAD);
        if (userRules != null && !userRules.isBlank()) {
            prompt.append("- ").append(userRules.trim()).append('\n');
        }
        prompt.append(TAIL);
        for (TaskItem item : items) {
            prompt.append(identifierOf(item)).append(". ").append(RowValues.flatten(item.textOriginal())).append('\n');
        }
        prompt.append(END);
        return prompt.toString();
    }

    /**
     * Longest prefix of {@code items} whose prompt stays within {@code maxChars}.
     * Always keeps the first item so a single oversized text still gets processed.
     * A null or non-positive limit keeps everything.
     */
    public List<TaskItem> fitToInputLimit(List<TaskItem> items, String userRules, Integer maxChars) {
        if (maxChars == null || maxChars <= 0 || items.size() <= 1) {
            return items;
        }
        int count = items.size();
        while (count > 1 && buildPrompt(items.subList(0, count), userRules).length() > maxChars) {
            count--;
        }
        if (count < items.size()) {
            log.info("Prompt trimmed to {} of {} items to fit {} characters", count, items.size(), maxChars);
        }
        return List.copyOf(items.subList(0, count));
    }

    /** Source id, else local id, else "?". */
    public static String identifierOf(TaskItem item) {
        if (item.remoteId() != null) {
            return String.valueOf(item.remoteId());
        }
        if (item.id() != null) {
            return String.valueOf(item.id());
        }
        return "?";
    }
}

package com.proofline.core.reconcile;

import com.proofline.core.llm.PromptBuilder;
import com.proofline.core.model.IdentifierScheme;
import com.proofline.core.model.TaskItem;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Original texts of the items sent in one prompt, indexed by both identifier
 * schemes, plus the set of identifiers the reply is expected to use.
 */
public final class OriginalTexts {

    private final Map<String, String> byRemoteId;
    private final Map<String, String> byTaskItemId;
    private final Set<String> expectedIdentifiers;

    private OriginalTexts(Map<String, String> byRemoteId, Map<String, String> byTaskItemId,
                          Set<String> expectedIdentifiers) {
        this.byRemoteId = byRemoteId;
        this.byTaskItemId = byTaskItemId;
        this.expectedIdentifiers = expectedIdentifiers;
    }

    public static OriginalTexts of(List<TaskItem> items) {
        Map<String, String> remote = new HashMap<>();
        Map<String, String> local = new HashMap<>();
        Set<String> expected = new LinkedHashSet<>();
        for (TaskItem item : items) {
            String text = item.textOriginal() == null ? "" : item.textOriginal();
            if (item.remoteId() != null) {
                remote.put(String.valueOf(item.remoteId()), text);
            }
            if (item.id() != null) {
                local.put(String.valueOf(item.id()), text);
            }
            String identifier = PromptBuilder.identifierOf(item);
            if (!"?".equals(identifier)) {
                expected.add(identifier);
            }
        }
        return new OriginalTexts(remote, local, Collections.unmodifiableSet(expected));
    }

    public static OriginalTexts empty() {
        return new OriginalTexts(Map.of(), Map.of(), Set.of());
    }

    /** Identifiers as written in the prompt. */
    public Set<String> expectedIdentifiers() {
        return expectedIdentifiers;
    }

    /**
     * @return the text, or null when no item of the prompt has that identifier
     */
    public String lookup(IdentifierScheme scheme, String identifier) {
        if (identifier == null) {
            return null;
        }
        return scheme == IdentifierScheme.REMOTE_ID ? byRemoteId.get(identifier) : byTaskItemId.get(identifier);
    }
}

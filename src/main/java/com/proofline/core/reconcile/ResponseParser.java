package com.proofline.core.reconcile;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the list of corrections from raw model text.
 * <p>
 * Models wrap JSON in Markdown fences, in a {@code content='...'} dump of a
 * message object, or (in JSON-object mode) in an object holding the array.
 * All three are unwrapped; anything that is not an array of objects after
 * that is rejected.
 */
@Component
public class ResponseParser {

    private static final Logger log = LoggerFactory.getLogger(ResponseParser.class);

    private static final Pattern FENCE = Pattern.compile("```(?:json)?\\s*(.*?)\\s*```", Pattern.DOTALL);
    private static final Pattern CONTENT = Pattern.compile("content=(['\"])((?:\\\\.|(?!\\1).)*)\\1", Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    public ResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<ResponseItem> parse(String raw) {
        String json = extractJson(raw);
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.debug("Unparseable model response: {}", raw);
            throw new ResponseFormatException("Model response is not valid JSON: " + e.getOriginalMessage(), e);
        }
        JsonNode array = unwrap(root);
        List<ResponseItem> items = new ArrayList<>(array.size());
        for (JsonNode element : array) {
            if (!element.isObject()) {
                throw new ResponseFormatException("Model response array contains a non-object element: " + element);
            }
            items.add(ResponseItem.fromJson(element));
        }
        return items;
    }

    static String extractJson(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ResponseFormatException("Model returned an empty response");
        }
        String text = raw.trim();
        if (text.startsWith("{") || text.startsWith("[")) {
            return text;
        }
        Matcher fence = FENCE.matcher(text);
        if (fence.find()) {
            return fence.group(1).trim();
        }
        Matcher content = CONTENT.matcher(text);
        if (content.find()) {
            return unescape(content.group(2)).trim();
        }
        int start = firstBracket(text);
        if (start >= 0) {
            return text.substring(start);
        }
        throw new ResponseFormatException("No JSON found in model response");
    }

    private static JsonNode unwrap(JsonNode root) {
        if (root.isArray()) {
            return root;
        }
        if (root.isObject()) {
            JsonNode items = root.get("items");
            if (items != null && items.isArray()) {
                return items;
            }
            JsonNode onlyArray = null;
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                JsonNode value = fields.next().getValue();
                if (value.isArray()) {
                    if (onlyArray != null) {
                        onlyArray = null;
                        break;
                    }
                    onlyArray = value;
                }
            }
            if (onlyArray != null) {
                return onlyArray;
            }
        }
        throw new ResponseFormatException("Model response is not a JSON array of objects");
    }

    private static int firstBracket(String text) {
        int brace = text.indexOf('{');
        int bracket = text.indexOf('[');
        if (brace < 0) {
            return bracket;
        }
        if (bracket < 0) {
            return brace;
        }
        return Math.min(brace, bracket);
    }

    private static String unescape(String text) {
        return text.replace("\\n", "\n").replace("\\'", "'").replace("\\\"", "\"");
    }
}

package com.taskweave.core.invocation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort recovery of a structured result from free text.
 * <p>
 * Tries, in order: the whole text as a JSON object, a fenced {@code ```json}
 * block, then the first balanced {@code {...}} island that parses. If none
 * works, the whole text is returned under {@value #TEXT_FIELD}.
 */
public class OutputExtractor {

    public static final String TEXT_FIELD = "output";

    private static final Pattern FENCED = Pattern.compile("```(?:json)?\\s*(\\{.*?})\\s*```", Pattern.DOTALL);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public OutputExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, Object> extract(String text) {
        if (text == null || text.isBlank()) {
            var empty = new LinkedHashMap<String, Object>();
            empty.put(TEXT_FIELD, "");
            return empty;
        }
        String trimmed = text.trim();

        Optional<Map<String, Object>> parsed = parse(trimmed);
        if (parsed.isPresent()) {
            return parsed.get();
        }

        Matcher fenced = FENCED.matcher(trimmed);
        while (fenced.find()) {
            parsed = parse(fenced.group(1));
            if (parsed.isPresent()) {
                return parsed.get();
            }
        }

        for (int start = trimmed.indexOf('{'); start >= 0; start = trimmed.indexOf('{', start + 1)) {
            int end = matchingBrace(trimmed, start);
            if (end < 0) {
                continue;
            }
            parsed = parse(trimmed.substring(start, end + 1));
            if (parsed.isPresent()) {
                return parsed.get();
            }
        }

        var fallback = new LinkedHashMap<String, Object>();
        fallback.put(TEXT_FIELD, trimmed);
        return fallback;
    }

    private Optional<Map<String, Object>> parse(String candidate) {
        if (!candidate.startsWith("{")) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(candidate, MAP_TYPE));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    /** Index of the brace closing the one at {@code start}, honouring JSON strings; -1 if unbalanced. */
    static int matchingBrace(String text, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}

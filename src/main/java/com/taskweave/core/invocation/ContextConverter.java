package com.taskweave.core.invocation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskweave.core.context.ContextSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns a task plus context snapshot into a plain-text prompt for the secondary backend.
 * <p>
 * Artifacts are rendered as JSON. A value that cannot be serialized is replaced
 * by a one-line text summary and reported in {@link Conversion#unconvertedKeys()};
 * oversized values are truncated. Nothing is dropped silently.
 */
public class ContextConverter {

    private static final Logger log = LoggerFactory.getLogger(ContextConverter.class);

    public static final int DEFAULT_MAX_ARTIFACT_CHARS = 4_000;

    private final ObjectMapper objectMapper;
    private final int maxArtifactChars;

    public ContextConverter(ObjectMapper objectMapper) {
        this(objectMapper, DEFAULT_MAX_ARTIFACT_CHARS);
    }

    public ContextConverter(ObjectMapper objectMapper, int maxArtifactChars) {
        this.objectMapper = objectMapper;
        this.maxArtifactChars = maxArtifactChars;
    }

    /**
     * @param prompt          text to send to the secondary backend
     * @param unconvertedKeys artifacts that could only be summarized
     */
    public record Conversion(String prompt, List<String> unconvertedKeys) {
        public boolean degraded() {
            return !unconvertedKeys.isEmpty();
        }
    }

    public Conversion convert(String unit, String task, ContextSnapshot context) {
        var prompt = new StringBuilder();
        var unconverted = new ArrayList<String>();

        prompt.append("You are completing the step \"").append(unit).append("\" of a larger workflow.\n\n");
        prompt.append("## Task\n").append(task).append("\n\n");

        if (context != null) {
            prompt.append("## Workflow\n");
            if (context.task() != null) {
                prompt.append("Goal: ").append(context.task()).append('\n');
            }
            prompt.append("Phase: ").append(context.phase()).append('\n');
            if (context.completedUnits() != null && !context.completedUnits().isEmpty()) {
                prompt.append("Completed steps: ").append(String.join(", ", context.completedUnits())).append('\n');
            }

            Map<String, Object> artifacts = context.artifacts();
            if (artifacts != null && !artifacts.isEmpty()) {
                prompt.append("\n## Artifacts\n");
                for (var entry : artifacts.entrySet()) {
                    prompt.append("- ").append(entry.getKey()).append(": ");
                    try {
                        prompt.append(truncate(objectMapper.writeValueAsString(entry.getValue())));
                    } catch (JsonProcessingException | RuntimeException e) {
                        unconverted.add(entry.getKey());
                        prompt.append(summarize(entry.getValue()));
                        log.debug("Artifact '{}' summarized as text: {}", entry.getKey(), e.getMessage());
                    }
                    prompt.append('\n');
                }
            }
        }

        prompt.append("\nRespond with a single JSON object holding your result.");
        if (!unconverted.isEmpty()) {
            log.warn("Context conversion for unit {} summarized {} artifact(s) as text: {}",
                    unit, unconverted.size(), unconverted);
        }
        return new Conversion(prompt.toString(), List.copyOf(unconverted));
    }

    private String truncate(String json) {
        if (json.length() <= maxArtifactChars) {
            return json;
        }
        return json.substring(0, maxArtifactChars) + "... (truncated, " + json.length() + " chars)";
    }

    private String summarize(Object value) {
        if (value == null) {
            return "null";
        }
        String text;
        try {
            text = String.valueOf(value);
        } catch (RuntimeException e) {
            text = "<unprintable>";
        }
        return "[" + value.getClass().getSimpleName() + "] " + truncate(text.replace('\n', ' '));
    }
}

package com.taskweave.core.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskweave.core.context.ContextSnapshot;
import com.taskweave.core.invocation.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Primary backend that shells out to an agent CLI.
 * <p>
 * The request is written to the process's stdin as a JSON object
 * {@code {"task", "context", "tool_permissions"}}; the process must print a JSON
 * object on stdout. Every failure is raised as a {@link BackendException}
 * carrying its {@link FailureKind}.
 */
public class CliPrimaryBackend implements PrimaryBackend {

    private static final Logger log = LoggerFactory.getLogger(CliPrimaryBackend.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final List<String> command;
    private final String credentialsEnv;
    private final Duration timeout;
    private final ObjectMapper objectMapper;
    private final Function<String, String> environment;

    public CliPrimaryBackend(List<String> command, String credentialsEnv, Duration timeout, ObjectMapper objectMapper) {
        this(command, credentialsEnv, timeout, objectMapper, System::getenv);
    }

    CliPrimaryBackend(List<String> command, String credentialsEnv, Duration timeout, ObjectMapper objectMapper,
                      Function<String, String> environment) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("primary backend command cannot be empty");
        }
        this.command = List.copyOf(command);
        this.credentialsEnv = credentialsEnv;
        this.timeout = timeout;
        this.objectMapper = objectMapper;
        this.environment = environment;
    }

    @Override
    public String name() {
        return "primary-cli";
    }

    @Override
    public boolean isAvailable() {
        return CliProcess.isResolvable(command.get(0));
    }

    public boolean hasCredentials() {
        if (credentialsEnv == null || credentialsEnv.isBlank()) {
            return true;
        }
        String value = environment.apply(credentialsEnv);
        return value != null && !value.isBlank();
    }

    public String credentialsEnv() {
        return credentialsEnv;
    }

    @Override
    public Map<String, Object> call(String task, ContextSnapshot context, ToolPermissions permissions) {
        if (!hasCredentials()) {
            throw new BackendException(FailureKind.CREDENTIALS_ABSENT,
                    "Environment variable " + credentialsEnv + " is not set");
        }

        byte[] request = encodeRequest(task, context, permissions);
        CliProcess.Output output;
        try {
            output = CliProcess.run(command, request, timeout);
        } catch (TimeoutException e) {
            throw new BackendException(FailureKind.TIMEOUT, e.getMessage(), e);
        } catch (IOException e) {
            throw new BackendException(FailureKind.BACKEND_UNAVAILABLE,
                    "Cannot start " + command.get(0) + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendException(FailureKind.BACKEND_CRASH, "Interrupted while waiting for " + command.get(0), e);
        }

        if (!output.succeeded()) {
            FailureKind kind = classifyOutput(output.text());
            throw new BackendException(kind, command.get(0) + " exited with " + output.exitCode() + ": "
                    + CliProcess.excerpt(output.text()));
        }

        Map<String, Object> result = parseResult(output.text());
        if (Boolean.TRUE.equals(result.get("is_error"))) {
            String message = String.valueOf(result.getOrDefault("result", "error reported by backend"));
            throw new BackendException(classifyOutput(message), CliProcess.excerpt(message));
        }
        log.debug("Primary backend returned {} field(s)", result.size());
        return result;
    }

    private byte[] encodeRequest(String task, ContextSnapshot context, ToolPermissions permissions) {
        var request = new LinkedHashMap<String, Object>();
        request.put("task", task);
        request.put("context", context);
        request.put("tool_permissions", permissions != null ? permissions.allowed() : List.of());
        try {
            return objectMapper.writeValueAsBytes(request);
        } catch (JsonProcessingException e) {
            throw new BackendException(FailureKind.VALIDATION_FAILURE,
                    "Task request could not be encoded: " + e.getOriginalMessage(), e);
        }
    }

    private Map<String, Object> parseResult(String text) {
        String trimmed = text == null ? "" : text.trim();
        int start = trimmed.indexOf('{');
        if (start < 0) {
            throw new BackendException(FailureKind.BACKEND_CRASH,
                    "No JSON object in backend output: " + CliProcess.excerpt(trimmed));
        }
        try {
            return objectMapper.readValue(trimmed.substring(start), MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new BackendException(FailureKind.BACKEND_CRASH,
                    "Unparseable backend output: " + e.getOriginalMessage(), e);
        }
    }

    static FailureKind classifyOutput(String text) {
        String lower = text == null ? "" : text.toLowerCase(Locale.ROOT);
        if (lower.contains("429") || lower.contains("rate limit") || lower.contains("rate_limit")) {
            return FailureKind.RATE_LIMITED;
        }
        if (lower.contains("401") || lower.contains("unauthorized") || lower.contains("api key")
                || lower.contains("authentication")) {
            return FailureKind.CREDENTIALS_ABSENT;
        }
        if (lower.contains("connection refused") || lower.contains("could not resolve")
                || lower.contains("network") || lower.contains("econnreset")) {
            return FailureKind.NETWORK_FAILURE;
        }
        if (lower.contains("timed out") || lower.contains("timeout")) {
            return FailureKind.TIMEOUT;
        }
        return FailureKind.BACKEND_CRASH;
    }
}

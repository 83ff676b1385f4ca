package com.taskweave.core.invocation;

import com.taskweave.core.backend.BackendException;
import com.taskweave.core.unit.UnitTimeoutException;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.nio.file.NoSuchFileException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Maps any throwable raised by a primary backend to a {@link FailureKind}.
 * <p>
 * Kinds declared by a {@link BackendException} win. Otherwise the cause chain
 * is inspected by type, then by message; anything unrecognised is a
 * {@link FailureKind#BACKEND_CRASH}.
 */
public final class FailureClassifier {

    private static final int MAX_CAUSE_DEPTH = 8;

    private FailureClassifier() {}

    public static FailureKind classify(Throwable error) {
        if (error == null) {
            return FailureKind.BACKEND_CRASH;
        }
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            FailureKind kind = byType(current);
            if (kind != null) {
                return kind;
            }
            current = current.getCause();
        }
        current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            FailureKind kind = byMessage(current.getMessage());
            if (kind != null) {
                return kind;
            }
            current = current.getCause();
        }
        return FailureKind.BACKEND_CRASH;
    }

    private static FailureKind byType(Throwable error) {
        if (error instanceof BackendException backend && backend.kind() != null) {
            return backend.kind();
        }
        if (error instanceof InvocationValidationException) {
            return FailureKind.VALIDATION_FAILURE;
        }
        if (error instanceof TimeoutException || error instanceof UnitTimeoutException
                || error instanceof InterruptedIOException) {
            return FailureKind.TIMEOUT;
        }
        if (error instanceof ConnectException || error instanceof UnknownHostException
                || error instanceof NoRouteToHostException || error instanceof SocketException) {
            return FailureKind.NETWORK_FAILURE;
        }
        if (error instanceof FileNotFoundException || error instanceof NoSuchFileException) {
            return FailureKind.BACKEND_UNAVAILABLE;
        }
        if (error instanceof IOException && error.getMessage() != null
                && error.getMessage().startsWith("Cannot run program")) {
            return FailureKind.BACKEND_UNAVAILABLE;
        }
        return null;
    }

    private static FailureKind byMessage(String message) {
        if (message == null || message.isBlank()) {
            return null;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("rate limit") || lower.contains("too many requests") || lower.contains("429")) {
            return FailureKind.RATE_LIMITED;
        }
        if (lower.contains("api key") || lower.contains("credential") || lower.contains("unauthorized")) {
            return FailureKind.CREDENTIALS_ABSENT;
        }
        if (lower.contains("timed out") || lower.contains("timeout")) {
            return FailureKind.TIMEOUT;
        }
        if (lower.contains("connection refused") || lower.contains("connection reset")
                || lower.contains("network is unreachable")) {
            return FailureKind.NETWORK_FAILURE;
        }
        if (lower.contains("not installed") || lower.contains("command not found")) {
            return FailureKind.BACKEND_UNAVAILABLE;
        }
        return null;
    }
}

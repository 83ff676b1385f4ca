package com.taskweave.core.invocation;

import com.taskweave.core.backend.BackendException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class FailureClassifierTest {

    @Nested
    @DisplayName("by type")
    class ByTypeTests {

        @Test
        @DisplayName("declared backend kind wins")
        void backendKind() {
            var e = new BackendException(FailureKind.RATE_LIMITED, "connection refused");
            assertEquals(FailureKind.RATE_LIMITED, FailureClassifier.classify(e));
        }

        @Test
        @DisplayName("timeouts anywhere in the cause chain")
        void timeout() {
            var e = new ExecutionException(new TimeoutException());
            assertEquals(FailureKind.TIMEOUT, FailureClassifier.classify(e));
        }

        @Test
        @DisplayName("socket errors are network failures")
        void network() {
            assertEquals(FailureKind.NETWORK_FAILURE, FailureClassifier.classify(new ConnectException("refused")));
            assertEquals(FailureKind.NETWORK_FAILURE, FailureClassifier.classify(new UnknownHostException("api")));
        }

        @Test
        @DisplayName("a program that cannot start is unavailable")
        void cannotRunProgram() {
            var e = new IOException("Cannot run program \"claude\": error=2, No such file or directory");
            assertEquals(FailureKind.BACKEND_UNAVAILABLE, FailureClassifier.classify(e));
        }

        @Test
        @DisplayName("validation exceptions are validation failures")
        void validation() {
            assertEquals(FailureKind.VALIDATION_FAILURE,
                    FailureClassifier.classify(new InvocationValidationException("bad")));
        }
    }

    @Nested
    @DisplayName("by message")
    class ByMessageTests {

        @Test
        @DisplayName("rate limit wording")
        void rateLimit() {
            assertEquals(FailureKind.RATE_LIMITED,
                    FailureClassifier.classify(new RuntimeException("HTTP 429 Too Many Requests")));
        }

        @Test
        @DisplayName("credential wording")
        void credentials() {
            assertEquals(FailureKind.CREDENTIALS_ABSENT,
                    FailureClassifier.classify(new RuntimeException("Invalid API key provided")));
        }

        @Test
        @DisplayName("message on a wrapped cause is found")
        void wrappedMessage() {
            var e = new RuntimeException("call failed", new IllegalStateException("request timed out"));
            assertEquals(FailureKind.TIMEOUT, FailureClassifier.classify(e));
        }

        @Test
        @DisplayName("anything else is a crash")
        void fallback() {
            assertEquals(FailureKind.BACKEND_CRASH, FailureClassifier.classify(new NullPointerException()));
            assertEquals(FailureKind.BACKEND_CRASH, FailureClassifier.classify(null));
        }
    }
}

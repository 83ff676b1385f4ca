package com.taskweave.core.backend;

import com.taskweave.core.context.ContextCodec;
import com.taskweave.core.invocation.FailureKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class CliBackendsTest {

    private static CliPrimaryBackend primary(String script, Map<String, String> env) {
        return new CliPrimaryBackend(List.of("sh", "-c", script), "TEST_API_KEY", Duration.ofSeconds(10),
                ContextCodec.defaultMapper(), env::get);
    }

    private static CliPrimaryBackend primary(String script) {
        return primary(script, Map.of("TEST_API_KEY", "secret"));
    }

    @Nested
    @DisplayName("output classification")
    class ClassifyTests {

        @Test
        @DisplayName("recognizes the usual failure wording")
        void classify() {
            assertEquals(FailureKind.RATE_LIMITED, CliPrimaryBackend.classifyOutput("Error 429: rate limit exceeded"));
            assertEquals(FailureKind.CREDENTIALS_ABSENT, CliPrimaryBackend.classifyOutput("401 Unauthorized"));
            assertEquals(FailureKind.NETWORK_FAILURE, CliPrimaryBackend.classifyOutput("connect ECONNRESET"));
            assertEquals(FailureKind.TIMEOUT, CliPrimaryBackend.classifyOutput("request timed out"));
            assertEquals(FailureKind.BACKEND_CRASH, CliPrimaryBackend.classifyOutput("segmentation fault"));
            assertEquals(FailureKind.BACKEND_CRASH, CliPrimaryBackend.classifyOutput(null));
        }
    }

    @Nested
    @DisplayName("primary backend")
    class PrimaryTests {

        @Test
        @DisplayName("missing credentials fail before starting the process")
        void missingCredentials() {
            var backend = primary("echo '{}'", Map.of());

            assertFalse(backend.hasCredentials());
            var ex = assertThrows(BackendException.class, () -> backend.call("t", null, ToolPermissions.none()));
            assertEquals(FailureKind.CREDENTIALS_ABSENT, ex.kind());
        }

        @Test
        @DisplayName("no credentials variable configured means none are needed")
        void noCredentialsNeeded() {
            var backend = new CliPrimaryBackend(List.of("sh"), "", Duration.ofSeconds(1),
                    ContextCodec.defaultMapper(), name -> null);
            assertTrue(backend.hasCredentials());
        }

        @Test
        @DisplayName("an unknown executable is unavailable")
        void unknownExecutable() {
            var backend = new CliPrimaryBackend(List.of("taskweave-no-such-binary-42"), null, Duration.ofSeconds(1),
                    ContextCodec.defaultMapper(), name -> null);

            assertFalse(backend.isAvailable());
            var ex = assertThrows(BackendException.class, () -> backend.call("t", null, ToolPermissions.none()));
            assertEquals(FailureKind.BACKEND_UNAVAILABLE, ex.kind());
        }

        @Test
        @EnabledOnOs({OS.LINUX, OS.MAC})
        @DisplayName("reads the request on stdin and parses the JSON reply")
        void roundTrip() {
            var backend = primary("cat > /dev/null; echo '{\"result\": \"done\", \"is_error\": false}'");

            var result = backend.call("do it", null, ToolPermissions.of("Read"));

            assertEquals("done", result.get("result"));
            assertTrue(backend.isAvailable());
        }

        @Test
        @EnabledOnOs({OS.LINUX, OS.MAC})
        @DisplayName("the request carries task and tool permissions")
        void requestShape() {
            var backend = primary("printf '{\"echo\": %s}' \"$(cat)\"");

            var result = backend.call("do it", null, ToolPermissions.of("Read", "Bash"));

            @SuppressWarnings("unchecked")
            var echoed = (Map<String, Object>) result.get("echo");
            assertEquals("do it", echoed.get("task"));
            assertEquals(List.of("Read", "Bash"), echoed.get("tool_permissions"));
        }

        @Test
        @EnabledOnOs({OS.LINUX, OS.MAC})
        @DisplayName("non-zero exit is classified from the output")
        void nonZeroExit() {
            var backend = primary("cat > /dev/null; echo 'HTTP 429 rate limit'; exit 1");

            var ex = assertThrows(BackendException.class, () -> backend.call("t", null, ToolPermissions.none()));
            assertEquals(FailureKind.RATE_LIMITED, ex.kind());
        }

        @Test
        @EnabledOnOs({OS.LINUX, OS.MAC})
        @DisplayName("an is_error reply is a failure")
        void isError() {
            var backend = primary("cat > /dev/null; echo '{\"is_error\": true, \"result\": \"Invalid API key\"}'");

            var ex = assertThrows(BackendException.class, () -> backend.call("t", null, ToolPermissions.none()));
            assertEquals(FailureKind.CREDENTIALS_ABSENT, ex.kind());
        }

        @Test
        @EnabledOnOs({OS.LINUX, OS.MAC})
        @DisplayName("output without JSON is a crash")
        void noJson() {
            var backend = primary("cat > /dev/null; echo 'hello there'");

            var ex = assertThrows(BackendException.class, () -> backend.call("t", null, ToolPermissions.none()));
            assertEquals(FailureKind.BACKEND_CRASH, ex.kind());
        }

        @Test
        @EnabledOnOs({OS.LINUX, OS.MAC})
        @DisplayName("a process outliving its timeout is killed")
        void timeout() {
            var backend = new CliPrimaryBackend(List.of("sh", "-c", "sleep 10"), null, Duration.ofMillis(200),
                    ContextCodec.defaultMapper(), name -> null);

            var ex = assertThrows(BackendException.class, () -> backend.call("t", null, ToolPermissions.none()));
            assertEquals(FailureKind.TIMEOUT, ex.kind());
        }
    }

    @Nested
    @DisplayName("process handling")
    @EnabledOnOs({OS.LINUX, OS.MAC})
    class ProcessTests {

        @Test
        @DisplayName("a large request to a child that never reads still honours the timeout")
        void unreadStdinTimesOut() {
            byte[] request = new byte[4 * 1024 * 1024];

            assertTimeout(Duration.ofSeconds(5), () -> assertThrows(TimeoutException.class,
                    () -> CliProcess.run(List.of("sh", "-c", "sleep 10"), request, Duration.ofMillis(300))));
        }

        @Test
        @DisplayName("interrupting the caller kills the child")
        void interruptKillsChild() throws Exception {
            var failure = new AtomicReference<Throwable>();
            Thread caller = new Thread(() -> {
                try {
                    CliProcess.run(List.of("sleep", "30"), new byte[0], Duration.ofSeconds(60));
                } catch (Exception e) {
                    failure.set(e);
                }
            });
            caller.start();

            ProcessHandle child = awaitChild("sleep");
            caller.interrupt();
            caller.join(5_000);

            assertInstanceOf(InterruptedException.class, failure.get());
            assertFalse(child.onExit().get(5, TimeUnit.SECONDS).isAlive());
        }

        private ProcessHandle awaitChild(String executable) throws InterruptedException {
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (System.nanoTime() < deadline) {
                var match = ProcessHandle.current().children()
                        .filter(p -> p.info().command().map(c -> c.endsWith("/" + executable)).orElse(false))
                        .findFirst();
                if (match.isPresent()) {
                    return match.get();
                }
                Thread.sleep(20);
            }
            return fail("no " + executable + " child appeared");
        }
    }

    @Nested
    @DisplayName("secondary backend")
    @EnabledOnOs({OS.LINUX, OS.MAC})
    class SecondaryTests {

        @Test
        @DisplayName("returns stripped stdout for the prompt")
        void echoesPrompt() {
            var backend = new CliSecondaryBackend(List.of("sh", "-c", "tr a-z A-Z"), Duration.ofSeconds(10));

            assertEquals("HELLO", backend.call("hello\n"));
        }

        @Test
        @DisplayName("empty output is a crash")
        void emptyOutput() {
            var backend = new CliSecondaryBackend(List.of("sh", "-c", "cat > /dev/null"), Duration.ofSeconds(10));

            var ex = assertThrows(BackendException.class, () -> backend.call("hello"));
            assertEquals(FailureKind.BACKEND_CRASH, ex.kind());
        }

        @Test
        @DisplayName("non-zero exit is a crash")
        void failingCommand() {
            var backend = new CliSecondaryBackend(List.of("sh", "-c", "cat > /dev/null; exit 3"), Duration.ofSeconds(10));

            assertThrows(BackendException.class, () -> backend.call("hello"));
        }
    }
}

package com.taskweave.core.backend;

import com.taskweave.core.invocation.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Secondary backend that pipes a plain prompt into a CLI and returns whatever
 * it prints.
 */
public class CliSecondaryBackend implements SecondaryBackend {

    private static final Logger log = LoggerFactory.getLogger(CliSecondaryBackend.class);

    private final List<String> command;
    private final Duration timeout;

    public CliSecondaryBackend(List<String> command, Duration timeout) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("secondary backend command cannot be empty");
        }
        this.command = List.copyOf(command);
        this.timeout = timeout;
    }

    @Override
    public String name() {
        return "secondary-cli";
    }

    @Override
    public boolean isAvailable() {
        return CliProcess.isResolvable(command.get(0));
    }

    @Override
    public String call(String prompt) {
        CliProcess.Output output;
        try {
            output = CliProcess.run(command, prompt.getBytes(StandardCharsets.UTF_8), timeout);
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
            throw new BackendException(FailureKind.BACKEND_CRASH, command.get(0) + " exited with "
                    + output.exitCode() + ": " + CliProcess.excerpt(output.text()));
        }
        String text = output.text().strip();
        if (text.isEmpty()) {
            throw new BackendException(FailureKind.BACKEND_CRASH, command.get(0) + " produced no output");
        }
        log.debug("Secondary backend returned {} chars", text.length());
        return text;
    }
}

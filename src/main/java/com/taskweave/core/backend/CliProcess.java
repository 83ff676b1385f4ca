package com.taskweave.core.backend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a command with stdin input and captures its combined stdout/stderr.
 */
final class CliProcess {

    private static final Logger log = LoggerFactory.getLogger(CliProcess.class);

    private static final int MAX_EXCERPT_CHARS = 512;

    record Output(int exitCode, String text) {
        boolean succeeded() {
            return exitCode == 0;
        }
    }

    private CliProcess() {}

    /**
     * Runs {@code command} to completion. The child is killed on every exit
     * path that leaves it running, including timeout and interruption of the
     * calling thread.
     */
    static Output run(List<String> command, byte[] stdin, Duration timeout)
            throws IOException, TimeoutException, InterruptedException {
        Process process = new ProcessBuilder(new ArrayList<>(command))
                .redirectErrorStream(true)
                .start();
        String executable = command.get(0);
        try {
            var buffer = new ByteArrayOutputStream();
            Thread drainer = daemon("cli-drain", () -> drain(process.getInputStream(), buffer));
            daemon("cli-feed", () -> feed(executable, process.getOutputStream(), stdin));

            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                throw new TimeoutException(executable + " did not finish within " + timeout.toSeconds() + "s");
            }
            drainer.join(TimeUnit.SECONDS.toMillis(5));
            String text;
            synchronized (buffer) {
                text = buffer.toString(StandardCharsets.UTF_8);
            }
            return new Output(process.exitValue(), text);
        } finally {
            if (process.isAlive()) {
                process.destroyForcibly();
                log.debug("Killed {} (pid {})", executable, process.pid());
            }
        }
    }

    private static Thread daemon(String name, Runnable body) {
        Thread thread = new Thread(body, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private static void feed(String executable, OutputStream stream, byte[] stdin) {
        try (stream) {
            stream.write(stdin);
            stream.flush();
        } catch (IOException e) {
            // exited or was killed before reading its input; the caller decides the outcome
            log.debug("{} closed stdin early: {}", executable, e.getMessage());
        }
    }

    private static void drain(InputStream stream, ByteArrayOutputStream sink) {
        byte[] chunk = new byte[8192];
        try (stream) {
            int read;
            while ((read = stream.read(chunk)) != -1) {
                synchronized (sink) {
                    sink.write(chunk, 0, read);
                }
            }
        } catch (IOException e) {
            synchronized (sink) {
                sink.writeBytes(("\n[output truncated: " + e.getMessage() + "]").getBytes(StandardCharsets.UTF_8));
            }
        }
    }

    /**
     * Whether {@code executable} is an executable path or resolvable on the PATH.
     */
    static boolean isResolvable(String executable) {
        if (executable == null || executable.isBlank()) {
            return false;
        }
        if (executable.contains(File.separator)) {
            return Files.isExecutable(Path.of(executable));
        }
        String pathEnv = System.getenv("PATH");
        if (pathEnv == null) {
            return false;
        }
        for (String dir : pathEnv.split(File.pathSeparator)) {
            if (!dir.isBlank() && Files.isExecutable(Path.of(dir, executable))) {
                return true;
            }
        }
        return false;
    }

    static String excerpt(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_EXCERPT_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_EXCERPT_CHARS) + "...";
    }
}

package com.taskweave.dispatch.cli;

import com.taskweave.core.context.ContextStateException;
import com.taskweave.core.persistence.ContextPersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;
import picocli.CommandLine.ParseResult;

/**
 * Runs the picocli command tree inside the Spring Boot lifecycle and hands
 * its exit status back to {@code SpringApplication.exit}.
 * <p>
 * Exit codes: 0 success, 1 command failure, 2 usage error,
 * {@value #STORAGE_FAILURE} context storage unreadable or unwritable,
 * {@value #CONTEXT_STATE} context archived, expired or otherwise not writable.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    static final int STORAGE_FAILURE = 3;
    static final int CONTEXT_STATE = 4;

    private final TaskweaveCommand taskweaveCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(TaskweaveCommand taskweaveCommand, IFactory factory) {
        this.taskweaveCommand = taskweaveCommand;
        this.factory = factory;
    }

    /**
     * The command tree with Taskweave's error reporting attached.
     */
    static CommandLine commandLine(TaskweaveCommand root, IFactory factory) {
        return new CommandLine(root, factory)
                .setExecutionExceptionHandler(CliRunner::reportFailure);
    }

    static int exitCodeFor(Throwable error) {
        if (error instanceof ContextPersistenceException) {
            return STORAGE_FAILURE;
        }
        if (error instanceof ContextStateException) {
            return CONTEXT_STATE;
        }
        return CommandLine.ExitCode.SOFTWARE;
    }

    private static int reportFailure(Exception error, CommandLine command, ParseResult parsed) {
        String name = command.getCommandName();
        log.debug("Command {} failed", name, error);
        ConsoleOutput.error(name + " failed: " + error.getMessage());
        return exitCodeFor(error);
    }

    @Override
    public void run(String... args) {
        exitCode = commandLine(taskweaveCommand, factory).execute(args);
        log.debug("Command line {} finished with exit code {}", String.join(" ", args), exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}

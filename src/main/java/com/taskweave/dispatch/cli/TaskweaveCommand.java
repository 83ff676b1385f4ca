package com.taskweave.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Root of the Taskweave command tree. Without a subcommand it prints the
 * banner and usage.
 */
@Command(
        name = "taskweave",
        mixinStandardHelpOptions = true,
        versionProvider = TaskweaveCommand.Version.class,
        description = "Inspect and maintain Taskweave workflow contexts and backend health",
        subcommands = {
                HealthCommand.class,
                HistoryCommand.class,
                InspectCommand.class,
                CleanupCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class TaskweaveCommand implements Runnable {

    static final String FALLBACK_VERSION = "0.1.0";

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }

    /** Version from the jar manifest, or the development version when run from classes. */
    static String version() {
        String packaged = TaskweaveCommand.class.getPackage().getImplementationVersion();
        return packaged != null ? packaged : FALLBACK_VERSION;
    }

    static final class Version implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            return new String[] {"Taskweave " + version()};
        }
    }
}

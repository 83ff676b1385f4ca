package com.taskweave.dispatch.cli;

import com.taskweave.core.context.ContextStore;
import com.taskweave.core.context.WorkflowContext;
import com.taskweave.core.persistence.ContextPersistenceException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: taskweave history
 * <p>
 * Lists stored workflow contexts as a table: ID | PHASE | VERSION | UNITS | TASK.
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "List stored workflow contexts")
@Component
public class HistoryCommand implements Runnable {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    @Option(names = "--archived", description = "List archived contexts instead of active ones")
    private boolean archived;

    private final ContextStore contextStore;

    public HistoryCommand(ContextStore contextStore) {
        this.contextStore = contextStore;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<String> ids = archived ? contextStore.listArchivedIds() : contextStore.listIds();
        String kind = archived ? "archived" : "stored";
        if (ids.isEmpty()) {
            ConsoleOutput.info("No " + kind + " workflows found.");
            return;
        }

        List<String> display = ids.size() > limit ? ids.subList(ids.size() - limit, ids.size()) : ids;

        ConsoleOutput.info("Workflows (" + display.size() + " of " + ids.size() + ", " + kind + "):");
        System.out.println();
        System.out.printf("  %-14s %-12s %-8s %-6s %s%n", "ID", "PHASE", "VERSION", "UNITS", "TASK");
        System.out.println("  " + "-".repeat(70));

        for (String id : display) {
            try {
                WorkflowContext context = archived ? contextStore.loadArchived(id) : contextStore.load(id);
                System.out.printf("  %-14s %-12s %-8d %-6d %s%n", id, context.phase(), context.version(),
                        context.completedUnits().size(), truncate(context.task(), 30));
            } catch (ContextPersistenceException e) {
                System.out.printf("  %-14s %-12s %-8s %-6s %s%n", id, "UNREADABLE", "-", "-", "-");
            }
        }
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}

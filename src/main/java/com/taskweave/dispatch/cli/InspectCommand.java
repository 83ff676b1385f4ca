package com.taskweave.dispatch.cli;

import com.taskweave.core.context.ContextEvent;
import com.taskweave.core.context.ContextMetadata;
import com.taskweave.core.context.ContextNotFoundException;
import com.taskweave.core.context.ContextStore;
import com.taskweave.core.context.WorkflowContext;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: taskweave inspect &lt;workflow-id&gt;
 * <p>
 * Shows a stored context: metadata, unit states, artifact keys, and the event
 * and degradation logs. Falls back to the archive when the id is not active.
 */
@Command(name = "inspect", mixinStandardHelpOptions = true, description = "Inspect a stored workflow context")
@Component
public class InspectCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Workflow ID")
    private String workflowId;

    @Option(names = "--events", description = "Number of most recent events to show", defaultValue = "20")
    private int events;

    private final ContextStore contextStore;

    public InspectCommand(ContextStore contextStore) {
        this.contextStore = contextStore;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        WorkflowContext context;
        try {
            context = contextStore.exists(workflowId)
                    ? contextStore.load(workflowId)
                    : contextStore.loadArchived(workflowId);
        } catch (ContextNotFoundException e) {
            ConsoleOutput.error("Workflow not found: " + workflowId);
            return 1;
        }

        ContextMetadata meta = context.metadata();
        System.out.println();
        System.out.println("WORKFLOW " + context.id() + (context.isArchived() ? " (archived)" : ""));
        System.out.println(ConsoleOutput.RULE);
        System.out.println("  Task:        " + (context.task() != null ? context.task() : "-"));
        System.out.println("  Phase:       " + context.phase());
        System.out.println("  Version:     " + meta.version());
        System.out.println("  Owner:       " + (meta.owner() != null ? meta.owner() : "-"));
        System.out.println("  Priority:    " + meta.priority());
        System.out.println("  Created:     " + meta.createdAt());
        System.out.println("  Updated:     " + meta.updatedAt());
        System.out.println("  Expires:     " + meta.expiresAt() + (context.isExpired() ? " (expired)" : ""));

        var artifacts = context.artifacts();
        System.out.println("  Artifacts:   " + (artifacts.isEmpty() ? "none" : String.join(", ", artifacts.keySet())));

        var units = context.unitStates();
        if (!units.isEmpty()) {
            System.out.println();
            System.out.println("  UNITS:");
            units.values().forEach(ConsoleOutput::unitState);
        }

        var degradations = context.degradationLog();
        if (!degradations.isEmpty()) {
            System.out.println();
            System.out.println("  DEGRADATIONS:");
            degradations.forEach(ConsoleOutput::degradation);
        }

        var log = context.eventLog();
        if (!log.isEmpty() && events > 0) {
            System.out.println();
            System.out.println("  EVENTS (last " + Math.min(events, log.size()) + " of " + log.size() + "):");
            for (ContextEvent event : log.subList(Math.max(0, log.size() - events), log.size())) {
                System.out.printf("    %s %-20s %-12s %s%n", event.timestamp(), event.kind(),
                        event.unit() != null ? event.unit() : "-", event.detail() != null ? event.detail() : "");
            }
        }
        return 0;
    }
}

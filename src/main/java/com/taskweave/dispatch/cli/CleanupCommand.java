package com.taskweave.dispatch.cli;

import com.taskweave.core.workflow.WorkflowOrchestrator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;

/**
 * CLI command: taskweave cleanup
 * <p>
 * Archives every stored workflow context whose TTL has elapsed.
 */
@Command(name = "cleanup", mixinStandardHelpOptions = true, description = "Archive expired workflow contexts")
@Component
public class CleanupCommand implements Runnable {

    private final WorkflowOrchestrator orchestrator;

    public CleanupCommand(WorkflowOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<String> archived = orchestrator.cleanupExpiredWorkflows();
        if (archived.isEmpty()) {
            ConsoleOutput.info("No expired workflows.");
            return;
        }
        for (String id : archived) {
            ConsoleOutput.success("Archived " + id);
        }
        ConsoleOutput.info("Archived " + archived.size() + " expired workflow" + (archived.size() != 1 ? "s" : ""));
    }
}

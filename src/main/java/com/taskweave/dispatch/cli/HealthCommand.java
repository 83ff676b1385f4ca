package com.taskweave.dispatch.cli;

import com.taskweave.core.health.HealthEvaluator;
import com.taskweave.core.health.HealthReport;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: taskweave health
 * <p>
 * Runs the readiness battery and prints each check plus the readiness verdict
 * per backend. Exits 1 when neither backend is ready.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check backend readiness")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthEvaluator healthEvaluator;

    public HealthCommand(HealthEvaluator healthEvaluator) {
        this.healthEvaluator = healthEvaluator;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        HealthReport report = healthEvaluator.getHealthReport();
        report.checks().values().forEach(ConsoleOutput::healthCheck);

        System.out.println(ConsoleOutput.RULE);
        printReadiness("Primary backend", report.readyForPrimary());
        printReadiness("Secondary backend", report.readyForSecondary());
        ConsoleOutput.info("Overall: " + report.overall().wireName());
        return report.readyForPrimary() || report.readyForSecondary() ? 0 : 1;
    }

    private static void printReadiness(String label, boolean ready) {
        if (ready) {
            ConsoleOutput.success(label + ": ready");
        } else {
            ConsoleOutput.error(label + ": not ready");
        }
    }
}

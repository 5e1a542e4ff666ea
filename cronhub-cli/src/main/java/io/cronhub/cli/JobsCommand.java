package io.cronhub.cli;

import io.cronhub.core.CronhubRuntime;
import io.cronhub.core.job.JobRecord;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "jobs", description = "List scheduled jobs")
public final class JobsCommand implements Callable<Integer> {
    private static final String ROW = "%-6s %-8s %-18s %-26s %s%n";

    private final CliContext context;

    public JobsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try (CronhubRuntime runtime = context.openRuntime()) {
            List<JobRecord> jobs = runtime.store().list();
            if (jobs.isEmpty()) {
                System.out.println("No jobs.");
                return 0;
            }
            System.out.printf(ROW, "ID", "ENABLED", "SCHEDULE", "LAST RUN", "NAME");
            for (JobRecord job : jobs) {
                System.out.printf(
                    ROW,
                    job.id(),
                    job.enabled() ? "yes" : "no",
                    job.recurrence(),
                    job.lastRun() == null ? "never" : job.lastRun().toString(),
                    job.name()
                );
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Jobs command failed: " + e.getMessage());
            return 1;
        }
    }
}

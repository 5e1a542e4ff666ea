package io.cronhub.cli;

import io.cronhub.core.CronhubRuntime;
import io.cronhub.core.execution.ExecutionOutcome;
import io.cronhub.core.execution.ExecutionResult;
import io.cronhub.core.job.JobRecord;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "run", description = "Run a job once in the foreground and record the result")
public final class RunCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", paramLabel = "JOB_ID", description = "Job id")
    long jobId;

    public RunCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try (CronhubRuntime runtime = context.openRuntime()) {
            Optional<JobRecord> job = runtime.store().get(jobId);
            if (job.isEmpty()) {
                System.err.println("Job " + jobId + " does not exist");
                return 1;
            }
            ExecutionResult result = runtime.runner().run(job.get());
            System.out.println("Outcome: " + result.outcome().tag()
                + (result.exitCode() == null ? "" : " (exit " + result.exitCode() + ")"));
            if (!result.stdout().isEmpty()) {
                System.out.print(result.stdout());
                if (!result.stdout().endsWith("\n")) {
                    System.out.println();
                }
            }
            if (!result.stderr().isEmpty()) {
                System.err.print(result.stderr());
            }
            return result.outcome() == ExecutionOutcome.SUCCESS ? 0 : 1;
        } catch (Exception e) {
            System.err.println("Run command failed: " + e.getMessage());
            return 1;
        }
    }
}

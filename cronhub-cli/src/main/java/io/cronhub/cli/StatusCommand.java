package io.cronhub.cli;

import io.cronhub.core.CronhubRuntime;
import io.cronhub.core.config.ConfigPaths;
import io.cronhub.core.config.model.CronhubConfig;
import io.cronhub.core.job.JobRecord;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration and catalog status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            CronhubConfig config = context.loadConfig();
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Database: " + ConfigPaths.resolve(config.storage().databasePath()));
            System.out.println("Run logs: " + ConfigPaths.resolve(config.storage().logDirectory()));
            System.out.println("Timezone: " + config.scheduler().zone());
            System.out.println("Shell: " + config.execution().shell());
            System.out.println("Gateway: http://" + config.gateway().host() + ":" + config.gateway().port());
            try (CronhubRuntime runtime = context.openRuntime()) {
                List<JobRecord> jobs = runtime.store().list();
                long enabled = jobs.stream().filter(JobRecord::enabled).count();
                System.out.println("Jobs: " + jobs.size() + " (" + enabled + " enabled)");
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}

package io.cronhub.app;

import io.cronhub.cli.CliContext;
import io.cronhub.cli.CronhubCliCommand;
import io.cronhub.cli.JobsCommand;
import io.cronhub.cli.OnboardCommand;
import io.cronhub.cli.RunCommand;
import io.cronhub.cli.ServeCommand;
import io.cronhub.cli.StatusCommand;
import io.cronhub.core.CronhubRuntime;
import io.cronhub.core.api.GatewayServer;
import io.cronhub.core.config.ConfigPaths;
import io.cronhub.core.config.ConfigService;
import io.cronhub.core.config.model.CronhubConfig;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class CronhubApplication {
    private static final Logger LOG = LoggerFactory.getLogger(CronhubApplication.class);

    private CronhubApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        Clock clock = Clock.systemUTC();

        CliContext context = new CliContext(
            configService,
            configPath,
            clock,
            (port, host) -> runServer(configService, configPath, clock, port, host)
        );

        CommandLine commandLine = new CommandLine(new CronhubCliCommand());
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("jobs", new JobsCommand(context));
        commandLine.addSubcommand("run", new RunCommand(context));
        commandLine.addSubcommand("serve", new ServeCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static int runServer(
        ConfigService configService,
        Path configPath,
        Clock clock,
        Integer portOverride,
        String hostOverride
    ) throws Exception {
        CronhubConfig config = configService.load(configPath);
        int port = portOverride != null ? portOverride : config.gateway().port();
        String host = hostOverride != null && !hostOverride.isBlank() ? hostOverride : config.gateway().host();

        CountDownLatch shutdown = new CountDownLatch(1);
        CountDownLatch stopped = new CountDownLatch(1);
        long stopWaitSeconds = config.execution().shutdownGraceSeconds() + 5L;
        try (CronhubRuntime runtime = CronhubRuntime.open(config, clock);
             GatewayServer server = new GatewayServer(port, host, runtime.synchronizer())) {
            int armed = runtime.synchronizer().start();
            server.start();
            // The JVM exits once hooks return, so the hook waits for the runtime to finish closing.
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                shutdown.countDown();
                try {
                    stopped.await(stopWaitSeconds, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "cronhub-shutdown"));
            LOG.info("cronhub serving {} armed jobs on http://{}:{} (zone {})",
                armed, host, server.port(), config.scheduler().zone());
            System.out.println("Gateway running on http://" + host + ":" + server.port());
            shutdown.await();
            LOG.info("Shutting down cronhub");
        } finally {
            stopped.countDown();
        }
        return 0;
    }
}

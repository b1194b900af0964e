package com.epiccharts.dispatch.cli;

import com.epiccharts.core.config.BotProperties;
import com.epiccharts.core.config.MissingConfigurationException;
import com.epiccharts.core.config.StartupValidator;
import com.epiccharts.core.pipeline.MentionPoller;
import com.epiccharts.core.scheduler.MentionScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: epic-charts run
 * <p>
 * Validates configuration and starts the poll loop. The embedded web server (enabled by
 * {@link com.epiccharts.EpicChartsApplication#main} when it sees "run") keeps the JVM alive;
 * Ctrl+C or SIGTERM closes the Spring context, which stops the loop and the browser.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Start polling for mentions")
@Component
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @Option(names = "--since-id", description = "Only consider mentions newer than this id")
    private String sinceId;

    private final StartupValidator validator;
    private final MentionPoller poller;
    private final MentionScheduler scheduler;
    private final BotProperties botProperties;

    public RunCommand(StartupValidator validator, MentionPoller poller,
                      MentionScheduler scheduler, BotProperties botProperties) {
        this.validator = validator;
        this.poller = poller;
        this.scheduler = scheduler;
        this.botProperties = botProperties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            validator.validate();
        } catch (MissingConfigurationException e) {
            log.error(e.getMessage());
            ConsoleOutput.error(e.getMessage());
            return 1;
        } catch (IllegalStateException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        if (sinceId != null && !poller.seedCursor(sinceId)) {
            ConsoleOutput.warn("Ignoring --since-id " + sinceId);
        }

        ConsoleOutput.info("Epic Charts Bot starting (user " + botProperties.getUserId() + ")");
        if (botProperties.hasAllowList()) {
            ConsoleOutput.info("Allowed users: " + String.join(", ", botProperties.getAllowedUserIds()));
        }
        scheduler.start();
        ConsoleOutput.info("Polling every " + botProperties.getPollIntervalMs() / 1000 + "s. Press Ctrl+C to stop.");
        return 0;
    }
}

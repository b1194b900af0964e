package com.epiccharts;

import com.epiccharts.core.scheduler.MentionScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicReference;

@SpringBootApplication
public class EpicChartsApplication {

    private static final Logger log = LoggerFactory.getLogger(EpicChartsApplication.class);

    public static void main(String[] args) {
        // Watermarking uses java.awt without a display.
        System.setProperty("java.awt.headless", "true");

        boolean runMode = Arrays.asList(args).contains("run");

        SpringApplicationBuilder builder = new SpringApplicationBuilder(EpicChartsApplication.class);
        if (runMode) {
            // Long-running bot: web server carries the admin API and keeps the JVM alive
            builder.properties(
                    "spring.main.web-application-type=servlet",
                    "spring.main.banner-mode=off"
            );
        } else {
            builder.properties(
                    "spring.main.web-application-type=none",
                    "spring.main.banner-mode=off"
            );
        }

        // Installed before startup so the first poll cycle is covered; the poll loop starts inside run().
        AtomicReference<ConfigurableApplicationContext> context = new AtomicReference<>();
        if (runMode) {
            Thread.setDefaultUncaughtExceptionHandler((thread, error) -> fatal(context.get(), thread, error));
        }

        ConfigurableApplicationContext ctx = builder.run(args);
        context.set(ctx);
        ExitCodeGenerator exitCodeGen = ctx.getBean(ExitCodeGenerator.class);

        if (!runMode || exitCodeGen.getExitCode() != 0) {
            int exitCode = SpringApplication.exit(ctx, exitCodeGen);
            System.exit(exitCode);
        }
    }

    /**
     * Shuts the poll loop and browser down, then exits non-zero.
     */
    private static void fatal(ConfigurableApplicationContext ctx, Thread thread, Throwable error) {
        log.error("Uncaught exception on {}: {}", thread.getName(), error.getMessage(), error);
        if (ctx == null) {
            System.exit(1);
        }
        try {
            ctx.getBean(MentionScheduler.class).shutdown();
        } finally {
            System.exit(SpringApplication.exit(ctx, () -> 1));
        }
    }
}

package com.epiccharts.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for the bot.
 * Routes to subcommands: run, health, extract, render.
 */
@Command(
        name = "epic-charts",
        mixinStandardHelpOptions = true,
        version = "epic-charts 0.1.0",
        description = "Replies to \"make it epic\" mentions with a redrawn chart",
        subcommands = {
                RunCommand.class,
                HealthCommand.class,
                ExtractCommand.class,
                RenderCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class EpicChartsCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}

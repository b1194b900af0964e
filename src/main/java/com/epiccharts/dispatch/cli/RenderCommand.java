package com.epiccharts.dispatch.cli;

import com.epiccharts.core.model.ChartData;
import com.epiccharts.core.model.ChartType;
import com.epiccharts.core.model.ColorScheme;
import com.epiccharts.core.model.DisplayConfig;
import com.epiccharts.core.model.StyleVariant;
import com.epiccharts.core.render.ChartRenderer;
import com.epiccharts.core.render.RenderException;
import com.epiccharts.core.render.WatermarkCompositor;
import com.epiccharts.core.render.WatermarkException;
import com.epiccharts.core.vision.ChartDataParser;
import com.epiccharts.core.vision.ExtractionException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: epic-charts render &lt;chart-data.json&gt; --out &lt;file.png&gt;
 * <p>
 * Renders and watermarks a chart data file exactly as the bot would, without posting it.
 * Type, colour scheme and style can be overridden to preview the other looks.
 */
@Command(name = "render", mixinStandardHelpOptions = true,
        description = "Render a chart data JSON file to a watermarked PNG")
@Component
public class RenderCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Chart data JSON (labels, series, suggestedTitle, suggestedType)")
    private Path input;

    @Option(names = {"--out", "-o"}, required = true, description = "Output PNG path")
    private Path output;

    @Option(names = "--type", description = "Chart type override: ${COMPLETION-CANDIDATES}")
    private ChartType type;

    @Option(names = "--scheme", defaultValue = "DEFAULT", description = "Colour scheme: ${COMPLETION-CANDIDATES}")
    private ColorScheme scheme;

    @Option(names = "--style", defaultValue = "PROFESSIONAL", description = "Style variant: ${COMPLETION-CANDIDATES}")
    private StyleVariant style;

    private final ChartRenderer renderer;
    private final WatermarkCompositor watermarkCompositor;
    private final ChartDataParser parser = new ChartDataParser();

    public RenderCommand(ChartRenderer renderer, WatermarkCompositor watermarkCompositor) {
        this.renderer = renderer;
        this.watermarkCompositor = watermarkCompositor;
    }

    @Override
    public Integer call() {
        ChartData data;
        try {
            data = parser.parse(Files.readString(input));
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read " + input + ": " + e.getMessage());
            return 1;
        } catch (ExtractionException e) {
            ConsoleOutput.error("Invalid chart data: " + e.getMessage());
            return 1;
        }

        DisplayConfig defaults = DisplayConfig.defaultsFor(data);
        var config = new DisplayConfig(
                type != null ? type : defaults.chartType(),
                scheme, style,
                defaults.showGrid(), defaults.showLegend(), defaults.showValues(), defaults.animate(),
                defaults.title());

        try {
            byte[] png = watermarkCompositor.watermark(renderer.render(data, config));
            Files.write(output, png);
            ConsoleOutput.success("Wrote " + config.chartType().name().toLowerCase() + " chart to " + output
                    + " (" + png.length + " bytes)");
            return 0;
        } catch (RenderException | WatermarkException e) {
            ConsoleOutput.error("Render failed: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            ConsoleOutput.error("Cannot write " + output + ": " + e.getMessage());
            return 1;
        } finally {
            renderer.shutdown();
        }
    }
}

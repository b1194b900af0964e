package com.epiccharts.dispatch.cli;

import com.epiccharts.core.model.ChartData;
import com.epiccharts.core.vision.ExtractionException;
import com.epiccharts.core.vision.VisionExtractionService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: epic-charts extract &lt;image&gt;
 * <p>
 * Runs vision extraction on a local file or an http(s) URL and prints the chart data as JSON.
 * Nothing is posted.
 */
@Command(name = "extract", mixinStandardHelpOptions = true,
        description = "Extract chart data from an image file or URL")
@Component
public class ExtractCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Image path or http(s) URL")
    private String source;

    private final VisionExtractionService visionService;
    private final ObjectMapper objectMapper;

    public ExtractCommand(VisionExtractionService visionService, ObjectMapper objectMapper) {
        this.visionService = visionService;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        ChartData data;
        try {
            if (source.startsWith("http://") || source.startsWith("https://")) {
                data = visionService.extractFromUrl(source);
            } else {
                data = visionService.extractFromBytes(Files.readAllBytes(Path.of(source)));
            }
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read " + source + ": " + e.getMessage());
            return 1;
        } catch (ExtractionException e) {
            ConsoleOutput.error("Extraction failed (" + e.getKind() + "): " + e.getMessage());
            return 1;
        }

        try {
            System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(data));
        } catch (JsonProcessingException e) {
            ConsoleOutput.error("Could not serialize chart data: " + e.getMessage());
            return 1;
        }
        return 0;
    }
}

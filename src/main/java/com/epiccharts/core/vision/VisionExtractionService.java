package com.epiccharts.core.vision;

import com.epiccharts.core.model.ChartData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.stereotype.Service;
import org.springframework.util.MimeType;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URL;
import java.util.function.Consumer;

/**
 * Asks a multimodal model to read chart-shaped data out of an image.
 * <p>
 * Wraps Spring AI's {@link ChatClient}; the model's reply is cleaned and validated by
 * {@link ChartDataParser}. All failures surface as {@link ExtractionException} with a
 * {@link ExtractionException.Kind} the caller can branch on.
 */
@Service
public class VisionExtractionService {

    private static final Logger log = LoggerFactory.getLogger(VisionExtractionService.class);

    static final String EXTRACTION_PROMPT = """
            Analyze this image and extract any data that could be turned into a chart.

            Look for:
            - Tables, leaderboards, rankings
            - Charts or graphs (extract the underlying data)
            - Statistics, scores, numbers with labels
            - Any structured numerical data

            Return ONLY valid JSON in this exact format (no markdown, no explanation):
            {
              "labels": ["label1", "label2", ...],
              "series": [
                {"name": "Series Name", "data": [num1, num2, ...]}
              ],
              "suggestedTitle": "A title for the chart",
              "suggestedType": "bar" | "line" | "area" | "pie" | "radar" | "scatter" | "table"
            }

            Rules:
            - labels array must match the length of each data array
            - All data values must be numbers (convert scores like "-27" to -27)
            - If there are multiple numeric columns, create multiple series
            - Choose suggestedType based on the data (rankings = table, trends = line, comparisons = bar, etc.)
            - If you can't find chartable data, return: {"error": "No chartable data found"}
            """;

    private final ChatClient chatClient;
    private final ChartDataParser parser;

    public VisionExtractionService(ChatClient.Builder builder) {
        this(builder.build(), new ChartDataParser());
    }

    VisionExtractionService(ChatClient chatClient, ChartDataParser parser) {
        this.chatClient = chatClient;
        this.parser = parser;
    }

    /**
     * Lets the model fetch the image itself. Cheapest path: nothing is downloaded here.
     */
    public ChartData extractFromUrl(String imageUrl) {
        log.info("Analyzing image by URL: {}", imageUrl);
        URL url;
        try {
            url = URI.create(imageUrl).toURL();
        } catch (IllegalArgumentException | MalformedURLException e) {
            throw new ExtractionException(ExtractionException.Kind.TRANSPORT, "Invalid image URL: " + imageUrl, e);
        }
        MimeType mimeType = ImageMediaTypes.fromUrl(imageUrl);
        return extract(u -> u.text(EXTRACTION_PROMPT).media(mimeType, url), "url");
    }

    /**
     * Sends the raw image bytes inline, with a media type sniffed from the file signature.
     */
    public ChartData extractFromBytes(byte[] image) {
        MimeType mimeType = ImageMediaTypes.sniff(image);
        log.info("Analyzing image from {} bytes ({})", image.length, mimeType);
        var resource = new ByteArrayResource(image);
        return extract(u -> u.text(EXTRACTION_PROMPT).media(mimeType, resource), "bytes");
    }

    private ChartData extract(Consumer<ChatClient.PromptUserSpec> userSpec, String source) {
        long start = System.currentTimeMillis();
        String content;
        try {
            content = chatClient.prompt()
                    .user(userSpec)
                    .call()
                    .content();
        } catch (RuntimeException e) {
            log.error("Vision call ({}) failed: {}", source, e.getMessage());
            throw new ExtractionException(ExtractionException.Kind.TRANSPORT,
                    "Vision API call failed: " + e.getMessage(), e);
        }
        long elapsed = System.currentTimeMillis() - start;
        log.info("Vision call ({}) complete ({}s)", source, String.format("%.1f", elapsed / 1000.0));

        ChartData data = parser.parse(content);
        log.info("Successfully extracted chart data: {} labels, {} series",
                data.labels().size(), data.series().size());
        return data;
    }
}

package com.epiccharts.core.vision;

import com.epiccharts.core.model.ChartData;
import com.epiccharts.core.model.DataSeries;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the vision model's free-text reply into validated {@link ChartData}.
 * <p>
 * The reply is expected to be a JSON object of the form
 * <pre>{@code
 * {"labels": [...], "series": [{"name": "...", "data": [...]}], "suggestedTitle": "...", "suggestedType": "bar"}
 * }</pre>
 * or {@code {"error": "No chartable data found"}}. Markdown code fences and surrounding
 * chatter are stripped before parsing.
 */
public class ChartDataParser {

    private static final Logger log = LoggerFactory.getLogger(ChartDataParser.class);

    static final String NO_DATA_MESSAGE = "No chartable data found";
    static final String INVALID_STRUCTURE_MESSAGE = "Invalid data structure returned";

    private final ObjectMapper mapper;

    public ChartDataParser() {
        this.mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public ChartData parse(String content) {
        if (content == null || content.isBlank()) {
            throw new ExtractionException(ExtractionException.Kind.TRANSPORT, "No response from vision API");
        }

        String cleaned = stripWrapping(content);
        JsonNode root;
        try {
            root = mapper.readTree(cleaned);
        } catch (JsonProcessingException e) {
            log.error("Failed to parse vision response: {}", e.getOriginalMessage());
            log.debug("Raw vision response: {}", content);
            throw new ExtractionException(ExtractionException.Kind.TRANSPORT,
                    "Failed to parse response: " + abbreviate(content), e);
        }

        if (root == null || !root.isObject()) {
            throw new ExtractionException(ExtractionException.Kind.INVALID_STRUCTURE, INVALID_STRUCTURE_MESSAGE);
        }

        JsonNode error = root.get("error");
        if (error != null && !error.isNull()) {
            String message = error.asText(NO_DATA_MESSAGE);
            throw new ExtractionException(ExtractionException.Kind.NO_DATA,
                    message.isBlank() ? NO_DATA_MESSAGE : message);
        }

        JsonNode labelsNode = root.get("labels");
        JsonNode seriesNode = root.get("series");
        if (labelsNode == null || seriesNode == null || !labelsNode.isArray() || !seriesNode.isArray()) {
            throw new ExtractionException(ExtractionException.Kind.INVALID_STRUCTURE, INVALID_STRUCTURE_MESSAGE);
        }
        if (labelsNode.isEmpty() || seriesNode.isEmpty()) {
            throw new ExtractionException(ExtractionException.Kind.NO_DATA, NO_DATA_MESSAGE);
        }

        var labels = new ArrayList<String>();
        for (JsonNode label : labelsNode) {
            labels.add(label.asText());
        }

        var series = new ArrayList<DataSeries>();
        int index = 0;
        for (JsonNode s : seriesNode) {
            index++;
            if (!s.isObject()) {
                throw new ExtractionException(ExtractionException.Kind.INVALID_STRUCTURE, INVALID_STRUCTURE_MESSAGE);
            }
            String name = s.path("name").asText("");
            if (name.isBlank()) {
                name = "Series " + index;
            }
            JsonNode valuesNode = s.has("data") ? s.get("data") : s.get("values");
            if (valuesNode == null || !valuesNode.isArray()) {
                throw new ExtractionException(ExtractionException.Kind.INVALID_STRUCTURE, INVALID_STRUCTURE_MESSAGE);
            }
            List<Double> values = numericValues(valuesNode);
            if (values.size() != labels.size()) {
                throw new ExtractionException(ExtractionException.Kind.INVALID_STRUCTURE,
                        INVALID_STRUCTURE_MESSAGE + ": series '" + name + "' has " + values.size()
                                + " values for " + labels.size() + " labels");
            }
            series.add(new DataSeries(name, values));
        }

        return new ChartData(labels, series, textOrNull(root, "suggestedTitle"), textOrNull(root, "suggestedType"));
    }

    /**
     * Removes markdown code fences and any prose around the outermost JSON object.
     */
    static String stripWrapping(String content) {
        String cleaned = content.trim();
        int fence = cleaned.indexOf("```");
        if (fence >= 0) {
            int close = cleaned.lastIndexOf("```");
            String inner = close > fence ? cleaned.substring(fence + 3, close) : cleaned.substring(fence + 3);
            inner = inner.strip();
            if (inner.regionMatches(true, 0, "json", 0, 4)) {
                inner = inner.substring(4);
            }
            cleaned = inner.trim();
        }
        if (!cleaned.startsWith("{")) {
            int open = cleaned.indexOf('{');
            int close = cleaned.lastIndexOf('}');
            if (open >= 0 && close > open) {
                cleaned = cleaned.substring(open, close + 1);
            }
        }
        return cleaned;
    }

    private static List<Double> numericValues(JsonNode valuesNode) {
        var values = new ArrayList<Double>();
        for (JsonNode v : valuesNode) {
            double value;
            if (v.isNumber()) {
                value = v.asDouble();
            } else if (v.isTextual()) {
                try {
                    value = Double.parseDouble(v.asText().trim().replace(",", ""));
                } catch (NumberFormatException e) {
                    throw new ExtractionException(ExtractionException.Kind.INVALID_STRUCTURE,
                            INVALID_STRUCTURE_MESSAGE + ": non-numeric value '" + v.asText() + "'", e);
                }
            } else {
                throw new ExtractionException(ExtractionException.Kind.INVALID_STRUCTURE,
                        INVALID_STRUCTURE_MESSAGE + ": non-numeric value " + v);
            }
            // NaN and infinities cannot be plotted
            if (!Double.isFinite(value)) {
                throw new ExtractionException(ExtractionException.Kind.INVALID_STRUCTURE,
                        INVALID_STRUCTURE_MESSAGE + ": non-finite value " + v);
            }
            values.add(value);
        }
        return values;
    }

    private static String textOrNull(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    private static String abbreviate(String content) {
        return content.length() <= 200 ? content : content.substring(0, 200) + "...";
    }
}

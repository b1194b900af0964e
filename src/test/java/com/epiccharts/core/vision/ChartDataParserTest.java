package com.epiccharts.core.vision;

import com.epiccharts.core.model.ChartData;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChartDataParserTest {

    private final ChartDataParser parser = new ChartDataParser();

    private ExtractionException.Kind failureKind(String content) {
        return assertThrows(ExtractionException.class, () -> parser.parse(content)).getKind();
    }

    @Test
    @DisplayName("parses a well-formed reply with title and type")
    void parsesWellFormed() {
        ChartData data = parser.parse("""
                {"labels":["Q1","Q2"],"series":[{"name":"Rev","data":[10,20]}],
                 "suggestedTitle":"Revenue","suggestedType":"line"}
                """);
        assertEquals(List.of("Q1", "Q2"), data.labels());
        assertEquals("Rev", data.series().get(0).name());
        assertEquals(List.of(10.0, 20.0), data.series().get(0).values());
        assertEquals("Revenue", data.suggestedTitle());
        assertEquals("line", data.suggestedType());
    }

    @Test
    @DisplayName("accepts 'values' as well as 'data' and numeric strings")
    void acceptsValuesAndNumericStrings() {
        ChartData data = parser.parse("""
                {"labels":["A","B"],"series":[{"name":"S","values":["-27","1,200"]}]}
                """);
        assertEquals(List.of(-27.0, 1200.0), data.series().get(0).values());
        assertNull(data.suggestedTitle());
    }

    @Test
    @DisplayName("strips markdown code fences and surrounding prose")
    void stripsFences() {
        String reply = """
                Sure! Here is the data:
                ```json
                {"labels":["A"],"series":[{"name":"S","data":[1]}]}
                ```
                """;
        assertEquals(List.of("A"), parser.parse(reply).labels());
    }

    @Test
    @DisplayName("stripWrapping extracts the outermost object from chatter")
    void stripWrappingWithoutFence() {
        assertEquals("{\"a\":{\"b\":1}}", ChartDataParser.stripWrapping("result: {\"a\":{\"b\":1}} done"));
    }

    @Test
    @DisplayName("blank series names are numbered")
    void defaultSeriesName() {
        ChartData data = parser.parse("""
                {"labels":["A"],"series":[{"data":[1]},{"name":"","data":[2]}]}
                """);
        assertEquals("Series 1", data.series().get(0).name());
        assertEquals("Series 2", data.series().get(1).name());
    }

    @Test
    @DisplayName("model error signal is NO_DATA")
    void errorSignal() {
        var ex = assertThrows(ExtractionException.class,
                () -> parser.parse("{\"error\": \"No chartable data found\"}"));
        assertEquals(ExtractionException.Kind.NO_DATA, ex.getKind());
        assertEquals("No chartable data found", ex.getMessage());
        assertTrue(ex.isUserActionable());
    }

    @Test
    @DisplayName("empty labels or series are NO_DATA")
    void emptyArrays() {
        assertEquals(ExtractionException.Kind.NO_DATA, failureKind("{\"labels\":[],\"series\":[]}"));
        assertEquals(ExtractionException.Kind.NO_DATA, failureKind("{\"labels\":[\"A\"],\"series\":[]}"));
    }

    @Test
    @DisplayName("length mismatch between labels and a series is INVALID_STRUCTURE")
    void lengthMismatch() {
        assertEquals(ExtractionException.Kind.INVALID_STRUCTURE, failureKind("""
                {"labels":["A","B","C"],"series":[{"name":"ok","data":[1,2,3]},{"name":"short","data":[1,2]}]}
                """));
    }

    @Test
    @DisplayName("NaN and infinite values cannot be plotted and are INVALID_STRUCTURE")
    void nonFiniteValues() {
        for (String value : List.of("NaN", "Infinity", "-Infinity", "1e999")) {
            assertEquals(ExtractionException.Kind.INVALID_STRUCTURE,
                    failureKind("{\"labels\":[\"A\",\"B\"],\"series\":[{\"name\":\"S\",\"data\":[1,\"" + value + "\"]}]}"),
                    value);
        }
    }

    @Test
    @DisplayName("missing fields, wrong shapes and non-numeric values are INVALID_STRUCTURE")
    void invalidShapes() {
        assertEquals(ExtractionException.Kind.INVALID_STRUCTURE, failureKind("{\"labels\":[\"A\"]}"));
        assertEquals(ExtractionException.Kind.INVALID_STRUCTURE, failureKind("{\"labels\":\"A\",\"series\":[]}"));
        assertEquals(ExtractionException.Kind.INVALID_STRUCTURE, failureKind("[1,2,3]"));
        assertEquals(ExtractionException.Kind.INVALID_STRUCTURE,
                failureKind("{\"labels\":[\"A\"],\"series\":[{\"name\":\"S\",\"data\":[\"n/a\"]}]}"));
        assertEquals(ExtractionException.Kind.INVALID_STRUCTURE,
                failureKind("{\"labels\":[\"A\"],\"series\":[{\"name\":\"S\"}]}"));
    }

    @Test
    @DisplayName("empty or unparseable replies are TRANSPORT and not user-actionable")
    void transportFailures() {
        var blank = assertThrows(ExtractionException.class, () -> parser.parse("  "));
        assertEquals(ExtractionException.Kind.TRANSPORT, blank.getKind());
        assertFalse(blank.isUserActionable());
        assertEquals(ExtractionException.Kind.TRANSPORT, failureKind(null));
        assertEquals(ExtractionException.Kind.TRANSPORT, failureKind("I cannot see any chart here."));
        assertEquals(ExtractionException.Kind.TRANSPORT, failureKind("{\"labels\": [\"A\""));
    }
}

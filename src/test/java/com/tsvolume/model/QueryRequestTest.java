package com.tsvolume.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class QueryRequestTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    public void testParseQueryDocument() throws Exception {
        String json = "{\"select\":\"temp\",\"range\":{\"from\":\"21000101T000000\",\"to\":\"19700101T000000\"},"
                + "\"where\":{\"tag\":\"test\"},\"output\":{\"format\":\"json\"},\"limit\":10}";

        QueryRequest request = mapper.readValue(json, QueryRequest.class);

        assertEquals("temp", request.getMetric());
        assertEquals(Direction.BACKWARD, request.getDirection());
        assertEquals(0L, request.getRange().getEnd());
        assertEquals(Map.of("tag", "test"), request.getTags());
        assertEquals(OutputFormat.JSON, request.getFormat());
        assertEquals(10, request.getLimit());
    }

    @Test
    public void testDefaults() throws Exception {
        QueryRequest request = mapper.readValue(
                "{\"select\":\"temp\",\"range\":{\"from\":\"1\",\"to\":\"100\"}}", QueryRequest.class);

        assertEquals(Direction.FORWARD, request.getDirection());
        assertEquals(OutputFormat.CSV, request.getFormat());
        assertEquals(0, request.getLimit());
        assertTrue(request.getTags().isEmpty());
    }

    @Test
    public void testMissingFieldsRejected() {
        assertThrows(Exception.class, () -> mapper.readValue(
                "{\"range\":{\"from\":\"1\",\"to\":\"100\"}}", QueryRequest.class));
        assertThrows(Exception.class, () -> mapper.readValue(
                "{\"select\":\"temp\",\"range\":{\"from\":\"1\"}}", QueryRequest.class));
        assertThrows(Exception.class, () -> mapper.readValue(
                "{\"select\":\"temp\",\"range\":{\"from\":\"1\",\"to\":\"1\"}}", QueryRequest.class));
        assertThrows(Exception.class, () -> mapper.readValue(
                "{\"select\":\"temp\",\"range\":{\"from\":\"1\",\"to\":\"2\"},\"output\":{\"format\":\"xml\"}}",
                QueryRequest.class));
    }

    @Test
    public void testMatches() {
        QueryRequest request = new QueryRequest("temp", new TimeRange(10, 20), Map.of("host", "a"), null, 0);

        assertTrue(request.matches(new DataPoint(SeriesKey.parse("temp host=a dc=x"), 10, 1.0)));
        assertFalse(request.matches(new DataPoint(SeriesKey.parse("temp host=a"), 20, 1.0)));
        assertFalse(request.matches(new DataPoint(SeriesKey.parse("temp host=b"), 15, 1.0)));
    }
}

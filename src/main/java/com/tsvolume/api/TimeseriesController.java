package com.tsvolume.api;

import com.tsvolume.ingest.IngestResult;
import com.tsvolume.model.DataPoint;
import com.tsvolume.model.QueryRequest;
import com.tsvolume.model.QueryResponse;
import com.tsvolume.service.TimeseriesService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * REST API controller for timeseries data operations.
 */
@RestController
@RequestMapping("/api/v1/timeseries")
public class TimeseriesController {

    private static final Logger logger = LoggerFactory.getLogger(TimeseriesController.class);

    @Autowired
    private TimeseriesService timeseriesService;

    /**
     * Write a single timeseries point.
     * POST /api/v1/timeseries/write
     */
    @PostMapping("/write")
    public ResponseEntity<Map<String, Object>> writePoint(@RequestBody DataPoint point) {
        try {
            IngestResult result = timeseriesService.writePoint(point);

            Map<String, Object> response = new HashMap<>();
            response.put("status", result.isAccepted() ? "success" : "rejected");
            response.put("result", result);
            response.put("point", point);

            return ResponseEntity.ok(response);

        } catch (IllegalStateException e) {
            logger.warn("Write operation failed: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(createErrorResponse("Service unavailable", e.getMessage()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(createErrorResponse("Invalid point", e.getMessage()));
        }
    }

    /**
     * Write multiple timeseries points in batch.
     * POST /api/v1/timeseries/write/batch
     */
    @PostMapping("/write/batch")
    public ResponseEntity<Map<String, Object>> writeBatch(@RequestBody List<DataPoint> points) {
        try {
            return ResponseEntity.ok(createBatchResponse(timeseriesService.writeBatch(points)));
        } catch (IllegalStateException e) {
            logger.warn("Batch write operation failed: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(createErrorResponse("Service unavailable", e.getMessage()));
        }
    }

    /**
     * Write points encoded in the line protocol.
     * POST /api/v1/timeseries/write/raw
     */
    @PostMapping(value = "/write/raw", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<Map<String, Object>> writeRaw(@RequestBody String payload) {
        try {
            return ResponseEntity.ok(createBatchResponse(timeseriesService.writeRaw(payload)));
        } catch (IllegalStateException e) {
            logger.warn("Raw write operation failed: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(createErrorResponse("Service unavailable", e.getMessage()));
        }
    }

    /**
     * Query timeseries data.
     * POST /api/v1/timeseries/query
     */
    @PostMapping("/query")
    public ResponseEntity<?> query(@RequestBody QueryRequest request) {
        try {
            QueryResponse response = timeseriesService.query(request);
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(createErrorResponse("Invalid query", e.getMessage()));
        }
    }

    /**
     * Get volume, cache and ingestion statistics.
     * GET /api/v1/timeseries/stats
     */
    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        return ResponseEntity.ok(timeseriesService.getStats());
    }

    /**
     * Wait until every accepted point has been flushed to a volume.
     * POST /api/v1/timeseries/flush?timeoutMs=...
     */
    @PostMapping("/flush")
    public ResponseEntity<Map<String, Object>> flush(@RequestParam(defaultValue = "5000") long timeoutMs) {
        try {
            boolean flushed = timeseriesService.flush(timeoutMs);

            Map<String, Object> response = new HashMap<>();
            response.put("status", flushed ? "success" : "timeout");
            response.put("flushed", flushed);

            return ResponseEntity.status(flushed ? HttpStatus.OK : HttpStatus.ACCEPTED).body(response);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(createErrorResponse("Flush interrupted", e.getMessage()));
        }
    }

    /**
     * Health check endpoint.
     * GET /api/v1/timeseries/health
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new HashMap<>();
        if (timeseriesService.isHealthy()) {
            response.put("status", "healthy");
            return ResponseEntity.ok(response);
        }
        response.put("status", "unhealthy");
        response.put("error", "Volume set halted after an invariant violation");
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
    }

    /**
     * Creates an error response map.
     */
    private Map<String, Object> createErrorResponse(String error, String message) {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "error");
        response.put("error", error);
        response.put("message", message);
        return response;
    }

    private Map<String, Object> createBatchResponse(List<IngestResult> results) {
        long accepted = results.stream().filter(IngestResult::isAccepted).count();

        Map<String, Object> response = new HashMap<>();
        response.put("status", accepted == results.size() ? "success" : "partial");
        response.put("pointsCount", results.size());
        response.put("accepted", accepted);
        response.put("rejected", results.size() - accepted);
        response.put("results", results);
        return response;
    }
}

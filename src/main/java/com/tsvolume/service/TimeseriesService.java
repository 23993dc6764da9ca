package com.tsvolume.service;

import com.tsvolume.ingest.IngestResult;
import com.tsvolume.ingest.RespPointDecoder;
import com.tsvolume.ingest.WriteRouter;
import com.tsvolume.model.DataPoint;
import com.tsvolume.model.QueryRequest;
import com.tsvolume.model.QueryResponse;
import com.tsvolume.query.QueryCursor;
import com.tsvolume.query.QueryEngine;
import com.tsvolume.query.RowWriter;
import com.tsvolume.stats.StatsReporter;
import com.tsvolume.storage.VolumeSetSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Service layer for timeseries operations.
 * Coordinates decoding, the write router, the query engine and stats reporting.
 */
@Service
public class TimeseriesService {

    private static final Logger logger = LoggerFactory.getLogger(TimeseriesService.class);

    private static final int STREAM_FLUSH_ROWS = 1000;

    @Autowired
    private WriteRouter writeRouter;

    @Autowired
    private QueryEngine queryEngine;

    @Autowired
    private StatsReporter statsReporter;

    @Autowired
    private RespPointDecoder decoder;

    /**
     * Writes a single timeseries point.
     */
    public IngestResult writePoint(DataPoint point) {
        if (point == null) {
            throw new IllegalArgumentException("Point cannot be null");
        }
        IngestResult result = writeRouter.ingest(point);
        logger.debug("Wrote point {}: {}", point, result);
        return result;
    }

    /**
     * Writes multiple timeseries points, reporting one result per point.
     */
    public List<IngestResult> writeBatch(List<DataPoint> points) {
        if (points == null || points.isEmpty()) {
            return List.of();
        }
        List<IngestResult> results = writeRouter.ingestAll(points);
        logger.debug("Wrote batch: {} points", points.size());
        return results;
    }

    /**
     * Decodes a payload in the line protocol and ingests every well-formed message.
     * Malformed messages are rejected in place without stopping the rest.
     */
    public List<IngestResult> writeRaw(String payload) {
        if (payload == null || payload.isEmpty()) {
            return List.of();
        }
        List<RespPointDecoder.DecodedMessage> messages = decoder.decodeAll(payload);
        List<IngestResult> results = new ArrayList<>(messages.size());
        for (RespPointDecoder.DecodedMessage message : messages) {
            if (message.isSuccess()) {
                results.add(writeRouter.ingest(message.getPoint()));
            } else {
                results.add(writeRouter.recordDecodeError(message.getError()));
            }
        }
        logger.debug("Decoded raw payload: {} messages", messages.size());
        return results;
    }

    /**
     * Opens a lazy cursor over the query's result. The caller must close it.
     */
    public QueryCursor openQuery(QueryRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Query request cannot be null");
        }
        return queryEngine.query(request.getMetric(), request.getTags(), request.getRange());
    }

    /**
     * Runs a query and collects its rows, honoring the request's limit.
     */
    public QueryResponse query(QueryRequest request) {
        long start = System.currentTimeMillis();
        List<DataPoint> points = new ArrayList<>();
        boolean truncated = false;
        try (QueryCursor cursor = openQuery(request)) {
            while (cursor.hasNext()) {
                if (request.getLimit() > 0 && points.size() >= request.getLimit()) {
                    truncated = true;
                    break;
                }
                points.add(cursor.next());
            }
        }
        long queryTime = System.currentTimeMillis() - start;
        if (points.isEmpty()) {
            logger.debug("Query {} matched no retained data", request);
        }
        return new QueryResponse(points, request.getMetric(), request.getDirection(), queryTime, truncated);
    }

    /**
     * Streams the query's rows in the requested format.
     *
     * @return number of rows written
     * @throws IOException if the client stream fails; the cursor is closed and engine state is untouched
     */
    public long streamQuery(QueryRequest request, OutputStream out) throws IOException {
        long rows = 0;
        try (QueryCursor cursor = openQuery(request);
             RowWriter writer = RowWriter.create(request.getFormat(), out)) {
            while (cursor.hasNext()) {
                if (request.getLimit() > 0 && rows >= request.getLimit()) {
                    break;
                }
                writer.write(cursor.next());
                rows++;
                if (rows % STREAM_FLUSH_ROWS == 0) {
                    writer.flush();
                }
            }
        }
        logger.debug("Streamed {} rows for {}", rows, request);
        return rows;
    }

    /**
     * Gets the stats document.
     */
    public Map<String, Object> getStats() {
        return statsReporter.report();
    }

    /**
     * Gets volume accounting.
     */
    public VolumeSetSnapshot getVolumeStats() {
        return statsReporter.volumes();
    }

    /**
     * Waits for every accepted point to reach a volume.
     */
    public boolean flush(long timeoutMs) throws InterruptedException {
        boolean flushed = writeRouter.awaitFlushed(timeoutMs);
        if (flushed) {
            logger.info("Write cache flushed to volumes");
        } else {
            logger.warn("Flush timed out after {}ms, {} points pending", timeoutMs, writeRouter.getPendingCount());
        }
        return flushed;
    }

    /**
     * Checks if the service is healthy.
     */
    public boolean isHealthy() {
        try {
            return !statsReporter.isHalted();
        } catch (Exception e) {
            logger.error("Health check failed", e);
            return false;
        }
    }
}

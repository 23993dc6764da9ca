package com.tsvolume.ingest;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters for accepted and rejected points.
 */
public class IngestionStats {

    private final AtomicLong accepted = new AtomicLong(0);
    private final AtomicLong flushed = new AtomicLong(0);
    private final Map<IngestResult.RejectReason, AtomicLong> rejected = new EnumMap<>(IngestResult.RejectReason.class);

    public IngestionStats() {
        for (IngestResult.RejectReason reason : IngestResult.RejectReason.values()) {
            rejected.put(reason, new AtomicLong(0));
        }
    }

    void recordAccepted() {
        accepted.incrementAndGet();
    }

    void recordFlushed() {
        flushed.incrementAndGet();
    }

    void recordRejected(IngestResult.RejectReason reason) {
        rejected.get(reason).incrementAndGet();
    }

    public Snapshot snapshot() {
        Map<IngestResult.RejectReason, Long> counts = new EnumMap<>(IngestResult.RejectReason.class);
        rejected.forEach((reason, count) -> counts.put(reason, count.get()));
        return new Snapshot(accepted.get(), flushed.get(), counts);
    }

    /**
     * Point-in-time copy of the counters.
     */
    public static class Snapshot {
        private final long accepted;
        private final long flushed;
        private final Map<IngestResult.RejectReason, Long> rejected;

        public Snapshot(long accepted, long flushed, Map<IngestResult.RejectReason, Long> rejected) {
            this.accepted = accepted;
            this.flushed = flushed;
            this.rejected = Collections.unmodifiableMap(rejected);
        }

        @JsonProperty("accepted")
        public long getAccepted() { return accepted; }

        @JsonProperty("flushed")
        public long getFlushed() { return flushed; }

        @JsonProperty("rejected")
        public Map<IngestResult.RejectReason, Long> getRejected() { return rejected; }

        @JsonProperty("decode_errors")
        public long getDecodeErrors() {
            return rejected.getOrDefault(IngestResult.RejectReason.DECODE_ERROR, 0L);
        }

        @Override
        public String toString() {
            return String.format("IngestionStats{accepted=%d, flushed=%d, rejected=%s}", accepted, flushed, rejected);
        }
    }
}

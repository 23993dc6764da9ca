package com.tsvolume.ingest;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-point outcome of ingestion. Rejections are recoverable: the point is dropped,
 * the caller is told why, and the stream continues.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class IngestResult {

    private static final IngestResult ACCEPTED = new IngestResult(true, null, null);

    public enum RejectReason {
        /**
         * The message could not be decoded or the point is malformed.
         */
        DECODE_ERROR,

        /**
         * The timestamp is not newer than the last accepted point of the series.
         */
        LATE_WRITE,

        /**
         * The point is larger than a whole volume.
         */
        TOO_LARGE,

        /**
         * The write cache stayed full for longer than the configured wait.
         */
        CACHE_OVERFLOW
    }

    private final boolean accepted;
    private final RejectReason reason;
    private final String message;

    private IngestResult(boolean accepted, RejectReason reason, String message) {
        this.accepted = accepted;
        this.reason = reason;
        this.message = message;
    }

    public static IngestResult accepted() {
        return ACCEPTED;
    }

    public static IngestResult rejected(RejectReason reason, String message) {
        return new IngestResult(false, reason, message);
    }

    @JsonProperty("accepted")
    public boolean isAccepted() {
        return accepted;
    }

    @JsonProperty("reason")
    public RejectReason getReason() {
        return reason;
    }

    @JsonProperty("message")
    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return accepted ? "IngestResult{accepted}"
                : String.format("IngestResult{rejected, reason=%s, message='%s'}", reason, message);
    }
}

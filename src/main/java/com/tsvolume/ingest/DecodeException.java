package com.tsvolume.ingest;

/**
 * A malformed ingestion message. Only the affected message is rejected.
 */
public class DecodeException extends Exception {

    private final int messageIndex;

    public DecodeException(int messageIndex, String message) {
        super(message);
        this.messageIndex = messageIndex;
    }

    public DecodeException(int messageIndex, String message, Throwable cause) {
        super(message, cause);
        this.messageIndex = messageIndex;
    }

    /**
     * Zero-based ordinal of the offending message within its payload.
     */
    public int getMessageIndex() {
        return messageIndex;
    }
}

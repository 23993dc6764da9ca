package com.tsvolume.ingest;

import com.tsvolume.model.DataPoint;
import com.tsvolume.model.SeriesKey;
import com.tsvolume.model.Timestamps;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes point-insertion messages in the RESP-style line protocol.
 *
 * A message is three CRLF terminated lines:
 * <pre>
 * +temp tag=test
 * +20150101T000000.000000000      (or :1420070400000000000)
 * +24.5                           (or :24)
 * </pre>
 * Simple strings start with '+', integers with ':'.
 */
public class RespPointDecoder {

    private static final int LINES_PER_MESSAGE = 3;

    /**
     * Decodes a single message.
     */
    public DataPoint decode(byte[] message) throws DecodeException {
        List<String> lines = splitLines(new String(message, StandardCharsets.UTF_8));
        if (lines.size() != LINES_PER_MESSAGE) {
            throw new DecodeException(0, "Expected 3 lines per message, got " + lines.size());
        }
        return decode(0, lines.get(0), lines.get(1), lines.get(2));
    }

    /**
     * Decodes every message of a payload. A malformed message consumes its three
     * lines and is reported in place; decoding carries on with the next one.
     */
    public List<DecodedMessage> decodeAll(String payload) {
        List<String> lines = splitLines(payload);
        List<DecodedMessage> result = new ArrayList<>(lines.size() / LINES_PER_MESSAGE + 1);
        int index = 0;
        for (int i = 0; i < lines.size(); i += LINES_PER_MESSAGE, index++) {
            if (i + LINES_PER_MESSAGE > lines.size()) {
                result.add(DecodedMessage.failure(new DecodeException(index,
                        "Truncated message: " + (lines.size() - i) + " of 3 lines")));
                break;
            }
            try {
                result.add(DecodedMessage.success(decode(index, lines.get(i), lines.get(i + 1), lines.get(i + 2))));
            } catch (DecodeException e) {
                result.add(DecodedMessage.failure(e));
            }
        }
        return result;
    }

    private DataPoint decode(int index, String seriesLine, String timestampLine, String valueLine)
            throws DecodeException {
        SeriesKey series;
        try {
            series = SeriesKey.parse(simpleString(index, seriesLine, "series"));
        } catch (IllegalArgumentException e) {
            throw new DecodeException(index, e.getMessage(), e);
        }
        return new DataPoint(series, timestamp(index, timestampLine), value(index, valueLine));
    }

    private long timestamp(int index, String line) throws DecodeException {
        try {
            if (line.startsWith(":")) {
                return Long.parseLong(line.substring(1));
            }
            return Timestamps.parse(simpleString(index, line, "timestamp"));
        } catch (IllegalArgumentException e) {
            throw new DecodeException(index, "Bad timestamp '" + line + "': " + e.getMessage(), e);
        }
    }

    private double value(int index, String line) throws DecodeException {
        double value;
        try {
            if (line.startsWith(":")) {
                value = Long.parseLong(line.substring(1));
            } else {
                value = Double.parseDouble(simpleString(index, line, "value"));
            }
        } catch (NumberFormatException e) {
            throw new DecodeException(index, "Bad value '" + line + "'", e);
        }
        if (!Double.isFinite(value)) {
            throw new DecodeException(index, "Value must be finite, got " + line);
        }
        return value;
    }

    private static String simpleString(int index, String line, String field) throws DecodeException {
        if (!line.startsWith("+")) {
            throw new DecodeException(index, "Expected simple string for " + field + ", got '" + line + "'");
        }
        return line.substring(1);
    }

    private static List<String> splitLines(String payload) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        int len = payload.length();
        while (start < len) {
            int nl = payload.indexOf('\n', start);
            int end = nl < 0 ? len : nl;
            int stop = end > start && payload.charAt(end - 1) == '\r' ? end - 1 : end;
            lines.add(payload.substring(start, stop));
            start = end + 1;
        }
        return lines;
    }

    /**
     * Either a decoded point or the reason the message was rejected.
     */
    public static final class DecodedMessage {
        private final DataPoint point;
        private final DecodeException error;

        private DecodedMessage(DataPoint point, DecodeException error) {
            this.point = point;
            this.error = error;
        }

        static DecodedMessage success(DataPoint point) {
            return new DecodedMessage(point, null);
        }

        static DecodedMessage failure(DecodeException error) {
            return new DecodedMessage(null, error);
        }

        public boolean isSuccess() { return point != null; }
        public DataPoint getPoint() { return point; }
        public DecodeException getError() { return error; }
    }
}

package com.tsvolume.model;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Conversions between nanosecond timestamps and the ISO basic text form
 * yyyyMMdd'T'HHmmss.fffffffff (UTC) used by the wire protocol and query output.
 */
public final class Timestamps {

    private static final long NANOS_PER_SECOND = 1_000_000_000L;
    private static final DateTimeFormatter BASIC = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss");

    private Timestamps() {
    }

    /**
     * Parses either an ISO basic timestamp with up to nine fraction digits or
     * a plain integer count of nanoseconds.
     *
     * @throws IllegalArgumentException if the text is neither form
     */
    public static long parse(String text) {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("Timestamp cannot be empty");
        }
        if (text.indexOf('T') < 0) {
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid timestamp: " + text, e);
            }
        }
        String seconds = text;
        long fractionNanos = 0;
        int dot = text.indexOf('.');
        if (dot >= 0) {
            seconds = text.substring(0, dot);
            String fraction = text.substring(dot + 1);
            if (fraction.isEmpty() || fraction.length() > 9 || !fraction.chars().allMatch(Character::isDigit)) {
                throw new IllegalArgumentException("Invalid fractional seconds in timestamp: " + text);
            }
            StringBuilder padded = new StringBuilder(fraction);
            while (padded.length() < 9) {
                padded.append('0');
            }
            fractionNanos = Long.parseLong(padded.toString());
        }
        try {
            long epochSeconds = LocalDateTime.parse(seconds, BASIC).toEpochSecond(ZoneOffset.UTC);
            return Math.addExact(Math.multiplyExact(epochSeconds, NANOS_PER_SECOND), fractionNanos);
        } catch (DateTimeParseException | ArithmeticException e) {
            throw new IllegalArgumentException("Invalid timestamp: " + text, e);
        }
    }

    public static String format(long nanos) {
        long seconds = Math.floorDiv(nanos, NANOS_PER_SECOND);
        long fraction = Math.floorMod(nanos, NANOS_PER_SECOND);
        LocalDateTime dt = LocalDateTime.ofEpochSecond(seconds, 0, ZoneOffset.UTC);
        return BASIC.format(dt) + "." + String.format("%09d", fraction);
    }

    public static long fromInstant(Instant instant) {
        return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), NANOS_PER_SECOND), instant.getNano());
    }
}

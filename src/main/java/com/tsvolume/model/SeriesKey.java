package com.tsvolume.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Identifies one time series: a metric name plus its tag set.
 *
 * Canonical form: metric_name tag1=value1 tag2=value2 (tags sorted by name).
 */
public final class SeriesKey implements Comparable<SeriesKey> {

    public static final int MAX_ENCODED_LENGTH = 512;

    private final String metric;
    private final SortedMap<String, String> tags;
    private final String canonical;
    private final int encodedLength;

    public SeriesKey(String metric, Map<String, String> tags) {
        this.metric = Objects.requireNonNull(metric, "Metric cannot be null");
        TreeMap<String, String> sorted = new TreeMap<>();
        if (tags != null) {
            for (Map.Entry<String, String> tag : tags.entrySet()) {
                if (tag.getKey() == null) {
                    throw new IllegalArgumentException("Tag name cannot be null");
                }
                sorted.put(tag.getKey(), tag.getValue());
            }
        }
        this.tags = Collections.unmodifiableSortedMap(sorted);
        this.canonical = buildCanonical(this.metric, this.tags);
        this.encodedLength = canonical.getBytes(StandardCharsets.UTF_8).length;
    }

    /**
     * Parses a free-form series name such as "temp tag=test host=a".
     *
     * @throws IllegalArgumentException if the text is not a valid series name
     */
    @JsonCreator
    public static SeriesKey parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Series key cannot be blank");
        }
        String[] tokens = text.trim().split("\\s+");
        String metric = tokens[0];
        if (metric.indexOf('=') >= 0) {
            throw new IllegalArgumentException("Series key must start with a metric name: " + text);
        }
        Map<String, String> tags = new TreeMap<>();
        for (int i = 1; i < tokens.length; i++) {
            String token = tokens[i];
            int eq = token.indexOf('=');
            if (eq <= 0 || eq == token.length() - 1) {
                throw new IllegalArgumentException("Malformed tag '" + token + "' in series key: " + text);
            }
            tags.put(token.substring(0, eq), token.substring(eq + 1));
        }
        return validate(new SeriesKey(metric, tags));
    }

    /**
     * Checks the constraints a series key must satisfy to be stored.
     */
    public static SeriesKey validate(SeriesKey key) {
        if (key.metric.isBlank() || containsWhitespace(key.metric)) {
            throw new IllegalArgumentException("Invalid metric name: '" + key.metric + "'");
        }
        for (Map.Entry<String, String> tag : key.tags.entrySet()) {
            if (tag.getValue() == null) {
                throw new IllegalArgumentException("Tag '" + tag.getKey() + "' has no value");
            }
            if (tag.getKey().isEmpty() || tag.getValue().isEmpty()
                    || containsWhitespace(tag.getKey()) || containsWhitespace(tag.getValue())
                    || tag.getKey().indexOf('=') >= 0) {
                throw new IllegalArgumentException("Invalid tag " + tag.getKey() + "=" + tag.getValue());
            }
        }
        if (key.encodedLength() > MAX_ENCODED_LENGTH) {
            throw new IllegalArgumentException("Series key exceeds " + MAX_ENCODED_LENGTH + " bytes");
        }
        return key;
    }

    public String getMetric() {
        return metric;
    }

    public Map<String, String> getTags() {
        return tags;
    }

    /**
     * True if every entry of the filter is present with the same value.
     */
    public boolean matches(String metricName, Map<String, String> filter) {
        if (!metric.equals(metricName)) {
            return false;
        }
        if (filter == null) {
            return true;
        }
        for (Map.Entry<String, String> required : filter.entrySet()) {
            if (!Objects.equals(required.getValue(), tags.get(required.getKey()))) {
                return false;
            }
        }
        return true;
    }

    public int encodedLength() {
        return encodedLength;
    }

    @JsonValue
    @Override
    public String toString() {
        return canonical;
    }

    @Override
    public int compareTo(SeriesKey other) {
        return canonical.compareTo(other.canonical);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return canonical.equals(((SeriesKey) o).canonical);
    }

    @Override
    public int hashCode() {
        return canonical.hashCode();
    }

    private static String buildCanonical(String metric, SortedMap<String, String> tags) {
        if (tags.isEmpty()) {
            return metric;
        }
        StringBuilder sb = new StringBuilder(metric);
        tags.forEach((k, v) -> sb.append(' ').append(k).append('=').append(v));
        return sb.toString();
    }

    private static boolean containsWhitespace(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isWhitespace(s.charAt(i))) {
                return true;
            }
        }
        return false;
    }
}

package com.tsvolume.model;

import java.util.Locale;

/**
 * Row encoding of a streamed query response.
 */
public enum OutputFormat {
    CSV("text/csv"),
    JSON("application/json");

    private final String contentType;

    OutputFormat(String contentType) {
        this.contentType = contentType;
    }

    public String getContentType() {
        return contentType;
    }

    public static OutputFormat parse(String name) {
        if (name == null) {
            return CSV;
        }
        try {
            return valueOf(name.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported output format: " + name, e);
        }
    }
}

package com.tsvolume.query;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.tsvolume.model.DataPoint;
import com.tsvolume.model.OutputFormat;
import com.tsvolume.model.Timestamps;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * Renders query rows onto a response stream, one row per point.
 */
public abstract class RowWriter implements AutoCloseable {

    private static final JsonFactory JSON_FACTORY = new JsonFactory();

    public static RowWriter create(OutputFormat format, OutputStream out) throws IOException {
        switch (format) {
            case JSON:
                return new JsonRowWriter(out);
            case CSV:
            default:
                return new CsvRowWriter(out);
        }
    }

    public abstract void write(DataPoint point) throws IOException;

    public abstract void flush() throws IOException;

    /**
     * Finishes the document. The underlying stream stays open.
     */
    @Override
    public abstract void close() throws IOException;

    /**
     * series,timestamp,value rows terminated by CRLF.
     */
    static final class CsvRowWriter extends RowWriter {
        private final Writer writer;

        CsvRowWriter(OutputStream out) {
            this.writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
        }

        @Override
        public void write(DataPoint point) throws IOException {
            writer.write(point.getSeries().toString());
            writer.write(',');
            writer.write(Timestamps.format(point.getTimestamp()));
            writer.write(',');
            writer.write(Double.toString(point.getValue()));
            writer.write("\r\n");
        }

        @Override
        public void flush() throws IOException {
            writer.flush();
        }

        @Override
        public void close() throws IOException {
            writer.flush();
        }
    }

    /**
     * A JSON array of {"series", "timestamp", "value"} objects.
     */
    static final class JsonRowWriter extends RowWriter {
        private final JsonGenerator generator;

        JsonRowWriter(OutputStream out) throws IOException {
            this.generator = JSON_FACTORY.createGenerator(out, JsonEncoding.UTF8);
            this.generator.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
            this.generator.writeStartArray();
        }

        @Override
        public void write(DataPoint point) throws IOException {
            generator.writeStartObject();
            generator.writeStringField("series", point.getSeries().toString());
            generator.writeStringField("timestamp", Timestamps.format(point.getTimestamp()));
            generator.writeNumberField("value", point.getValue());
            generator.writeEndObject();
        }

        @Override
        public void flush() throws IOException {
            generator.flush();
        }

        @Override
        public void close() throws IOException {
            generator.writeEndArray();
            generator.close();
        }
    }
}

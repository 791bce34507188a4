package com.javainsight.adapter.report;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonIOException;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializer;
import com.javainsight.engine.model.Visibility;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Serializes analysis results to JSON for consumers. Output is pretty printed;
 * visibilities are written as their lower-case keyword and paths as plain strings.
 */
public class ReportWriter {

    public static class ReportWriteException extends RuntimeException {
        public ReportWriteException(String msg, Throwable cause) { super(msg, cause); }
    }

    private final Gson gson = new GsonBuilder()
        .setPrettyPrinting()
        .disableHtmlEscaping()
        .serializeNulls()
        .registerTypeAdapter(Visibility.class,
            (JsonSerializer<Visibility>) (visibility, type, context) -> new JsonPrimitive(visibility.keyword()))
        .registerTypeHierarchyAdapter(Path.class,
            (JsonSerializer<Path>) (path, type, context) -> new JsonPrimitive(path.toString()))
        .create();

    public String toJson(Object value) {
        return gson.toJson(value);
    }

    /**
     * Writes {@code value} followed by a line break.
     *
     * @throws ReportWriteException when {@code out} rejects the write
     */
    public void write(Object value, Appendable out) {
        try {
            gson.toJson(value, out);
            out.append(System.lineSeparator());
        } catch (JsonIOException | IOException e) {
            throw new ReportWriteException("Failed to write report: " + e.getMessage(), e);
        }
    }
}

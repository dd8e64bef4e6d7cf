package com.spreadsheet.fgraph.io;

import java.io.IOException;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Reads and writes {@link GraphSnapshot}s as JSON.
 */
public final class JsonGraphSerializer {
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private JsonGraphSerializer() {
        // Utility class
    }

    public static String write(GraphSnapshot snapshot) {
        try {
            return MAPPER.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize snapshot " + snapshot.getName(), e);
        }
    }

    public static void write(GraphSnapshot snapshot, Path path) throws IOException {
        MAPPER.writeValue(path.toFile(), snapshot);
    }

    public static GraphSnapshot read(String json) {
        try {
            return MAPPER.readValue(json, GraphSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid snapshot JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static GraphSnapshot read(Path path) throws IOException {
        return MAPPER.readValue(path.toFile(), GraphSnapshot.class);
    }
}

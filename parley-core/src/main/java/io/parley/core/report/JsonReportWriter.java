package io.parley.core.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * Persists a {@link DetectionReport} as pretty-printed JSON.
 */
public final class JsonReportWriter {
    private final ObjectMapper mapper;

    public JsonReportWriter() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public void write(DetectionReport report, Path path) throws IOException {
        Objects.requireNonNull(report, "report must not be null");
        Objects.requireNonNull(path, "path must not be null");
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, toJson(report) + System.lineSeparator());
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
    }

    public String toJson(DetectionReport report) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize detection report", e);
        }
    }
}

package tech.webextools.cli.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Writes timestamped JSON reports such as {@code disabled_users_report.20240131_154500.json}.
 */
@ApplicationScoped
public class JsonReportWriter {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Inject
    public JsonReportWriter(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.clock = clock;
    }

    /**
     * @param directory where to write
     * @param prefix file name before the timestamp
     * @param report value to serialize
     * @return absolute path of the written file
     */
    public Path write(Path directory, String prefix, Object report) {
        String name = prefix + "." + TIMESTAMP.format(LocalDateTime.now(clock)) + ".json";
        Path file = directory.resolve(name).toAbsolutePath();
        try {
            objectMapper.writeValue(file.toFile(), report);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write report " + file, e);
        }
        return file;
    }

    public String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}

package tech.webextools.cli.io;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tech.webextools.sdk.exception.ValidationException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CsvFilesTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should read one column ignoring BOM, header case and spaces")
    void shouldReadColumn() throws IOException {
        Path file = tempDir.resolve("users.csv");
        Files.writeString(file, "\uFEFFName , Email \nAlice, alice@example.com \nBob,\nCarol,carol@example.com\n",
            StandardCharsets.UTF_8);

        assertThat(CsvFiles.readColumn(file, "email")).containsExactly("alice@example.com", "carol@example.com");
    }

    @Test
    @DisplayName("Should reject a missing column")
    void shouldRejectMissingColumn() throws IOException {
        Path file = tempDir.resolve("users.csv");
        Files.writeString(file, "name,mail\nAlice,alice@example.com\n", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> CsvFiles.readColumn(file, "email"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("email");
    }

    @Test
    @DisplayName("Should write a header row and append the csv extension")
    void shouldWriteRows() throws IOException {
        Path written = CsvFiles.write(tempDir.resolve("report"), List.of("recordingId", "topic", "viewed"),
            List.of(Arrays.asList("r1", "Weekly, sync", true), Arrays.asList("r2", null, false)));

        assertThat(written.getFileName().toString()).isEqualTo("report.csv");
        assertThat(Files.readAllLines(written)).containsExactly(
            "recordingId,topic,viewed",
            "r1,\"Weekly, sync\",true",
            "r2,,false");
    }

    @Test
    @DisplayName("Should keep an existing csv extension")
    void shouldKeepExtension() {
        assertThat(CsvFiles.withCsvExtension(Path.of("out/report.CSV"))).isEqualTo(Path.of("out/report.CSV"));
        assertThat(CsvFiles.withCsvExtension(Path.of("out/report"))).isEqualTo(Path.of("out/report.csv"));
    }
}

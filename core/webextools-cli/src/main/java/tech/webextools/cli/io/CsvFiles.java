package tech.webextools.cli.io;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import tech.webextools.sdk.exception.ValidationException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * CSV input and output for the commands.
 */
public final class CsvFiles {

    private static final int BOM = '\uFEFF';

    private static final CSVFormat INPUT = CSVFormat.DEFAULT.builder()
        .setHeader()
        .setSkipHeaderRecord(true)
        .setIgnoreHeaderCase(true)
        .setIgnoreSurroundingSpaces(true)
        .setTrim(true)
        .setIgnoreEmptyLines(true)
        .setAllowMissingColumnNames(true)
        .build();

    private CsvFiles() {
    }

    /**
     * Non-blank values of one column, in file order. Header names are matched ignoring case and
     * surrounding spaces; a leading byte order mark is skipped.
     *
     * @throws ValidationException if the file has no such column
     */
    public static List<String> readColumn(Path file, String column) {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            skipBom(reader);
            try (CSVParser parser = INPUT.parse(reader)) {
                String header = parser.getHeaderNames().stream()
                    .filter(name -> name.trim().equalsIgnoreCase(column.trim()))
                    .findFirst()
                    .orElseThrow(() -> new ValidationException("column",
                        "Column '" + column + "' not found in " + file));

                List<String> values = new ArrayList<>();
                for (CSVRecord record : parser) {
                    if (record.isSet(header)) {
                        String value = record.get(header).trim();
                        if (!value.isEmpty()) {
                            values.add(value);
                        }
                    }
                }
                return values;
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    /**
     * Write a header row and the given rows. A {@code .csv} extension is appended when missing.
     *
     * @return the file actually written
     */
    public static Path write(Path file, List<String> header, List<? extends List<?>> rows) {
        Path target = withCsvExtension(file);
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader(header.toArray(String[]::new))
            .build();
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (List<?> row : rows) {
                printer.printRecord(row);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + target, e);
        }
        return target;
    }

    static Path withCsvExtension(Path file) {
        String name = file.getFileName().toString();
        return name.toLowerCase(Locale.ROOT).endsWith(".csv") ? file : file.resolveSibling(name + ".csv");
    }

    private static void skipBom(BufferedReader reader) throws IOException {
        reader.mark(1);
        if (reader.read() != BOM) {
            reader.reset();
        }
    }
}

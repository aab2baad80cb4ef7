package com.heronix.grader.adapter.csv;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.DuplicateHeaderMode;
import org.springframework.stereotype.Component;

import com.heronix.grader.exception.SchemaException;
import com.heronix.grader.model.table.GradeTable;

import lombok.extern.slf4j.Slf4j;

/**
 * Reads a spreadsheet export with a header row into a raw table.
 *
 * Rows are keyed by their 1-based data line number. Empty cells are absent;
 * every other cell is kept as text. A leading byte order mark is ignored;
 * repeated or missing header names are a {@link SchemaException}.
 */
@Component
@Slf4j
public class CsvTableReader {

    static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .setDuplicateHeaderMode(DuplicateHeaderMode.DISALLOW)
            .build();

    private static final String BOM = "\uFEFF";

    public GradeTable read(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path.toString());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }

    public GradeTable read(Reader reader, String source) {
        try (CSVParser parser = parse(reader, source)) {
            List<String> headers = new ArrayList<>(parser.getHeaderNames());
            if (headers.isEmpty()) {
                throw new SchemaException(source + " has no header row");
            }
            // spreadsheet exports often start with a UTF-8 byte order mark
            if (headers.get(0).startsWith(BOM)) {
                headers.set(0, headers.get(0).substring(BOM.length()));
            }

            GradeTable.Builder table = GradeTable.builder().columns(headers);
            int line = 0;
            for (CSVRecord record : parser) {
                String rowId = String.valueOf(++line);
                table.row(rowId);
                for (int i = 0; i < headers.size() && i < record.size(); i++) {
                    String value = record.get(i);
                    table.set(rowId, headers.get(i), value.isEmpty() ? null : value);
                }
            }

            log.debug("Read {} rows and {} columns from {}", line, headers.size(), source);
            return table.build();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse " + source, e);
        }
    }

    private static CSVParser parse(Reader reader, String source) throws IOException {
        try {
            return FORMAT.parse(reader);
        } catch (IllegalArgumentException e) {
            throw new SchemaException("Invalid header row in " + source + ": " + e.getMessage(), e);
        }
    }
}

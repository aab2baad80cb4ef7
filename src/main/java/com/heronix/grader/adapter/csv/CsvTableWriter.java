package com.heronix.grader.adapter.csv;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import com.heronix.grader.model.table.GradeTable;

import lombok.extern.slf4j.Slf4j;

/**
 * Writes a table as CSV with a header row and no row key column.
 * Absent cells are written empty.
 */
@Component
@Slf4j
public class CsvTableWriter {

    public void write(GradeTable table, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
                write(table, writer);
            }
            log.info("Wrote {} rows to {}", table.size(), path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + path, e);
        }
    }

    public String writeToString(GradeTable table) {
        StringWriter writer = new StringWriter();
        write(table, writer);
        return writer.toString();
    }

    public void write(GradeTable table, Writer writer) {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader(table.columns().toArray(String[]::new))
                .build();
        try {
            CSVPrinter printer = new CSVPrinter(writer, format);
            for (String rowId : table.rowIds()) {
                List<Object> values = new ArrayList<>(table.columns().size());
                for (String column : table.columns()) {
                    values.add(format(table.get(rowId, column)));
                }
                printer.printRecord(values);
            }
            printer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write CSV", e);
        }
    }

    private static Object format(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double number && number == Math.rint(number) && !Double.isInfinite(number)) {
            return String.valueOf(number.longValue());
        }
        return value;
    }
}

package com.heronix.grader.service;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.heronix.grader.exception.GradeValidationException;
import com.heronix.grader.exception.SchemaException;
import com.heronix.grader.exception.UnknownLetterException;
import com.heronix.grader.model.domain.ImportOptions;
import com.heronix.grader.model.table.GradeTable;

class ImportExporterTest {

    private ImportExporter exporter;
    private GradeTable report;

    @BeforeEach
    void setUp() {
        exporter = new ImportExporter(new LetterMapper());
        report = GradeTable.builder()
                .columns(List.of("Last Name", "First Name", "ID", "Email", "Final exam", "Final grade", "Letter grade"))
                .set("1", "Last Name", "Lovelace").set("1", "First Name", "Ada").set("1", "ID", "ada")
                .set("1", "Email", "ada@school.edu").set("1", "Final exam", "92").set("1", "Final grade", "94.2")
                .set("1", "Letter grade", "A")
                .set("2", "Last Name", "Turing").set("2", "First Name", "Alan").set("2", "ID", "alan")
                .set("2", "Email", "alan@school.edu").set("2", "Final exam", "40").set("2", "Final grade", "61.3")
                .set("2", "Letter grade", "D")
                .build();
    }

    @Test
    void standardizedImportUsesBracketMiddles() {
        GradeTable result = exporter.createImport(report,
                ImportOptions.defaults().toBuilder().includeOthers(List.of("Final exam")).build());

        assertEquals(List.of("Username", "Last Name", "First Name", "Email", "Final exam Points Grade",
                "Adjusted Final Grade Numerator", "Adjusted Final Grade Denominator", "End-Of-Line Indicator"),
                result.columns());
        assertEquals("#ada", result.get("1", "Username"));
        assertEquals("92", result.get("1", "Final exam Points Grade"));
        assertEquals(96, result.get("1", "Adjusted Final Grade Numerator"));
        assertEquals(57, result.get("2", "Adjusted Final Grade Numerator"));
        assertEquals(100, result.get("2", "Adjusted Final Grade Denominator"));
        assertEquals("#", result.get("2", "End-Of-Line Indicator"));
    }

    @Test
    void rawImportCopiesTheChosenColumn() {
        GradeTable result = exporter.createImport(report, ImportOptions.builder()
                .letterGradeColumn("Final grade")
                .standardize(false)
                .build());

        assertEquals("94.2", result.get("1", "Adjusted Final Grade Numerator"));
    }

    @Test
    void missingColumnIsASchemaError() {
        ImportOptions options = ImportOptions.builder().includeOthers(List.of("Midterm")).build();

        assertThrows(SchemaException.class, () -> exporter.createImport(report, options));
    }

    @Test
    void unknownLetterIsRejected() {
        GradeTable edited = GradeTable.builder()
                .columns(report.columns())
                .set("1", "ID", "ada").set("1", "Letter grade", "E")
                .build();

        assertThrows(UnknownLetterException.class, () -> exporter.createImport(edited, ImportOptions.defaults()));
    }

    @Test
    void absentLetterIsRejectedWhenStandardizing() {
        GradeTable edited = GradeTable.builder()
                .columns(report.columns())
                .set("1", "ID", "ada")
                .build();

        assertThrows(GradeValidationException.class, () -> exporter.createImport(edited, ImportOptions.defaults()));
    }
}

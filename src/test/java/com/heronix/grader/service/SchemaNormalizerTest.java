package com.heronix.grader.service;

import static com.heronix.grader.TestTables.raw;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.heronix.grader.diagnostics.GradingDiagnostics;
import com.heronix.grader.exception.GradeValidationException;
import com.heronix.grader.exception.SchemaException;
import com.heronix.grader.model.domain.ColumnMapping;
import com.heronix.grader.model.domain.Gradebook;
import com.heronix.grader.model.domain.NormalizationOptions;
import com.heronix.grader.model.enums.DiagnosticType;
import com.heronix.grader.model.enums.FileType;
import com.heronix.grader.model.table.GradeTable;

class SchemaNormalizerTest {

    private SchemaNormalizer normalizer;
    private GradingDiagnostics diagnostics;

    @BeforeEach
    void setUp() {
        normalizer = new SchemaNormalizer();
        diagnostics = new GradingDiagnostics();
    }

    @Test
    void gradescopePresetSplitsFirstNameFirst() {
        GradeTable table = raw(new String[] {"Name", "SID", "Email", "HW 1"},
                new String[] {"Ada Lovelace", "1001", "ada@school.edu", "20"},
                new String[] {"Alan Turing", "1002", "alan@school.edu", ""});

        Gradebook gradebook = normalizer.normalize("gs.csv", table, NormalizationOptions.preset(FileType.GS), diagnostics);
        GradeTable result = gradebook.table();

        assertEquals(List.of("Last Name", "First Name", "ID", "Email", "HW 1"), result.columns());
        assertEquals(List.of("1001", "1002"), result.rowIds());
        assertEquals("Lovelace", result.get("1001", "Last Name"));
        assertEquals("Ada", result.get("1001", "First Name"));
        assertEquals("20", result.get("1001", "HW 1"));
        assertTrue(result.isAbsent("1002", "HW 1"));
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void webassignPresetReadsLastNameFirstAndAliases() {
        GradeTable table = raw(new String[] {"Fullname", "Email", "WebAssign"},
                new String[] {"Lovelace, Ada", "ada@school.edu", "ND"},
                new String[] {"Turing, Alan", "alan@school.edu", "NS"},
                new String[] {"Babbage, Charles", "charles@school.edu", "88"});

        GradeTable result = normalizer.normalize("wa.csv", table, NormalizationOptions.preset(FileType.WA), diagnostics)
                .table();

        assertEquals(List.of("ada", "alan", "charles"), result.rowIds());
        assertEquals("Ada", result.get("ada", "First Name"));
        assertEquals("Lovelace", result.get("ada", "Last Name"));
        assertTrue(result.isAbsent("ada", "WebAssign"));
        assertTrue(result.isAbsent("alan", "WebAssign"));
        assertEquals("88", result.get("charles", "WebAssign"));
    }

    @Test
    void absentIdsFallBackToTheEmailUsername() {
        GradeTable table = raw(new String[] {"Name", "SID", "Email"},
                new String[] {"Grace Hopper", "", "grace@school.edu"});

        GradeTable result = normalizer.normalize("gs.csv", table, NormalizationOptions.preset(FileType.GS), diagnostics)
                .table();

        assertEquals("grace", result.get("grace", "ID"));
    }

    @Test
    void longNamesAreSplitOnTheFirstTwoPartsAndReported() {
        GradeTable table = raw(new String[] {"Name", "SID", "Email"},
                new String[] {"Grace Brewster Hopper", "1003", "grace@school.edu"},
                new String[] {"Ada Lovelace", "1001", "ada@school.edu"});

        GradeTable result = normalizer.normalize("gs.csv", table, NormalizationOptions.preset(FileType.GS), diagnostics)
                .table();

        assertEquals("Grace", result.get("1003", "First Name"));
        assertEquals("Brewster", result.get("1003", "Last Name"));
        assertTrue(diagnostics.has(DiagnosticType.NAME_SPLIT));
        assertEquals(1, diagnostics.list().size());
        assertTrue(diagnostics.list().get(0).message().contains("Grace Brewster Hopper"));
    }

    @Test
    void explicitMappingOverridesThePreset() {
        GradeTable table = raw(new String[] {"Given", "Family", "Student", "Quiz"},
                new String[] {"Ada", "Lovelace", "a1", "-"});
        NormalizationOptions options = NormalizationOptions.builder()
                .fileType(FileType.GS)
                .columns(ColumnMapping.builder().first("Given").last("Family").id("Student").build())
                .missingValues(List.of("-"))
                .build();

        GradeTable result = normalizer.normalize("custom.csv", table, options, diagnostics).table();

        assertEquals("Lovelace", result.get("a1", "Last Name"));
        assertTrue(result.isAbsent("a1", "Email"));
        assertTrue(result.isAbsent("a1", "Quiz"));
    }

    @Test
    void unmappedEmailColumnStillFillsTheEmail() {
        GradeTable table = raw(new String[] {"Name", "SID", "Email"},
                new String[] {"Ada Lovelace", "1001", "ada@school.edu"});
        NormalizationOptions options = NormalizationOptions.mapping(
                ColumnMapping.builder().full("Name").id("SID").build());

        GradeTable result = normalizer.normalize("roster.csv", table, options, diagnostics).table();

        assertEquals("ada@school.edu", result.get("1001", "Email"));
        assertEquals(List.of("Last Name", "First Name", "ID", "Email"), result.columns());
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void unmappedIdColumnIsUsedForIds() {
        GradeTable table = raw(new String[] {"Name", "Mail", "ID"},
                new String[] {"Ada Lovelace", "ada@school.edu", "a-17"});
        NormalizationOptions options = NormalizationOptions.mapping(
                ColumnMapping.builder().full("Name").email("Mail").build());

        GradeTable result = normalizer.normalize("roster.csv", table, options, diagnostics).table();

        assertEquals(List.of("a-17"), result.rowIds());
        assertEquals("ada@school.edu", result.get("a-17", "Email"));
    }

    @Test
    void infoNamedColumnReplacedByTheMappingIsReported() {
        GradeTable table = raw(new String[] {"Name", "SID", "Email", "First Name"},
                new String[] {"Ada Lovelace", "1001", "ada@school.edu", "Augusta"});

        GradeTable result = normalizer.normalize("gs.csv", table, NormalizationOptions.preset(FileType.GS), diagnostics)
                .table();

        assertEquals("Ada", result.get("1001", "First Name"));
        assertTrue(diagnostics.has(DiagnosticType.DUPLICATE_COLUMN));
    }

    @Test
    void duplicateIdsAreRejected() {
        GradeTable table = raw(new String[] {"Name", "SID", "Email"},
                new String[] {"John Doe", "jdoe", "john@school.edu"},
                new String[] {"Jane Doe", "jdoe", "jane@school.edu"});

        GradeValidationException error = assertThrows(GradeValidationException.class,
                () -> normalizer.normalize("gs.csv", table, NormalizationOptions.preset(FileType.GS), diagnostics));

        assertTrue(error.getMessage().contains("jdoe"));
    }

    @Test
    void studentsWithoutIdNorEmailAreRejected() {
        GradeTable table = raw(new String[] {"Name", "SID", "Email"},
                new String[] {"John Doe", "", ""});

        GradeValidationException error = assertThrows(GradeValidationException.class,
                () -> normalizer.normalize("gs.csv", table, NormalizationOptions.preset(FileType.GS), diagnostics));

        assertTrue(error.getMessage().contains("John Doe"));
    }

    @Test
    void missingMappedColumnIsASchemaError() {
        GradeTable table = raw(new String[] {"Name", "Email"},
                new String[] {"Ada Lovelace", "ada@school.edu"});

        assertThrows(SchemaException.class,
                () -> normalizer.normalize("gs.csv", table, NormalizationOptions.preset(FileType.GS), diagnostics));
    }

    @Test
    void mappingWithoutNamesIsASchemaError() {
        GradeTable table = raw(new String[] {"SID"}, new String[] {"1"});
        NormalizationOptions options = NormalizationOptions.mapping(ColumnMapping.builder().id("SID").build());

        assertThrows(SchemaException.class, () -> normalizer.normalize("x.csv", table, options, diagnostics));
    }

    @Test
    void mappingWithoutIdNorEmailIsASchemaError() {
        GradeTable table = raw(new String[] {"Name"}, new String[] {"Ada Lovelace"});
        NormalizationOptions options = NormalizationOptions.mapping(ColumnMapping.builder().full("Name").build());

        assertThrows(SchemaException.class, () -> normalizer.normalize("x.csv", table, options, diagnostics));
    }

    @Test
    void optionsNeedAPresetOrAMapping() {
        GradeTable table = raw(new String[] {"Name"}, new String[] {"Ada Lovelace"});

        assertThrows(SchemaException.class,
                () -> normalizer.normalize("x.csv", table, NormalizationOptions.builder().build(), diagnostics));
    }

    @Test
    void emailUsernameStopsAtTheAtSign() {
        assertEquals("ada.l", SchemaNormalizer.emailUsername("ada.l@school.edu"));
        assertEquals("ada", SchemaNormalizer.emailUsername("ada"));
    }
}

package com.heronix.grader.service;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import com.heronix.grader.exception.GradeValidationException;
import com.heronix.grader.exception.UnknownLetterException;
import com.heronix.grader.model.domain.ImportOptions;
import com.heronix.grader.model.domain.InfoColumns;
import com.heronix.grader.model.table.GradeTable;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds the table uploaded back to the LMS gradebook (Brightspace grade import
 * layout) from a grade report, possibly edited by hand.
 *
 * Columns: Username ("#" + ID), last name, first name, email, one
 * "&lt;name&gt; Points Grade" per extra column, the adjusted final grade
 * numerator and denominator (100), and the end-of-line indicator "#".
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ImportExporter {

    public static final String USERNAME = "Username";
    public static final String POINTS_GRADE_SUFFIX = " Points Grade";
    public static final String FINAL_GRADE_NUMERATOR = "Adjusted Final Grade Numerator";
    public static final String FINAL_GRADE_DENOMINATOR = "Adjusted Final Grade Denominator";
    public static final String END_OF_LINE = "End-Of-Line Indicator";

    private static final int DENOMINATOR = 100;
    private static final String MARKER = "#";

    private final LetterMapper letterMapper;

    public GradeTable createImport(GradeTable report, ImportOptions options) {
        InfoColumns info = options.getInfoColumns();
        List<String> required = new ArrayList<>(List.of(info.id(), info.last(), info.first(), info.email(),
                options.getLetterGradeColumn()));
        required.addAll(options.getIncludeOthers());
        // fails on any missing column
        report.select(required);

        GradeTable.Builder output = GradeTable.builder()
                .column(USERNAME)
                .columns(List.of(info.last(), info.first(), info.email()));
        for (String column : options.getIncludeOthers()) {
            output.column(column + POINTS_GRADE_SUFFIX);
        }
        output.columns(List.of(FINAL_GRADE_NUMERATOR, FINAL_GRADE_DENOMINATOR, END_OF_LINE));

        for (String row : report.rowIds()) {
            String id = report.getText(row, info.id());
            if (id == null) {
                throw new GradeValidationException("Row " + row + " of the report has no " + info.id());
            }
            output.set(row, USERNAME, MARKER + id);
            output.set(row, info.last(), report.get(row, info.last()));
            output.set(row, info.first(), report.get(row, info.first()));
            output.set(row, info.email(), report.get(row, info.email()));
            for (String column : options.getIncludeOthers()) {
                output.set(row, column + POINTS_GRADE_SUFFIX, report.get(row, column));
            }
            output.set(row, FINAL_GRADE_NUMERATOR, numerator(report, row, id, options));
            output.set(row, FINAL_GRADE_DENOMINATOR, DENOMINATOR);
            output.set(row, END_OF_LINE, MARKER);
        }

        log.info("Prepared import of {} students from column '{}' (standardize: {})",
                report.size(), options.getLetterGradeColumn(), options.isStandardize());
        return output.build();
    }

    private Object numerator(GradeTable report, String row, String id, ImportOptions options) {
        Object letter = report.get(row, options.getLetterGradeColumn());
        if (!options.isStandardize()) {
            return letter;
        }
        if (letter == null) {
            throw new GradeValidationException("Student " + id + " has no " + options.getLetterGradeColumn());
        }
        try {
            return letterMapper.toNumeric(letter.toString().trim(), options.getLetterScale());
        } catch (UnknownLetterException e) {
            log.error("Cannot convert letter grade of student {}: {}", id, e.getMessage());
            throw e;
        }
    }
}

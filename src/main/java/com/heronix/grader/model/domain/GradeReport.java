package com.heronix.grader.model.domain;

import java.util.List;

import com.heronix.grader.diagnostics.Diagnostic;
import com.heronix.grader.model.table.GradeTable;

/**
 * Computed grades, one row per roster student in roster order, along with the
 * warnings raised while computing them.
 */
public record GradeReport(
        GradeTable table,
        List<Diagnostic> diagnostics
) {

    public static final String FINAL_GRADE_COLUMN = "Final grade";
    public static final String LETTER_GRADE_COLUMN = "Letter grade";
    public static final String MISSED_SUFFIX = " missed";

    public GradeReport {
        diagnostics = List.copyOf(diagnostics);
    }

    public GradeReport sortedBy(String column, boolean descending) {
        return new GradeReport(table.sortedBy(column, descending), diagnostics);
    }
}

package com.heronix.grader.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.heronix.grader.diagnostics.GradingDiagnostics;
import com.heronix.grader.exception.SchemaException;
import com.heronix.grader.model.domain.Assignment;
import com.heronix.grader.model.domain.Course;
import com.heronix.grader.model.domain.GradeReport;
import com.heronix.grader.model.domain.GradedTest;
import com.heronix.grader.model.domain.ReportOptions;
import com.heronix.grader.model.enums.DiagnosticType;
import com.heronix.grader.model.enums.ReportSection;
import com.heronix.grader.model.scheme.GradingScheme;
import com.heronix.grader.model.scheme.ScoreSet;
import com.heronix.grader.model.table.GradeTable;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Computes the grade report of a course.
 *
 * Absent test scores count as 0 in averages; the tests section shows them as
 * absent. Each assignment average is the best of its schemes over the test
 * scores divided by their max points, then multiplied by the assignment's
 * scaling. The final grade is the best of the course schemes over the unscaled
 * (0 to 1) averages, out of 100.
 *
 * A course is never modified: the same course can be reported on repeatedly
 * with different options.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GradeAggregator {

    private final LetterMapper letterMapper;

    public GradeReport computeGrades(Course course) {
        return computeGrades(course, ReportOptions.defaults());
    }

    public GradeReport computeGrades(Course course, ReportOptions options) {
        GradingDiagnostics diagnostics = new GradingDiagnostics();
        letterMapper.checkScale(options.getLetterScale(), diagnostics);

        List<Assignment> assignments = course.getAssignments();
        List<String> assignmentNames = assignments.stream().map(Assignment::getName).toList();
        for (GradingScheme scheme : options.getGradingSchemes()) {
            scheme.validate(assignmentNames);
        }

        boolean needAverages = options.includes(ReportSection.AVERAGES)
                || options.includes(ReportSection.FINAL) || options.includes(ReportSection.LETTER);
        boolean needFinal = options.includes(ReportSection.FINAL) || options.includes(ReportSection.LETTER);

        GradeTable grades = course.getGrades();
        GradeTable roster = course.getRoster();

        GradeTable.Builder report = GradeTable.builder().columns(roster.columns());
        List<String> others = declareColumns(report, course, options, selectOthers(course, options), diagnostics);

        for (String id : roster.rowIds()) {
            for (String column : roster.columns()) {
                report.set(id, column, roster.get(id, column));
            }

            if (options.includes(ReportSection.TESTS)) {
                for (GradedTest test : course.getTests()) {
                    if (!assignmentNames.contains(test.name()) || !options.includes(ReportSection.AVERAGES)) {
                        report.set(id, test.name(), grades.get(id, test.name()));
                    }
                }
            }

            Map<String, Double> unscaled = new LinkedHashMap<>();
            if (needAverages) {
                for (Assignment assignment : assignments) {
                    double average = GradingScheme.best(assignment.getGradingSchemes(),
                            normalizedScores(id, assignment, grades));
                    unscaled.put(assignment.getName(), average);
                    if (options.includes(ReportSection.AVERAGES)) {
                        report.set(id, assignment.getName(), average * assignment.getScaling());
                    }
                }
            }

            if (needFinal) {
                double finalGrade = GradingScheme.best(options.getGradingSchemes(), ScoreSet.of(unscaled)) * 100;
                if (options.includes(ReportSection.FINAL)) {
                    report.set(id, GradeReport.FINAL_GRADE_COLUMN, finalGrade);
                }
                if (options.includes(ReportSection.LETTER)) {
                    report.set(id, GradeReport.LETTER_GRADE_COLUMN,
                            letterMapper.toLetter(finalGrade, options.getLetterScale()));
                }
            }

            if (options.includes(ReportSection.MISSED)) {
                for (Assignment assignment : assignments) {
                    report.set(id, assignment.getName() + GradeReport.MISSED_SUFFIX, countMissed(id, assignment, grades));
                }
            }

            for (String column : others) {
                report.set(id, column, course.getGradebook().get(id, column));
            }
        }

        log.info("Computed {} for {} students", options.getInclude(), roster.size());
        return new GradeReport(report.build(), diagnostics.list());
    }

    /**
     * Test scores of one student divided by their max points, absent as 0.
     */
    private ScoreSet normalizedScores(String id, Assignment assignment, GradeTable grades) {
        Map<String, Double> normalized = new LinkedHashMap<>();
        for (GradedTest test : assignment.getTests()) {
            Object score = grades.get(id, test.name());
            double value = score == null ? 0 : ((Number) score).doubleValue();
            normalized.put(test.name(), value / test.maxPoints());
        }
        return ScoreSet.of(normalized);
    }

    private int countMissed(String id, Assignment assignment, GradeTable grades) {
        int missed = 0;
        for (GradedTest test : assignment.getTests()) {
            if (grades.isAbsent(id, test.name())) {
                missed++;
            }
        }
        return missed;
    }

    /**
     * Fix the column order: tests, averages, final, letter, missed, others.
     * Passthrough columns named like a computed column are dropped.
     *
     * @return the passthrough columns kept
     */
    private List<String> declareColumns(GradeTable.Builder report, Course course, ReportOptions options,
                                        List<String> others, GradingDiagnostics diagnostics) {
        List<String> assignmentNames = course.getAssignments().stream().map(Assignment::getName).toList();
        if (options.includes(ReportSection.TESTS)) {
            for (GradedTest test : course.getTests()) {
                if (assignmentNames.contains(test.name()) && options.includes(ReportSection.AVERAGES)) {
                    diagnostics.warn(DiagnosticType.DUPLICATE_COLUMN,
                            "Test " + test.name() + " shares its name with its assignment, only the average is shown");
                    continue;
                }
                report.column(test.name());
            }
        }
        if (options.includes(ReportSection.AVERAGES)) {
            report.columns(assignmentNames);
        }
        if (options.includes(ReportSection.FINAL)) {
            report.column(GradeReport.FINAL_GRADE_COLUMN);
        }
        if (options.includes(ReportSection.LETTER)) {
            report.column(GradeReport.LETTER_GRADE_COLUMN);
        }
        if (options.includes(ReportSection.MISSED)) {
            for (String name : assignmentNames) {
                report.column(name + GradeReport.MISSED_SUFFIX);
            }
        }
        List<String> kept = others.stream().filter(column -> !report.hasColumn(column)).toList();
        report.columns(kept);
        return kept;
    }

    /**
     * Passthrough columns to copy: section keywords and roster columns are
     * skipped, unknown columns rejected.
     */
    private List<String> selectOthers(Course course, ReportOptions options) {
        List<String> selected = new ArrayList<>();
        List<String> unknown = new ArrayList<>();
        for (String column : options.getIncludeOthers()) {
            if (ReportSection.isKeyword(column) || course.getRoster().hasColumn(column) || selected.contains(column)) {
                continue;
            }
            if (!course.getGradebook().hasColumn(column)) {
                unknown.add(column);
                continue;
            }
            selected.add(column);
        }
        if (!unknown.isEmpty()) {
            throw new SchemaException("Columns " + unknown + " not found in the course gradebook");
        }
        return selected;
    }
}

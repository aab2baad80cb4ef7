package com.heronix.grader.service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.heronix.grader.diagnostics.GradingDiagnostics;
import com.heronix.grader.exception.GradingConfigException;
import com.heronix.grader.model.domain.Assignment;
import com.heronix.grader.model.domain.Course;
import com.heronix.grader.model.domain.GradedTest;
import com.heronix.grader.model.domain.Gradebook;
import com.heronix.grader.model.domain.InfoColumns;
import com.heronix.grader.model.enums.DiagnosticType;
import com.heronix.grader.model.table.GradeTable;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds a course from its assignments and gradebooks.
 *
 * The first gradebook is the reference: it should come from a platform that
 * drops withdrawn students (Gradescope, Brightspace). Students found only in
 * later gradebooks are never added to the course.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GradebookMerger {

    private final ScoreResolver scoreResolver;

    public Course buildCourse(List<Assignment> assignments, List<Gradebook> gradebooks) {
        return buildCourse(assignments, gradebooks, InfoColumns.DEFAULT);
    }

    public Course buildCourse(List<Assignment> assignments, List<Gradebook> gradebooks, InfoColumns info) {
        if (assignments == null || assignments.isEmpty()) {
            throw new GradingConfigException("A course needs at least one assignment");
        }
        if (gradebooks == null || gradebooks.isEmpty()) {
            throw new GradingConfigException("A course needs at least one gradebook");
        }
        checkUniqueTestNames(assignments);

        GradingDiagnostics diagnostics = new GradingDiagnostics();

        GradeTable roster = gradebooks.get(0).table().select(info.all());
        List<String> studentIds = roster.rowIds();

        reportMissingStudents(studentIds, gradebooks, diagnostics);
        GradeTable gradebook = merge(roster, gradebooks, info, diagnostics);
        GradeTable grades = resolveGrades(roster, gradebook, assignments, diagnostics);

        log.info("Built course with {} students, {} assignments from {} gradebooks",
                studentIds.size(), assignments.size(), gradebooks.size());
        return new Course(assignments, info, roster, gradebook, grades, diagnostics.list());
    }

    private void reportMissingStudents(List<String> studentIds, List<Gradebook> gradebooks,
                                       GradingDiagnostics diagnostics) {
        for (int i = 1; i < gradebooks.size(); i++) {
            GradeTable other = gradebooks.get(i).table();
            Set<String> missing = new LinkedHashSet<>();
            for (String id : studentIds) {
                if (!other.hasRow(id)) {
                    missing.add(id);
                }
            }
            if (!missing.isEmpty()) {
                diagnostics.warn(DiagnosticType.MISSING_STUDENTS,
                        "The following students are missing grades in gradebook " + i
                                + " (" + gradebooks.get(i).source() + "): " + missing);
            }
        }
    }

    /**
     * Roster columns followed by every non-info column of every gradebook, one
     * row per roster student. On a repeated column name the first gradebook wins.
     */
    private GradeTable merge(GradeTable roster, List<Gradebook> gradebooks, InfoColumns info,
                             GradingDiagnostics diagnostics) {
        List<String> studentIds = roster.rowIds();
        GradeTable.Builder merged = GradeTable.builder().columns(roster.columns());
        for (String id : studentIds) {
            merged.row(id);
            for (String column : roster.columns()) {
                merged.set(id, column, roster.get(id, column));
            }
        }

        for (Gradebook source : gradebooks) {
            GradeTable table = source.table().withoutColumns(info.all());
            for (String column : table.columns()) {
                if (merged.hasColumn(column)) {
                    diagnostics.warn(DiagnosticType.DUPLICATE_COLUMN,
                            "Column '" + column + "' of " + source.source() + " already merged from an earlier gradebook, ignored");
                    continue;
                }
                merged.column(column);
                for (String id : studentIds) {
                    merged.set(id, column, table.get(id, column));
                }
            }
        }
        return merged.build();
    }

    private GradeTable resolveGrades(GradeTable roster, GradeTable gradebook, List<Assignment> assignments,
                                     GradingDiagnostics diagnostics) {
        GradeTable.Builder grades = GradeTable.builder().columns(roster.columns());
        for (String id : roster.rowIds()) {
            for (String column : roster.columns()) {
                grades.set(id, column, roster.get(id, column));
            }
        }

        for (Assignment assignment : assignments) {
            for (GradedTest test : assignment.getTests()) {
                grades.column(test.name());
                for (String id : roster.rowIds()) {
                    List<Object> versionValues = new ArrayList<>(test.versions().size());
                    for (String version : test.versions()) {
                        versionValues.add(gradebook.get(id, version));
                    }
                    Double score = scoreResolver.resolve(test.name(), id, versionValues, diagnostics).orElse(null);
                    grades.set(id, test.name(), score);
                }
            }
        }
        return grades.build();
    }

    private void checkUniqueTestNames(List<Assignment> assignments) {
        Set<String> seen = new LinkedHashSet<>();
        Set<String> assignmentNames = new LinkedHashSet<>();
        for (Assignment assignment : assignments) {
            if (!assignmentNames.add(assignment.getName())) {
                throw new GradingConfigException("Duplicate assignment name: " + assignment.getName());
            }
            for (String test : assignment.getTestNames()) {
                if (!seen.add(test)) {
                    throw new GradingConfigException("Test " + test + " belongs to more than one assignment");
                }
            }
        }
    }
}

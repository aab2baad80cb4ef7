package com.heronix.grader.model.domain;

import java.util.List;

import com.heronix.grader.diagnostics.Diagnostic;
import com.heronix.grader.model.table.GradeTable;

import lombok.Getter;

/**
 * A course: its assignments and the student data gathered for them.
 *
 * The roster comes from the first gradebook only and fixes the set and order
 * of students. The gradebook is every supplied gradebook's columns side by
 * side, reindexed to the roster. Grades hold one resolved score per test
 * (null when absent). A course is read-only once built.
 */
@Getter
public final class Course {

    private final List<Assignment> assignments;
    private final InfoColumns infoColumns;
    private final GradeTable roster;
    private final GradeTable gradebook;
    private final GradeTable grades;
    private final List<Diagnostic> diagnostics;

    public Course(List<Assignment> assignments, InfoColumns infoColumns, GradeTable roster,
                  GradeTable gradebook, GradeTable grades, List<Diagnostic> diagnostics) {
        this.assignments = List.copyOf(assignments);
        this.infoColumns = infoColumns;
        this.roster = roster;
        this.gradebook = gradebook;
        this.grades = grades;
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<GradedTest> getTests() {
        return assignments.stream().flatMap(a -> a.getTests().stream()).toList();
    }

    public List<String> getStudentIds() {
        return roster.rowIds();
    }
}

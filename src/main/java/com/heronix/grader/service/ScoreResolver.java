package com.heronix.grader.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.heronix.grader.diagnostics.GradingDiagnostics;
import com.heronix.grader.exception.GradeValidationException;
import com.heronix.grader.model.enums.DiagnosticType;

/**
 * Collapses the scores of all versions of a test into one score per student.
 *
 * The first version holding a score wins. A student with scores in several
 * versions is reported but not rejected. No range check is performed.
 */
@Component
public class ScoreResolver {

    /**
     * Resolve one student's score for a test.
     *
     * @param testName      the logical test name, for diagnostics
     * @param studentId     the student, for diagnostics
     * @param versionValues raw cell values in version order, null when absent
     * @param diagnostics   collector for multi-version warnings
     * @return the score, or empty when every version is absent
     * @throws GradeValidationException if a cell is neither absent nor numeric
     */
    public Optional<Double> resolve(String testName, String studentId, List<?> versionValues,
                                    GradingDiagnostics diagnostics) {
        List<Double> present = new ArrayList<>();
        for (Object value : versionValues) {
            Double score = toScore(value, testName, studentId);
            if (score != null) {
                present.add(score);
            }
        }

        if (present.isEmpty()) {
            return Optional.empty();
        }
        if (present.size() > 1) {
            diagnostics.warn(DiagnosticType.MULTIPLE_VERSIONS,
                    "A student has grades in multiple versions of " + testName + ": " + studentId);
        }
        return Optional.of(present.get(0));
    }

    static Double toScore(Object value, String column, String studentId) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return Double.isNaN(number.doubleValue()) ? null : number.doubleValue();
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new GradeValidationException(
                    "Score '" + text + "' of student " + studentId + " in " + column + " is not a number", e);
        }
    }
}

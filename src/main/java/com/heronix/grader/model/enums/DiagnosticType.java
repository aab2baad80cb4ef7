package com.heronix.grader.model.enums;

/**
 * Kinds of non-fatal issues reported while grading.
 */
public enum DiagnosticType {
    MISSING_STUDENTS,
    MULTIPLE_VERSIONS,
    NAME_SPLIT,
    DUPLICATE_COLUMN,
    THRESHOLDS_NOT_SORTED,
    LETTER_COUNT_MISMATCH
}

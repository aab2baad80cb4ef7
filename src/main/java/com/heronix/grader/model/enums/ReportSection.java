package com.heronix.grader.model.enums;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Optional sections of a grade report, in the order they appear.
 */
public enum ReportSection {

    /**
     * Resolved score of each individual test
     */
    TESTS,

    /**
     * Scaled average of each assignment
     */
    AVERAGES,

    /**
     * Final course grade out of 100
     */
    FINAL,

    /**
     * Letter grade derived from the final grade
     */
    LETTER,

    /**
     * Number of absent tests per assignment
     */
    MISSED;

    public static final Set<ReportSection> DEFAULTS = Set.copyOf(EnumSet.of(AVERAGES, MISSED, FINAL, LETTER));

    /**
     * Whether a passthrough column name is one of the lowercase section
     * keywords ("tests", "final", ...). A gradebook column named "Final" is not.
     */
    public static boolean isKeyword(String name) {
        for (ReportSection section : values()) {
            if (section.name().toLowerCase(Locale.ROOT).equals(name)) {
                return true;
            }
        }
        return false;
    }
}

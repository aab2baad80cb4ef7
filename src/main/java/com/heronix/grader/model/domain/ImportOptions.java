package com.heronix.grader.model.domain;

import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * Settings for building an LMS reimport table from a grade report.
 */
@Value
@Builder(toBuilder = true)
public class ImportOptions {

    public static final String DEFAULT_LETTER_GRADE_COLUMN = "Letter grade";

    @Builder.Default
    InfoColumns infoColumns = InfoColumns.DEFAULT;

    /**
     * Report column holding the letter grade, e.g. an "Adjusted letter grade" edited by hand
     */
    @Builder.Default
    String letterGradeColumn = DEFAULT_LETTER_GRADE_COLUMN;

    /**
     * When true, the final grade sent is the middle of the letter's bracket;
     * otherwise the letter column is sent as-is
     */
    @Builder.Default
    boolean standardize = true;

    @Builder.Default
    LetterScale letterScale = LetterScale.DEFAULT;

    /**
     * Report columns exported as "&lt;name&gt; Points Grade"
     */
    @Builder.Default
    List<String> includeOthers = List.of();

    public static ImportOptions defaults() {
        return builder().build();
    }
}

package com.heronix.grader.model.domain;

import java.util.List;
import java.util.Set;

import com.heronix.grader.model.enums.ReportSection;
import com.heronix.grader.model.scheme.GradingScheme;

import lombok.Builder;
import lombok.Value;

/**
 * What a grade report computes and shows.
 */
@Value
@Builder(toBuilder = true)
public class ReportOptions {

    /**
     * Schemes turning assignment averages into the final grade; the best one counts
     */
    @Builder.Default
    List<GradingScheme> gradingSchemes = List.of(GradingScheme.mean());

    /**
     * Letter thresholds and letters
     */
    @Builder.Default
    LetterScale letterScale = LetterScale.DEFAULT;

    /**
     * Sections to include
     */
    @Builder.Default
    Set<ReportSection> include = ReportSection.DEFAULTS;

    /**
     * Other gradebook columns copied into the report, e.g. "Comments"
     */
    @Builder.Default
    List<String> includeOthers = List.of();

    public static ReportOptions defaults() {
        return builder().build();
    }

    public boolean includes(ReportSection section) {
        return include.contains(section);
    }
}

package com.heronix.grader.service;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import com.heronix.grader.diagnostics.GradingDiagnostics;
import com.heronix.grader.exception.GradingConfigException;
import com.heronix.grader.exception.UnknownLetterException;
import com.heronix.grader.model.domain.LetterScale;
import com.heronix.grader.model.enums.DiagnosticType;

/**
 * Converts numeric grades to letter grades and back.
 */
@Component
public class LetterMapper {

    private static final double LOWEST_BOUND = 0;
    private static final double HIGHEST_BOUND = 100;

    /**
     * Letter of the first threshold the score reaches (a score equal to a
     * threshold gets the higher letter), or the last letter if none is reached.
     */
    public String toLetter(double score, LetterScale scale) {
        List<Double> thresholds = scale.thresholds();
        List<String> letters = scale.letters();
        for (int i = 0; i < thresholds.size() && i < letters.size(); i++) {
            if (score >= thresholds.get(i)) {
                return letters.get(i);
            }
        }
        return letters.get(letters.size() - 1);
    }

    /**
     * Numeric grade standing for a letter: the middle of the letter's bracket,
     * rounded down. The top letter's bracket ends at 100 and the last letter's
     * bracket starts at 0.
     *
     * @throws UnknownLetterException if the letter is not in the scale
     */
    public int toNumeric(String letter, LetterScale scale) {
        int index = scale.letters().indexOf(letter);
        if (index < 0) {
            throw new UnknownLetterException(letter);
        }

        List<Double> bounds = new ArrayList<>(scale.thresholds());
        bounds.add(LOWEST_BOUND);
        bounds.add(HIGHEST_BOUND);
        if (index >= bounds.size()) {
            throw new GradingConfigException("Letter " + letter + " has no bracket in thresholds " + scale.thresholds());
        }

        double lower = bounds.get(index);
        double upper = index == 0 ? bounds.get(bounds.size() - 1) : bounds.get(index - 1);
        return (int) Math.floor((lower + upper) / 2);
    }

    /**
     * Report scale shapes that will not map grades the way they are meant to.
     */
    public void checkScale(LetterScale scale, GradingDiagnostics diagnostics) {
        if (!scale.isStrictlyDescending()) {
            diagnostics.warn(DiagnosticType.THRESHOLDS_NOT_SORTED,
                    "Thresholds not sorted in decreasing order: " + scale.thresholds());
        }
        if (!scale.hasMatchingSizes()) {
            diagnostics.warn(DiagnosticType.LETTER_COUNT_MISMATCH,
                    "Incorrect sizes of thresholds (" + scale.thresholds().size() + ") and letters ("
                            + scale.letters().size() + "). There should be n letter grades and n-1 thresholds.");
        }
    }
}

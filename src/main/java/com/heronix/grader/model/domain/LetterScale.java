package com.heronix.grader.model.domain;

import java.util.List;

/**
 * Thresholds between letter grades, highest first, and the letters they
 * separate. A scale normally has one letter more than it has thresholds; the
 * last letter is the catch-all failing grade.
 */
public record LetterScale(
        List<Double> thresholds,
        List<String> letters
) {

    public static final LetterScale DEFAULT = new LetterScale(
            List.of(93.0, 90.0, 87.0, 83.0, 80.0, 75.0, 65.0, 50.0),
            List.of("A", "A-", "B+", "B", "B-", "C+", "C", "D", "F"));

    public LetterScale {
        thresholds = List.copyOf(thresholds);
        letters = List.copyOf(letters);
        if (letters.isEmpty()) {
            throw new IllegalArgumentException("A letter scale needs at least one letter");
        }
    }

    public boolean isStrictlyDescending() {
        for (int i = 0; i + 1 < thresholds.size(); i++) {
            if (thresholds.get(i) <= thresholds.get(i + 1)) {
                return false;
            }
        }
        return true;
    }

    public boolean hasMatchingSizes() {
        return thresholds.size() == letters.size() - 1;
    }
}

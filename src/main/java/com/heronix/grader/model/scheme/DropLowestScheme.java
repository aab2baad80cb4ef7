package com.heronix.grader.model.scheme;

import java.util.Comparator;
import java.util.List;

import com.heronix.grader.exception.GradingConfigException;
import com.heronix.grader.model.enums.SchemeType;

/**
 * Mean of the scores left after removing the {@code dropped} lowest ones.
 * Ties among the lowest scores are irrelevant since only values are kept.
 */
public record DropLowestScheme(int dropped) implements GradingScheme {

    public DropLowestScheme {
        if (dropped < 0) {
            throw new GradingConfigException("Cannot drop a negative number of scores: " + dropped);
        }
    }

    @Override
    public SchemeType getType() {
        return SchemeType.DROP_LOWEST;
    }

    @Override
    public double apply(ScoreSet scores) {
        int kept = checkKept(scores.size());
        List<Double> highest = scores.values().stream()
                .sorted(Comparator.reverseOrder())
                .limit(kept)
                .toList();
        double sum = 0;
        for (double value : highest) {
            sum += value;
        }
        return sum / kept;
    }

    @Override
    public void validate(List<String> names) {
        checkKept(names.size());
    }

    private int checkKept(int count) {
        if (dropped >= count) {
            throw new GradingConfigException(
                    "Cannot drop " + dropped + " scores out of " + count);
        }
        return count - dropped;
    }
}

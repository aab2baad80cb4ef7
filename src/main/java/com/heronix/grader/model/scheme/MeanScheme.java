package com.heronix.grader.model.scheme;

import com.heronix.grader.exception.GradingConfigException;
import com.heronix.grader.model.enums.SchemeType;

/**
 * Arithmetic mean of all scores.
 */
public record MeanScheme() implements GradingScheme {

    static final MeanScheme INSTANCE = new MeanScheme();

    @Override
    public SchemeType getType() {
        return SchemeType.MEAN;
    }

    @Override
    public double apply(ScoreSet scores) {
        if (scores.isEmpty()) {
            throw new GradingConfigException("Cannot average an empty set of scores");
        }
        double sum = 0;
        for (double value : scores.values()) {
            sum += value;
        }
        return sum / scores.size();
    }
}

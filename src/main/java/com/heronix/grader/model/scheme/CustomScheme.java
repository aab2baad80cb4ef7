package com.heronix.grader.model.scheme;

import java.util.function.ToDoubleFunction;

import com.heronix.grader.model.enums.SchemeType;

/**
 * Scheme delegating to a caller-supplied function.
 */
public record CustomScheme(String description, ToDoubleFunction<ScoreSet> function) implements GradingScheme {

    @Override
    public SchemeType getType() {
        return SchemeType.CUSTOM;
    }

    @Override
    public double apply(ScoreSet scores) {
        return function.applyAsDouble(scores);
    }

    @Override
    public String toString() {
        return "CustomScheme[" + description + "]";
    }
}

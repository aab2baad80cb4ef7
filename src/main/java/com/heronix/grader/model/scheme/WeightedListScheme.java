package com.heronix.grader.model.scheme;

import java.util.List;

import com.heronix.grader.exception.GradingConfigException;
import com.heronix.grader.model.enums.SchemeType;

/**
 * Weighted mean where the i-th weight applies to the i-th score.
 */
public record WeightedListScheme(List<Double> weights) implements GradingScheme {

    public WeightedListScheme {
        weights = List.copyOf(weights);
        if (weights.isEmpty()) {
            throw new GradingConfigException("Weighted scheme needs at least one weight");
        }
        if (weights.stream().mapToDouble(Double::doubleValue).sum() == 0) {
            throw new GradingConfigException("Weights must not sum to zero: " + weights);
        }
    }

    @Override
    public SchemeType getType() {
        return SchemeType.WEIGHTED_LIST;
    }

    @Override
    public double apply(ScoreSet scores) {
        checkSize(scores.size());
        List<Double> values = scores.values();
        double weighted = 0;
        double total = 0;
        for (int i = 0; i < weights.size(); i++) {
            weighted += values.get(i) * weights.get(i);
            total += weights.get(i);
        }
        return weighted / total;
    }

    @Override
    public void validate(List<String> names) {
        checkSize(names.size());
    }

    private void checkSize(int count) {
        if (count != weights.size()) {
            throw new GradingConfigException(
                    "Expected " + weights.size() + " scores for weights " + weights + " but got " + count);
        }
    }
}

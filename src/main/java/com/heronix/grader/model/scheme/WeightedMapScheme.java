package com.heronix.grader.model.scheme;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.heronix.grader.exception.GradingConfigException;
import com.heronix.grader.exception.MissingScoreKeyException;
import com.heronix.grader.model.enums.SchemeType;

/**
 * Weighted mean where each weight names the score it applies to.
 * Scores without a weight are ignored.
 */
public record WeightedMapScheme(Map<String, Double> weights) implements GradingScheme {

    public WeightedMapScheme {
        if (weights.isEmpty()) {
            throw new GradingConfigException("Weighted scheme needs at least one weight");
        }
        if (weights.values().stream().mapToDouble(Double::doubleValue).sum() == 0) {
            throw new GradingConfigException("Weights must not sum to zero: " + weights);
        }
    }

    static WeightedMapScheme of(Map<String, ? extends Number> weights) {
        Map<String, Double> ordered = new LinkedHashMap<>();
        weights.forEach((name, weight) -> ordered.put(name, weight.doubleValue()));
        return new WeightedMapScheme(Collections.unmodifiableMap(ordered));
    }

    @Override
    public SchemeType getType() {
        return SchemeType.WEIGHTED_MAP;
    }

    @Override
    public double apply(ScoreSet scores) {
        double weighted = 0;
        double total = 0;
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            if (!scores.contains(entry.getKey())) {
                throw new MissingScoreKeyException(entry.getKey());
            }
            weighted += scores.get(entry.getKey()) * entry.getValue();
            total += entry.getValue();
        }
        return weighted / total;
    }

    @Override
    public void validate(List<String> names) {
        for (String key : weights.keySet()) {
            if (!names.contains(key)) {
                throw new MissingScoreKeyException(key);
            }
        }
    }
}

package com.heronix.grader.model.scheme;

import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

import com.heronix.grader.exception.GradingConfigException;
import com.heronix.grader.model.enums.SchemeType;

/**
 * An averaging policy: maps a set of scores to one number.
 *
 * Implementations are stateless and may be shared between assignments and
 * computations. A list of schemes is combined with {@link #best}, which models
 * "best of several alternative policies".
 *
 * Schemes are created through the static factories:
 * <pre>
 * GradingScheme.mean()
 * GradingScheme.drop(2)
 * GradingScheme.weights(List.of(5.0, 15.0, 80.0))
 * GradingScheme.weights(Map.of("Quiz", 1.0, "Final exam", 3.0))
 * GradingScheme.custom("median", scores -> ...)
 * </pre>
 */
public interface GradingScheme {

    /**
     * The policy this scheme applies.
     */
    SchemeType getType();

    /**
     * Aggregate the given scores.
     *
     * @param scores scores with absences already substituted
     * @return the aggregate value
     * @throws GradingConfigException if the scores do not fit this scheme
     */
    double apply(ScoreSet scores);

    /**
     * Check, before any score is known, that this scheme can be applied to
     * scores carrying the given names.
     *
     * @param names the score names the scheme will receive, in order
     * @throws GradingConfigException if the scheme cannot apply to them
     */
    default void validate(List<String> names) {
    }

    // ========================================================================
    // FACTORIES
    // ========================================================================

    static GradingScheme mean() {
        return MeanScheme.INSTANCE;
    }

    static GradingScheme drop(int lowestDropped) {
        return new DropLowestScheme(lowestDropped);
    }

    static GradingScheme weights(List<? extends Number> weights) {
        return new WeightedListScheme(weights.stream().map(Number::doubleValue).toList());
    }

    static GradingScheme weights(Map<String, ? extends Number> weights) {
        return WeightedMapScheme.of(weights);
    }

    static GradingScheme custom(String description, ToDoubleFunction<ScoreSet> function) {
        return new CustomScheme(description, function);
    }

    /**
     * Maximum over several schemes applied to the same scores.
     *
     * @throws GradingConfigException if no scheme is given
     */
    static double best(List<GradingScheme> schemes, ScoreSet scores) {
        if (schemes == null || schemes.isEmpty()) {
            throw new GradingConfigException("At least one grading scheme is required");
        }
        double best = Double.NEGATIVE_INFINITY;
        for (GradingScheme scheme : schemes) {
            best = Math.max(best, scheme.apply(scores));
        }
        return best;
    }
}

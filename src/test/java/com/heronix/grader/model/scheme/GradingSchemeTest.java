package com.heronix.grader.model.scheme;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.heronix.grader.exception.GradingConfigException;
import com.heronix.grader.exception.MissingScoreKeyException;
import com.heronix.grader.model.enums.SchemeType;

class GradingSchemeTest {

    private static final double DELTA = 1e-9;

    @Test
    void meanAveragesEveryScore() {
        assertEquals(0.75, GradingScheme.mean().apply(ScoreSet.of(1.0, 0.5)), DELTA);
        assertEquals(SchemeType.MEAN, GradingScheme.mean().getType());
    }

    @Test
    void meanOfNothingFails() {
        assertThrows(GradingConfigException.class, () -> GradingScheme.mean().apply(ScoreSet.of()));
    }

    @Test
    void dropLowestAveragesTheRest() {
        assertEquals(30, GradingScheme.drop(1).apply(ScoreSet.of(10, 20, 30, 40)), DELTA);
        assertEquals(35, GradingScheme.drop(2).apply(ScoreSet.of(40, 10, 30, 20)), DELTA);
        assertEquals(25, GradingScheme.drop(0).apply(ScoreSet.of(10, 20, 30, 40)), DELTA);
    }

    @Test
    void dropMustLeaveAtLeastOneScore() {
        GradingScheme drop = GradingScheme.drop(4);

        assertThrows(GradingConfigException.class, () -> drop.apply(ScoreSet.of(10, 20, 30, 40)));
        assertThrows(GradingConfigException.class, () -> drop.validate(List.of("a", "b", "c", "d")));
        assertThrows(GradingConfigException.class, () -> GradingScheme.drop(-1));
    }

    @Test
    void positionalWeights() {
        GradingScheme weights = GradingScheme.weights(List.of(1, 3));

        assertEquals(87.5, weights.apply(ScoreSet.of(80, 90)), DELTA);
        assertEquals(0.875, weights.apply(ScoreSet.of(0.5, 1.0)), DELTA);
        assertThrows(GradingConfigException.class, () -> weights.apply(ScoreSet.of(0.5, 1.0, 1.0)));
        assertThrows(GradingConfigException.class, () -> weights.validate(List.of("HW")));
    }

    @Test
    void weightsMustNotSumToZero() {
        assertThrows(GradingConfigException.class, () -> GradingScheme.weights(List.of(0, 0)));
    }

    @Test
    void namedWeightsIgnoreUnweightedScores() {
        Map<String, Integer> named = new LinkedHashMap<>();
        named.put("Final exam", 3);
        named.put("Midterm", 1);
        GradingScheme weights = GradingScheme.weights(named);

        Map<String, Double> scores = new LinkedHashMap<>();
        scores.put("Midterm", 0.5);
        scores.put("Final exam", 1.0);
        scores.put("Quiz", 0.0);

        assertEquals(0.875, weights.apply(ScoreSet.of(scores)), DELTA);
        assertEquals(SchemeType.WEIGHTED_MAP, weights.getType());
    }

    @Test
    void namedWeightsOnRawScores() {
        GradingScheme weights = GradingScheme.weights(Map.of("a", 1, "b", 3));

        assertEquals(87.5, weights.apply(ScoreSet.of(Map.of("a", 80.0, "b", 90.0))), DELTA);
        assertThrows(MissingScoreKeyException.class, () -> weights.apply(ScoreSet.of(Map.of("a", 80.0))));
    }

    @Test
    void namedWeightsRequireTheirScores() {
        GradingScheme weights = GradingScheme.weights(Map.of("Final exam", 1.0));

        MissingScoreKeyException error = assertThrows(MissingScoreKeyException.class,
                () -> weights.apply(ScoreSet.of(Map.of("Midterm", 1.0))));

        assertEquals("Final exam", error.getKey());
        assertThrows(MissingScoreKeyException.class, () -> weights.validate(List.of("Midterm")));
    }

    @Test
    void customSchemeSeesNamedScores() {
        GradingScheme best = GradingScheme.custom("best score",
                scores -> scores.values().stream().mapToDouble(Double::doubleValue).max().orElse(0));

        assertEquals(0.9, best.apply(ScoreSet.of(Map.of("a", 0.2, "b", 0.9))), DELTA);
        assertEquals(SchemeType.CUSTOM, best.getType());
    }

    @Test
    void bestTakesTheHighestScheme() {
        List<GradingScheme> schemes = List.of(GradingScheme.mean(), GradingScheme.drop(1));

        assertEquals(0.9, GradingScheme.best(schemes, ScoreSet.of(0.9, 0.1)), DELTA);
        assertThrows(GradingConfigException.class, () -> GradingScheme.best(List.of(), ScoreSet.of(1.0)));
    }

    @Test
    void scoreSetRejectsAbsentScores() {
        assertThrows(IllegalArgumentException.class, () -> ScoreSet.of(Arrays.asList(1.0, null)));
    }
}

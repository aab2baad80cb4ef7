package com.heronix.grader.model.scheme;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered, named collection of numeric scores a grading scheme is applied to.
 *
 * Scores can be read by position or by name. Absent scores must be replaced
 * (typically by 0) before a set is built.
 */
public final class ScoreSet {

    private final Map<String, Double> scores;

    private ScoreSet(Map<String, Double> scores) {
        this.scores = Collections.unmodifiableMap(scores);
    }

    /**
     * Named scores, kept in the map's iteration order.
     */
    public static ScoreSet of(Map<String, ? extends Number> named) {
        Map<String, Double> copy = new LinkedHashMap<>();
        named.forEach((name, value) -> {
            if (value == null) {
                throw new IllegalArgumentException("Score '" + name + "' is absent");
            }
            copy.put(name, value.doubleValue());
        });
        return new ScoreSet(copy);
    }

    /**
     * Positional scores; names are the 0-based positions.
     */
    public static ScoreSet of(List<? extends Number> values) {
        Map<String, Double> indexed = new LinkedHashMap<>();
        for (int i = 0; i < values.size(); i++) {
            indexed.put(String.valueOf(i), values.get(i) == null ? null : values.get(i).doubleValue());
        }
        return of(indexed);
    }

    public static ScoreSet of(double... values) {
        List<Double> boxed = new ArrayList<>(values.length);
        for (double value : values) {
            boxed.add(value);
        }
        return of(boxed);
    }

    public int size() {
        return scores.size();
    }

    public boolean isEmpty() {
        return scores.isEmpty();
    }

    public List<Double> values() {
        return List.copyOf(scores.values());
    }

    public List<String> names() {
        return List.copyOf(scores.keySet());
    }

    public boolean contains(String name) {
        return scores.containsKey(name);
    }

    public double get(String name) {
        Double value = scores.get(name);
        if (value == null) {
            throw new IllegalArgumentException("No score named " + name);
        }
        return value;
    }

    public Map<String, Double> asMap() {
        return scores;
    }

    @Override
    public String toString() {
        return scores.toString();
    }
}

package com.heronix.grader.model.domain;

import java.util.ArrayList;
import java.util.List;

import com.heronix.grader.exception.GradingConfigException;

/**
 * One logical test, such as "Quiz 3" or "HW 1", and the gradebook columns
 * holding its versions.
 *
 * A bare test ({@code nbVersions == null}) is read from a single column named
 * after the test. A versioned test is read from {@code name + separator + i}
 * for i = 1..nbVersions, e.g. "Quiz 3 - v1", "Quiz 3 - v2". Note that
 * {@code nbVersions == 1} gives the single column "Quiz 3 - v1", not "Quiz 3".
 */
public record GradedTest(
        String name,
        double maxPoints,
        List<String> versions
) {

    public static final String DEFAULT_VERSION_SEPARATOR = " - v";

    public GradedTest {
        if (name == null || name.isBlank()) {
            throw new GradingConfigException("Test name is required");
        }
        if (maxPoints <= 0) {
            throw new GradingConfigException("Test " + name + " must have positive max points, got " + maxPoints);
        }
        versions = List.copyOf(versions);
        if (versions.isEmpty()) {
            throw new GradingConfigException("Test " + name + " has no versions");
        }
    }

    public static GradedTest bare(String name, double maxPoints) {
        return new GradedTest(name, maxPoints, List.of(name));
    }

    public static GradedTest of(String name, double maxPoints, Integer nbVersions, String versionSeparator) {
        if (nbVersions == null) {
            return bare(name, maxPoints);
        }
        if (nbVersions < 1) {
            throw new GradingConfigException("Test " + name + " needs at least one version, got " + nbVersions);
        }
        List<String> versions = new ArrayList<>(nbVersions);
        for (int i = 1; i <= nbVersions; i++) {
            versions.add(name + versionSeparator + i);
        }
        return new GradedTest(name, maxPoints, versions);
    }
}

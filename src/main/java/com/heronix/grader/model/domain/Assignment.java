package com.heronix.grader.model.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.heronix.grader.exception.GradingConfigException;
import com.heronix.grader.model.scheme.GradingScheme;

import lombok.Getter;

/**
 * A type of graded work, such as "Quiz" or "HW", made of one or more tests
 * averaged with one or more grading schemes (the best one counts).
 *
 * Test naming:
 * <ul>
 *   <li>no test count: a single test named after the assignment</li>
 *   <li>test count n: tests {@code name + testSeparator + i}, i = 1..n, e.g. "HW 1" .. "HW 11"</li>
 * </ul>
 *
 * The scaling is the number of points the average is displayed out of. It
 * defaults to the max points when all tests share one value, 100 otherwise.
 */
@Getter
public final class Assignment {

    public static final String DEFAULT_TEST_SEPARATOR = " ";
    public static final double DEFAULT_SCALING = 100;

    private final String name;
    private final List<GradedTest> tests;
    private final List<GradingScheme> gradingSchemes;
    private final double scaling;

    private Assignment(Builder builder) {
        if (builder.name == null || builder.name.isBlank()) {
            throw new GradingConfigException("Assignment name is required");
        }
        this.name = builder.name;

        int testCount = builder.nbTests == null ? 1 : builder.nbTests;
        if (testCount < 1) {
            throw new GradingConfigException("Assignment " + name + " needs at least one test, got " + testCount);
        }

        List<Double> maxPoints = broadcast("max points", builder.uniformMaxPoints, builder.maxPoints, testCount);
        List<Integer> nbVersions = broadcast("version counts", builder.uniformVersions, builder.nbVersions, testCount);

        List<GradedTest> built = new ArrayList<>(testCount);
        if (builder.nbTests == null) {
            built.add(GradedTest.of(name, maxPoints.get(0), nbVersions.get(0), builder.versionSeparator));
        } else {
            for (int i = 0; i < testCount; i++) {
                built.add(GradedTest.of(name + builder.testSeparator + (i + 1),
                        maxPoints.get(i), nbVersions.get(i), builder.versionSeparator));
            }
        }
        this.tests = Collections.unmodifiableList(built);

        this.gradingSchemes = builder.gradingSchemes.isEmpty()
                ? List.of(GradingScheme.mean())
                : List.copyOf(builder.gradingSchemes);
        List<String> testNames = getTestNames();
        for (GradingScheme scheme : gradingSchemes) {
            scheme.validate(testNames);
        }

        if (builder.scaling != null) {
            this.scaling = builder.scaling;
        } else if (builder.uniformMaxPoints != null) {
            this.scaling = builder.uniformMaxPoints;
        } else {
            this.scaling = DEFAULT_SCALING;
        }
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public List<String> getTestNames() {
        return tests.stream().map(GradedTest::name).toList();
    }

    private <T> List<T> broadcast(String what, T uniform, List<T> perTest, int testCount) {
        if (perTest == null) {
            List<T> repeated = new ArrayList<>(testCount);
            for (int i = 0; i < testCount; i++) {
                repeated.add(uniform);
            }
            return repeated;
        }
        if (perTest.size() != testCount) {
            throw new GradingConfigException("Assignment " + name + " has " + testCount + " tests but "
                    + perTest.size() + " " + what + ": " + perTest);
        }
        return perTest;
    }

    @Override
    public String toString() {
        return "Assignment[" + name + ", tests=" + getTestNames() + ", scaling=" + scaling + "]";
    }

    /**
     * Builder for assignments. Max points must be given, either once for all
     * tests or once per test.
     */
    public static final class Builder {

        private final String name;
        private Integer nbTests;
        private Double uniformMaxPoints;
        private List<Double> maxPoints;
        private Integer uniformVersions;
        private List<Integer> nbVersions;
        private final List<GradingScheme> gradingSchemes = new ArrayList<>();
        private Double scaling;
        private String testSeparator = DEFAULT_TEST_SEPARATOR;
        private String versionSeparator = GradedTest.DEFAULT_VERSION_SEPARATOR;

        private Builder(String name) {
            this.name = name;
        }

        public Builder tests(int count) {
            this.nbTests = count;
            return this;
        }

        public Builder maxPoints(double points) {
            this.uniformMaxPoints = points;
            this.maxPoints = null;
            return this;
        }

        public Builder maxPoints(List<Double> pointsPerTest) {
            this.maxPoints = List.copyOf(pointsPerTest);
            this.uniformMaxPoints = null;
            return this;
        }

        public Builder versions(int count) {
            this.uniformVersions = count;
            this.nbVersions = null;
            return this;
        }

        /**
         * Version count per test; a null entry marks a bare test.
         */
        public Builder versions(List<Integer> countsPerTest) {
            this.nbVersions = Collections.unmodifiableList(new ArrayList<>(countsPerTest));
            this.uniformVersions = null;
            return this;
        }

        public Builder scheme(GradingScheme scheme) {
            this.gradingSchemes.add(scheme);
            return this;
        }

        public Builder schemes(List<GradingScheme> schemes) {
            this.gradingSchemes.addAll(schemes);
            return this;
        }

        public Builder scaling(double scaling) {
            this.scaling = scaling;
            return this;
        }

        public Builder testSeparator(String separator) {
            this.testSeparator = separator;
            return this;
        }

        public Builder versionSeparator(String separator) {
            this.versionSeparator = separator;
            return this;
        }

        public Assignment build() {
            if (uniformMaxPoints == null && maxPoints == null) {
                throw new GradingConfigException("Assignment " + name + " needs max points");
            }
            return new Assignment(this);
        }
    }
}

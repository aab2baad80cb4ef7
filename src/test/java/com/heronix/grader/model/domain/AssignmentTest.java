package com.heronix.grader.model.domain;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.heronix.grader.exception.GradingConfigException;
import com.heronix.grader.exception.MissingScoreKeyException;
import com.heronix.grader.model.enums.SchemeType;
import com.heronix.grader.model.scheme.GradingScheme;

class AssignmentTest {

    @Test
    void singleTestAssignmentIsNamedAfterItself() {
        Assignment midterm = Assignment.builder("Midterm 1").maxPoints(100).build();

        assertEquals(List.of("Midterm 1"), midterm.getTestNames());
        assertEquals(List.of("Midterm 1"), midterm.getTests().get(0).versions());
        assertEquals(100, midterm.getScaling());
        assertEquals(SchemeType.MEAN, midterm.getGradingSchemes().get(0).getType());
    }

    @Test
    void numberedTestsWithVersions() {
        Assignment quiz = Assignment.builder("Quiz").maxPoints(20).tests(3).versions(2)
                .scheme(GradingScheme.drop(1)).build();

        assertEquals(List.of("Quiz 1", "Quiz 2", "Quiz 3"), quiz.getTestNames());
        assertEquals(List.of("Quiz 2 - v1", "Quiz 2 - v2"), quiz.getTests().get(1).versions());
        assertEquals(20, quiz.getScaling());
    }

    @Test
    void perTestMaxPointsDefaultScalingTo100() {
        Assignment lab = Assignment.builder("Lab").tests(2).maxPoints(List.of(10.0, 30.0)).build();

        assertEquals(10, lab.getTests().get(0).maxPoints());
        assertEquals(30, lab.getTests().get(1).maxPoints());
        assertEquals(100, lab.getScaling());
    }

    @Test
    void explicitScalingWins() {
        assertEquals(5, Assignment.builder("WebAssign").maxPoints(100).scaling(5).build().getScaling());
    }

    @Test
    void perTestVersionsMayMixBareAndVersionedTests() {
        Assignment quiz = Assignment.builder("Quiz").maxPoints(10).tests(2)
                .versions(Arrays.asList(null, 2)).build();

        assertEquals(List.of("Quiz 1"), quiz.getTests().get(0).versions());
        assertEquals(List.of("Quiz 2 - v1", "Quiz 2 - v2"), quiz.getTests().get(1).versions());
    }

    @Test
    void mismatchedMaxPointsFailAtConstruction() {
        Assignment.Builder builder = Assignment.builder("HW").tests(3).maxPoints(List.of(10.0, 20.0));

        assertThrows(GradingConfigException.class, builder::build);
    }

    @Test
    void mismatchedVersionsFailAtConstruction() {
        Assignment.Builder builder = Assignment.builder("HW").tests(2).maxPoints(10).versions(List.of(1, 2, 3));

        assertThrows(GradingConfigException.class, builder::build);
    }

    @Test
    void dropMustLeaveAScore() {
        Assignment.Builder builder = Assignment.builder("HW").tests(2).maxPoints(10).scheme(GradingScheme.drop(2));

        assertThrows(GradingConfigException.class, builder::build);
    }

    @Test
    void weightsMustNameExistingTests() {
        Assignment.Builder builder = Assignment.builder("HW").tests(2).maxPoints(10)
                .scheme(GradingScheme.weights(Map.of("HW 3", 1.0)));

        assertThrows(MissingScoreKeyException.class, builder::build);
    }

    @Test
    void maxPointsAreRequired() {
        assertThrows(GradingConfigException.class, () -> Assignment.builder("HW").build());
    }
}

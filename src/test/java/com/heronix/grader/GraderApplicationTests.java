package com.heronix.grader;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.test.context.SpringBootTest;

import com.heronix.grader.config.CourseConfigFactory;
import com.heronix.grader.config.GradebookSourcesHealthIndicator;
import com.heronix.grader.config.GradingRunner;
import com.heronix.grader.model.domain.Assignment;
import com.heronix.grader.model.enums.SchemeType;

@SpringBootTest
class GraderApplicationTests {

    @Autowired
    private CourseConfigFactory configFactory;

    @Autowired
    private GradebookSourcesHealthIndicator healthIndicator;

    @Autowired(required = false)
    private GradingRunner runner;

    @Test
    void exampleCourseBindsFromApplicationYaml() {
        List<Assignment> assignments = configFactory.assignments();

        assertEquals(List.of("WebAssign", "Quiz", "HW", "Participation", "Midterm 1", "Midterm 2", "Final exam"),
                assignments.stream().map(Assignment::getName).toList());
        assertEquals(5, assignments.get(0).getScaling());
        assertEquals(List.of("Quiz 10 - v1", "Quiz 10 - v2"), assignments.get(1).getTests().get(9).versions());
        assertEquals(SchemeType.DROP_LOWEST, assignments.get(2).getGradingSchemes().get(0).getType());
        assertEquals(3, configFactory.reportOptions().getGradingSchemes().size());
    }

    @Test
    void runnerIsOffByDefault() {
        assertNull(runner);
    }

    @Test
    void missingGradebookFilesReportDown() {
        assertEquals(Status.DOWN, healthIndicator.health().getStatus());
    }
}

package com.heronix.grader.config;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.heronix.grader.service.GradingRunService;
import com.heronix.grader.service.GradingRunService.RunResult;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs the configured course once at startup.
 *
 * Only active when heronix.grader.run-on-startup=true.
 */
@Component
@ConditionalOnProperty(prefix = "heronix.grader", name = "run-on-startup", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class GradingRunner implements ApplicationRunner {

    private final GradingRunService runService;

    @Override
    public void run(ApplicationArguments args) {
        RunResult result = runService.runConfiguredCourse();
        log.info("GRADER: Report for {} students written to {}", result.students(), result.reportPath());
        if (result.importPath() != null) {
            log.info("GRADER: LMS import written to {}", result.importPath());
        }
        result.diagnostics().forEach(d -> log.info("GRADER: {} - {}", d.type(), d.message()));
    }
}

package com.heronix.grader.config;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

/**
 * Spring Boot Actuator health indicator for the configured gradebook exports.
 *
 * Reports UP when every configured gradebook file is readable, DOWN otherwise.
 */
@Component
@RequiredArgsConstructor
public class GradebookSourcesHealthIndicator implements HealthIndicator {

    private final GraderProperties properties;

    @Override
    public Health health() {
        List<String> unreadable = new ArrayList<>();
        for (GraderProperties.GradebookConfig gradebook : properties.getGradebooks()) {
            if (!Files.isReadable(Path.of(gradebook.getPath()))) {
                unreadable.add(gradebook.getPath());
            }
        }

        if (unreadable.isEmpty()) {
            return Health.up()
                    .withDetail("gradebooks", properties.getGradebooks().size())
                    .build();
        }
        return Health.down()
                .withDetail("gradebooks", properties.getGradebooks().size())
                .withDetail("unreadable", unreadable)
                .build();
    }
}

package com.heronix.grader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import com.heronix.grader.config.GraderProperties;

/**
 * Heronix Grader - Gradebook Aggregation and Course Grading
 *
 * Grader merges the gradebook exports of several platforms (Gradescope,
 * WebAssign, spreadsheets) into one roster, computes assignment averages,
 * final grades and letter grades, and prepares the file imported back into
 * the LMS gradebook.
 *
 * Core Principle: the first gradebook is the roster; every other source only adds grades.
 */
@SpringBootApplication
@EnableConfigurationProperties(GraderProperties.class)
public class GraderApplication {

    public static void main(String[] args) {
        SpringApplication.run(GraderApplication.class, args);
    }
}

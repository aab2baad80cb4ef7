package com.heronix.grader.exception;

/**
 * Exception thrown when assignments, grading schemes or course settings
 * are inconsistent.
 */
public class GradingConfigException extends GraderException {

    public GradingConfigException(String message) {
        super(message);
    }
}

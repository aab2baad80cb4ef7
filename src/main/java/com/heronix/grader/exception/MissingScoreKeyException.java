package com.heronix.grader.exception;

/**
 * Exception thrown when a weighted scheme references a score that is not present.
 */
public class MissingScoreKeyException extends GradingConfigException {

    private final String key;

    public MissingScoreKeyException(String key) {
        super("No score named '" + key + "' to weight");
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}

package com.heronix.grader.exception;

/**
 * Exception thrown when a letter grade is not part of the letter scale.
 */
public class UnknownLetterException extends GraderException {

    public UnknownLetterException(String letter) {
        super("Letter grade not found in scale: " + letter);
    }
}

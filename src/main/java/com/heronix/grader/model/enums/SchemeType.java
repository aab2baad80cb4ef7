package com.heronix.grader.model.enums;

/**
 * Averaging policies a grading scheme can apply.
 */
public enum SchemeType {

    /**
     * Arithmetic mean
     */
    MEAN,

    /**
     * Mean of the scores left after dropping the k lowest
     */
    DROP_LOWEST,

    /**
     * Weighted mean, weights matched to scores by position
     */
    WEIGHTED_LIST,

    /**
     * Weighted mean, weights matched to scores by name
     */
    WEIGHTED_MAP,

    /**
     * Caller-supplied function
     */
    CUSTOM
}

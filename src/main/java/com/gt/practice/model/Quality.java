package com.gt.practice.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Recall quality on the SM-2 scale. 0 is a complete blackout, 5 a perfect response; anything below
 * {@link #PASS_THRESHOLD} counts as a lapse.
 */
public record Quality(int value) {

    public static final int MIN = 0;
    public static final int MAX = 5;
    public static final int PASS_THRESHOLD = 3;

    public static final Quality PERFECT = new Quality(5);
    public static final Quality FAILED = new Quality(2);

    public Quality {
        if (value < MIN || value > MAX) {
            throw new IllegalArgumentException("Quality must be between " + MIN + " and " + MAX + ", was " + value);
        }
    }

    public static Quality of(int value) {
        return new Quality(value);
    }

    @JsonIgnore
    public boolean isPassing() {
        return value >= PASS_THRESHOLD;
    }
}

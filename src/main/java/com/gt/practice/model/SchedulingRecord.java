package com.gt.practice.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.OptionalDouble;

public record SchedulingRecord(String itemId,
                               double easeFactor,
                               int repetitionCount,
                               int intervalDays,
                               Instant nextDueAt,
                               Instant lastReviewedAt,
                               int totalReviews,
                               int lapseCount) {

    public static final double DEFAULT_EASE_FACTOR = 2.5;

    // Record for an item the learner has never seen. Due immediately.
    public static SchedulingRecord newRecord(String itemId, double initialEaseFactor, Instant now) {
        return new SchedulingRecord(itemId, initialEaseFactor, 0, 0, now, null, 0, 0);
    }

    public static SchedulingRecord newRecord(String itemId, Instant now) {
        return newRecord(itemId, DEFAULT_EASE_FACTOR, now);
    }

    public boolean isDue(Instant now) {
        return !nextDueAt.isAfter(now);
    }

    // Share of reviews that were not lapses, empty until the item has been reviewed
    public OptionalDouble accuracy() {
        return totalReviews == 0
                ? OptionalDouble.empty()
                : OptionalDouble.of((double) (totalReviews - lapseCount) / totalReviews);
    }

    @JsonIgnore
    public boolean isGraduated() {
        return repetitionCount >= 2;
    }

    public SchedulingRecord withNextDueAt(Instant newNextDueAt) {
        return new SchedulingRecord(itemId, easeFactor, repetitionCount, intervalDays, newNextDueAt, lastReviewedAt,
                totalReviews, lapseCount);
    }
}

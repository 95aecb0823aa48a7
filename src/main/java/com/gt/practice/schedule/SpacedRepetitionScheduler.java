package com.gt.practice.schedule;

import com.gt.practice.model.Quality;
import com.gt.practice.model.SchedulingRecord;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * SM-2 scheduler. Computes the successor of a scheduling record for a review of the given quality; the input record is
 * never modified and no I/O is performed.
 * <p>
 * A lapse (quality below 3) restarts the repetition count and brings the item back the next day. Otherwise the interval
 * goes 1 day, 6 days, then grows by the ease factor, capped at the configured maximum. The ease factor never drops
 * below 1.3; a configured minimum can only raise that floor.
 */
@Component
public class SpacedRepetitionScheduler {

    public static final double DEFAULT_MINIMUM_EASE_FACTOR = 1.3;
    public static final int DEFAULT_MAX_INTERVAL_DAYS = 365;

    private static final double EASE_FACTOR_EPSILON = 1e-9;
    private static final int FIRST_INTERVAL_DAYS = 1;
    private static final int SECOND_INTERVAL_DAYS = 6;
    private static final int LAPSE_INTERVAL_DAYS = 1;

    private final double initialEaseFactor;
    private final double minimumEaseFactor;
    private final int maxIntervalDays;

    @Autowired
    public SpacedRepetitionScheduler(@Value("${practice.scheduler.initialEaseFactor:2.5}") double initialEaseFactor,
                                     @Value("${practice.scheduler.minimumEaseFactor:1.3}") double minimumEaseFactor,
                                     @Value("${practice.scheduler.maxIntervalDays:365}") int maxIntervalDays) {
        if (minimumEaseFactor < DEFAULT_MINIMUM_EASE_FACTOR || initialEaseFactor < minimumEaseFactor) {
            throw new IllegalArgumentException("Invalid ease factor configuration: initial " + initialEaseFactor
                    + ", minimum " + minimumEaseFactor);
        }
        if (maxIntervalDays < SECOND_INTERVAL_DAYS) {
            throw new IllegalArgumentException("Maximum interval must be at least " + SECOND_INTERVAL_DAYS + " days");
        }

        this.initialEaseFactor = initialEaseFactor;
        this.minimumEaseFactor = minimumEaseFactor;
        this.maxIntervalDays = maxIntervalDays;
    }

    public SpacedRepetitionScheduler() {
        this(SchedulingRecord.DEFAULT_EASE_FACTOR, DEFAULT_MINIMUM_EASE_FACTOR, DEFAULT_MAX_INTERVAL_DAYS);
    }

    public SchedulingRecord newRecord(String itemId, Instant now) {
        return SchedulingRecord.newRecord(itemId, initialEaseFactor, now);
    }

    public SchedulingRecord update(SchedulingRecord record, Quality quality, Instant now) {
        int q = quality.value();

        double easeFactor = nextEaseFactor(record.easeFactor(), q);

        int repetitionCount;
        int intervalDays;
        if (!quality.isPassing()) {
            repetitionCount = 0;
            intervalDays = LAPSE_INTERVAL_DAYS;
        } else {
            repetitionCount = record.repetitionCount() + 1;
            if (repetitionCount == 1) {
                intervalDays = FIRST_INTERVAL_DAYS;
            } else if (repetitionCount == 2) {
                intervalDays = SECOND_INTERVAL_DAYS;
            } else {
                intervalDays = (int) Math.min(Math.round(record.intervalDays() * easeFactor), Integer.MAX_VALUE);
            }
        }

        intervalDays = Math.max(1, Math.min(intervalDays, maxIntervalDays));

        return new SchedulingRecord(
                record.itemId(),
                easeFactor,
                repetitionCount,
                intervalDays,
                now.plus(Duration.ofDays(intervalDays)),
                now,
                record.totalReviews() + 1,
                quality.isPassing() ? record.lapseCount() : record.lapseCount() + 1);
    }

    private double nextEaseFactor(double easeFactor, int q) {
        int miss = Quality.MAX - q;
        double next = easeFactor + (0.1 - miss * (0.08 + miss * 0.02));

        return next < minimumEaseFactor + EASE_FACTOR_EPSILON ? minimumEaseFactor : next;
    }

    public int getMaxIntervalDays() {
        return maxIntervalDays;
    }
}

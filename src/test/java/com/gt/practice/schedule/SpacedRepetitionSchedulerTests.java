package com.gt.practice.schedule;

import com.gt.practice.model.Quality;
import com.gt.practice.model.SchedulingRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Fail.fail;
import static org.junit.jupiter.api.Assertions.*;

public class SpacedRepetitionSchedulerTests {

    private static final String TEST_ITEM_ID = "item-1";
    private static final Instant NOW = Instant.parse("2024-03-01T10:15:30.123456Z");
    private static final double EPSILON = 1e-9;

    private SpacedRepetitionScheduler scheduler;

    @BeforeEach
    public void setup() {
        scheduler = new SpacedRepetitionScheduler();
    }

    @Test
    public void testUpdate_FirstPerfectReview() {
        SchedulingRecord record = SchedulingRecord.newRecord(TEST_ITEM_ID, NOW);

        SchedulingRecord next = scheduler.update(record, Quality.of(5), NOW);

        assertEquals(TEST_ITEM_ID, next.itemId());
        assertEquals(2.6, next.easeFactor(), EPSILON);
        assertEquals(1, next.repetitionCount());
        assertEquals(1, next.intervalDays());
        assertEquals(NOW.plus(Duration.ofDays(1)), next.nextDueAt());
        assertEquals(NOW, next.lastReviewedAt());
    }

    @Test
    public void testUpdate_LapseResetsRepetitions() {
        SchedulingRecord record = new SchedulingRecord(TEST_ITEM_ID, 2.1, 3, 15, NOW, NOW.minus(Duration.ofDays(15)), 3, 0);

        SchedulingRecord next = scheduler.update(record, Quality.of(1), NOW);

        assertEquals(1.56, next.easeFactor(), EPSILON);
        assertEquals(0, next.repetitionCount());
        assertEquals(1, next.intervalDays());
        assertEquals(NOW.plus(Duration.ofDays(1)), next.nextDueAt());
        assertEquals(4, next.totalReviews());
        assertEquals(1, next.lapseCount());
    }

    @Test
    public void testUpdate_CountsReviewsAndLapses() {
        SchedulingRecord record = SchedulingRecord.newRecord(TEST_ITEM_ID, NOW);
        assertTrue(record.accuracy().isEmpty());

        record = scheduler.update(record, Quality.of(5), NOW);
        record = scheduler.update(record, Quality.of(2), NOW);
        record = scheduler.update(record, Quality.of(3), NOW);
        record = scheduler.update(record, Quality.of(4), NOW);

        assertEquals(4, record.totalReviews());
        assertEquals(1, record.lapseCount());
        assertEquals(0.75, record.accuracy().getAsDouble(), EPSILON);

        SchedulingRecord rescheduled = record.withNextDueAt(NOW.plus(Duration.ofDays(2)));
        assertEquals(4, rescheduled.totalReviews());
        assertEquals(1, rescheduled.lapseCount());
    }

    @Test
    public void testUpdate_IntervalProgression() {
        SchedulingRecord record = SchedulingRecord.newRecord(TEST_ITEM_ID, NOW);

        record = scheduler.update(record, Quality.of(4), NOW);
        assertEquals(1, record.intervalDays());
        assertEquals(2.5, record.easeFactor(), EPSILON);

        record = scheduler.update(record, Quality.of(4), NOW);
        assertEquals(2, record.repetitionCount());
        assertEquals(6, record.intervalDays());

        record = scheduler.update(record, Quality.of(5), NOW);
        assertEquals(3, record.repetitionCount());
        assertEquals(2.6, record.easeFactor(), EPSILON);
        assertEquals(16, record.intervalDays());
    }

    @Test
    public void testUpdate_QualityThreeStillPasses() {
        SchedulingRecord record = new SchedulingRecord(TEST_ITEM_ID, 2.5, 1, 1, NOW, NOW, 1, 0);

        SchedulingRecord next = scheduler.update(record, Quality.of(3), NOW);

        assertEquals(2.36, next.easeFactor(), EPSILON);
        assertEquals(2, next.repetitionCount());
        assertEquals(6, next.intervalDays());
    }

    @Test
    public void testUpdate_EaseFactorNeverBelowMinimum() {
        SchedulingRecord record = SchedulingRecord.newRecord(TEST_ITEM_ID, NOW);

        for (int review = 0; review < 20; review++) {
            record = scheduler.update(record, Quality.of(review % 3), NOW);
            assertTrue(record.easeFactor() >= SpacedRepetitionScheduler.DEFAULT_MINIMUM_EASE_FACTOR,
                    "Ease factor dropped to " + record.easeFactor());
        }

        assertEquals(1.3, record.easeFactor(), EPSILON);
    }

    @Test
    public void testUpdate_IntervalCappedAtMaximum() {
        SchedulingRecord record = new SchedulingRecord(TEST_ITEM_ID, 2.5, 5, 300, NOW, NOW, 5, 0);

        SchedulingRecord next = scheduler.update(record, Quality.of(5), NOW);

        assertEquals(365, next.intervalDays());
        assertEquals(NOW.plus(Duration.ofDays(365)), next.nextDueAt());
    }

    @Test
    public void testUpdate_PassingReviewsNeverShortenInterval() {
        SchedulingRecord record = SchedulingRecord.newRecord(TEST_ITEM_ID, NOW);

        for (int review = 0; review < 12; review++) {
            SchedulingRecord next = scheduler.update(record, Quality.of(3 + review % 3), NOW);
            assertTrue(next.intervalDays() >= record.intervalDays());
            record = next;
        }
    }

    @Test
    public void testUpdate_DoesNotModifyInput() {
        SchedulingRecord record = new SchedulingRecord(TEST_ITEM_ID, 2.5, 2, 6, NOW, NOW, 2, 0);

        scheduler.update(record, Quality.of(0), NOW.plus(Duration.ofDays(6)));

        assertEquals(new SchedulingRecord(TEST_ITEM_ID, 2.5, 2, 6, NOW, NOW, 2, 0), record);
    }

    @Test
    public void testConfiguredScheduler() {
        SpacedRepetitionScheduler configured = new SpacedRepetitionScheduler(2.0, 1.5, 30);

        SchedulingRecord record = configured.newRecord(TEST_ITEM_ID, NOW);
        assertEquals(2.0, record.easeFactor(), EPSILON);
        assertEquals(0, record.repetitionCount());
        assertEquals(0, record.intervalDays());
        assertEquals(NOW, record.nextDueAt());

        SchedulingRecord lapsed = configured.update(record, Quality.of(0), NOW);
        assertEquals(1.5, lapsed.easeFactor(), EPSILON);

        SchedulingRecord mature = configured.update(new SchedulingRecord(TEST_ITEM_ID, 2.0, 4, 25, NOW, NOW, 4, 0), Quality.of(5), NOW);
        assertEquals(30, mature.intervalDays());
    }

    @Test
    public void testInvalidConfiguration() {
        try {
            new SpacedRepetitionScheduler(1.2, 1.3, 365);
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException ex) {
            // expected
        }
    }

    @Test
    public void testMinimumEaseFactorBelowFloorRejected() {
        try {
            new SpacedRepetitionScheduler(2.5, 1.2, 365);
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException ex) {
            // expected
        }
    }

    @Test
    public void testInvalidQuality() {
        try {
            Quality.of(6);
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException ex) {
            // expected
        }
    }
}

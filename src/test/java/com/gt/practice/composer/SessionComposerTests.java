package com.gt.practice.composer;

import com.gt.practice.model.ContentItem;
import com.gt.practice.model.SchedulingRecord;
import com.gt.practice.model.SessionConfiguration;
import com.gt.practice.util.TestUtils;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

import static org.assertj.core.api.Fail.fail;
import static org.junit.jupiter.api.Assertions.*;

public class SessionComposerTests {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
    private static final long TEST_SEED = 42L;

    private final SessionComposer shuffledComposer = new SessionComposer(CompositionOrder.Shuffled);
    private final SessionComposer stableComposer = new SessionComposer(CompositionOrder.Stable);

    @Test
    public void testCompose_Underflow() {
        List<ContentItem> pool = pool("c", "a", "b");

        Composition composition = shuffledComposer.compose(pool, Map.of(), config(10, true), NOW, new Random(TEST_SEED));

        assertEquals(3, composition.taskIds().size());
        assertEquals(Set.of("a", "b", "c"), new HashSet<>(composition.taskIds()));
        assertEquals(0, composition.dueCount());
        assertEquals(3, composition.newCount());
        assertTrue(composition.underflow());
    }

    @Test
    public void testCompose_DueItemsFirst() {
        List<ContentItem> pool = pool("n1", "n2", "n3", "n4", "n5", "d1", "d2");
        Map<String, SchedulingRecord> records = Map.of(
                "d1", dueRecord("d1", 3),
                "d2", dueRecord("d2", 1));

        Composition composition = stableComposer.compose(pool, records, config(4, true), NOW, new Random(TEST_SEED));

        assertEquals(List.of("d1", "d2", "n1", "n2"), composition.taskIds());
        assertEquals(2, composition.dueCount());
        assertEquals(2, composition.newCount());
        assertFalse(composition.underflow());
    }

    @Test
    public void testCompose_DueItemsFillTargetFirst() {
        List<ContentItem> pool = pool("n1", "d1", "d2", "d3");
        Map<String, SchedulingRecord> records = Map.of(
                "d1", dueRecord("d1", 2),
                "d2", dueRecord("d2", 2),
                "d3", dueRecord("d3", 2));

        Composition composition = shuffledComposer.compose(pool, records, config(2, true), NOW, new Random(TEST_SEED));

        assertEquals(2, composition.taskIds().size());
        assertTrue(composition.taskIds().stream().allMatch(id -> id.startsWith("d")));
        assertEquals(0, composition.newCount());
    }

    @Test
    public void testCompose_ExcludeReview() {
        List<ContentItem> pool = pool("n1", "d1", "lapsed", "later");
        Map<String, SchedulingRecord> records = Map.of(
                "d1", dueRecord("d1", 3),
                "lapsed", dueRecord("lapsed", 0),
                "later", new SchedulingRecord("later", 2.5, 2, 6, NOW.plus(Duration.ofDays(3)), NOW.minus(Duration.ofDays(3)), 2, 0));

        Composition composition = stableComposer.compose(pool, records, config(10, false), NOW, new Random(TEST_SEED));

        assertEquals(List.of("lapsed", "n1"), composition.taskIds());
        assertEquals(0, composition.dueCount());
    }

    @Test
    public void testCompose_NotYetDueItemsSkipped() {
        List<ContentItem> pool = pool("later");
        Map<String, SchedulingRecord> records = Map.of(
                "later", new SchedulingRecord("later", 2.5, 2, 6, NOW.plus(Duration.ofDays(3)), NOW.minus(Duration.ofDays(3)), 2, 0));

        Composition composition = shuffledComposer.compose(pool, records, config(5, true), NOW, new Random(TEST_SEED));

        assertTrue(composition.taskIds().isEmpty());
    }

    @Test
    public void testCompose_NoDuplicates() {
        List<ContentItem> pool = new ArrayList<>(pool("a", "b", "c"));
        pool.addAll(pool("b", "c"));

        Composition composition = shuffledComposer.compose(pool, Map.of(), config(10, true), NOW, new Random(TEST_SEED));

        assertEquals(3, composition.taskIds().size());
        assertEquals(3, new HashSet<>(composition.taskIds()).size());
    }

    @Test
    public void testCompose_SameSeedSameOrder() {
        List<String> ids = new ArrayList<>();
        for (int index = 0; index < 30; index++) {
            ids.add(String.format("item-%02d", index));
        }
        List<ContentItem> pool = pool(ids.toArray(new String[0]));
        List<ContentItem> reversedPool = new ArrayList<>(pool);
        Collections.reverse(reversedPool);

        Composition first = shuffledComposer.compose(pool, Map.of(), config(10, true), NOW, new Random(TEST_SEED));
        Composition second = shuffledComposer.compose(reversedPool, Map.of(), config(10, true), NOW, new Random(TEST_SEED));

        assertEquals(first.taskIds(), second.taskIds());
    }

    @Test
    public void testCompose_EmptyPool() {
        Composition composition = shuffledComposer.compose(List.of(), Map.of(), config(5, true), NOW, new Random(TEST_SEED));

        assertTrue(composition.taskIds().isEmpty());
        assertTrue(composition.underflow());
    }

    @Test
    public void testCompose_NonPositiveTarget() {
        try {
            shuffledComposer.compose(pool("a"), Map.of(), config(0, true), NOW, new Random(TEST_SEED));
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException ex) {
            // expected
        }
    }

    private static List<ContentItem> pool(String... ids) {
        return Arrays.stream(ids).map(TestUtils::flashcard).toList();
    }

    private static SchedulingRecord dueRecord(String itemId, int repetitionCount) {
        return new SchedulingRecord(itemId, 2.5, repetitionCount, 1, NOW.minus(Duration.ofHours(1)), NOW.minus(Duration.ofDays(1)), repetitionCount, 0);
    }

    private static SessionConfiguration config(int targetCount, boolean includeReview) {
        return new SessionConfiguration(TestUtils.TEST_TOPIC_ID, List.of(TestUtils.TEST_LEARNING_PATH_ID), targetCount, includeReview);
    }
}

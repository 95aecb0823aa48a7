package com.gt.practice.composer;

import com.gt.practice.model.ContentItem;
import com.gt.practice.model.SchedulingRecord;
import com.gt.practice.model.SessionConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.*;

/**
 * Picks the ordered task list for a new session. Items due for review come first, then new items fill whatever is left
 * of the target count. An item is never picked twice.
 */
@Component
public class SessionComposer {

    private static final Logger log = LoggerFactory.getLogger(SessionComposer.class);

    private final CompositionOrder order;

    @Autowired
    public SessionComposer(@Value("${practice.composer.order:Shuffled}") CompositionOrder order) {
        this.order = order;
    }

    public SessionComposer() {
        this(CompositionOrder.Shuffled);
    }

    public Composition compose(Collection<ContentItem> pool,
                               Map<String, SchedulingRecord> records,
                               SessionConfiguration configuration,
                               Instant now,
                               Random random) {
        if (configuration.targetCount() <= 0) {
            throw new IllegalArgumentException("Target count must be positive, was " + configuration.targetCount());
        }

        List<String> dueIds = new ArrayList<>();
        List<String> newIds = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (ContentItem item : pool) {
            if (!seen.add(item.id())) {
                continue;
            }

            SchedulingRecord record = records.get(item.id());
            if (record == null) {
                newIds.add(item.id());
            } else if (configuration.includeReview() && record.isDue(now)) {
                dueIds.add(item.id());
            } else if (record.repetitionCount() == 0) {
                newIds.add(item.id());
            }
        }

        arrange(dueIds, random);
        arrange(newIds, random);

        int dueTaken = Math.min(dueIds.size(), configuration.targetCount());
        int newTaken = Math.min(newIds.size(), configuration.targetCount() - dueTaken);

        List<String> taskIds = new ArrayList<>(dueTaken + newTaken);
        taskIds.addAll(dueIds.subList(0, dueTaken));
        taskIds.addAll(newIds.subList(0, newTaken));

        Composition composition = new Composition(taskIds, configuration.targetCount(), dueTaken, newTaken);

        if (composition.underflow()) {
            log.info("Session for topic {} underflowed: {} of {} requested tasks available ({} due, {} new)",
                    configuration.topicId(), taskIds.size(), configuration.targetCount(), dueTaken, newTaken);
        }

        return composition;
    }

    private void arrange(List<String> itemIds, Random random) {
        Collections.sort(itemIds);
        if (order == CompositionOrder.Shuffled) {
            Collections.shuffle(itemIds, random);
        }
    }
}

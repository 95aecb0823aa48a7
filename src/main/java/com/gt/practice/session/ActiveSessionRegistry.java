package com.gt.practice.session;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

// In-memory state machines of the sessions currently being practiced, keyed by session id
@Component
public class ActiveSessionRegistry {

    private final Map<String, Registration> machines = new ConcurrentHashMap<>();

    public Optional<PracticeSessionStateMachine> get(String sessionId, Instant now) {
        Registration registration = machines.computeIfPresent(sessionId, (id, existing) -> existing.touchedAt(now));
        return Optional.ofNullable(registration).map(Registration::machine);
    }

    // Returns the machine already registered for the session if another thread got there first
    public PracticeSessionStateMachine register(PracticeSessionStateMachine machine, Instant now) {
        Registration registration = machines.compute(machine.getSession().id(),
                (id, existing) -> existing == null ? new Registration(machine, now) : existing.touchedAt(now));
        return registration.machine();
    }

    // Only drops the given machine; a newer one registered under the same id stays
    public void remove(String sessionId, PracticeSessionStateMachine machine) {
        machines.computeIfPresent(sessionId, (id, existing) -> existing.machine() == machine ? null : existing);
    }

    /**
     * Drops machines not used since {@code cutoff}. Machines still holding unacknowledged writes are kept so a later
     * sync can flush them.
     *
     * @return number of machines dropped
     */
    public int evictIdle(Instant cutoff) {
        int evicted = 0;
        for (Map.Entry<String, Registration> entry : machines.entrySet()) {
            Registration registration = entry.getValue();
            if (registration.lastAccessAt().isBefore(cutoff)
                    && !hasPendingWrites(registration.machine())
                    && machines.remove(entry.getKey(), registration)) {
                evicted++;
            }
        }

        return evicted;
    }

    public int size() {
        return machines.size();
    }

    private static boolean hasPendingWrites(PracticeSessionStateMachine machine) {
        synchronized (machine) {
            return machine.hasPendingWrites();
        }
    }

    private record Registration(PracticeSessionStateMachine machine, Instant lastAccessAt) {

        Registration touchedAt(Instant now) {
            return now.isAfter(lastAccessAt) ? new Registration(machine, now) : this;
        }
    }
}

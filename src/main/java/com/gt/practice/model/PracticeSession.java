package com.gt.practice.model;

import java.time.Instant;
import java.util.List;

public record PracticeSession(String id,
                              String learnerId,
                              SessionConfiguration configuration,
                              SessionExecution execution,
                              SessionResults results,
                              long version,
                              Instant createdAt,
                              Instant updatedAt) {

    public static PracticeSession create(String id, String learnerId, SessionConfiguration configuration, List<String> taskIds, Instant now) {
        return new PracticeSession(id, learnerId, configuration, SessionExecution.planned(taskIds), SessionResults.EMPTY, 0, now, now);
    }

    public SessionStatus status() {
        return execution.status();
    }

    public PracticeSession withExecution(SessionExecution newExecution, Instant now) {
        return new PracticeSession(id, learnerId, configuration, newExecution, results, version, createdAt, now);
    }

    public PracticeSession withResults(SessionResults newResults) {
        return new PracticeSession(id, learnerId, configuration, execution, newResults, version, createdAt, updatedAt);
    }

    public PracticeSession withVersion(long newVersion) {
        return new PracticeSession(id, learnerId, configuration, execution, results, newVersion, createdAt, updatedAt);
    }
}

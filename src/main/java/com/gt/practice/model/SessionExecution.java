package com.gt.practice.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public record SessionExecution(List<String> taskIds,
                               int currentTaskIndex,
                               int completedCount,
                               int correctCount,
                               int skippedCount,
                               long totalTimeMs,
                               SessionStatus status,
                               Instant startedAt,
                               Instant completedAt,
                               List<TaskOutcome> outcomes) {

    public SessionExecution {
        taskIds = List.copyOf(taskIds);
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public static SessionExecution planned(List<String> taskIds) {
        return new SessionExecution(taskIds, 0, 0, 0, 0, 0, SessionStatus.NotStarted, null, null, List.of());
    }

    public SessionExecution started(Instant now) {
        return new SessionExecution(taskIds, 0, completedCount, correctCount, skippedCount, totalTimeMs,
                SessionStatus.InProgress, now, completedAt, outcomes);
    }

    public SessionExecution withAnswer(TaskOutcome outcome) {
        return new SessionExecution(taskIds, currentTaskIndex, completedCount + 1,
                outcome.correct() ? correctCount + 1 : correctCount, skippedCount, totalTimeMs + outcome.timeSpentMs(),
                status, startedAt, completedAt, append(outcome));
    }

    public SessionExecution withSkip(TaskOutcome outcome) {
        return new SessionExecution(taskIds, currentTaskIndex, completedCount, correctCount, skippedCount + 1, totalTimeMs,
                status, startedAt, completedAt, append(outcome));
    }

    public SessionExecution atTask(int taskIndex) {
        return new SessionExecution(taskIds, taskIndex, completedCount, correctCount, skippedCount, totalTimeMs,
                status, startedAt, completedAt, outcomes);
    }

    public SessionExecution finished(SessionStatus finalStatus, Instant now) {
        return new SessionExecution(taskIds, currentTaskIndex, completedCount, correctCount, skippedCount, totalTimeMs,
                finalStatus, startedAt, now, outcomes);
    }

    @JsonIgnore
    public boolean isLastTask() {
        return currentTaskIndex >= taskIds.size() - 1;
    }

    public String currentTaskId() {
        return currentTaskIndex < taskIds.size() ? taskIds.get(currentTaskIndex) : null;
    }

    // True when the task under the cursor already has an outcome recorded but the cursor has not moved on
    @JsonIgnore
    public boolean isCurrentTaskResolved() {
        return outcomes.size() > currentTaskIndex;
    }

    private List<TaskOutcome> append(TaskOutcome outcome) {
        List<TaskOutcome> newOutcomes = new ArrayList<>(outcomes);
        newOutcomes.add(outcome);
        return newOutcomes;
    }
}

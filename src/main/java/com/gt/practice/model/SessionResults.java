package com.gt.practice.model;

import java.util.EnumMap;
import java.util.Map;

public record SessionResults(double accuracy,
                             double averageTimeMs,
                             int hintsUsed,
                             Map<TaskVariant, VariantStats> perVariant) {

    public static final SessionResults EMPTY = new SessionResults(0, 0, 0, Map.of());

    public SessionResults {
        perVariant = perVariant == null ? Map.of() : Map.copyOf(perVariant);
    }

    public static SessionResults fromExecution(SessionExecution execution) {
        Map<TaskVariant, VariantStats> perVariant = new EnumMap<>(TaskVariant.class);
        int hintsUsed = 0;

        for (TaskOutcome outcome : execution.outcomes()) {
            if (outcome.hintUsed()) {
                hintsUsed++;
            }
            if (!outcome.skipped()) {
                perVariant.put(outcome.variant(), perVariant.getOrDefault(outcome.variant(), VariantStats.EMPTY).plus(outcome));
            }
        }

        int completed = execution.completedCount();
        return new SessionResults(
                completed == 0 ? 0 : (double) execution.correctCount() / completed,
                completed == 0 ? 0 : (double) execution.totalTimeMs() / completed,
                hintsUsed,
                perVariant);
    }
}

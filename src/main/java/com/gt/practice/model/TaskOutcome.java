package com.gt.practice.model;

public record TaskOutcome(String itemId,
                          TaskVariant variant,
                          boolean correct,
                          double score,
                          long timeSpentMs,
                          boolean skipped,
                          boolean hintUsed) {

    public static TaskOutcome answered(ContentItem item, EvaluationResult result, boolean hintUsed) {
        return new TaskOutcome(item.id(), item.variant(), result.correct(), result.score(), result.timeSpentMs(), false, hintUsed);
    }

    public static TaskOutcome skipped(ContentItem item, long timeSpentMs, boolean hintUsed) {
        return new TaskOutcome(item.id(), item.variant(), false, 0, timeSpentMs, true, hintUsed);
    }
}

package com.gt.practice.model;

public record SessionSnapshot(String sessionId,
                              SessionExecution execution,
                              SessionResults results,
                              ContentItem currentTask,
                              TaskState taskState,
                              boolean hintVisible,
                              EvaluationResult lastEvaluation,
                              boolean syncPending) { }

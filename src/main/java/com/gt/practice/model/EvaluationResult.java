package com.gt.practice.model;

public record EvaluationResult(boolean correct,
                               double score,
                               CanonicalAnswer canonicalAnswer,
                               long timeSpentMs) {

    public static EvaluationResult ofScore(double score, CanonicalAnswer canonicalAnswer, long timeSpentMs) {
        return new EvaluationResult(score >= 1.0, score, canonicalAnswer, timeSpentMs);
    }

    public static EvaluationResult ofMatch(boolean correct, CanonicalAnswer canonicalAnswer, long timeSpentMs) {
        return new EvaluationResult(correct, correct ? 1.0 : 0.0, canonicalAnswer, timeSpentMs);
    }
}

package com.gt.practice.schedule;

import com.gt.practice.model.EvaluationResult;
import com.gt.practice.model.Quality;
import com.gt.practice.model.TaskVariant;

// Turns a graded answer into an SM-2 recall quality
public class QualityMapper {

    private static final double PERFECT_SCORE_THRESHOLD = 0.9;
    private static final double GOOD_SCORE_THRESHOLD = 0.6;
    private static final double PASSING_SCORE_THRESHOLD = 0.3;

    public static Quality fromEvaluation(TaskVariant variant, EvaluationResult result) {
        if (!variant.hasPartialCredit()) {
            return result.correct() ? Quality.PERFECT : Quality.FAILED;
        }

        return fromScore(result.score());
    }

    public static Quality fromScore(double score) {
        if (score >= PERFECT_SCORE_THRESHOLD) {
            return Quality.of(5);
        } else if (score >= GOOD_SCORE_THRESHOLD) {
            return Quality.of(4);
        } else if (score >= PASSING_SCORE_THRESHOLD) {
            return Quality.of(3);
        } else {
            return Quality.FAILED;
        }
    }
}

package com.gt.practice.model;

public record VariantStats(int answered, int correct, long totalTimeMs) {

    public static final VariantStats EMPTY = new VariantStats(0, 0, 0);

    public VariantStats plus(TaskOutcome outcome) {
        return new VariantStats(answered + 1, outcome.correct() ? correct + 1 : correct, totalTimeMs + outcome.timeSpentMs());
    }

    public double accuracy() {
        return answered == 0 ? 0 : (double) correct / answered;
    }
}

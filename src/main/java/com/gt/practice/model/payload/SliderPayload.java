package com.gt.practice.model.payload;

public record SliderPayload(String question,
                            double min,
                            double max,
                            double step,
                            double target,
                            double tolerance,
                            String unit) implements TaskPayload {

    public SliderPayload {
        if (min > max) {
            throw new IllegalArgumentException("Slider min " + min + " is greater than max " + max);
        }
        if (tolerance < 0) {
            throw new IllegalArgumentException("Slider tolerance must not be negative");
        }
    }
}

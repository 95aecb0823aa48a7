package com.gt.practice.model;

// averageAccuracy is the mean over items reviewed at least once, 0 when none has been
public record SchedulingStatistics(int totalItems,
                                   int dueNow,
                                   int graduated,
                                   double averageIntervalDays,
                                   double averageAccuracy) {

    public static final SchedulingStatistics EMPTY = new SchedulingStatistics(0, 0, 0, 0, 0);
}

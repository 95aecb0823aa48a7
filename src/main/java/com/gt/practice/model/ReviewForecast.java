package com.gt.practice.model;

import java.time.Instant;

// Number of items falling due in the 24 hours starting at dayStart. Day 0 also counts overdue items.
public record ReviewForecast(int dayOffset, Instant dayStart, int dueCount) { }

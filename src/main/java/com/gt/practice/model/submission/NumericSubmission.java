package com.gt.practice.model.submission;

public record NumericSubmission(double value) implements Submission { }

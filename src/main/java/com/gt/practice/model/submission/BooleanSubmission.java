package com.gt.practice.model.submission;

public record BooleanSubmission(boolean value) implements Submission { }

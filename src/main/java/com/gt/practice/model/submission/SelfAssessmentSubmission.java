package com.gt.practice.model.submission;

public record SelfAssessmentSubmission(boolean known) implements Submission { }

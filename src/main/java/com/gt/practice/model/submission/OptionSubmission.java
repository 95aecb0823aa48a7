package com.gt.practice.model.submission;

public record OptionSubmission(String optionId) implements Submission { }

package com.gt.practice.model.submission;

public record TextSubmission(String text) implements Submission { }

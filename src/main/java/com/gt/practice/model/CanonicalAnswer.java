package com.gt.practice.model;

import com.gt.practice.model.submission.Submission;

// What the right answer was: a display string and the submission that would have scored 1.0
public record CanonicalAnswer(String display, Submission expected) { }

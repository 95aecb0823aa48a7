package com.gt.practice.model.payload;

public record TrueFalsePayload(String statement, boolean correctAnswer) implements TaskPayload { }

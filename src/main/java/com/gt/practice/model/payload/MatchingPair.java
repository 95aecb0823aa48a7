package com.gt.practice.model.payload;

public record MatchingPair(String leftId, String left, String rightId, String right) { }

package com.gt.practice.model.payload;

public record ChoiceOption(String id, String text) { }

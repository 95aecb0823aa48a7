package com.gt.practice.model.payload;

public record FlashcardPayload(String front, String back) implements TaskPayload { }

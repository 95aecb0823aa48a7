package com.gt.practice.model.payload;

import java.util.List;

public record TextInputPayload(String question, List<String> acceptedAnswers, boolean caseSensitive) implements TaskPayload {

    public TextInputPayload {
        acceptedAnswers = List.copyOf(acceptedAnswers);
        if (acceptedAnswers.isEmpty()) {
            throw new IllegalArgumentException("Text input needs at least one accepted answer");
        }
    }
}

package com.gt.practice.model.payload;

import java.util.List;
import java.util.Objects;

public record MultipleChoicePayload(String question, List<ChoiceOption> options, String correctOptionId) implements TaskPayload {

    public MultipleChoicePayload {
        options = List.copyOf(options);
        Objects.requireNonNull(correctOptionId, "correctOptionId");
    }
}

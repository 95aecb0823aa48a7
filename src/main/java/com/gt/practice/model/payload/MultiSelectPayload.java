package com.gt.practice.model.payload;

import java.util.List;
import java.util.Set;

public record MultiSelectPayload(String question, List<ChoiceOption> options, Set<String> correctOptionIds) implements TaskPayload {

    public MultiSelectPayload {
        options = List.copyOf(options);
        correctOptionIds = Set.copyOf(correctOptionIds);
    }
}

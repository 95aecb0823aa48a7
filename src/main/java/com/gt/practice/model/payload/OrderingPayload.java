package com.gt.practice.model.payload;

import java.util.List;

public record OrderingPayload(String question, List<ChoiceOption> items, List<String> correctOrder) implements TaskPayload {

    public OrderingPayload {
        items = List.copyOf(items);
        correctOrder = List.copyOf(correctOrder);
    }
}

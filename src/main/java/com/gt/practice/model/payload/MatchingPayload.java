package com.gt.practice.model.payload;

import java.util.List;

public record MatchingPayload(String question, List<MatchingPair> pairs) implements TaskPayload {

    public MatchingPayload {
        pairs = List.copyOf(pairs);
    }
}

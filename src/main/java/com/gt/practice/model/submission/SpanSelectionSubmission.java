package com.gt.practice.model.submission;

import java.util.Set;

public record SpanSelectionSubmission(Set<Integer> spanIndices) implements Submission {

    public SpanSelectionSubmission {
        spanIndices = spanIndices == null ? Set.of() : Set.copyOf(spanIndices);
    }
}

package com.gt.practice.model.payload;

import java.util.List;
import java.util.Set;

/**
 * Content split into selectable spans. {@link #errorIndices()} are the indices into {@link #spans()} that contain an error.
 */
public record ErrorDetectionPayload(String content, List<String> spans, Set<Integer> errorIndices) implements TaskPayload {

    public ErrorDetectionPayload {
        spans = List.copyOf(spans);
        errorIndices = Set.copyOf(errorIndices);
        for (Integer index : errorIndices) {
            if (index < 0 || index >= spans.size()) {
                throw new IllegalArgumentException("Error index " + index + " is outside of the " + spans.size() + " spans");
            }
        }
    }
}

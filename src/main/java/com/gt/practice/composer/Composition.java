package com.gt.practice.composer;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record Composition(List<String> taskIds, int targetCount, int dueCount, int newCount) {

    public Composition {
        taskIds = List.copyOf(taskIds);
    }

    // Fewer eligible items than requested. Reported to the caller, not an error.
    @JsonProperty
    public boolean underflow() {
        return taskIds.size() < targetCount;
    }
}

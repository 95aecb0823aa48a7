package com.gt.practice.model;

import java.util.List;

public record SessionConfiguration(String topicId,
                                   List<String> learningPathIds,
                                   int targetCount,
                                   boolean includeReview) {

    public SessionConfiguration {
        learningPathIds = learningPathIds == null ? List.of() : learningPathIds.stream().distinct().toList();
    }
}

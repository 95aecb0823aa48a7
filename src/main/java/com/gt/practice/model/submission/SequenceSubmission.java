package com.gt.practice.model.submission;

import java.util.List;

public record SequenceSubmission(List<String> order) implements Submission {

    public SequenceSubmission {
        order = order == null ? List.of() : List.copyOf(order);
    }
}

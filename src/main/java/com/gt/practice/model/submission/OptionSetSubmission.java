package com.gt.practice.model.submission;

import java.util.Set;

public record OptionSetSubmission(Set<String> optionIds) implements Submission {

    public OptionSetSubmission {
        optionIds = optionIds == null ? Set.of() : Set.copyOf(optionIds);
    }
}

package com.gt.practice.model.submission;

import java.util.Map;

/**
 * Left id to the right id the learner paired it with.
 */
public record PairingSubmission(Map<String, String> pairs) implements Submission {

    public PairingSubmission {
        pairs = pairs == null ? Map.of() : Map.copyOf(pairs);
    }
}

package com.gt.practice.model.submission;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record BlankSubmission(List<String> answers) implements Submission {

    // Blanks left unanswered may be null, so List.copyOf can't be used here
    public BlankSubmission {
        answers = answers == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(answers));
    }
}

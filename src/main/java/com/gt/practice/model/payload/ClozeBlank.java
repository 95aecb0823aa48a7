package com.gt.practice.model.payload;

import java.util.List;

public record ClozeBlank(String correctAnswer, List<String> alternatives) {

    public ClozeBlank {
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
    }
}

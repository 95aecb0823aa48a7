package com.gt.practice.model.payload;

import java.util.Objects;

public record WordScramblePayload(String question, String scrambledLetters, String targetWord) implements TaskPayload {

    public WordScramblePayload {
        Objects.requireNonNull(targetWord, "targetWord");
    }
}

package com.gt.practice.model.payload;

import java.util.List;

/**
 * Text with one or more blanks, written as {@code ___} in {@link #text()}. Blanks are answered in order.
 */
public record ClozeDeletionPayload(String text, List<ClozeBlank> blanks) implements TaskPayload {

    public ClozeDeletionPayload {
        blanks = List.copyOf(blanks);
    }
}

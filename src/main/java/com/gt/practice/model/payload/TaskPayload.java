package com.gt.practice.model.payload;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = MultipleChoicePayload.class, name = "multiple-choice"),
        @JsonSubTypes.Type(value = MultiSelectPayload.class, name = "multi-select"),
        @JsonSubTypes.Type(value = ClozeDeletionPayload.class, name = "cloze-deletion"),
        @JsonSubTypes.Type(value = MatchingPayload.class, name = "matching"),
        @JsonSubTypes.Type(value = OrderingPayload.class, name = "ordering"),
        @JsonSubTypes.Type(value = TrueFalsePayload.class, name = "true-false"),
        @JsonSubTypes.Type(value = SliderPayload.class, name = "slider"),
        @JsonSubTypes.Type(value = TextInputPayload.class, name = "text-input"),
        @JsonSubTypes.Type(value = WordScramblePayload.class, name = "word-scramble"),
        @JsonSubTypes.Type(value = ErrorDetectionPayload.class, name = "error-detection"),
        @JsonSubTypes.Type(value = FlashcardPayload.class, name = "flashcard")
})
public sealed interface TaskPayload permits MultipleChoicePayload, MultiSelectPayload, ClozeDeletionPayload, MatchingPayload,
        OrderingPayload, TrueFalsePayload, SliderPayload, TextInputPayload, WordScramblePayload, ErrorDetectionPayload,
        FlashcardPayload { }

package com.gt.practice.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.practice.model.payload.*;
import com.gt.practice.model.submission.*;
import com.gt.practice.serialization.TaskVariantDeserializer;
import com.gt.practice.serialization.TaskVariantKeyDeserializer;
import com.gt.practice.serialization.TaskVariantKeySerializer;
import com.gt.practice.serialization.TaskVariantSerializer;

@JsonSerialize(using = TaskVariantSerializer.class, keyUsing = TaskVariantKeySerializer.class)
@JsonDeserialize(using = TaskVariantDeserializer.class, keyUsing = TaskVariantKeyDeserializer.class)
public enum TaskVariant {
    MultipleChoice("multiple-choice", MultipleChoicePayload.class, OptionSubmission.class),
    MultiSelect("multi-select", MultiSelectPayload.class, OptionSetSubmission.class),
    ClozeDeletion("cloze-deletion", ClozeDeletionPayload.class, BlankSubmission.class),
    Matching("matching", MatchingPayload.class, PairingSubmission.class),
    Ordering("ordering", OrderingPayload.class, SequenceSubmission.class),
    TrueFalse("true-false", TrueFalsePayload.class, BooleanSubmission.class),
    Slider("slider", SliderPayload.class, NumericSubmission.class),
    TextInput("text-input", TextInputPayload.class, TextSubmission.class),
    WordScramble("word-scramble", WordScramblePayload.class, TextSubmission.class),
    ErrorDetection("error-detection", ErrorDetectionPayload.class, SpanSelectionSubmission.class),
    Flashcard("flashcard", FlashcardPayload.class, SelfAssessmentSubmission.class);

    private final String code;
    private final Class<? extends TaskPayload> payloadType;
    private final Class<? extends Submission> submissionType;

    TaskVariant(String code, Class<? extends TaskPayload> payloadType, Class<? extends Submission> submissionType) {
        this.code = code;
        this.payloadType = payloadType;
        this.submissionType = submissionType;
    }

    public String getCode() {
        return code;
    }

    public Class<? extends TaskPayload> getPayloadType() {
        return payloadType;
    }

    public Class<? extends Submission> getSubmissionType() {
        return submissionType;
    }

    // Variants whose score can fall strictly between 0 and 1
    public boolean hasPartialCredit() {
        return this == MultiSelect || this == ClozeDeletion || this == Matching || this == ErrorDetection;
    }

    public static TaskVariant fromCode(String code) {
        for (TaskVariant variant : values()) {
            if (variant.code.equals(code)) {
                return variant;
            }
        }

        return null;
    }
}

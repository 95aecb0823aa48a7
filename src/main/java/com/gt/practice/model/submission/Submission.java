package com.gt.practice.model.submission;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = OptionSubmission.class, name = "option"),
        @JsonSubTypes.Type(value = OptionSetSubmission.class, name = "option-set"),
        @JsonSubTypes.Type(value = BlankSubmission.class, name = "blanks"),
        @JsonSubTypes.Type(value = PairingSubmission.class, name = "pairing"),
        @JsonSubTypes.Type(value = SequenceSubmission.class, name = "sequence"),
        @JsonSubTypes.Type(value = BooleanSubmission.class, name = "boolean"),
        @JsonSubTypes.Type(value = NumericSubmission.class, name = "numeric"),
        @JsonSubTypes.Type(value = TextSubmission.class, name = "text"),
        @JsonSubTypes.Type(value = SpanSelectionSubmission.class, name = "span-selection"),
        @JsonSubTypes.Type(value = SelfAssessmentSubmission.class, name = "self-assessment")
})
public sealed interface Submission permits OptionSubmission, OptionSetSubmission, BlankSubmission, PairingSubmission,
        SequenceSubmission, BooleanSubmission, NumericSubmission, TextSubmission, SpanSelectionSubmission,
        SelfAssessmentSubmission { }

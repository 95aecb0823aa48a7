package com.gt.practice.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.practice.serialization.SessionStatusDeserializer;
import com.gt.practice.serialization.SessionStatusSerializer;

@JsonSerialize(using = SessionStatusSerializer.class)
@JsonDeserialize(using = SessionStatusDeserializer.class)
public enum SessionStatus {
    NotStarted("not-started"),
    InProgress("in-progress"),
    Completed("completed"),
    Cancelled("cancelled");

    private final String code;

    SessionStatus(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean isFinal() {
        return this == Completed || this == Cancelled;
    }

    public static SessionStatus fromCode(String code) {
        for (SessionStatus status : values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }

        return null;
    }
}

package com.gt.practice.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.gt.practice.model.SessionStatus;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class SessionStatusDeserializer extends JsonDeserializer<SessionStatus> {
    @Override
    public SessionStatus deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException {
        String code = jsonParser.getValueAsString();
        SessionStatus sessionStatus = SessionStatus.fromCode(code);
        if (sessionStatus == null) {
            return (SessionStatus) deserializationContext.handleWeirdStringValue(SessionStatus.class, code, "Unknown session status");
        }
        return sessionStatus;
    }
}

package com.gt.practice.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.gt.practice.model.TaskVariant;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class TaskVariantDeserializer extends JsonDeserializer<TaskVariant> {
    @Override
    public TaskVariant deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException {
        String code = jsonParser.getValueAsString();
        TaskVariant taskVariant = TaskVariant.fromCode(code);
        if (taskVariant == null) {
            return (TaskVariant) deserializationContext.handleWeirdStringValue(TaskVariant.class, code, "Unknown task variant");
        }
        return taskVariant;
    }
}

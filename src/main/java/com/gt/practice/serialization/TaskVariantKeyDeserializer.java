package com.gt.practice.serialization;

import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.KeyDeserializer;
import com.gt.practice.model.TaskVariant;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class TaskVariantKeyDeserializer extends KeyDeserializer {
    @Override
    public Object deserializeKey(String key, DeserializationContext deserializationContext) throws IOException {
        TaskVariant taskVariant = TaskVariant.fromCode(key);
        if (taskVariant == null) {
            return deserializationContext.handleWeirdKey(TaskVariant.class, key, "Unknown task variant");
        }
        return taskVariant;
    }
}

package com.gt.practice.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.gt.practice.model.TaskVariant;
import org.springframework.stereotype.Component;

import java.io.IOException;

// Map keys use the same code as values
@Component
public class TaskVariantKeySerializer extends JsonSerializer<TaskVariant> {
    @Override
    public void serialize(TaskVariant taskVariant, JsonGenerator jsonGenerator, SerializerProvider serializerProvider) throws IOException {
        jsonGenerator.writeFieldName(taskVariant.getCode());
    }
}

package com.gt.practice.model;

import com.gt.practice.model.payload.TaskPayload;

import java.util.Objects;

public record ContentItem(String id,
                          String topicId,
                          String learningPathId,
                          TaskVariant variant,
                          TaskPayload payload,
                          String hint) {

    public ContentItem {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(variant, "variant");
        Objects.requireNonNull(payload, "payload");

        if (!variant.getPayloadType().isInstance(payload)) {
            throw new IllegalArgumentException("Content item " + id + " has variant " + variant.getCode()
                    + " but payload " + payload.getClass().getSimpleName());
        }
    }

    public boolean hasHint() {
        return hint != null && !hint.isBlank();
    }
}

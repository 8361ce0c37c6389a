package com.datcoord.store;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public record ContentId(String value) {
    public ContentId {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("content id must not be blank");
        }
        value = value.strip();
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ContentId of(String value) {
        return new ContentId(value);
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}

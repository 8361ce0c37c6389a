package com.datcoord.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public record Identity(String value) implements Comparable<Identity> {
    public Identity {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("identity must not be blank");
        }
        value = value.strip();
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Identity of(String value) {
        return new Identity(value);
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }

    @Override
    public int compareTo(Identity other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}

package com.datcoord.session;

import java.util.Locale;

import com.datcoord.core.CoordinationException;
import com.datcoord.core.ErrorCode;

public enum OptimizerKind {
    ADAM,
    SGD,
    RMSPROP,
    ADAGRAD;

    public static OptimizerKind fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new CoordinationException(ErrorCode.INVALID_CONFIG, "optimizer is required");
        }
        try {
            return valueOf(name.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new CoordinationException(ErrorCode.INVALID_CONFIG, "unknown optimizer: " + name);
        }
    }
}

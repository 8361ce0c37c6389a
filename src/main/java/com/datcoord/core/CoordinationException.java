package com.datcoord.core;

public class CoordinationException extends RuntimeException {
    private final ErrorCode code;

    public CoordinationException(ErrorCode code, String message) {
        super("[" + code + "] " + message);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}

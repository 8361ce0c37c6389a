package com.datcoord.core;

public enum ErrorCode {
    INVALID_CONFIG,
    SESSION_CONFLICT,
    INVALID_TRANSITION,
    SESSION_NOT_FOUND,
    UNKNOWN_MODEL_VERSION,
    STALE_VERSION,
    MODEL_NOT_FOUND,
    LINEAGE_EXISTS,
    VERSION_NOT_FINALIZED,
    NOT_AUTHORIZED,
    ALREADY_FINALIZED,
    UNKNOWN_CONTRIBUTOR,
    INVALID_ARGUMENT,
    INVALID_GRADIENT
}

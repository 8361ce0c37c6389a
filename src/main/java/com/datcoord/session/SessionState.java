package com.datcoord.session;

public enum SessionState {
    CREATED,
    RUNNING,
    PAUSED,
    COMPLETED,
    STOPPED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == STOPPED || this == FAILED;
    }
}

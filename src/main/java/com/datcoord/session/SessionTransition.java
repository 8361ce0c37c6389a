package com.datcoord.session;

public record SessionTransition(
        long at,
        SessionState from,
        SessionState to,
        String detail) {
}

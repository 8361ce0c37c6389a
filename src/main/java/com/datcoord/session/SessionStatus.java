package com.datcoord.session;

import java.util.List;

public record SessionStatus(
        String sessionId,
        String modelRef,
        TrainingConfig config,
        SessionState state,
        int currentEpoch,
        List<EpochMetrics> metricsHistory,
        String failureReason,
        List<SessionTransition> transitions) {

    public SessionStatus {
        metricsHistory = metricsHistory == null ? List.of() : List.copyOf(metricsHistory);
        transitions = transitions == null ? List.of() : List.copyOf(transitions);
    }
}

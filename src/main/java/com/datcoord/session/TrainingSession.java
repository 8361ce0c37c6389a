package com.datcoord.session;

import java.util.ArrayList;
import java.util.List;

import com.datcoord.store.ContentId;

final class TrainingSession {
    private final String sessionId;
    private final String modelRef;
    private TrainingConfig config;
    private SessionState state;
    private int currentEpoch;
    private final List<EpochMetrics> metricsHistory = new ArrayList<>();
    private String failureReason;
    private final List<SessionTransition> transitions = new ArrayList<>();

    TrainingSession(String sessionId, String modelRef, TrainingConfig config, long createdAt) {
        this.sessionId = sessionId;
        this.modelRef = modelRef;
        this.config = config;
        this.state = SessionState.CREATED;
        this.transitions.add(new SessionTransition(createdAt, null, SessionState.CREATED, "created"));
    }

    static TrainingSession fromStatus(SessionStatus status) {
        TrainingSession session = new TrainingSession(status.sessionId(), status.modelRef(), status.config(), 0L);
        session.transitions.clear();
        session.transitions.addAll(status.transitions());
        session.metricsHistory.addAll(status.metricsHistory());
        session.state = status.state();
        session.currentEpoch = status.currentEpoch();
        session.failureReason = status.failureReason();
        return session;
    }

    String sessionId() {
        return sessionId;
    }

    String modelRef() {
        return modelRef;
    }

    TrainingConfig config() {
        return config;
    }

    SessionState state() {
        return state;
    }

    int currentEpoch() {
        return currentEpoch;
    }

    void attachDataset(ContentId datasetRef) {
        this.config = config.withDatasetRef(datasetRef);
    }

    void transition(SessionState to, long at, String detail) {
        transitions.add(new SessionTransition(at, state, to, detail));
        state = to;
    }

    void recordEpoch(double loss, double accuracy) {
        currentEpoch++;
        metricsHistory.add(new EpochMetrics(currentEpoch, loss, accuracy));
    }

    void recordFailure(String reason) {
        this.failureReason = reason;
    }

    long lastTransitionAt() {
        return transitions.isEmpty() ? 0L : transitions.get(transitions.size() - 1).at();
    }

    SessionStatus status() {
        return new SessionStatus(sessionId, modelRef, config, state, currentEpoch, metricsHistory, failureReason, transitions);
    }
}

package com.datcoord.session;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.datcoord.core.CoordinationException;
import com.datcoord.core.ErrorCode;
import com.datcoord.core.LogicalClock;
import com.datcoord.store.ContentId;

public class TrainingSessionManager {
    private static final Logger log = LoggerFactory.getLogger(TrainingSessionManager.class);

    private final Map<String, TrainingSession> sessions = new LinkedHashMap<>();
    private final LogicalClock clock;
    private final Set<OptimizerKind> allowedOptimizers;
    private final Supplier<String> idGenerator;

    public TrainingSessionManager(LogicalClock clock, Collection<OptimizerKind> allowedOptimizers) {
        this(clock, allowedOptimizers, () -> UUID.randomUUID().toString());
    }

    TrainingSessionManager(LogicalClock clock, Collection<OptimizerKind> allowedOptimizers, Supplier<String> idGenerator) {
        this.clock = clock;
        this.allowedOptimizers = allowedOptimizers.isEmpty()
                ? EnumSet.noneOf(OptimizerKind.class)
                : EnumSet.copyOf(allowedOptimizers);
        this.idGenerator = idGenerator;
    }

    public synchronized String start(String modelRef, TrainingConfig config) {
        if (modelRef == null || modelRef.isBlank()) {
            throw new CoordinationException(ErrorCode.INVALID_CONFIG, "modelRef must not be blank");
        }
        if (config == null) {
            throw new CoordinationException(ErrorCode.INVALID_CONFIG, "config is required");
        }
        config.validate(allowedOptimizers);
        String lineage = modelRef.strip();
        Optional<TrainingSession> active = activeLocked(lineage);
        if (active.isPresent()) {
            throw new CoordinationException(ErrorCode.SESSION_CONFLICT,
                    "lineage " + lineage + " already has session " + active.get().sessionId()
                            + " in state " + active.get().state());
        }

        String sessionId = idGenerator.get();
        TrainingSession session = new TrainingSession(sessionId, lineage, config, clock.tick());
        sessions.put(sessionId, session);
        log.info("session.created id={} lineage={} epochs={} optimizer={}",
                sessionId, lineage, config.epochs(), config.optimizer());
        if (config.datasetRef() != null) {
            move(session, SessionState.RUNNING, "dataset " + config.datasetRef());
        }
        return sessionId;
    }

    public synchronized SessionStatus begin(String sessionId, ContentId datasetRef) {
        TrainingSession session = require(sessionId);
        expect(session, "begin", SessionState.CREATED);
        ContentId dataset = datasetRef != null ? datasetRef : session.config().datasetRef();
        if (dataset == null) {
            throw new CoordinationException(ErrorCode.INVALID_ARGUMENT,
                    "session " + sessionId + " has no dataset to train on");
        }
        session.attachDataset(dataset);
        move(session, SessionState.RUNNING, "dataset " + dataset);
        return session.status();
    }

    public synchronized SessionStatus pause(String sessionId) {
        TrainingSession session = require(sessionId);
        expect(session, "pause", SessionState.RUNNING);
        move(session, SessionState.PAUSED, "paused");
        return session.status();
    }

    public synchronized SessionStatus resume(String sessionId) {
        TrainingSession session = require(sessionId);
        expect(session, "resume", SessionState.PAUSED);
        move(session, SessionState.RUNNING, "resumed");
        return session.status();
    }

    public synchronized SessionStatus stop(String sessionId) {
        TrainingSession session = require(sessionId);
        expect(session, "stop", SessionState.RUNNING, SessionState.PAUSED);
        move(session, SessionState.STOPPED, "stopped");
        return session.status();
    }

    public synchronized SessionStatus advanceEpoch(String sessionId, double loss, double accuracy) {
        TrainingSession session = require(sessionId);
        expect(session, "advanceEpoch", SessionState.RUNNING);
        if (!Double.isFinite(loss) || !Double.isFinite(accuracy)) {
            throw new CoordinationException(ErrorCode.INVALID_ARGUMENT,
                    "epoch metrics must be finite, got loss=" + loss + " accuracy=" + accuracy);
        }
        session.recordEpoch(loss, accuracy);
        log.info("session.epoch id={} epoch={}/{} loss={} accuracy={}",
                sessionId, session.currentEpoch(), session.config().epochs(), loss, accuracy);
        if (session.currentEpoch() == session.config().epochs()) {
            move(session, SessionState.COMPLETED, "all " + session.config().epochs() + " epochs done");
        }
        return session.status();
    }

    public synchronized SessionStatus fail(String sessionId, String reason) {
        TrainingSession session = require(sessionId);
        if (session.state().isTerminal()) {
            throw new CoordinationException(ErrorCode.INVALID_TRANSITION,
                    "cannot fail session " + sessionId + " in terminal state " + session.state());
        }
        String recorded = reason == null || reason.isBlank() ? "unspecified" : reason;
        session.recordFailure(recorded);
        move(session, SessionState.FAILED, recorded);
        return session.status();
    }

    public synchronized SessionStatus status(String sessionId) {
        return require(sessionId).status();
    }

    public synchronized List<SessionStatus> list() {
        return sessions.values().stream().map(TrainingSession::status).toList();
    }

    public synchronized List<SessionStatus> listByLineage(String modelRef) {
        return sessions.values().stream()
                .filter(session -> session.modelRef().equals(modelRef))
                .map(TrainingSession::status)
                .toList();
    }

    public synchronized Optional<SessionStatus> activeSession(String modelRef) {
        return activeLocked(modelRef).map(TrainingSession::status);
    }

    public synchronized void restore(Collection<SessionStatus> persisted) {
        if (!sessions.isEmpty()) {
            throw new IllegalStateException("restore requires an empty session table");
        }
        List<SessionStatus> ordered = new ArrayList<>(persisted);
        ordered.sort(Comparator.comparingLong(TrainingSessionManager::createdAt));
        for (SessionStatus status : ordered) {
            TrainingSession session = TrainingSession.fromStatus(status);
            sessions.put(session.sessionId(), session);
            clock.advanceTo(session.lastTransitionAt());
        }
    }

    private static long createdAt(SessionStatus status) {
        return status.transitions().isEmpty() ? 0L : status.transitions().get(0).at();
    }

    private Optional<TrainingSession> activeLocked(String lineage) {
        return sessions.values().stream()
                .filter(session -> session.modelRef().equals(lineage))
                .filter(session -> !session.state().isTerminal())
                .findFirst();
    }

    private TrainingSession require(String sessionId) {
        TrainingSession session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null) {
            throw new CoordinationException(ErrorCode.SESSION_NOT_FOUND, "unknown session " + sessionId);
        }
        return session;
    }

    private static void expect(TrainingSession session, String operation, SessionState... allowed) {
        for (SessionState state : allowed) {
            if (session.state() == state) {
                return;
            }
        }
        throw new CoordinationException(ErrorCode.INVALID_TRANSITION,
                "cannot " + operation + " session " + session.sessionId() + " in state " + session.state());
    }

    private void move(TrainingSession session, SessionState to, String detail) {
        SessionState from = session.state();
        session.transition(to, clock.tick(), detail);
        log.info("session.transition id={} lineage={} from={} to={} detail={}",
                session.sessionId(), session.modelRef(), from, to, detail);
    }
}

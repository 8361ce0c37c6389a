package com.datcoord.coordinator;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.datcoord.aggregation.AggregationEngine;
import com.datcoord.aggregation.AggregationReport;
import com.datcoord.aggregation.FederatedAveragingJob;
import com.datcoord.aggregation.FinalizeResult;
import com.datcoord.aggregation.GradientDocuments;
import com.datcoord.contributor.Contributor;
import com.datcoord.core.CoordinationException;
import com.datcoord.core.ErrorCode;
import com.datcoord.core.Identity;
import com.datcoord.gradient.GradientSubmission;
import com.datcoord.gradient.SubmissionResult;
import com.datcoord.session.SessionState;
import com.datcoord.session.SessionStatus;
import com.datcoord.session.TrainingConfig;
import com.datcoord.store.ContentId;
import com.datcoord.versioning.ModelVersion;

public class Coordinator {
    private static final Logger log = LoggerFactory.getLogger(Coordinator.class);

    private final CoordinationContext context;
    private final AggregationEngine engine;
    private final FederatedAveragingJob averagingJob;

    public Coordinator(CoordinationContext context) {
        this.context = context;
        this.engine = new AggregationEngine(
                context.versions(),
                context.pending(),
                context.contributors(),
                context.policy(),
                context.auditLog(),
                context.clock(),
                context.rewardPerContribution());
        this.averagingJob = new FederatedAveragingJob(context.contentStore(), context.pending(), engine);
    }

    public CoordinationContext context() {
        return context;
    }

    public String startSession(String modelRef, TrainingConfig config) {
        if (modelRef != null && !modelRef.isBlank() && context.versions().latest(modelRef.strip()).isEmpty()) {
            throw new CoordinationException(ErrorCode.MODEL_NOT_FOUND, "unknown lineage: " + modelRef.strip());
        }
        return context.sessions().start(modelRef, config);
    }

    public SessionStatus beginSession(String sessionId, ContentId datasetRef) {
        return context.sessions().begin(sessionId, datasetRef);
    }

    public SessionStatus pauseSession(String sessionId) {
        return context.sessions().pause(sessionId);
    }

    public SessionStatus resumeSession(String sessionId) {
        return context.sessions().resume(sessionId);
    }

    public SessionStatus stopSession(String sessionId) {
        return context.sessions().stop(sessionId);
    }

    public SessionStatus advanceEpoch(String sessionId, double loss, double accuracy) {
        return context.sessions().advanceEpoch(sessionId, loss, accuracy);
    }

    public SessionStatus failSession(String sessionId, String reason) {
        return context.sessions().fail(sessionId, reason);
    }

    public SessionStatus sessionStatus(String sessionId) {
        return context.sessions().status(sessionId);
    }

    public List<SessionStatus> listSessions(String modelRef) {
        return modelRef == null || modelRef.isBlank()
                ? context.sessions().list()
                : context.sessions().listByLineage(modelRef.strip());
    }

    public ModelVersion createModel(String lineage, ContentId weightsRef, Identity owner) {
        return context.versions().createModel(lineage, weightsRef, owner);
    }

    public ModelVersion advanceVersion(String lineage, Identity caller) {
        return context.versions().advanceVersion(lineage, caller, context.policy());
    }

    public ModelVersion getModelVersion(long version) {
        ModelVersion found = context.versions().require(version, ErrorCode.MODEL_NOT_FOUND);
        return context.locks().withReadLock(found.lineage(),
                () -> context.versions().require(version, ErrorCode.MODEL_NOT_FOUND));
    }

    public ModelVersion latestModelVersion(String lineage) {
        return context.locks().withReadLock(lineage, () -> context.versions().latest(lineage)
                .orElseThrow(() -> new CoordinationException(ErrorCode.MODEL_NOT_FOUND, "unknown lineage: " + lineage)));
    }

    public List<ModelVersion> listModelVersions(String lineage) {
        return context.locks().withReadLock(lineage, () -> context.versions().list(lineage));
    }

    public SubmissionResult submitGradient(Identity contributor, long modelVersion, ContentId gradientRef) {
        return context.pending().submit(contributor, modelVersion, gradientRef);
    }

    public SubmissionResult submitGradientBlob(Identity contributor, long modelVersion, byte[] gradientBytes) {
        context.versions().require(modelVersion, ErrorCode.UNKNOWN_MODEL_VERSION);
        if (gradientBytes == null || gradientBytes.length == 0) {
            throw new CoordinationException(ErrorCode.INVALID_GRADIENT, "gradient blob must not be empty");
        }
        GradientDocuments.requireUsable(gradientBytes);
        ContentId ref = storeBlob(gradientBytes);
        return submitGradient(contributor, modelVersion, ref);
    }

    public List<GradientSubmission> listPending(long modelVersion) {
        ModelVersion found = context.versions().require(modelVersion, ErrorCode.UNKNOWN_MODEL_VERSION);
        return context.locks().withReadLock(found.lineage(), () -> context.pending().listPending(modelVersion));
    }

    public boolean aggregationDue(long modelVersion) {
        ModelVersion found = context.versions().require(modelVersion, ErrorCode.UNKNOWN_MODEL_VERSION);
        if (found.finalized()) {
            return false;
        }
        Optional<SessionStatus> active = context.sessions().activeSession(found.lineage());
        if (active.isEmpty() || active.get().state() != SessionState.RUNNING) {
            return false;
        }
        int threshold = active.get().config().aggregationThreshold();
        return threshold > 0 && context.pending().pendingCount(modelVersion) >= threshold;
    }

    public FinalizeResult finalize(long modelVersion, ContentId newWeightsRef, Identity caller) {
        return engine.finalize(modelVersion, newWeightsRef, caller);
    }

    public AggregationReport aggregate(long modelVersion, Identity caller) {
        return averagingJob.run(modelVersion, caller);
    }

    public Contributor registerContributor(Identity identity) {
        return context.contributors().register(identity);
    }

    public Optional<Contributor> contributor(Identity identity) {
        return context.contributors().lookup(identity);
    }

    public List<Contributor> leaderboard(int limit) {
        return context.contributors().leaderboard(limit);
    }

    public Contributor awardReputation(Identity admin, Identity identity, long amount) {
        return context.contributors().awardReputation(admin, identity, amount, awarded -> {
            try {
                context.auditLog().recordAward(context.clock().tick(), admin.value(), identity.value(), amount);
            } catch (IOException e) {
                throw new UncheckedIOException("award to " + identity + " was not applied because the audit log could not be written", e);
            }
        });
    }

    public ContentId storeBlob(byte[] data) {
        if (data == null || data.length == 0) {
            throw new CoordinationException(ErrorCode.INVALID_ARGUMENT, "blob must not be empty");
        }
        return context.contentStore().put(data);
    }

    public byte[] loadBlob(ContentId id) {
        return context.contentStore().get(id);
    }

    public CoordinatorSnapshot snapshot() {
        return context.locks().withAllWriteLocks(() -> {
            Map<Long, ModelVersion> versions = new LinkedHashMap<>();
            for (ModelVersion version : context.versions().all()) {
                versions.put(version.version(), version);
            }
            Map<String, Contributor> contributors = new LinkedHashMap<>();
            for (Contributor contributor : context.contributors().leaderboard()) {
                contributors.put(contributor.identity().value(), contributor);
            }
            Map<String, SessionStatus> sessions = new LinkedHashMap<>();
            for (SessionStatus session : context.sessions().list()) {
                sessions.put(session.sessionId(), session);
            }
            return new CoordinatorSnapshot(
                    context.clock().current(),
                    versions,
                    context.pending().all(),
                    contributors,
                    sessions);
        });
    }

    public void restore(CoordinatorSnapshot snapshot) {
        context.versions().restore(snapshot.modelVersions().values());
        context.pending().restore(snapshot.pendingGradients());
        context.contributors().restore(snapshot.contributors().values());
        context.sessions().restore(snapshot.sessions().values());
        context.clock().advanceTo(snapshot.clock());
        log.info("coordinator.restored versions={} pending={} contributors={} sessions={} clock={}",
                snapshot.modelVersions().size(),
                snapshot.pendingGradients().size(),
                snapshot.contributors().size(),
                snapshot.sessions().size(),
                context.clock().current());
    }
}

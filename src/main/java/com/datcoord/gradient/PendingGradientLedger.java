package com.datcoord.gradient;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.datcoord.core.CoordinationException;
import com.datcoord.core.ErrorCode;
import com.datcoord.core.Identity;
import com.datcoord.core.LogicalClock;
import com.datcoord.store.ContentId;
import com.datcoord.versioning.ModelVersion;
import com.datcoord.versioning.ModelVersionLedger;

public class PendingGradientLedger {
    private static final Logger log = LoggerFactory.getLogger(PendingGradientLedger.class);

    private final Map<Long, PendingSet> pending = new ConcurrentHashMap<>();
    private final ModelVersionLedger versions;
    private final LogicalClock clock;

    public PendingGradientLedger(ModelVersionLedger versions, LogicalClock clock) {
        this.versions = versions;
        this.clock = clock;
    }

    public SubmissionResult submit(Identity contributor, long modelVersion, ContentId gradientRef) {
        if (contributor == null || gradientRef == null) {
            throw new CoordinationException(ErrorCode.INVALID_ARGUMENT, "contributor and gradientRef are required");
        }
        ModelVersion target = versions.require(modelVersion, ErrorCode.UNKNOWN_MODEL_VERSION);
        return versions.locks().withReadLock(target.lineage(), () -> {
            ModelVersion current = versions.require(modelVersion, ErrorCode.UNKNOWN_MODEL_VERSION);
            if (current.finalized()) {
                throw new CoordinationException(ErrorCode.STALE_VERSION,
                        "version " + modelVersion + " is already finalized");
            }
            PendingSet set = pending.computeIfAbsent(modelVersion, key -> new PendingSet());
            synchronized (set) {
                GradientSubmission.Key key = new GradientSubmission.Key(contributor, modelVersion, gradientRef);
                if (set.contains(key)) {
                    log.debug("gradient.duplicate version={} contributor={} ref={}", modelVersion, contributor, gradientRef);
                    return SubmissionResult.DUPLICATE;
                }
                set.add(new GradientSubmission(contributor, modelVersion, gradientRef, clock.tick()));
                ModelVersion counted = versions.recordGradient(modelVersion);
                log.info("gradient.accepted version={} contributor={} ref={} gradientCount={}",
                        modelVersion, contributor, gradientRef, counted.gradientCount());
                return SubmissionResult.ACCEPTED;
            }
        });
    }

    public List<GradientSubmission> listPending(long modelVersion) {
        return underReadLock(modelVersion, () -> {
            PendingSet set = pending.get(modelVersion);
            return set == null ? List.<GradientSubmission>of() : set.snapshot();
        }, List.of());
    }

    public int pendingCount(long modelVersion) {
        return underReadLock(modelVersion, () -> {
            PendingSet set = pending.get(modelVersion);
            return set == null ? 0 : set.size();
        }, 0);
    }

    // caller holds the lineage write lock
    public List<GradientSubmission> drain(long modelVersion) {
        ModelVersion target = versions.require(modelVersion, ErrorCode.MODEL_NOT_FOUND);
        if (!versions.locks().forLineage(target.lineage()).isWriteLockedByCurrentThread()) {
            throw new IllegalStateException("drain of version " + modelVersion + " without the lineage write lock");
        }
        PendingSet removed = pending.remove(modelVersion);
        return removed == null ? List.of() : removed.snapshot();
    }

    public List<GradientSubmission> all() {
        List<GradientSubmission> result = new ArrayList<>();
        for (PendingSet set : pending.values()) {
            result.addAll(set.snapshot());
        }
        result.sort(Comparator.comparingLong(GradientSubmission::timestamp));
        return List.copyOf(result);
    }

    public void restore(Collection<GradientSubmission> persisted) {
        if (!pending.isEmpty()) {
            throw new IllegalStateException("restore requires an empty ledger");
        }
        List<GradientSubmission> ordered = new ArrayList<>(persisted);
        ordered.sort(Comparator.comparingLong(GradientSubmission::timestamp));
        for (GradientSubmission submission : ordered) {
            versions.require(submission.modelVersion(), ErrorCode.UNKNOWN_MODEL_VERSION);
            pending.computeIfAbsent(submission.modelVersion(), key -> new PendingSet()).add(submission);
            clock.advanceTo(submission.timestamp());
        }
    }

    private <T> T underReadLock(long modelVersion, Supplier<T> read, T missing) {
        Optional<ModelVersion> target = versions.find(modelVersion);
        if (target.isEmpty()) {
            return missing;
        }
        return versions.locks().withReadLock(target.get().lineage(), read);
    }
}

package com.datcoord.aggregation;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.datcoord.audit.ContributionAuditLog;
import com.datcoord.contributor.Contributor;
import com.datcoord.contributor.ContributorLedger;
import com.datcoord.core.CoordinationException;
import com.datcoord.core.ErrorCode;
import com.datcoord.core.Identity;
import com.datcoord.core.LogicalClock;
import com.datcoord.governance.AuthorityPolicy;
import com.datcoord.gradient.GradientSubmission;
import com.datcoord.gradient.PendingGradientLedger;
import com.datcoord.store.ContentId;
import com.datcoord.versioning.ModelVersion;
import com.datcoord.versioning.ModelVersionLedger;

public class AggregationEngine {
    private static final Logger log = LoggerFactory.getLogger(AggregationEngine.class);

    private final ModelVersionLedger versions;
    private final PendingGradientLedger pending;
    private final ContributorLedger contributors;
    private final AuthorityPolicy policy;
    private final ContributionAuditLog auditLog;
    private final LogicalClock clock;
    private final long rewardPerContribution;

    public AggregationEngine(
            ModelVersionLedger versions,
            PendingGradientLedger pending,
            ContributorLedger contributors,
            AuthorityPolicy policy,
            ContributionAuditLog auditLog,
            LogicalClock clock,
            long rewardPerContribution) {
        if (rewardPerContribution < 0) {
            throw new IllegalArgumentException("rewardPerContribution must be >= 0");
        }
        this.versions = versions;
        this.pending = pending;
        this.contributors = contributors;
        this.policy = policy;
        this.auditLog = auditLog;
        this.clock = clock;
        this.rewardPerContribution = rewardPerContribution;
    }

    public ModelVersion checkFinalizable(long modelVersion, Identity caller) {
        ModelVersion target = versions.require(modelVersion, ErrorCode.MODEL_NOT_FOUND);
        if (!policy.mayFinalize(target, caller)) {
            throw new CoordinationException(ErrorCode.NOT_AUTHORIZED,
                    caller + " may not finalize version " + modelVersion);
        }
        if (target.finalized()) {
            throw new CoordinationException(ErrorCode.ALREADY_FINALIZED,
                    "version " + modelVersion + " is already finalized");
        }
        return target;
    }

    public FinalizeResult finalize(long modelVersion, ContentId newWeightsRef, Identity caller) {
        if (newWeightsRef == null) {
            throw new CoordinationException(ErrorCode.INVALID_ARGUMENT, "newWeightsRef is required");
        }
        ModelVersion target = checkFinalizable(modelVersion, caller);
        FinalizeResult result = versions.locks().withWriteLock(target.lineage(), () -> {
            checkFinalizable(modelVersion, caller);
            Set<Identity> distinct = new LinkedHashSet<>();
            for (GradientSubmission submission : pending.listPending(modelVersion)) {
                distinct.add(submission.contributor());
            }
            // audit first: a failed write leaves the version open
            List<Contributor> credited = contributors.recordContributions(distinct, rewardPerContribution,
                    updates -> audit(modelVersion, newWeightsRef, caller, updates));
            ModelVersion updated = versions.markFinalized(modelVersion, newWeightsRef);
            List<GradientSubmission> drained = pending.drain(modelVersion);
            return new FinalizeResult(updated, drained, credited);
        });
        log.info("aggregation.finalized version={} lineage={} weightsRef={} drained={} credited={}",
                modelVersion, target.lineage(), newWeightsRef, result.drained().size(), result.credited().size());
        return result;
    }

    private void audit(long modelVersion, ContentId newWeightsRef, Identity caller, List<Contributor> credited) {
        Map<String, Long> credits = new LinkedHashMap<>();
        for (Contributor contributor : credited) {
            credits.put(contributor.identity().value(), rewardPerContribution);
        }
        try {
            auditLog.recordFinalize(clock.tick(), modelVersion, newWeightsRef.value(), caller.value(), credits);
        } catch (IOException e) {
            log.error("aggregation.audit.failed version={} path={}", modelVersion, auditLog.path(), e);
            throw new UncheckedIOException("version " + modelVersion
                    + " was not finalized because the audit log could not be written", e);
        }
    }
}

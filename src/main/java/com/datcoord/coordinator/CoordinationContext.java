package com.datcoord.coordinator;

import java.nio.file.Path;

import com.datcoord.audit.ContributionAuditLog;
import com.datcoord.contributor.ContributorLedger;
import com.datcoord.core.Identity;
import com.datcoord.core.LineageLocks;
import com.datcoord.core.LogicalClock;
import com.datcoord.governance.AuthorityPolicy;
import com.datcoord.governance.OwnerAuthorityPolicy;
import com.datcoord.gradient.PendingGradientLedger;
import com.datcoord.runtime.AppConfig;
import com.datcoord.session.TrainingSessionManager;
import com.datcoord.store.ContentStore;
import com.datcoord.versioning.ModelVersionLedger;

public record CoordinationContext(
        LogicalClock clock,
        LineageLocks locks,
        ModelVersionLedger versions,
        PendingGradientLedger pending,
        ContributorLedger contributors,
        TrainingSessionManager sessions,
        AuthorityPolicy policy,
        ContributionAuditLog auditLog,
        ContentStore contentStore,
        long rewardPerContribution) {

    public static CoordinationContext create(AppConfig.CoordinatorConfig config, ContentStore contentStore) {
        AuthorityPolicy policy = new OwnerAuthorityPolicy(new Identity(config.getAdminIdentity()));
        return create(config, contentStore, policy);
    }

    public static CoordinationContext create(
            AppConfig.CoordinatorConfig config,
            ContentStore contentStore,
            AuthorityPolicy policy) {
        LogicalClock clock = new LogicalClock();
        LineageLocks locks = new LineageLocks();
        ModelVersionLedger versions = new ModelVersionLedger(locks, clock);
        return new CoordinationContext(
                clock,
                locks,
                versions,
                new PendingGradientLedger(versions, clock),
                new ContributorLedger(clock, policy),
                new TrainingSessionManager(clock, config.getAllowedOptimizers()),
                policy,
                new ContributionAuditLog(Path.of(config.getAuditLogPath())),
                contentStore,
                config.getRewardPerContribution());
    }
}

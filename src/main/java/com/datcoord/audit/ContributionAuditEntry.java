package com.datcoord.audit;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ContributionAuditEntry(
        long timestamp,
        String event,
        Long modelVersion,
        String weightsRef,
        String actor,
        Map<String, Long> credits,
        String previousHash,
        String entryHash) {

    public static final String FINALIZE = "FINALIZE";
    public static final String AWARD = "AWARD";

    ContributionAuditEntry unhashed() {
        return new ContributionAuditEntry(timestamp, event, modelVersion, weightsRef, actor, credits, previousHash, null);
    }

    ContributionAuditEntry chained(String previous, String hash) {
        return new ContributionAuditEntry(timestamp, event, modelVersion, weightsRef, actor, credits, previous, hash);
    }
}

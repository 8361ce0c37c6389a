package com.datcoord.versioning;

import com.datcoord.core.Identity;
import com.datcoord.store.ContentId;

public record ModelVersion(
        long version,
        String lineage,
        ContentId weightsRef,
        Identity owner,
        long createdAt,
        long updatedAt,
        long gradientCount,
        boolean finalized,
        long finalizedAt) {

    public static ModelVersion open(long version, String lineage, ContentId weightsRef, Identity owner, long createdAt) {
        return new ModelVersion(version, lineage, weightsRef, owner, createdAt, createdAt, 0L, false, 0L);
    }

    ModelVersion withGradientCount(long count) {
        return new ModelVersion(version, lineage, weightsRef, owner, createdAt, updatedAt, count, finalized, finalizedAt);
    }

    ModelVersion finalizedWith(ContentId newWeightsRef, long timestamp) {
        return new ModelVersion(version, lineage, newWeightsRef, owner, createdAt, timestamp, gradientCount, true, timestamp);
    }
}

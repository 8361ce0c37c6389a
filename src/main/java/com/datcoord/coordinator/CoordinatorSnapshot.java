package com.datcoord.coordinator;

import java.util.List;
import java.util.Map;

import com.datcoord.contributor.Contributor;
import com.datcoord.gradient.GradientSubmission;
import com.datcoord.session.SessionStatus;
import com.datcoord.versioning.ModelVersion;

public record CoordinatorSnapshot(
        long clock,
        Map<Long, ModelVersion> modelVersions,
        List<GradientSubmission> pendingGradients,
        Map<String, Contributor> contributors,
        Map<String, SessionStatus> sessions) {

    public CoordinatorSnapshot {
        modelVersions = modelVersions == null ? Map.of() : Map.copyOf(modelVersions);
        pendingGradients = pendingGradients == null ? List.of() : List.copyOf(pendingGradients);
        contributors = contributors == null ? Map.of() : Map.copyOf(contributors);
        sessions = sessions == null ? Map.of() : Map.copyOf(sessions);
    }

    public static CoordinatorSnapshot empty() {
        return new CoordinatorSnapshot(0L, Map.of(), List.of(), Map.of(), Map.of());
    }
}

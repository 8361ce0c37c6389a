package com.datcoord.aggregation;

import java.util.List;

import com.datcoord.contributor.Contributor;
import com.datcoord.gradient.GradientSubmission;
import com.datcoord.versioning.ModelVersion;

public record FinalizeResult(
        ModelVersion version,
        List<GradientSubmission> drained,
        List<Contributor> credited) {
}

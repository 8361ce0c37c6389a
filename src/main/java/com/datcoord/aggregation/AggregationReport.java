package com.datcoord.aggregation;

import java.util.List;

import com.datcoord.store.ContentId;

public record AggregationReport(
        FinalizeResult finalizeResult,
        int gradientsAveraged,
        List<ContentId> skipped) {
}

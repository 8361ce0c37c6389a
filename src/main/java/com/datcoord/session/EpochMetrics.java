package com.datcoord.session;

public record EpochMetrics(
        int epoch,
        double loss,
        double accuracy) {
}

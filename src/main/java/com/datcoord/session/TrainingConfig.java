package com.datcoord.session;

import java.util.Set;

import com.datcoord.core.CoordinationException;
import com.datcoord.core.ErrorCode;
import com.datcoord.store.ContentId;

public record TrainingConfig(
        int epochs,
        int batchSize,
        double learningRate,
        OptimizerKind optimizer,
        double validationSplit,
        ContentId datasetRef,
        int aggregationThreshold) {

    public static TrainingConfig defaults() {
        return new TrainingConfig(10, 32, 0.001, OptimizerKind.ADAM, 0.2, null, 3);
    }

    public TrainingConfig withDatasetRef(ContentId ref) {
        return new TrainingConfig(epochs, batchSize, learningRate, optimizer, validationSplit, ref, aggregationThreshold);
    }

    public void validate(Set<OptimizerKind> allowedOptimizers) {
        if (epochs <= 0) {
            throw invalid("epochs must be > 0, got " + epochs);
        }
        if (batchSize <= 0) {
            throw invalid("batchSize must be > 0, got " + batchSize);
        }
        if (!Double.isFinite(learningRate) || learningRate <= 0) {
            throw invalid("learningRate must be a finite value > 0, got " + learningRate);
        }
        if (optimizer == null || !allowedOptimizers.contains(optimizer)) {
            throw invalid("optimizer not allowed: " + optimizer);
        }
        if (!(validationSplit >= 0 && validationSplit < 1)) {
            throw invalid("validationSplit must be in [0, 1), got " + validationSplit);
        }
        if (aggregationThreshold < 0) {
            throw invalid("aggregationThreshold must be >= 0, got " + aggregationThreshold);
        }
    }

    private static CoordinationException invalid(String message) {
        return new CoordinationException(ErrorCode.INVALID_CONFIG, message);
    }
}

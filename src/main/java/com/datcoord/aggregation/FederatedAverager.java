package com.datcoord.aggregation;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.datcoord.core.CoordinationException;
import com.datcoord.core.ErrorCode;

public final class FederatedAverager {
    private FederatedAverager() {
    }

    public static GradientDocument average(List<GradientDocument> documents) {
        if (documents.isEmpty()) {
            throw new CoordinationException(ErrorCode.INVALID_GRADIENT, "nothing to average");
        }
        Map<String, double[]> sums = new TreeMap<>();
        Map<String, Integer> counts = new TreeMap<>();
        for (GradientDocument document : documents) {
            for (Map.Entry<String, double[]> tensor : document.gradients().entrySet()) {
                double[] values = tensor.getValue();
                double[] sum = sums.get(tensor.getKey());
                if (sum == null) {
                    sums.put(tensor.getKey(), values.clone());
                } else if (sum.length != values.length) {
                    throw new CoordinationException(ErrorCode.INVALID_GRADIENT,
                            "shape mismatch for " + tensor.getKey() + ": " + sum.length + " vs " + values.length);
                } else {
                    for (int i = 0; i < sum.length; i++) {
                        sum[i] += values[i];
                    }
                }
                counts.merge(tensor.getKey(), 1, Integer::sum);
            }
        }
        for (Map.Entry<String, double[]> entry : sums.entrySet()) {
            int count = counts.get(entry.getKey());
            double[] sum = entry.getValue();
            for (int i = 0; i < sum.length; i++) {
                sum[i] /= count;
            }
        }
        return GradientDocument.of(sums);
    }

    static boolean isUsable(GradientDocument document) {
        if (document == null || !GradientDocument.FORMAT_VERSION.equals(document.formatVersion())) {
            return false;
        }
        if (document.gradients() == null || document.gradients().isEmpty()) {
            return false;
        }
        for (double[] values : document.gradients().values()) {
            if (values == null || values.length == 0) {
                return false;
            }
            for (double value : values) {
                if (!Double.isFinite(value)) {
                    return false;
                }
            }
        }
        return true;
    }
}

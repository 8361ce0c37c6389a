package com.datcoord.gradient;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class PendingSet {
    private final Map<GradientSubmission.Key, GradientSubmission> entries = new LinkedHashMap<>();

    synchronized boolean add(GradientSubmission submission) {
        return entries.putIfAbsent(submission.key(), submission) == null;
    }

    synchronized boolean contains(GradientSubmission.Key key) {
        return entries.containsKey(key);
    }

    synchronized List<GradientSubmission> snapshot() {
        return List.copyOf(new ArrayList<>(entries.values()));
    }

    synchronized int size() {
        return entries.size();
    }
}

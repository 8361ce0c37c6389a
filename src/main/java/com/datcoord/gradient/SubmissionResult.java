package com.datcoord.gradient;

public enum SubmissionResult {
    ACCEPTED,
    DUPLICATE
}

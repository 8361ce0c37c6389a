package com.datcoord.gradient;

import com.datcoord.core.Identity;
import com.datcoord.store.ContentId;
import com.fasterxml.jackson.annotation.JsonIgnore;

public record GradientSubmission(
        Identity contributor,
        long modelVersion,
        ContentId gradientRef,
        long timestamp) {

    @JsonIgnore
    public Key key() {
        return new Key(contributor, modelVersion, gradientRef);
    }

    public record Key(
            Identity contributor,
            long modelVersion,
            ContentId gradientRef) {
    }
}

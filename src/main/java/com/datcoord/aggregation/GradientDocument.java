package com.datcoord.aggregation;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GradientDocument(
        @JsonProperty("format_version") String formatVersion,
        @JsonProperty("gradients") Map<String, double[]> gradients) {

    public static final String FORMAT_VERSION = "1.0";

    public static GradientDocument of(Map<String, double[]> gradients) {
        return new GradientDocument(FORMAT_VERSION, gradients);
    }
}

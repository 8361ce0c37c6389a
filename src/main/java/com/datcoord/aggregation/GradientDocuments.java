package com.datcoord.aggregation;

import java.io.IOException;

import com.datcoord.core.CoordinationException;
import com.datcoord.core.ErrorCode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

public final class GradientDocuments {
    private static final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();

    private GradientDocuments() {
    }

    public static GradientDocument read(byte[] bytes) throws IOException {
        return mapper.readValue(bytes, GradientDocument.class);
    }

    public static byte[] write(GradientDocument document) {
        try {
            return mapper.writeValueAsBytes(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("could not serialize gradient document", e);
        }
    }

    public static GradientDocument requireUsable(byte[] bytes) {
        GradientDocument document;
        try {
            document = read(bytes);
        } catch (IOException e) {
            throw new CoordinationException(ErrorCode.INVALID_GRADIENT, "not a gradient document: " + e.getMessage());
        }
        if (!FederatedAverager.isUsable(document)) {
            throw new CoordinationException(ErrorCode.INVALID_GRADIENT,
                    "gradient document must have format_version " + GradientDocument.FORMAT_VERSION
                            + " and at least one non-empty tensor of finite values");
        }
        return document;
    }
}

package com.datcoord.store;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

final class ContentDigests {
    static final String PREFIX = "sha256:";

    private ContentDigests() {
    }

    static ContentId contentIdOf(byte[] data) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return new ContentId(PREFIX + HexFormat.of().formatHex(digest.digest(data)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}

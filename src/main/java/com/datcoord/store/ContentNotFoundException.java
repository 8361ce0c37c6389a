package com.datcoord.store;

public class ContentNotFoundException extends ContentStoreException {
    private final ContentId contentId;

    public ContentNotFoundException(ContentId contentId) {
        super("content not found: " + contentId);
        this.contentId = contentId;
    }

    public ContentId getContentId() {
        return contentId;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}

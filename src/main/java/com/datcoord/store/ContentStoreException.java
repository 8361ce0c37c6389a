package com.datcoord.store;

public abstract class ContentStoreException extends RuntimeException {
    protected ContentStoreException(String message) {
        super(message);
    }

    protected ContentStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean isRetryable();
}

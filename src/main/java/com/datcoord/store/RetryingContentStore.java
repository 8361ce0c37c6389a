package com.datcoord.store;

import java.util.Objects;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class RetryingContentStore implements ContentStore {
    private static final Logger log = LoggerFactory.getLogger(RetryingContentStore.class);

    private final ContentStore delegate;
    private final int maxRetries;
    private final long retryBackoffMs;
    private final Sleeper sleeper;

    public RetryingContentStore(ContentStore delegate, int maxRetries, long retryBackoffMs) {
        this(delegate, maxRetries, retryBackoffMs, Thread::sleep);
    }

    RetryingContentStore(ContentStore delegate, int maxRetries, long retryBackoffMs, Sleeper sleeper) {
        if (maxRetries < 0 || retryBackoffMs < 0) {
            throw new IllegalArgumentException("retry settings must be >= 0");
        }
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.maxRetries = maxRetries;
        this.retryBackoffMs = retryBackoffMs;
        this.sleeper = sleeper;
    }

    @Override
    public ContentId put(byte[] data) {
        return runWithRetries("put", () -> delegate.put(data));
    }

    @Override
    public byte[] get(ContentId id) {
        return runWithRetries("get", () -> delegate.get(id));
    }

    @Override
    public String describe() {
        return delegate.describe();
    }

    private <T> T runWithRetries(String operation, Supplier<T> supplier) {
        int maxAttempts = maxRetries + 1;
        for (int attempt = 1; ; attempt++) {
            try {
                return supplier.get();
            } catch (StorageUnavailableException e) {
                if (attempt >= maxAttempts) {
                    log.warn("content.retry.exhausted operation={} attempts={} reason={}", operation, attempt, e.getMessage());
                    throw e;
                }
                long backoff = retryBackoffMs * attempt;
                log.warn("content.retry operation={} attempt={} maxAttempts={} backoffMs={} reason={}",
                        operation, attempt, maxAttempts, backoff, e.getMessage());
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw new StorageUnavailableException("interrupted while retrying " + operation, interrupted);
                }
            }
        }
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}

package com.datcoord.store;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryingContentStoreTest {

    @Test
    void shouldRetryTransientFailuresWithLinearBackoff() {
        AtomicInteger calls = new AtomicInteger();
        InMemoryContentStore backing = new InMemoryContentStore();
        ContentStore flaky = new ContentStore() {
            @Override
            public ContentId put(byte[] data) {
                if (calls.incrementAndGet() < 3) {
                    throw new StorageUnavailableException("publisher busy");
                }
                return backing.put(data);
            }

            @Override
            public byte[] get(ContentId id) {
                return backing.get(id);
            }
        };
        List<Long> sleeps = new ArrayList<>();
        RetryingContentStore store = new RetryingContentStore(flaky, 3, 100, sleeps::add);

        ContentId id = store.put(new byte[] { 7 });

        assertEquals(3, calls.get());
        assertEquals(List.of(100L, 200L), sleeps);
        assertEquals(backing.put(new byte[] { 7 }), id);
    }

    @Test
    void shouldGiveUpAfterMaxRetries() {
        AtomicInteger calls = new AtomicInteger();
        ContentStore down = new ContentStore() {
            @Override
            public ContentId put(byte[] data) {
                calls.incrementAndGet();
                throw new StorageUnavailableException("down");
            }

            @Override
            public byte[] get(ContentId id) {
                calls.incrementAndGet();
                throw new StorageUnavailableException("down");
            }
        };
        RetryingContentStore store = new RetryingContentStore(down, 2, 0, millis -> { });

        StorageUnavailableException error = assertThrows(StorageUnavailableException.class,
                () -> store.get(new ContentId("sha256:abc")));

        assertTrue(error.isRetryable());
        assertEquals(3, calls.get());
    }

    @Test
    void shouldNotRetryMissingContent() {
        AtomicInteger calls = new AtomicInteger();
        ContentStore empty = new ContentStore() {
            @Override
            public ContentId put(byte[] data) {
                throw new UnsupportedOperationException();
            }

            @Override
            public byte[] get(ContentId id) {
                calls.incrementAndGet();
                throw new ContentNotFoundException(id);
            }
        };
        RetryingContentStore store = new RetryingContentStore(empty, 5, 0, millis -> { });

        assertThrows(ContentNotFoundException.class, () -> store.get(new ContentId("sha256:abc")));
        assertEquals(1, calls.get());
    }
}

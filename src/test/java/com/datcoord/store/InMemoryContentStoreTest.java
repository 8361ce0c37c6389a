package com.datcoord.store;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryContentStoreTest {

    @Test
    void shouldAddressBlobsByContentDigest() {
        InMemoryContentStore store = new InMemoryContentStore();

        ContentId first = store.put("weights".getBytes(StandardCharsets.UTF_8));
        ContentId second = store.put("weights".getBytes(StandardCharsets.UTF_8));

        assertEquals(first, second);
        assertEquals(1, store.size());
        assertTrue(first.value().startsWith("sha256:"));
        assertArrayEquals("weights".getBytes(StandardCharsets.UTF_8), store.get(first));
    }

    @Test
    void shouldNotExposeInternalArrays() {
        InMemoryContentStore store = new InMemoryContentStore();
        byte[] data = { 1, 2, 3 };
        ContentId id = store.put(data);

        data[0] = 9;
        byte[] loaded = store.get(id);
        loaded[1] = 9;

        assertArrayEquals(new byte[] { 1, 2, 3 }, store.get(id));
    }

    @Test
    void shouldReportMissingBlobAsNotRetryable() {
        InMemoryContentStore store = new InMemoryContentStore();

        ContentNotFoundException error = assertThrows(ContentNotFoundException.class,
                () -> store.get(new ContentId("sha256:missing")));

        assertFalse(error.isRetryable());
        assertEquals("sha256:missing", error.getContentId().value());
    }
}

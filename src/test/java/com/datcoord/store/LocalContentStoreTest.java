package com.datcoord.store;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalContentStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldPersistBlobsAcrossInstances() {
        Path root = tempDir.resolve("blobs");
        ContentId id = new LocalContentStore(root).put("gradient".getBytes(StandardCharsets.UTF_8));

        byte[] loaded = new LocalContentStore(root).get(id);

        assertArrayEquals("gradient".getBytes(StandardCharsets.UTF_8), loaded);
        assertEquals(new InMemoryContentStore().put("gradient".getBytes(StandardCharsets.UTF_8)), id);
        assertTrue(Files.exists(root.resolve(id.value().substring("sha256:".length()) + ".blob")));
    }

    @Test
    void shouldTreatUnknownAndForeignIdsAsNotFound() {
        LocalContentStore store = new LocalContentStore(tempDir);

        assertThrows(ContentNotFoundException.class,
                () -> store.get(new ContentId("sha256:" + "a".repeat(64))));
        assertThrows(ContentNotFoundException.class,
                () -> store.get(new ContentId("../../etc/passwd")));
    }

    @Test
    void shouldSurfaceUnwritableRootAsStorageUnavailable() throws Exception {
        Path blocker = tempDir.resolve("not-a-directory");
        Files.writeString(blocker, "x");
        LocalContentStore store = new LocalContentStore(blocker.resolve("blobs"));

        StorageUnavailableException error = assertThrows(StorageUnavailableException.class,
                () -> store.put(new byte[] { 1 }));

        assertTrue(error.isRetryable());
    }
}

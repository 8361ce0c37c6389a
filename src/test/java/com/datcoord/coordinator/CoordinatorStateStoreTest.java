package com.datcoord.coordinator;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.datcoord.core.Identity;
import com.datcoord.runtime.AppConfig;
import com.datcoord.session.TrainingConfig;
import com.datcoord.store.ContentId;
import com.datcoord.store.InMemoryContentStore;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CoordinatorStateStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadEmptySnapshotWhenFileIsMissing() throws Exception {
        CoordinatorStateStore store = new CoordinatorStateStore(tempDir.resolve("missing.json"));

        assertEquals(CoordinatorSnapshot.empty(), store.load());
    }

    @Test
    void shouldPersistSnapshotAsJson() throws Exception {
        AppConfig.CoordinatorConfig config = new AppConfig.CoordinatorConfig();
        config.setAuditLogPath(tempDir.resolve("audit.jsonl").toString());
        Coordinator coordinator = new Coordinator(CoordinationContext.create(config, new InMemoryContentStore()));
        Identity owner = new Identity("0xowner");
        long version = coordinator.createModel("mnist", new ContentId("w1"), owner).version();
        coordinator.submitGradient(new Identity("0xA"), version, new ContentId("g1"));
        String sessionId = coordinator.startSession("mnist", TrainingConfig.defaults());
        coordinator.beginSession(sessionId, new ContentId("dataset"));
        coordinator.advanceEpoch(sessionId, 0.7, 0.6);
        coordinator.awardReputation(new Identity("admin"), new Identity("0xB"), 3);

        Path statePath = tempDir.resolve("nested/state.json");
        CoordinatorStateStore store = new CoordinatorStateStore(statePath);
        CoordinatorSnapshot snapshot = coordinator.snapshot();
        store.save(snapshot);

        assertTrue(Files.readString(statePath).contains("\"weightsRef\" : \"w1\""));
        assertEquals(snapshot, store.load());
        try (Stream<Path> files = Files.list(statePath.getParent())) {
            assertEquals(1, files.count());
        }
    }
}

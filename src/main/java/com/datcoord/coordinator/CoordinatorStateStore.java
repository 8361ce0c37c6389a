package com.datcoord.coordinator;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class CoordinatorStateStore {
    private static final Logger log = LoggerFactory.getLogger(CoordinatorStateStore.class);

    private final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .build();
    private final Path statePath;

    public CoordinatorStateStore(Path statePath) {
        this.statePath = statePath;
    }

    public CoordinatorSnapshot load() throws IOException {
        if (!Files.exists(statePath) || Files.size(statePath) == 0L) {
            return CoordinatorSnapshot.empty();
        }
        return objectMapper.readValue(statePath.toFile(), CoordinatorSnapshot.class);
    }

    public void save(CoordinatorSnapshot snapshot) throws IOException {
        Path parent = statePath.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path temp = Files.createTempFile(parent, statePath.getFileName().toString(), ".tmp");
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), snapshot);
            try {
                Files.move(temp, statePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, statePath, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        log.debug("state.saved path={} versions={} pending={}",
                statePath, snapshot.modelVersions().size(), snapshot.pendingGradients().size());
    }
}

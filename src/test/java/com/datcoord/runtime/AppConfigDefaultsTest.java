package com.datcoord.runtime;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.datcoord.session.OptimizerKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AppConfigDefaultsTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldDefaultToLocalStoreAndOwnerAdmin() {
        AppConfig config = new AppConfig();

        assertEquals("admin", config.getCoordinator().getAdminIdentity());
        assertEquals(10, config.getCoordinator().getRewardPerContribution());
        assertEquals(List.of(OptimizerKind.values()), config.getCoordinator().getAllowedOptimizers());
        assertEquals("local", config.getContentStore().getType());
        assertEquals(3, config.getContentStore().getMaxRetries());
        assertEquals(30000, config.getContentStore().getTimeoutMs());
    }

    @Test
    void shouldOverlayYamlOnDefaultsAndIgnoreUnknownKeys() throws Exception {
        Path yaml = tempDir.resolve("application.yml");
        Files.writeString(yaml, """
                coordinator:
                  rewardPerContribution: 25
                  allowedOptimizers: [ADAM]
                  dashboard: ignored
                contentStore:
                  type: http
                  publisherUrl: http://walrus.local:31415
                """);

        AppConfig config = new ObjectMapper(new YAMLFactory()).readValue(yaml.toFile(), AppConfig.class);

        assertEquals(25, config.getCoordinator().getRewardPerContribution());
        assertEquals(List.of(OptimizerKind.ADAM), config.getCoordinator().getAllowedOptimizers());
        assertEquals("admin", config.getCoordinator().getAdminIdentity());
        assertEquals("http", config.getContentStore().getType());
        assertEquals(500, config.getContentStore().getRetryBackoffMs());
    }
}

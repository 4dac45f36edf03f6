package io.snapbridge.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class SnapBridgeConfigTest {

    @Test
    void missingSettingsFileYieldsDefaults() throws Exception {
        Path root = Files.createTempDirectory("snapbridge-test-config-");
        try {
            SnapBridgeConfig config = SnapBridgeConfig.load(root.resolve("absent.json").toString());

            Assertions.assertEquals("127.0.0.1", config.bind());
            Assertions.assertEquals(5178, config.port());
            Assertions.assertEquals("/__snap", config.basePath());
            Assertions.assertEquals(45_000L, config.activeWindowMs());
            Assertions.assertEquals(15_000L, config.heartbeatIntervalMs());
            Assertions.assertEquals(60_000L, config.sweepIntervalMs());
            Assertions.assertEquals(300_000L, config.staleAfterMs());
            Assertions.assertEquals(5_000L, config.dumpWaitMs());
            Assertions.assertEquals(3_000L, config.pingWaitMs());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void settingsFileOverridesSelectedFields() throws Exception {
        Path root = Files.createTempDirectory("snapbridge-test-config-");
        try {
            Path settings = root.resolve("snapbridge-settings.json");
            Files.writeString(settings, "{\n"
                    + "  \"port\": 6000,\n"
                    + "  \"basePath\": \"debug/\",\n"
                    + "  \"activeWindowMs\": 30000,\n"
                    + "  \"staleAfterMs\": 10,\n"
                    + "  \"dumpWaitMs\": 900000\n"
                    + "}\n", StandardCharsets.UTF_8);

            SnapBridgeConfig config = SnapBridgeConfig.load(settings.toString());

            Assertions.assertEquals(6000, config.port());
            Assertions.assertEquals("/debug", config.basePath());
            Assertions.assertEquals(30_000L, config.activeWindowMs());
            Assertions.assertEquals(1_000L, config.staleAfterMs(), "raised to the minimum");
            Assertions.assertEquals(120_000L, config.dumpWaitMs(), "capped by maxWaitMs");
            Assertions.assertEquals(60_000L, config.sweepIntervalMs());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void malformedSettingsFileFailsLoudly() throws Exception {
        Path root = Files.createTempDirectory("snapbridge-test-config-");
        try {
            Path settings = root.resolve("broken.json");
            Files.writeString(settings, "{ port: ", StandardCharsets.UTF_8);

            RuntimeException e = Assertions.assertThrows(RuntimeException.class, () -> SnapBridgeConfig.load(settings.toString()));
            Assertions.assertTrue(e.getMessage().startsWith("Failed to load settings"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void mergeIgnoresOutOfRangePort() {
        SnapBridgeConfig config = SnapBridgeConfig.defaults().merge(new SnapBridgeConfig.SettingsFile(
                "0.0.0.0", 70_000, null, null, null, null, null, null, null, null, null
        ));

        Assertions.assertEquals("0.0.0.0", config.bind());
        Assertions.assertEquals(5178, config.port());
        Assertions.assertSame(config, config.merge(null));
        Assertions.assertEquals(5178, config.merge(SnapBridgeConfig.SettingsFile.empty()).port());
    }

    @Test
    void waitBudgetsAreClamped() {
        SnapBridgeConfig config = SnapBridgeConfig.defaults();

        Assertions.assertEquals(5_000L, config.clampWaitMs(null, config.dumpWaitMs()));
        Assertions.assertEquals(1L, config.clampWaitMs(0L, config.dumpWaitMs()));
        Assertions.assertEquals(1L, config.clampWaitMs(-50L, config.dumpWaitMs()));
        Assertions.assertEquals(1_000L, config.clampWaitMs(1_000L, config.dumpWaitMs()));
        Assertions.assertEquals(120_000L, config.clampWaitMs(Long.MAX_VALUE, config.dumpWaitMs()));
    }

    @Test
    void basePathIsNormalized() {
        Assertions.assertEquals("/__snap", SnapBridgeConfig.normalizeBasePath(null));
        Assertions.assertEquals("/__snap", SnapBridgeConfig.normalizeBasePath("  "));
        Assertions.assertEquals("/snap", SnapBridgeConfig.normalizeBasePath("snap"));
        Assertions.assertEquals("/a/b", SnapBridgeConfig.normalizeBasePath("/a/b//"));
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}

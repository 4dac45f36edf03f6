package io.snapbridge.config;

import io.snapbridge.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public final class SnapBridgeConfig {
    public static final String DEFAULT_SETTINGS_FILE = "snapbridge-settings.json";
    public static final String DEFAULT_BIND = "127.0.0.1";
    public static final int DEFAULT_PORT = 5178;
    public static final String DEFAULT_BASE_PATH = "/__snap";
    // ~3 missed heartbeats at the default heartbeat interval
    public static final long DEFAULT_ACTIVE_WINDOW_MS = 45_000L;
    public static final long DEFAULT_HEARTBEAT_INTERVAL_MS = 15_000L;
    public static final long DEFAULT_SWEEP_INTERVAL_MS = 60_000L;
    public static final long DEFAULT_STALE_AFTER_MS = 5L * 60_000L;
    public static final long DEFAULT_DUMP_WAIT_MS = 5_000L;
    public static final long DEFAULT_PING_WAIT_MS = 3_000L;
    public static final long DEFAULT_MAX_WAIT_MS = 120_000L;
    public static final long DEFAULT_CHANNEL_KEEP_ALIVE_MS = 20_000L;

    private final String bind;
    private final int port;
    private final String basePath;
    private final long activeWindowMs;
    private final long heartbeatIntervalMs;
    private final long sweepIntervalMs;
    private final long staleAfterMs;
    private final long dumpWaitMs;
    private final long pingWaitMs;
    private final long maxWaitMs;
    private final long channelKeepAliveMs;

    public SnapBridgeConfig(
            String bind,
            int port,
            String basePath,
            long activeWindowMs,
            long heartbeatIntervalMs,
            long sweepIntervalMs,
            long staleAfterMs,
            long dumpWaitMs,
            long pingWaitMs,
            long maxWaitMs,
            long channelKeepAliveMs
    ) {
        this.bind = bind == null || bind.isBlank() ? DEFAULT_BIND : bind.trim();
        this.port = port;
        this.basePath = normalizeBasePath(basePath);
        this.activeWindowMs = activeWindowMs;
        this.heartbeatIntervalMs = heartbeatIntervalMs;
        this.sweepIntervalMs = sweepIntervalMs;
        this.staleAfterMs = staleAfterMs;
        this.dumpWaitMs = dumpWaitMs;
        this.pingWaitMs = pingWaitMs;
        this.maxWaitMs = maxWaitMs;
        this.channelKeepAliveMs = channelKeepAliveMs;
    }

    public static SnapBridgeConfig defaults() {
        return new SnapBridgeConfig(
                DEFAULT_BIND,
                DEFAULT_PORT,
                DEFAULT_BASE_PATH,
                DEFAULT_ACTIVE_WINDOW_MS,
                DEFAULT_HEARTBEAT_INTERVAL_MS,
                DEFAULT_SWEEP_INTERVAL_MS,
                DEFAULT_STALE_AFTER_MS,
                DEFAULT_DUMP_WAIT_MS,
                DEFAULT_PING_WAIT_MS,
                DEFAULT_MAX_WAIT_MS,
                DEFAULT_CHANNEL_KEEP_ALIVE_MS
        );
    }

    /**
     * Loads settings from a JSON file, falling back to defaults for every absent field.
     * A missing file yields {@link #defaults()}.
     */
    public static SnapBridgeConfig load(String settingsFile) {
        Path path = settingsFile == null || settingsFile.isBlank()
                ? Paths.get(DEFAULT_SETTINGS_FILE)
                : Paths.get(settingsFile);
        if (!Files.exists(path)) {
            return defaults();
        }
        try {
            SettingsFile file = Jsons.mapper().readValue(path.toFile(), SettingsFile.class);
            return defaults().merge(file);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load settings: " + path.toAbsolutePath(), e);
        }
    }

    /**
     * Applies the non-null fields of {@code overrides} on top of this config.
     */
    public SnapBridgeConfig merge(SettingsFile overrides) {
        if (overrides == null) {
            return this;
        }
        int resolvedPort = overrides.port() == null ? port : overrides.port();
        if (resolvedPort < 0 || resolvedPort > 65_535) {
            resolvedPort = port;
        }
        long heartbeat = sanitizeLong(overrides.heartbeatIntervalMs(), heartbeatIntervalMs, 100L);
        long sweep = sanitizeLong(overrides.sweepIntervalMs(), sweepIntervalMs, 100L);
        long maxWait = sanitizeLong(overrides.maxWaitMs(), maxWaitMs, 1L);
        long dumpWait = Math.min(sanitizeLong(overrides.dumpWaitMs(), dumpWaitMs, 1L), maxWait);
        long pingWait = Math.min(sanitizeLong(overrides.pingWaitMs(), pingWaitMs, 1L), maxWait);
        return new SnapBridgeConfig(
                overrides.bind() == null ? bind : overrides.bind(),
                resolvedPort,
                overrides.basePath() == null ? basePath : overrides.basePath(),
                sanitizeLong(overrides.activeWindowMs(), activeWindowMs, 0L),
                heartbeat,
                sweep,
                sanitizeLong(overrides.staleAfterMs(), staleAfterMs, 1_000L),
                dumpWait,
                pingWait,
                maxWait,
                sanitizeLong(overrides.channelKeepAliveMs(), channelKeepAliveMs, 100L)
        );
    }

    static String normalizeBasePath(String raw) {
        String value = raw == null || raw.isBlank() ? DEFAULT_BASE_PATH : raw.trim();
        if (!value.startsWith("/")) {
            value = "/" + value;
        }
        while (value.length() > 1 && value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    public long clampWaitMs(Long requested, long fallback) {
        long value = requested == null ? fallback : requested;
        if (value < 1L) {
            return 1L;
        }
        return Math.min(value, maxWaitMs);
    }

    public String bind() {
        return bind;
    }

    public int port() {
        return port;
    }

    public String basePath() {
        return basePath;
    }

    public long activeWindowMs() {
        return activeWindowMs;
    }

    public long heartbeatIntervalMs() {
        return heartbeatIntervalMs;
    }

    public long sweepIntervalMs() {
        return sweepIntervalMs;
    }

    public long staleAfterMs() {
        return staleAfterMs;
    }

    public long dumpWaitMs() {
        return dumpWaitMs;
    }

    public long pingWaitMs() {
        return pingWaitMs;
    }

    public long maxWaitMs() {
        return maxWaitMs;
    }

    public long channelKeepAliveMs() {
        return channelKeepAliveMs;
    }

    public record SettingsFile(
            String bind,
            Integer port,
            String basePath,
            Long activeWindowMs,
            Long heartbeatIntervalMs,
            Long sweepIntervalMs,
            Long staleAfterMs,
            Long dumpWaitMs,
            Long pingWaitMs,
            Long maxWaitMs,
            Long channelKeepAliveMs
    ) {
        public static SettingsFile empty() {
            return new SettingsFile(null, null, null, null, null, null, null, null, null, null, null);
        }
    }
}

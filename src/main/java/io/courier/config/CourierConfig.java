package io.courier.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class CourierConfig {
    public static final long DEFAULT_DEBOUNCE_MS = 2_000L;
    public static final long DEFAULT_MAX_DEBOUNCE_MS = 10_000L;
    public static final long DEFAULT_DEQUEUE_TIMEOUT_MS = 5_000L;
    public static final long DEFAULT_BACKGROUND_POLL_INTERVAL_MS = 5_000L;
    public static final long DEFAULT_BACKGROUND_TIMEOUT_MS = 5L * 60L * 1000L;
    public static final long DEFAULT_IDLE_BACKOFF_MS = 1_000L;
    public static final long DEFAULT_SCRIPT_TIMEOUT_MS = 60_000L;
    public static final int DEFAULT_RECENT_EVENT_LIMIT = 10;
    public static final int EVENT_RESULT_MAX_CHARS = 200;
    public static final int EVENT_ERROR_MAX_CHARS = 500;

    private final Path rootDir;

    public CourierConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static CourierConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        return new CourierConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("courier.db");
    }

    public Path settingsFile() {
        return rootDir.resolve("courier-settings.json");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path securityRoot() {
        return rootDir.resolve("security");
    }
}

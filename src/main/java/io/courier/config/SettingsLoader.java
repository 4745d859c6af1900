package io.courier.config;

import io.courier.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Reads {@code courier-settings.json} from the data root and keeps the last
 * sanitized snapshot. A missing file means defaults.
 */
public final class SettingsLoader {
    private static final Logger log = LoggerFactory.getLogger(SettingsLoader.class);

    private final Path settingsFile;
    private volatile CourierSettings current;
    private volatile long fileMtimeMs;
    private volatile long lastCheckMs;

    public SettingsLoader(CourierConfig config) {
        this.settingsFile = config.settingsFile();
        this.current = CourierSettings.defaults();
        this.fileMtimeMs = Long.MIN_VALUE;
        this.lastCheckMs = 0L;
    }

    public CourierSettings current() {
        return current;
    }

    public ReloadOutcome load() {
        return load(true);
    }

    public ReloadOutcome maybeReload(long minIntervalMs) {
        long nowMs = Instant.now().toEpochMilli();
        long interval = Math.max(1_000L, minIntervalMs);
        if ((nowMs - lastCheckMs) < interval) {
            return new ReloadOutcome(false, fileMtimeMs >= 0L, settingsFile.toString(), current, "skip_interval", List.of());
        }
        lastCheckMs = nowMs;
        return load(false);
    }

    private synchronized ReloadOutcome load(boolean force) {
        CourierSettings defaults = CourierSettings.defaults();
        long mtime = resolveMtimeMs(settingsFile);
        if (!force && mtime == fileMtimeMs) {
            return new ReloadOutcome(false, mtime >= 0L, settingsFile.toString(), current, "unchanged", List.of());
        }
        if (mtime < 0L) {
            CourierSettings previous = current;
            current = defaults;
            fileMtimeMs = -1L;
            List<String> changed = previous.diff(defaults);
            return new ReloadOutcome(!changed.isEmpty(), false, settingsFile.toString(), defaults, "defaults", changed);
        }
        try {
            CourierSettings.SettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), CourierSettings.SettingsFile.class);
            CourierSettings resolved = CourierSettings.fromFile(file, defaults);
            CourierSettings previous = current;
            current = resolved;
            fileMtimeMs = mtime;
            List<String> changed = previous.diff(resolved);
            if (!changed.isEmpty()) {
                log.info("Loaded settings from {} (changed: {})", settingsFile, changed);
            }
            return new ReloadOutcome(!changed.isEmpty(), true, settingsFile.toString(), resolved,
                    changed.isEmpty() ? "unchanged_content" : "reloaded", changed);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load settings: " + settingsFile, e);
        }
    }

    private static long resolveMtimeMs(Path file) {
        try {
            if (!Files.exists(file)) {
                return -1L;
            }
            return Files.getLastModifiedTime(file).toMillis();
        } catch (IOException e) {
            return -1L;
        }
    }

    public record ReloadOutcome(
            boolean changed,
            boolean fileExists,
            String path,
            CourierSettings settings,
            String reason,
            List<String> changedFields
    ) {
    }
}

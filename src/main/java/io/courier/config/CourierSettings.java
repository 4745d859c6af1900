package io.courier.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public record CourierSettings(
        long debounceMs,
        long maxDebounceMs,
        long dequeueTimeoutMs,
        long backgroundPollIntervalMs,
        long backgroundTimeoutMs,
        long idleBackoffMs,
        int recentEventLimit,
        List<String> scriptCommand,
        long scriptTimeoutMs
) {
    public CourierSettings {
        scriptCommand = scriptCommand == null ? List.of() : List.copyOf(scriptCommand);
    }

    public static CourierSettings defaults() {
        return new CourierSettings(
                CourierConfig.DEFAULT_DEBOUNCE_MS,
                CourierConfig.DEFAULT_MAX_DEBOUNCE_MS,
                CourierConfig.DEFAULT_DEQUEUE_TIMEOUT_MS,
                CourierConfig.DEFAULT_BACKGROUND_POLL_INTERVAL_MS,
                CourierConfig.DEFAULT_BACKGROUND_TIMEOUT_MS,
                CourierConfig.DEFAULT_IDLE_BACKOFF_MS,
                CourierConfig.DEFAULT_RECENT_EVENT_LIMIT,
                List.of(),
                CourierConfig.DEFAULT_SCRIPT_TIMEOUT_MS
        );
    }

    public static CourierSettings fromFile(SettingsFile file, CourierSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long debounce = sanitizeLong(file.debounceMs(), defaults.debounceMs(), 0L);
        long maxDebounce = sanitizeLong(file.maxDebounceMs(), defaults.maxDebounceMs(), debounce);
        if (maxDebounce < debounce) {
            maxDebounce = debounce;
        }
        long dequeueTimeout = sanitizeLong(file.dequeueTimeoutMs(), defaults.dequeueTimeoutMs(), 10L);
        long pollInterval = sanitizeLong(file.backgroundPollIntervalMs(), defaults.backgroundPollIntervalMs(), 10L);
        long backgroundTimeout = sanitizeLong(file.backgroundTimeoutMs(), defaults.backgroundTimeoutMs(), pollInterval);
        if (backgroundTimeout < pollInterval) {
            backgroundTimeout = pollInterval;
        }
        long idleBackoff = sanitizeLong(file.idleBackoffMs(), defaults.idleBackoffMs(), 0L);
        int recentEvents = sanitizeInt(file.recentEventLimit(), defaults.recentEventLimit(), 1);
        List<String> command = file.scriptCommand() == null
                ? defaults.scriptCommand()
                : file.scriptCommand().stream().filter(Objects::nonNull).filter(s -> !s.isBlank()).toList();
        long scriptTimeout = sanitizeLong(file.scriptTimeoutMs(), defaults.scriptTimeoutMs(), 1_000L);
        return new CourierSettings(
                debounce,
                maxDebounce,
                dequeueTimeout,
                pollInterval,
                backgroundTimeout,
                idleBackoff,
                recentEvents,
                command,
                scriptTimeout
        );
    }

    public Duration debounce() {
        return Duration.ofMillis(debounceMs);
    }

    public Duration maxDebounce() {
        return Duration.ofMillis(maxDebounceMs);
    }

    public Duration dequeueTimeout() {
        return Duration.ofMillis(dequeueTimeoutMs);
    }

    public Duration backgroundPollInterval() {
        return Duration.ofMillis(backgroundPollIntervalMs);
    }

    public Duration backgroundTimeout() {
        return Duration.ofMillis(backgroundTimeoutMs);
    }

    public Duration idleBackoff() {
        return Duration.ofMillis(idleBackoffMs);
    }

    public List<String> diff(CourierSettings other) {
        List<String> out = new ArrayList<>();
        if (other == null) {
            return out;
        }
        if (debounceMs != other.debounceMs) out.add("debounceMs");
        if (maxDebounceMs != other.maxDebounceMs) out.add("maxDebounceMs");
        if (dequeueTimeoutMs != other.dequeueTimeoutMs) out.add("dequeueTimeoutMs");
        if (backgroundPollIntervalMs != other.backgroundPollIntervalMs) out.add("backgroundPollIntervalMs");
        if (backgroundTimeoutMs != other.backgroundTimeoutMs) out.add("backgroundTimeoutMs");
        if (idleBackoffMs != other.idleBackoffMs) out.add("idleBackoffMs");
        if (recentEventLimit != other.recentEventLimit) out.add("recentEventLimit");
        if (!scriptCommand.equals(other.scriptCommand)) out.add("scriptCommand");
        if (scriptTimeoutMs != other.scriptTimeoutMs) out.add("scriptTimeoutMs");
        return out;
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SettingsFile(
            Long debounceMs,
            Long maxDebounceMs,
            Long dequeueTimeoutMs,
            Long backgroundPollIntervalMs,
            Long backgroundTimeoutMs,
            Long idleBackoffMs,
            Integer recentEventLimit,
            List<String> scriptCommand,
            Long scriptTimeoutMs
    ) {
    }
}

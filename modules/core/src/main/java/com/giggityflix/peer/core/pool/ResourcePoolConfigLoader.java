package com.giggityflix.peer.core.pool;

import org.eclipse.microprofile.config.Config;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds a {@link ResourcePoolConfig} from MicroProfile Config.
 * <p>
 * Keys:
 * <ul>
 *   <li>{@code peer.resources.cpu-workers} (or env {@code PEER_CPU_WORKERS}), default: available processors</li>
 *   <li>{@code peer.resources.default-io-limit} (or env {@code PEER_DEFAULT_IO_LIMIT}), default 2</li>
 *   <li>env {@code PEER_DRIVE_<KEY>_IO}, per-device override by env key</li>
 *   <li>{@code peer.resources.io-limit."<device>"}, per-device override by literal id</li>
 *   <li>{@code peer.resources.mount-points}, comma-separated</li>
 *   <li>{@code peer.resources.acquire-timeout}, unset means unbounded waits</li>
 *   <li>{@code peer.resources.shutdown-timeout}, default 30s</li>
 * </ul>
 * Durations accept ISO-8601 ({@code PT5S}) or a number with an optional
 * {@code ms}, {@code s}, {@code m} or {@code h} suffix (bare numbers are seconds).
 */
public final class ResourcePoolConfigLoader {

    public static final String CPU_WORKERS = "peer.resources.cpu-workers";
    public static final String DEFAULT_IO_LIMIT = "peer.resources.default-io-limit";
    public static final String IO_LIMIT_PREFIX = "peer.resources.io-limit.";
    public static final String MOUNT_POINTS = "peer.resources.mount-points";
    public static final String ACQUIRE_TIMEOUT = "peer.resources.acquire-timeout";
    public static final String SHUTDOWN_TIMEOUT = "peer.resources.shutdown-timeout";

    static final String ENV_CPU_WORKERS = "PEER_CPU_WORKERS";
    static final String ENV_DEFAULT_IO_LIMIT = "PEER_DEFAULT_IO_LIMIT";

    private static final Pattern ENV_DRIVE_OVERRIDE = Pattern.compile("^PEER_DRIVE_(.+)_IO$");
    private static final Pattern SIMPLE_DURATION = Pattern.compile("^(\\d+)(ms|s|m|h)?$");

    private ResourcePoolConfigLoader() {}

    public static ResourcePoolConfig load(Config config) {
        int cpuWorkers = config.getOptionalValue(CPU_WORKERS, Integer.class)
                .or(() -> config.getOptionalValue(ENV_CPU_WORKERS, Integer.class))
                .orElse(Runtime.getRuntime().availableProcessors());
        int defaultIoLimit = config.getOptionalValue(DEFAULT_IO_LIMIT, Integer.class)
                .or(() -> config.getOptionalValue(ENV_DEFAULT_IO_LIMIT, Integer.class))
                .orElse(ResourcePoolConfig.DEFAULT_IO_LIMIT);

        Map<String, Integer> overrides = new HashMap<>();
        for (String rawName : config.getPropertyNames()) {
            // Profile-qualified names (%test.x) resolve through their plain name
            String name = rawName.startsWith("%") ? rawName.substring(rawName.indexOf('.') + 1) : rawName;
            Matcher env = ENV_DRIVE_OVERRIDE.matcher(name);
            if (env.matches()) {
                config.getOptionalValue(name, Integer.class)
                        .ifPresent(limit -> overrides.put(env.group(1), limit));
            } else if (name.startsWith(IO_LIMIT_PREFIX)) {
                String device = unquote(name.substring(IO_LIMIT_PREFIX.length()));
                config.getOptionalValue(name, Integer.class)
                        .ifPresent(limit -> overrides.put(device, limit));
            }
        }

        List<String> mountPoints = config.getOptionalValues(MOUNT_POINTS, String.class).orElse(List.of());
        Optional<Duration> acquireTimeout = config.getOptionalValue(ACQUIRE_TIMEOUT, String.class)
                .filter(s -> !s.isBlank())
                .map(s -> parseDuration(ACQUIRE_TIMEOUT, s));
        Duration shutdownTimeout = config.getOptionalValue(SHUTDOWN_TIMEOUT, String.class)
                .map(s -> parseDuration(SHUTDOWN_TIMEOUT, s))
                .orElse(ResourcePoolConfig.DEFAULT_SHUTDOWN_TIMEOUT);

        return new ResourcePoolConfig(cpuWorkers, defaultIoLimit, overrides, mountPoints,
                acquireTimeout, shutdownTimeout);
    }

    static Duration parseDuration(String key, String value) {
        String v = value.trim().toLowerCase(Locale.ROOT);
        if (v.startsWith("p")) {
            try {
                return Duration.parse(v.toUpperCase(Locale.ROOT));
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid duration for " + key + ": " + value, e);
            }
        }
        Matcher m = SIMPLE_DURATION.matcher(v);
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid duration for " + key + ": " + value);
        }
        long amount = Long.parseLong(m.group(1));
        String unit = m.group(2) == null ? "s" : m.group(2);
        return switch (unit) {
            case "ms" -> Duration.ofMillis(amount);
            case "m" -> Duration.ofMinutes(amount);
            case "h" -> Duration.ofHours(amount);
            default -> Duration.ofSeconds(amount);
        };
    }

    private static String unquote(String device) {
        if (device.length() >= 2 && device.startsWith("\"") && device.endsWith("\"")) {
            return device.substring(1, device.length() - 1);
        }
        return device;
    }
}

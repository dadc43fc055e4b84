package com.giggityflix.peer.core.pool;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable sizing of the resource pool, built once at startup.
 *
 * <p>Per-device overrides are keyed either by the literal device id
 * ({@code C:}, {@code /mnt/data}) or by its environment key
 * ({@code C}, {@code MNT_DATA}); the literal id wins when both are present.
 *
 * @param cpuWorkerCount   number of CPU pool workers, {@code > 0}
 * @param defaultIoLimit   concurrent IO operations per device without an override, {@code > 0}
 * @param perDeviceIoLimit overrides, every value {@code > 0}
 * @param mountPoints      mount points known to the device resolver
 * @param acquireTimeout   bounded wait for permits and queue slots; empty means wait forever
 * @param shutdownTimeout  drain budget when the manager shuts down
 */
public record ResourcePoolConfig(
        int cpuWorkerCount,
        int defaultIoLimit,
        Map<String, Integer> perDeviceIoLimit,
        List<String> mountPoints,
        Optional<Duration> acquireTimeout,
        Duration shutdownTimeout
) {

    public static final int DEFAULT_IO_LIMIT = 2;
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    public ResourcePoolConfig {
        if (cpuWorkerCount <= 0) {
            throw new IllegalArgumentException("cpuWorkerCount must be > 0, got: " + cpuWorkerCount);
        }
        if (defaultIoLimit <= 0) {
            throw new IllegalArgumentException("defaultIoLimit must be > 0, got: " + defaultIoLimit);
        }
        Objects.requireNonNull(perDeviceIoLimit, "perDeviceIoLimit cannot be null");
        perDeviceIoLimit.forEach((device, limit) -> {
            if (limit == null || limit <= 0) {
                throw new IllegalArgumentException(
                        "IO limit for device '" + device + "' must be > 0, got: " + limit);
            }
        });
        perDeviceIoLimit = Map.copyOf(perDeviceIoLimit);
        mountPoints = List.copyOf(Objects.requireNonNull(mountPoints, "mountPoints cannot be null"));
        Objects.requireNonNull(acquireTimeout, "acquireTimeout cannot be null");
        acquireTimeout.ifPresent(t -> {
            if (t.isNegative() || t.isZero()) {
                throw new IllegalArgumentException("acquireTimeout must be positive, got: " + t);
            }
        });
        Objects.requireNonNull(shutdownTimeout, "shutdownTimeout cannot be null");
    }

    /** Config with no overrides, no mount points and unbounded waits. */
    public static ResourcePoolConfig of(int cpuWorkerCount, int defaultIoLimit) {
        return new ResourcePoolConfig(cpuWorkerCount, defaultIoLimit, Map.of(), List.of(),
                Optional.empty(), DEFAULT_SHUTDOWN_TIMEOUT);
    }

    public ResourcePoolConfig withDeviceLimits(Map<String, Integer> overrides) {
        return new ResourcePoolConfig(cpuWorkerCount, defaultIoLimit, overrides, mountPoints,
                acquireTimeout, shutdownTimeout);
    }

    public ResourcePoolConfig withMountPoints(List<String> mounts) {
        return new ResourcePoolConfig(cpuWorkerCount, defaultIoLimit, perDeviceIoLimit, mounts,
                acquireTimeout, shutdownTimeout);
    }

    public ResourcePoolConfig withAcquireTimeout(Duration timeout) {
        return new ResourcePoolConfig(cpuWorkerCount, defaultIoLimit, perDeviceIoLimit, mountPoints,
                Optional.of(timeout), shutdownTimeout);
    }

    /** Configured limit for {@code device}: literal override, then env-key override, then default. */
    public int ioLimitFor(DeviceIdentifier device) {
        Integer limit = perDeviceIoLimit.get(device.value());
        if (limit == null) {
            limit = perDeviceIoLimit.get(device.envKey());
        }
        return limit != null ? limit : defaultIoLimit;
    }
}

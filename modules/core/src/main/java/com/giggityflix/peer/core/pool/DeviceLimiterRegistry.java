package com.giggityflix.peer.core.pool;

import org.jboss.logging.Logger;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Lazily-populated table of per-device IO limiters.
 * <p>
 * Limiters are created on first use of a device through
 * {@link ConcurrentMap#computeIfAbsent}, so concurrent first access for the
 * same device always observes a single limiter. Limiters live until the
 * registry is closed.
 */
public class DeviceLimiterRegistry {

    private static final Logger log = Logger.getLogger(DeviceLimiterRegistry.class);

    private final ResourcePoolConfig config;
    private final DeviceResolver resolver;
    private final ConcurrentMap<DeviceIdentifier, DeviceLimiter> limiters = new ConcurrentHashMap<>();

    public DeviceLimiterRegistry(ResourcePoolConfig config, DeviceResolver resolver) {
        this.config = config;
        this.resolver = resolver;
    }

    public DeviceIdentifier resolve(String path) {
        return resolver.resolve(path);
    }

    public DeviceLimiter limiterFor(String path) {
        return limiterFor(resolver.resolve(path));
    }

    public DeviceLimiter limiterFor(DeviceIdentifier device) {
        return limiters.computeIfAbsent(device, d -> {
            int limit = config.ioLimitFor(d);
            log.debugf("Created IO limiter for device %s (limit=%d)", d, limit);
            return new DeviceLimiter(d, limit);
        });
    }

    /** Blocks until a permit for the device holding {@code path} is free. */
    public DevicePermit acquire(String path) throws InterruptedException {
        return limiterFor(path).acquire(config.acquireTimeout());
    }

    public CompletableFuture<DevicePermit> acquireAsync(String path) {
        return limiterFor(path).acquireAsync(config.acquireTimeout());
    }

    /**
     * Sets the live limit of {@code deviceId}, creating its limiter if needed.
     */
    public void resize(String deviceId, int newLimit) {
        if (newLimit <= 0) {
            throw new IllegalArgumentException("limit must be > 0, got: " + newLimit);
        }
        DeviceIdentifier device = DeviceIdentifier.of(deviceId);
        DeviceLimiter created = new DeviceLimiter(device, newLimit);
        DeviceLimiter existing = limiters.putIfAbsent(device, created);
        if (existing != null) {
            existing.resize(newLimit);
        } else {
            log.infof("IO limit for device %s set to %d", device, newLimit);
        }
    }

    /** Live limits of materialized limiters plus configured overrides not yet in use. */
    public Map<String, Integer> limits() {
        Map<String, Integer> result = new TreeMap<>(config.perDeviceIoLimit());
        limiters.forEach((device, limiter) -> result.put(device.value(), limiter.limit()));
        return result;
    }

    public Map<String, Integer> inFlightByDevice() {
        Map<String, Integer> result = new TreeMap<>();
        limiters.forEach((device, limiter) -> result.put(device.value(), limiter.inFlight()));
        return result;
    }

    public Optional<DeviceLimiter> existing(DeviceIdentifier device) {
        return Optional.ofNullable(limiters.get(device));
    }

    public int size() {
        return limiters.size();
    }

    /**
     * Closes every limiter, failing queued waiters.
     *
     * @return permits still held per device; empty when everything was released
     */
    public Map<String, Integer> close() {
        Map<String, Integer> outstanding = new TreeMap<>();
        limiters.forEach((device, limiter) -> {
            int held = limiter.close();
            if (held > 0) {
                outstanding.put(device.value(), held);
            }
        });
        return outstanding;
    }
}

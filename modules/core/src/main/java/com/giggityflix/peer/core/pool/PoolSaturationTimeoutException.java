package com.giggityflix.peer.core.pool;

import java.time.Duration;

/**
 * Thrown when a bounded wait for a device permit or a worker slot expires.
 */
public class PoolSaturationTimeoutException extends RuntimeException {

    private final String resource;
    private final Duration timeout;

    public PoolSaturationTimeoutException(String resource, Duration timeout) {
        super("Timed out after " + timeout.toMillis() + " ms waiting for " + resource);
        this.resource = resource;
        this.timeout = timeout;
    }

    public String resource() {
        return resource;
    }

    public Duration timeout() {
        return timeout;
    }
}

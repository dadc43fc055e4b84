package com.giggityflix.peer.core.pool;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One granted slot on a {@link DeviceLimiter}. Closing releases the slot;
 * only the first close has any effect.
 */
public final class DevicePermit implements AutoCloseable {

    private final DeviceLimiter limiter;
    private final AtomicBoolean released = new AtomicBoolean();

    DevicePermit(DeviceLimiter limiter) {
        this.limiter = limiter;
    }

    public DeviceIdentifier device() {
        return limiter.device();
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            limiter.release();
        }
    }
}

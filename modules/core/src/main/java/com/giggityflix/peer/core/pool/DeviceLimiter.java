package com.giggityflix.peer.core.pool;

import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Resizable counting semaphore guarding IO against one storage device.
 * <p>
 * Waiters are queued FIFO and granted as slots free up. Acquisition is
 * future-based so cooperative callers never block a thread; {@link #acquire}
 * layers a blocking wait on top for synchronous callers. A waiter that is
 * cancelled or times out never consumes a slot.
 * <p>
 * Shrinking the limit never revokes granted permits: in-flight work finishes
 * and new permits are granted only once {@code inFlight < limit} again.
 */
public final class DeviceLimiter {

    private static final Logger log = Logger.getLogger(DeviceLimiter.class);

    private final DeviceIdentifier device;
    private final Deque<CompletableFuture<DevicePermit>> waiters = new ArrayDeque<>();

    private int limit;
    private int inFlight;
    private boolean closed;

    DeviceLimiter(DeviceIdentifier device, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0, got: " + limit);
        }
        this.device = device;
        this.limit = limit;
    }

    public DeviceIdentifier device() {
        return device;
    }

    public synchronized int limit() {
        return limit;
    }

    public synchronized int inFlight() {
        return inFlight;
    }

    public synchronized int waiting() {
        return waiters.size();
    }

    public CompletableFuture<DevicePermit> acquireAsync() {
        return acquireAsync(Optional.empty());
    }

    /**
     * Requests a permit. The future completes with the permit once a slot is
     * free, or exceptionally with {@link PoolSaturationTimeoutException} when
     * {@code timeout} elapses first, or {@link ShutdownInProgressException}
     * when the limiter is closed.
     */
    public CompletableFuture<DevicePermit> acquireAsync(Optional<Duration> timeout) {
        CompletableFuture<DevicePermit> pending = new CompletableFuture<>();
        synchronized (this) {
            if (closed) {
                pending.completeExceptionally(new ShutdownInProgressException(
                        "Device limiter for " + device + " is closed"));
                return pending;
            }
            if (waiters.isEmpty() && inFlight < limit) {
                inFlight++;
                pending.complete(new DevicePermit(this));
                return pending;
            }
            waiters.addLast(pending);
        }

        pending.whenComplete((permit, failure) -> {
            if (failure != null) {
                removeWaiter(pending);
            }
        });
        timeout.ifPresent(t -> CompletableFuture
                .delayedExecutor(t.toMillis(), TimeUnit.MILLISECONDS)
                .execute(() -> pending.completeExceptionally(
                        new PoolSaturationTimeoutException("IO permit on device " + device, t))));
        return pending;
    }

    /**
     * Blocks the calling thread until a permit is granted.
     *
     * @throws PoolSaturationTimeoutException if {@code timeout} elapses first
     * @throws ShutdownInProgressException    if the limiter is closed
     */
    public DevicePermit acquire(Optional<Duration> timeout) throws InterruptedException {
        CompletableFuture<DevicePermit> pending = acquireAsync();
        try {
            if (timeout.isPresent()) {
                return pending.get(timeout.get().toMillis(), TimeUnit.MILLISECONDS);
            }
            return pending.get();
        } catch (TimeoutException e) {
            abandon(pending);
            throw new PoolSaturationTimeoutException("IO permit on device " + device, timeout.get());
        } catch (InterruptedException e) {
            abandon(pending);
            throw e;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException("Permit acquisition failed on device " + device, e.getCause());
        }
    }

    /**
     * Changes the live limit. Growing admits queued waiters immediately.
     */
    public void resize(int newLimit) {
        if (newLimit <= 0) {
            throw new IllegalArgumentException("limit must be > 0, got: " + newLimit);
        }
        int old;
        synchronized (this) {
            old = limit;
            limit = newLimit;
        }
        log.infof("IO limit for device %s resized: %d -> %d", device, old, newLimit);
        dispatch();
    }

    void release() {
        synchronized (this) {
            if (inFlight == 0) {
                throw new IllegalStateException("Permit released on idle device " + device);
            }
            inFlight--;
        }
        dispatch();
    }

    /**
     * Fails all queued waiters and refuses new requests.
     *
     * @return permits still held at close
     */
    int close() {
        List<CompletableFuture<DevicePermit>> abandoned;
        int held;
        synchronized (this) {
            closed = true;
            abandoned = new ArrayList<>(waiters);
            waiters.clear();
            held = inFlight;
        }
        for (CompletableFuture<DevicePermit> waiter : abandoned) {
            waiter.completeExceptionally(new ShutdownInProgressException(
                    "Device limiter for " + device + " closed while waiting"));
        }
        return held;
    }

    // Grants are completed outside the monitor so dependent stages never run under it.
    private void dispatch() {
        while (true) {
            CompletableFuture<DevicePermit> next;
            synchronized (this) {
                if (closed || waiters.isEmpty() || inFlight >= limit) {
                    return;
                }
                next = waiters.pollFirst();
                inFlight++;
            }
            if (!next.complete(new DevicePermit(this))) {
                synchronized (this) {
                    inFlight--;
                }
            }
        }
    }

    private synchronized void removeWaiter(CompletableFuture<DevicePermit> waiter) {
        waiters.remove(waiter);
    }

    // A permit granted after the caller gave up goes straight back.
    static void abandon(CompletableFuture<DevicePermit> pending) {
        if (!pending.cancel(false)) {
            pending.thenAccept(DevicePermit::close);
        }
    }
}

package com.giggityflix.peer.core.pool;

import com.giggityflix.peer.types.ExecutionPath;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Arbitrates CPU-bound and IO-bound work for the whole process.
 * <p>
 * IO-bound work is gated by the {@link DeviceLimiterRegistry}: a permit for
 * the device holding the path is held for the duration of the operation and
 * released on success, failure and cancellation alike. CPU-bound work goes to
 * the {@link CpuWorkerPool}, except when the caller is already one of its
 * workers, in which case it runs inline on the calling thread.
 * <p>
 * Each entry point comes in a synchronous form ({@code call*}, blocking the
 * calling thread) and a cooperative form ({@code run*}, returning a lazy
 * {@link Uni}).
 * <p>
 * Constructed once at startup and shared by reference; see
 * {@code ResourcePoolService} for the CDI-managed instance.
 */
public class ResourcePoolManager {

    private static final Logger log = Logger.getLogger(ResourcePoolManager.class);

    static final String ANONYMOUS = "anonymous";

    private final ResourcePoolConfig config;
    private final Executor ioExecutor;
    private final PoolMetrics metrics = new PoolMetrics();
    private final DeviceLimiterRegistry registry;
    private final CpuWorkerPool cpuPool;
    private final AtomicBoolean shuttingDown = new AtomicBoolean();

    public ResourcePoolManager(ResourcePoolConfig config, Executor ioExecutor) {
        this(config, new MountPointDeviceResolver(config.mountPoints()), ioExecutor);
    }

    public ResourcePoolManager(ResourcePoolConfig config, DeviceResolver resolver, Executor ioExecutor) {
        this.config = config;
        this.ioExecutor = ioExecutor;
        this.registry = new DeviceLimiterRegistry(config, resolver);
        this.cpuPool = new CpuWorkerPool("cpu-worker", config.cpuWorkerCount(),
                config.acquireTimeout(), metrics);
        log.infof("Resource pool manager started (cpuWorkers=%d, defaultIoLimit=%d, overrides=%s)",
                config.cpuWorkerCount(), config.defaultIoLimit(), config.perDeviceIoLimit());
    }

    // -- IO-bound --

    public <T> T callIoBound(String path, Callable<T> operation) throws Exception {
        return callIoBound(ANONYMOUS, path, operation);
    }

    /**
     * Runs {@code body} on the calling thread while holding a permit for the
     * device that holds {@code path}.
     *
     * @throws InvalidDevicePathException     if the path does not resolve to a device
     * @throws PoolSaturationTimeoutException if a bounded wait is configured and expires
     * @throws ShutdownInProgressException    if the manager is shutting down
     */
    public <T> T callIoBound(String operation, String path, Callable<T> body) throws Exception {
        ensureAccepting();
        DeviceLimiter limiter = registry.limiterFor(path);
        PoolMetrics.Timer timer = metrics.start(ExecutionPath.IO);
        try (DevicePermit permit = limiter.acquire(config.acquireTimeout())) {
            timer.started();
            T result = body.call();
            metrics.completed(operation, timer);
            return result;
        } catch (Exception | Error e) {
            metrics.failed(operation, timer, e);
            throw e;
        }
    }

    public <T> Uni<T> runIoBound(String path, Callable<T> operation) {
        return runIoBound(ANONYMOUS, path, operation);
    }

    /**
     * Cooperative form of {@link #callIoBound}: waits for the permit without
     * blocking a thread, then runs the blocking {@code body} on the IO executor.
     * <p>
     * Cancelling releases the permit at once, but a body already running on
     * the IO executor is not interrupted. Until it returns, the device can
     * carry one more operation than its limit.
     */
    public <T> Uni<T> runIoBound(String operation, String path, Callable<T> body) {
        return runIoBoundAsync(operation, path, () -> fromCallable(body).runSubscriptionOn(ioExecutor));
    }

    public <T> Uni<T> runIoBoundAsync(String path, Supplier<Uni<T>> operation) {
        return runIoBoundAsync(ANONYMOUS, path, operation);
    }

    /**
     * Gates an asynchronous IO operation: {@code body} is subscribed once the
     * device permit is granted, and the permit is released when it terminates
     * or is cancelled.
     */
    public <T> Uni<T> runIoBoundAsync(String operation, String path, Supplier<Uni<T>> body) {
        return Uni.createFrom().deferred(() -> {
            ensureAccepting();
            DeviceLimiter limiter = registry.limiterFor(path);
            PoolMetrics.Timer timer = metrics.start(ExecutionPath.IO);
            return awaitPermit(limiter)
                    .onItem().transformToUni(permit -> {
                        timer.started();
                        return Uni.createFrom().deferred(() -> body.get())
                                .onTermination().invoke(permit::close);
                    })
                    .onItem().invoke(item -> metrics.completed(operation, timer))
                    .onFailure().invoke(failure -> metrics.failed(operation, timer, failure));
        });
    }

    // -- CPU-bound --

    public <T> T callCpuBound(Callable<T> callable) throws Exception {
        return callCpuBound(ANONYMOUS, callable);
    }

    /**
     * Runs {@code callable} on a pool worker and blocks for its result. From
     * inside a worker of this pool the callable runs inline instead.
     *
     * @throws WorkerExecutionException    wrapping the callable's failure (pool case)
     * @throws ShutdownInProgressException if the manager is shutting down
     */
    public <T> T callCpuBound(String operation, Callable<T> callable) throws Exception {
        if (ExecutionContext.isInside(cpuPool)) {
            return runInline(operation, callable);
        }
        ensureAccepting();
        CompletableFuture<T> future = cpuPool.submit(operation, callable);
        try {
            return future.get();
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            throw asRuntime(e.getCause());
        }
    }

    public <T> Uni<T> runCpuBound(Callable<T> callable) {
        return runCpuBound(ANONYMOUS, callable);
    }

    /**
     * Cooperative form of {@link #callCpuBound}. Cancelling the returned
     * {@code Uni} cancels the queued item or interrupts its worker.
     */
    public <T> Uni<T> runCpuBound(String operation, Callable<T> callable) {
        return Uni.createFrom().emitter(emitter -> {
            if (ExecutionContext.isInside(cpuPool)) {
                T value;
                try {
                    value = runInline(operation, callable);
                } catch (Exception e) {
                    emitter.fail(e);
                    return;
                }
                emitter.complete(value);
                return;
            }

            ensureAccepting();
            CompletableFuture<T> future = cpuPool.submit(operation, callable);
            emitter.onTermination(() -> future.cancel(true));
            future.whenComplete((value, failure) -> {
                if (failure != null) {
                    emitter.fail(unwrap(failure));
                } else {
                    emitter.complete(value);
                }
            });
        });
    }

    // -- async --

    /**
     * Tracks an already-asynchronous unit on the {@link ExecutionPath#ASYNC}
     * path. No permit or worker is involved.
     */
    public <T> Uni<T> runAsync(String operation, Supplier<Uni<T>> unit) {
        return Uni.createFrom().deferred(() -> {
            ensureAccepting();
            PoolMetrics.Timer timer = metrics.start(ExecutionPath.ASYNC);
            timer.started();
            return Uni.createFrom().deferred(() -> unit.get())
                    .onItem().invoke(item -> metrics.completed(operation, timer))
                    .onFailure().invoke(failure -> metrics.failed(operation, timer, failure));
        });
    }

    // -- administration --

    public void resizeCpuPool(int newSize) {
        ensureAccepting();
        cpuPool.resize(newSize);
    }

    public void resizeDeviceLimit(String deviceId, int newLimit) {
        ensureAccepting();
        registry.resize(deviceId, newLimit);
    }

    public int cpuPoolSize() {
        return cpuPool.workerCount();
    }

    public Map<String, Integer> ioLimits() {
        return registry.limits();
    }

    public DeviceIdentifier deviceFor(String path) {
        return registry.resolve(path);
    }

    public PoolMetricsSnapshot metrics() {
        return new PoolMetricsSnapshot(
                metrics.snapshot(),
                cpuPool.workerCount(),
                cpuPool.activeWorkers(),
                cpuPool.queueDepth(),
                registry.inFlightByDevice());
    }

    public ResourcePoolConfig config() {
        return config;
    }

    public DeviceLimiterRegistry registry() {
        return registry;
    }

    public CpuWorkerPool cpuPool() {
        return cpuPool;
    }

    public boolean isShutdown() {
        return shuttingDown.get();
    }

    /**
     * Drains the CPU pool and closes every device limiter. Idempotent.
     *
     * @throws IllegalStateException if device permits are still held once
     *                               draining finishes
     */
    public void shutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        log.info("Resource pool manager shutting down");

        cpuPool.shutdown();
        boolean drained;
        try {
            drained = cpuPool.awaitTermination(config.shutdownTimeout());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            drained = false;
        }
        if (!drained) {
            int dropped = cpuPool.shutdownNow();
            log.warnf("CPU pool did not drain within %s; %d queued items dropped",
                    config.shutdownTimeout(), dropped);
        }

        Map<String, Integer> outstanding = registry.close();
        if (!outstanding.isEmpty()) {
            log.errorf("Device permits still held at shutdown: %s", outstanding);
            throw new IllegalStateException("Device permits still held at shutdown: " + outstanding);
        }
        log.info("Resource pool manager stopped");
    }

    // -- internals --

    private void ensureAccepting() {
        if (shuttingDown.get()) {
            throw new ShutdownInProgressException("Resource pool manager is shutting down");
        }
    }

    private <T> T runInline(String operation, Callable<T> callable) throws Exception {
        PoolMetrics.Timer timer = metrics.start(ExecutionPath.INLINE);
        timer.started();
        try {
            T result = callable.call();
            metrics.completed(operation, timer);
            return result;
        } catch (Exception | Error e) {
            metrics.failed(operation, timer, e);
            throw e;
        }
    }

    /**
     * Emits the permit once granted. On cancellation the request is abandoned:
     * a queued waiter is withdrawn, and a permit granted in the meantime is
     * closed so the slot is not lost.
     */
    private Uni<DevicePermit> awaitPermit(DeviceLimiter limiter) {
        return Uni.createFrom().deferred(() -> {
            CompletableFuture<DevicePermit> pending = limiter.acquireAsync(config.acquireTimeout());
            return Uni.createFrom().completionStage(pending)
                    .onFailure(CompletionException.class).transform(ResourcePoolManager::unwrap)
                    .onCancellation().invoke(() -> DeviceLimiter.abandon(pending));
        });
    }

    private static <T> Uni<T> fromCallable(Callable<T> callable) {
        return Uni.createFrom().emitter(emitter -> {
            T value;
            try {
                value = callable.call();
            } catch (Exception e) {
                emitter.fail(e);
                return;
            }
            emitter.complete(value);
        });
    }

    private static Throwable unwrap(Throwable failure) {
        if (failure instanceof CompletionException && failure.getCause() != null) {
            return failure.getCause();
        }
        return failure;
    }

    private static RuntimeException asRuntime(Throwable cause) {
        if (cause instanceof RuntimeException re) {
            return re;
        }
        if (cause instanceof Error err) {
            throw err;
        }
        return new WorkerExecutionException(ANONYMOUS, cause);
    }
}

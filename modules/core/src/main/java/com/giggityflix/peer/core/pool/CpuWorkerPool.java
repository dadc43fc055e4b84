package com.giggityflix.peer.core.pool;

import com.giggityflix.peer.types.ExecutionPath;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded set of long-lived worker threads executing CPU-bound callables
 * from one unbounded FIFO queue.
 * <p>
 * A callable's failure, {@code Error}s included, completes its future with a
 * {@link WorkerExecutionException}; the worker itself keeps servicing the
 * queue. Every callable runs inside an {@link ExecutionContext} scope naming
 * this pool.
 */
public class CpuWorkerPool {

    private static final Logger log = Logger.getLogger(CpuWorkerPool.class);

    private static final long POLL_INTERVAL_MS = 200;

    private final String name;
    private final Optional<Duration> queueTimeout;
    private final PoolMetrics metrics;

    private final BlockingQueue<WorkItem<?>> queue = new LinkedBlockingQueue<>();
    private final List<Thread> workers = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger targetSize;
    private final AtomicInteger liveWorkers = new AtomicInteger();
    private final AtomicInteger activeWorkers = new AtomicInteger();
    private final AtomicInteger workerSeq = new AtomicInteger();
    private final Object lifecycleLock = new Object();

    private volatile boolean accepting = true;
    private volatile boolean stopped;

    public CpuWorkerPool(String name, int workerCount, Optional<Duration> queueTimeout, PoolMetrics metrics) {
        if (workerCount <= 0) {
            throw new IllegalArgumentException("workerCount must be > 0, got: " + workerCount);
        }
        this.name = name;
        this.queueTimeout = queueTimeout;
        this.metrics = metrics;
        this.targetSize = new AtomicInteger(workerCount);
        growToTarget();
        log.infof("CPU worker pool '%s' started with %d workers", name, workerCount);
    }

    /**
     * Queues {@code callable} for execution on a worker.
     *
     * @throws ShutdownInProgressException if the pool is draining or stopped
     */
    public <T> CompletableFuture<T> submit(String operation, Callable<T> callable) {
        WorkItem<T> item = new WorkItem<>(operation, callable);
        synchronized (lifecycleLock) {
            if (!accepting) {
                throw new ShutdownInProgressException("CPU worker pool '" + name + "' is shutting down");
            }
            item.timer = metrics.start(ExecutionPath.CPU);
            queue.add(item);
        }
        item.future.whenComplete((value, failure) -> {
            if (item.future.isCancelled()) {
                item.interruptRunner();
            }
        });
        return item.future;
    }

    /**
     * Changes the number of workers. Growing starts threads immediately;
     * shrinking retires surplus workers as they finish their current item.
     */
    public void resize(int newSize) {
        if (newSize <= 0) {
            throw new IllegalArgumentException("workerCount must be > 0, got: " + newSize);
        }
        int old = targetSize.getAndSet(newSize);
        if (accepting) {
            growToTarget();
        }
        log.infof("CPU worker pool '%s' resized: %d -> %d", name, old, newSize);
    }

    /** Stops accepting new work; queued and running items still complete. Idempotent. */
    public void shutdown() {
        synchronized (lifecycleLock) {
            if (!accepting) {
                return;
            }
            accepting = false;
        }
        log.infof("CPU worker pool '%s' draining (%d queued, %d active)",
                name, queue.size(), activeWorkers.get());
    }

    /**
     * Cancels queued items and interrupts running ones.
     *
     * @return number of queued items that never started
     */
    public int shutdownNow() {
        shutdown();
        stopped = true;
        List<WorkItem<?>> dropped = new ArrayList<>();
        queue.drainTo(dropped);
        for (WorkItem<?> item : dropped) {
            ShutdownInProgressException stoppedBeforeRun = new ShutdownInProgressException(
                    "CPU worker pool '" + name + "' stopped before '" + item.operation + "' ran");
            metrics.failed(item.operation, item.timer, stoppedBeforeRun);
            item.future.completeExceptionally(stoppedBeforeRun);
        }
        for (Thread worker : List.copyOf(workers)) {
            worker.interrupt();
        }
        return dropped.size();
    }

    /**
     * Waits for every worker to exit after {@link #shutdown()}.
     *
     * @return true if all workers exited within {@code timeout}
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        for (Thread worker : List.copyOf(workers)) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                break;
            }
            worker.join(Math.max(1, TimeUnit.NANOSECONDS.toMillis(remaining)));
        }
        return liveWorkers.get() == 0;
    }

    public boolean isShutdown() {
        return !accepting;
    }

    public int workerCount() {
        return targetSize.get();
    }

    public int liveWorkers() {
        return liveWorkers.get();
    }

    public int activeWorkers() {
        return activeWorkers.get();
    }

    public int queueDepth() {
        return queue.size();
    }

    public String name() {
        return name;
    }

    // -- internals --

    private void growToTarget() {
        while (true) {
            int live = liveWorkers.get();
            if (live >= targetSize.get()) {
                return;
            }
            if (liveWorkers.compareAndSet(live, live + 1)) {
                Thread worker = new Thread(this::workerLoop, name + "-" + workerSeq.getAndIncrement());
                worker.setDaemon(true);
                workers.add(worker);
                worker.start();
            }
        }
    }

    private boolean retireIfSurplus() {
        int live = liveWorkers.get();
        return live > targetSize.get() && liveWorkers.compareAndSet(live, live - 1);
    }

    private void workerLoop() {
        boolean retired = false;
        try {
            while (!stopped) {
                if (retireIfSurplus()) {
                    retired = true;
                    log.debugf("Worker %s retired", Thread.currentThread().getName());
                    return;
                }
                WorkItem<?> item;
                try {
                    item = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    // Late interrupt aimed at a cancelled item, or shutdownNow; the loop re-checks stopped.
                    continue;
                }
                if (item == null) {
                    if (!accepting) {
                        return;
                    }
                    continue;
                }
                try {
                    execute(item);
                } catch (Throwable t) {
                    log.error("Unexpected error in worker loop", t);
                }
            }
        } finally {
            if (!retired) {
                liveWorkers.decrementAndGet();
            }
            workers.remove(Thread.currentThread());
        }
    }

    private <T> void execute(WorkItem<T> item) {
        if (item.future.isDone()) {
            // cancelled while queued
            metrics.failed(item.operation, item.timer, new CancellationException(
                    "'" + item.operation + "' cancelled before it ran"));
            return;
        }
        if (queueTimeout.isPresent() && item.timer.queueTime().compareTo(queueTimeout.get()) > 0) {
            PoolSaturationTimeoutException timeout =
                    new PoolSaturationTimeoutException("CPU worker slot", queueTimeout.get());
            metrics.failed(item.operation, item.timer, timeout);
            item.future.completeExceptionally(timeout);
            return;
        }

        T result = null;
        Throwable failure = null;
        item.bind(Thread.currentThread());
        activeWorkers.incrementAndGet();
        item.timer.started();
        try (ExecutionContext.Scope ignored = ExecutionContext.enter(this)) {
            result = item.callable.call();
        } catch (Throwable t) {
            failure = t;
        } finally {
            activeWorkers.decrementAndGet();
            item.unbind();
            // Clear any cancellation interrupt before taking the next item
            Thread.interrupted();
        }

        // Completed outside the scope so dependent stages never see the marker
        if (failure == null) {
            metrics.completed(item.operation, item.timer);
            item.future.complete(result);
        } else {
            metrics.failed(item.operation, item.timer, failure);
            log.debugf(failure, "CPU-bound operation '%s' failed", item.operation);
            item.future.completeExceptionally(new WorkerExecutionException(item.operation, failure));
        }
    }

    private static final class WorkItem<T> {

        final String operation;
        final Callable<T> callable;
        final CompletableFuture<T> future = new CompletableFuture<>();
        PoolMetrics.Timer timer;
        private Thread runner;

        WorkItem(String operation, Callable<T> callable) {
            this.operation = operation;
            this.callable = callable;
        }

        synchronized void bind(Thread thread) {
            runner = thread;
        }

        synchronized void unbind() {
            runner = null;
        }

        synchronized void interruptRunner() {
            if (runner != null) {
                runner.interrupt();
            }
        }
    }
}

package com.giggityflix.peer.core.pool;

import com.giggityflix.peer.types.ExecutionPath;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Submission counters per {@link ExecutionPath}, plus per-operation timing
 * (time queued, time executing) reported at DEBUG.
 */
public class PoolMetrics {

    private static final Logger log = Logger.getLogger(PoolMetrics.class);

    private final Map<ExecutionPath, Counters> counters = new EnumMap<>(ExecutionPath.class);

    public PoolMetrics() {
        for (ExecutionPath path : ExecutionPath.values()) {
            counters.put(path, new Counters());
        }
    }

    /** Counts a submission on {@code path} and starts its queue clock. */
    public Timer start(ExecutionPath path) {
        counters.get(path).submitted.increment();
        return new Timer(path);
    }

    public void completed(String operation, Timer timer) {
        counters.get(timer.path).completed.increment();
        report(operation, timer, "completed");
    }

    public void failed(String operation, Timer timer, Throwable cause) {
        counters.get(timer.path).failed.increment();
        report(operation, timer, "failed (" + cause.getClass().getSimpleName() + ")");
    }

    public PathCounters counters(ExecutionPath path) {
        Counters c = counters.get(path);
        return new PathCounters(c.submitted.sum(), c.completed.sum(), c.failed.sum());
    }

    public Map<ExecutionPath, PathCounters> snapshot() {
        Map<ExecutionPath, PathCounters> result = new EnumMap<>(ExecutionPath.class);
        for (ExecutionPath path : ExecutionPath.values()) {
            result.put(path, counters(path));
        }
        return result;
    }

    private void report(String operation, Timer timer, String outcome) {
        if (log.isDebugEnabled()) {
            log.debugf("[%s] %s %s: queued for %d ms, executed in %d ms",
                    timer.path.label(), operation, outcome,
                    timer.queueTime().toMillis(), timer.executionTime().toMillis());
        }
    }

    public record PathCounters(long submitted, long completed, long failed) {}

    private static final class Counters {
        final LongAdder submitted = new LongAdder();
        final LongAdder completed = new LongAdder();
        final LongAdder failed = new LongAdder();
    }

    /**
     * Queue and execution clock for one operation. If {@link #started()} is
     * never called the whole elapsed time counts as queue time.
     */
    public static final class Timer {

        private final ExecutionPath path;
        private final long queuedAt = System.nanoTime();
        private volatile long startedAt;

        private Timer(ExecutionPath path) {
            this.path = path;
        }

        public ExecutionPath path() {
            return path;
        }

        public void started() {
            startedAt = System.nanoTime();
        }

        public Duration queueTime() {
            long start = startedAt;
            return Duration.ofNanos((start == 0 ? System.nanoTime() : start) - queuedAt);
        }

        public Duration executionTime() {
            long start = startedAt;
            return start == 0 ? Duration.ZERO : Duration.ofNanos(System.nanoTime() - start);
        }
    }
}

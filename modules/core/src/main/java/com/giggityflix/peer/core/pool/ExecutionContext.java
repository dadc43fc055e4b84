package com.giggityflix.peer.core.pool;

import java.util.Optional;

/**
 * Per-thread marker recording which {@link CpuWorkerPool} the current thread
 * is executing a callable for.
 * <p>
 * Workers enter a scope around every callable. A CPU-bound submission made
 * while the marker names the same pool is re-entrant and must run inline:
 * queueing it could leave every worker blocked on work that never starts.
 * The marker is keyed by pool, so unrelated pools and non-worker threads
 * are unaffected.
 */
public final class ExecutionContext {

    private static final ThreadLocal<CpuWorkerPool> CURRENT = new ThreadLocal<>();

    private ExecutionContext() {}

    public static boolean isInside(CpuWorkerPool pool) {
        return pool != null && CURRENT.get() == pool;
    }

    static Optional<CpuWorkerPool> current() {
        return Optional.ofNullable(CURRENT.get());
    }

    /**
     * Marks the current thread as running inside {@code pool} until the
     * returned scope is closed; closing restores the previous marker.
     */
    static Scope enter(CpuWorkerPool pool) {
        CpuWorkerPool previous = CURRENT.get();
        CURRENT.set(pool);
        return () -> {
            if (previous == null) {
                CURRENT.remove();
            } else {
                CURRENT.set(previous);
            }
        };
    }

    @FunctionalInterface
    interface Scope extends AutoCloseable {
        @Override
        void close();
    }
}

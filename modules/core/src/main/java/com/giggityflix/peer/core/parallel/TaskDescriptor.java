package com.giggityflix.peer.core.parallel;

import com.giggityflix.peer.core.pool.ResourcePoolManager;
import io.smallrye.mutiny.Uni;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * One unit of work for {@link ParallelExecutor}. The variant decides the
 * path: {@link Async} units run as they are, {@link CpuBound} callables go
 * through the CPU worker pool and {@link IoBound} callables through the
 * device limiter of their path. Arguments are captured by the callable.
 */
public sealed interface TaskDescriptor<T> {

    String name();

    Uni<T> dispatch(ResourcePoolManager manager);

    record Async<T>(String name, Supplier<Uni<T>> unit) implements TaskDescriptor<T> {
        public Async {
            Objects.requireNonNull(unit, "unit cannot be null");
        }

        @Override
        public Uni<T> dispatch(ResourcePoolManager manager) {
            return manager.runAsync(name, unit);
        }
    }

    record CpuBound<T>(String name, Callable<T> callable) implements TaskDescriptor<T> {
        public CpuBound {
            Objects.requireNonNull(callable, "callable cannot be null");
        }

        @Override
        public Uni<T> dispatch(ResourcePoolManager manager) {
            return manager.runCpuBound(name, callable);
        }
    }

    record IoBound<T>(String name, String path, Callable<T> callable) implements TaskDescriptor<T> {
        public IoBound {
            Objects.requireNonNull(callable, "callable cannot be null");
        }

        @Override
        public Uni<T> dispatch(ResourcePoolManager manager) {
            return manager.runIoBound(name, path, callable);
        }
    }

    static <T> TaskDescriptor<T> async(Supplier<Uni<T>> unit) {
        return new Async<>("async", unit);
    }

    static <T> TaskDescriptor<T> async(String name, Supplier<Uni<T>> unit) {
        return new Async<>(name, unit);
    }

    static <T> TaskDescriptor<T> cpu(Callable<T> callable) {
        return new CpuBound<>("cpu", callable);
    }

    static <T> TaskDescriptor<T> cpu(String name, Callable<T> callable) {
        return new CpuBound<>(name, callable);
    }

    static <T> TaskDescriptor<T> io(String path, Callable<T> callable) {
        return new IoBound<>("io", path, callable);
    }

    static <T> TaskDescriptor<T> io(String name, String path, Callable<T> callable) {
        return new IoBound<>(name, path, callable);
    }
}

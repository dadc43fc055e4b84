package com.giggityflix.peer.core.parallel;

import com.giggityflix.peer.core.pool.ResourcePoolManager;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs a batch of heterogeneous {@link TaskDescriptor}s concurrently and
 * collects one {@link TaskResult} per descriptor, in input order.
 * <p>
 * Every unit is subscribed at once; concurrency is bounded only by the CPU
 * pool and device limiters the units pass through. A failing unit becomes a
 * {@link TaskResult.Failure} and never cancels its siblings. Cancelling the
 * returned {@code Uni} cancels every unit still outstanding.
 */
public class ParallelExecutor {

    private static final Logger log = Logger.getLogger(ParallelExecutor.class);

    private final ResourcePoolManager manager;

    public ParallelExecutor(ResourcePoolManager manager) {
        this.manager = manager;
    }

    public Uni<List<TaskResult<?>>> executeParallel(List<? extends TaskDescriptor<?>> tasks) {
        if (tasks.isEmpty()) {
            return Uni.createFrom().item(List.of());
        }

        List<Uni<TaskResult<?>>> settled = new ArrayList<>(tasks.size());
        for (TaskDescriptor<?> task : tasks) {
            settled.add(settle(task));
        }

        return Uni.combine().all().unis(settled).with(results -> {
            List<TaskResult<?>> ordered = new ArrayList<>(results.size());
            for (Object result : results) {
                ordered.add((TaskResult<?>) result);
            }
            log.debugf("Parallel batch of %d finished (%d failed)", ordered.size(),
                    ordered.stream().filter(r -> !r.isSuccess()).count());
            return ordered;
        });
    }

    /** Blocking form of {@link #executeParallel(List)}. */
    public List<TaskResult<?>> executeParallelAndAwait(List<? extends TaskDescriptor<?>> tasks) {
        return executeParallel(tasks).await().indefinitely();
    }

    private <T> Uni<TaskResult<?>> settle(TaskDescriptor<T> task) {
        Uni<T> dispatched;
        try {
            dispatched = task.dispatch(manager);
        } catch (RuntimeException e) {
            return Uni.createFrom().item(TaskResult.failure(e));
        }
        return dispatched.onItemOrFailure().transform((item, failure) -> {
            if (failure != null) {
                log.debugf("Parallel task '%s' failed: %s", task.name(), failure.toString());
                return TaskResult.failure(failure);
            }
            return TaskResult.success(item);
        });
    }
}

package com.giggityflix.peer.core.pool;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Produces the executor that runs blocking IO callables once their device
 * permit is granted. Unbounded: device limiters cap the concurrency.
 */
@ApplicationScoped
public class IoExecutorProducer {

    private final AtomicInteger threadSeq = new AtomicInteger();
    private ExecutorService executor;

    @Produces
    @ApplicationScoped
    @Named("ioExecutor")
    public ExecutorService ioExecutor() {
        executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "io-worker-" + threadSeq.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        return executor;
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) executor.shutdown();
    }
}

package com.giggityflix.peer.core.pool;

import com.giggityflix.peer.core.parallel.ParallelExecutor;
import com.giggityflix.peer.core.service.AbstractManagedService;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.Config;

import java.util.concurrent.ExecutorService;

/**
 * Process-wide owner of the {@link ResourcePoolManager}. Starts eagerly at
 * boot via {@code @Startup}, reading its sizing from configuration once, and
 * drains the pool on shutdown.
 * <p>
 * After shutdown {@link #manager()} still returns the drained manager, whose
 * entry points then fail with {@link ShutdownInProgressException}.
 */
@ApplicationScoped
@Startup
public class ResourcePoolService extends AbstractManagedService {

    @Inject
    Config config;

    @Inject
    @Named("ioExecutor")
    ExecutorService ioExecutor;

    private volatile ResourcePoolManager manager;
    private volatile ParallelExecutor parallel;

    @Override
    public String serviceId() {
        return "resource-pool";
    }

    @Override
    protected void doStart() {
        ResourcePoolConfig poolConfig = ResourcePoolConfigLoader.load(config);
        manager = new ResourcePoolManager(poolConfig, ioExecutor);
        parallel = new ParallelExecutor(manager);
    }

    @Override
    protected void doStop() {
        if (manager != null) {
            manager.shutdown();
        }
    }

    /** Throws if the service never started. */
    public ResourcePoolManager manager() {
        ResourcePoolManager m = manager;
        if (m == null) {
            throw new IllegalStateException(
                    "ResourcePoolService has not started (state=" + state() + ")");
        }
        return m;
    }

    public ParallelExecutor parallel() {
        manager();
        return parallel;
    }

    @PostConstruct
    void init() {
        try {
            start();
        } catch (Exception e) {
            throw new RuntimeException("ResourcePoolService failed to start", e);
        }
    }

    @PreDestroy
    void shutdown() {
        try {
            stop();
        } catch (Exception e) {
            log.error("Error stopping ResourcePoolService", e);
        }
    }
}

package com.giggityflix.peer.core.health;

import com.giggityflix.peer.core.pool.PoolMetricsSnapshot;
import com.giggityflix.peer.core.pool.ResourcePoolService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

@Readiness
@ApplicationScoped
public class ResourcePoolHealthCheck implements HealthCheck {

    @Inject
    ResourcePoolService resourcePool;

    @Override
    public HealthCheckResponse call() {
        if (!resourcePool.isRunning()) {
            return HealthCheckResponse.named("resource-pool")
                    .down()
                    .withData("state", resourcePool.state().name())
                    .build();
        }
        PoolMetricsSnapshot metrics = resourcePool.manager().metrics();
        return HealthCheckResponse.named("resource-pool")
                .up()
                .withData("workers", metrics.workerCount())
                .withData("activeWorkers", metrics.activeWorkers())
                .withData("queueDepth", metrics.queueDepth())
                .build();
    }
}

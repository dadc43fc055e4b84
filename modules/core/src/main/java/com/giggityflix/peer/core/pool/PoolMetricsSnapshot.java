package com.giggityflix.peer.core.pool;

import com.giggityflix.peer.types.ExecutionPath;

import java.util.Map;

/**
 * Point-in-time view of the resource pool for metrics and health reporting.
 */
public record PoolMetricsSnapshot(
        Map<ExecutionPath, PoolMetrics.PathCounters> paths,
        int workerCount,
        int activeWorkers,
        int queueDepth,
        Map<String, Integer> deviceInFlight
) {
    public PoolMetricsSnapshot {
        paths = Map.copyOf(paths);
        deviceInFlight = Map.copyOf(deviceInFlight);
    }
}

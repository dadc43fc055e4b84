package com.giggityflix.peer.api;

import com.giggityflix.peer.core.pool.PoolMetricsSnapshot;
import com.giggityflix.peer.core.pool.ResourcePoolManager;
import com.giggityflix.peer.core.pool.ResourcePoolService;
import jakarta.inject.Inject;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.jboss.logging.Logger;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runtime administration of the resource pool: CPU worker count and
 * per-device IO limits.
 */
@Path("/api/resources")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ResourcePoolResource {

    private static final Logger log = Logger.getLogger(ResourcePoolResource.class);

    @Inject
    ResourcePoolService resourcePool;

    public record PoolSizeUpdate(Integer size) {}

    public record DriveLimitUpdate(String drive, Integer limit) {}

    @GET
    @Path("/pool")
    public Map<String, Object> pool() {
        PoolMetricsSnapshot snapshot = resourcePool.manager().metrics();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("size", snapshot.workerCount());
        body.put("activeWorkers", snapshot.activeWorkers());
        body.put("queueDepth", snapshot.queueDepth());
        return body;
    }

    @PUT
    @Path("/pool")
    public Map<String, Object> resizePool(PoolSizeUpdate update) {
        if (update == null || update.size() == null || update.size() <= 0) {
            throw new BadRequestException("size must be a positive integer");
        }
        resourcePool.manager().resizeCpuPool(update.size());
        log.infof("CPU pool resized to %d via API", update.size());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "success");
        body.put("new_size", update.size());
        return body;
    }

    @GET
    @Path("/io-limits")
    public Map<String, Object> ioLimits() {
        return Map.of("limits", resourcePool.manager().ioLimits());
    }

    @PUT
    @Path("/io-limits")
    public Map<String, Object> updateIoLimit(DriveLimitUpdate update) {
        if (update == null || update.drive() == null || update.drive().isBlank()
                || update.limit() == null || update.limit() <= 0) {
            throw new BadRequestException("drive and a positive limit are required");
        }
        ResourcePoolManager manager = resourcePool.manager();
        try {
            manager.resizeDeviceLimit(update.drive(), update.limit());
        } catch (IllegalArgumentException e) {
            throw new BadRequestException(e.getMessage(), e);
        }
        log.infof("IO limit for %s set to %d via API", update.drive(), update.limit());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "success");
        body.put("drive", update.drive());
        body.put("limit", update.limit());
        return body;
    }

    @GET
    @Path("/metrics")
    public PoolMetricsSnapshot metrics() {
        return resourcePool.manager().metrics();
    }
}

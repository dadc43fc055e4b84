package com.giggityflix.peer.api;

import com.giggityflix.peer.core.pool.ResourcePoolConfig;
import com.giggityflix.peer.core.pool.ResourcePoolService;
import com.giggityflix.peer.core.service.ManagedService;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness check for peer operators plus the effective resource pool sizing,
 * as resolved from configuration at startup.
 */
@Path("/api/diagnostic")
@Produces(MediaType.APPLICATION_JSON)
public class DiagnosticResource {

    @ConfigProperty(name = "quarkus.application.name")
    String appName;

    @ConfigProperty(name = "quarkus.application.version")
    String appVersion;

    @ConfigProperty(name = "quarkus.profile", defaultValue = "prod")
    String profile;

    @Inject
    ResourcePoolService resourcePool;

    /** 200 while the resource pool accepts work, 503 otherwise. */
    @GET
    @Path("/ping")
    public Response ping() {
        ManagedService.State state = resourcePool.state();
        boolean up = state == ManagedService.State.RUNNING;
        Map<String, String> body = Map.of(
                "status", up ? "ok" : "unavailable",
                "resourcePool", state.name());
        return Response.status(up ? Response.Status.OK : Response.Status.SERVICE_UNAVAILABLE)
                .entity(body)
                .build();
    }

    @GET
    @Path("/info")
    public Map<String, Object> info() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", appName);
        body.put("version", appVersion);
        body.put("profile", profile);
        body.put("java", System.getProperty("java.version"));
        body.put("resources", describe(resourcePool.manager().config()));
        return body;
    }

    private static Map<String, Object> describe(ResourcePoolConfig config) {
        Map<String, Object> resources = new LinkedHashMap<>();
        resources.put("cpuWorkers", config.cpuWorkerCount());
        resources.put("defaultIoLimit", config.defaultIoLimit());
        resources.put("ioLimitOverrides", config.perDeviceIoLimit());
        resources.put("mountPoints", config.mountPoints());
        resources.put("acquireTimeout", config.acquireTimeout().map(Object::toString).orElse("unbounded"));
        resources.put("shutdownTimeout", config.shutdownTimeout().toString());
        return resources;
    }
}

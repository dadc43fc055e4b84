package com.giggityflix.peer.core.annotation;

import com.giggityflix.peer.core.pool.ResourcePoolService;
import com.giggityflix.peer.core.pool.WorkerExecutionException;
import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.interceptor.AroundInvoke;
import jakarta.interceptor.Interceptor;
import jakarta.interceptor.InvocationContext;

/**
 * Moves {@link CpuBound} invocations onto the CPU worker pool. The original
 * exception of the method is rethrown rather than its worker wrapper.
 */
@CpuBound
@Interceptor
@Priority(Interceptor.Priority.PLATFORM_AFTER + 100)
public class CpuBoundInterceptor {

    @Inject
    ResourcePoolService resourcePool;

    @AroundInvoke
    Object offload(InvocationContext ctx) throws Exception {
        String operation = ctx.getMethod().getDeclaringClass().getSimpleName()
                + "." + ctx.getMethod().getName();
        try {
            return resourcePool.manager().callCpuBound(operation, ctx::proceed);
        } catch (WorkerExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw e;
        }
    }
}

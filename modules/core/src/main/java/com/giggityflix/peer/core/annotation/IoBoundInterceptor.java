package com.giggityflix.peer.core.annotation;

import com.giggityflix.peer.core.pool.ResourcePoolService;
import io.smallrye.mutiny.Uni;
import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.interceptor.AroundInvoke;
import jakarta.interceptor.Interceptor;
import jakarta.interceptor.InvocationContext;
import org.jboss.logging.Logger;

import java.lang.reflect.Method;
import java.lang.reflect.Parameter;

@IoBound
@Interceptor
@Priority(Interceptor.Priority.PLATFORM_AFTER + 100)
public class IoBoundInterceptor {

    private static final Logger log = Logger.getLogger(IoBoundInterceptor.class);

    @Inject
    ResourcePoolService resourcePool;

    @AroundInvoke
    Object gate(InvocationContext ctx) throws Exception {
        Method method = ctx.getMethod();
        Object pathArg = ctx.getParameters()[pathIndex(method)];
        String operation = method.getDeclaringClass().getSimpleName() + "." + method.getName();

        if (pathArg == null) {
            log.debugf("%s called without a path; running ungated", operation);
            return ctx.proceed();
        }

        String path = pathArg.toString();
        if (Uni.class.isAssignableFrom(method.getReturnType())) {
            return resourcePool.manager().runIoBoundAsync(operation, path, () -> proceedAsync(ctx));
        }
        return resourcePool.manager().callIoBound(operation, path, ctx::proceed);
    }

    static int pathIndex(Method method) {
        Parameter[] params = method.getParameters();
        for (int i = 0; i < params.length; i++) {
            if (params[i].isAnnotationPresent(DevicePath.class)) {
                return i;
            }
        }

        IoBound binding = method.getAnnotation(IoBound.class);
        if (binding == null) {
            binding = method.getDeclaringClass().getAnnotation(IoBound.class);
        }
        String name = binding != null ? binding.pathParam() : "filepath";
        for (int i = 0; i < params.length; i++) {
            if (params[i].getName().equals(name)) {
                return i;
            }
        }
        throw new IllegalStateException("@IoBound method " + method.getDeclaringClass().getName()
                + "." + method.getName() + " has no @DevicePath parameter and no parameter named '"
                + name + "'");
    }

    @SuppressWarnings("unchecked")
    private static Uni<Object> proceedAsync(InvocationContext ctx) {
        try {
            return (Uni<Object>) ctx.proceed();
        } catch (Exception e) {
            return Uni.createFrom().failure(e);
        }
    }
}

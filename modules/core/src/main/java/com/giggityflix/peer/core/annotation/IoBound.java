package com.giggityflix.peer.core.annotation;

import jakarta.enterprise.util.Nonbinding;
import jakarta.interceptor.InterceptorBinding;

import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Marks a method as IO-bound: each call holds a permit of the device limiter
 * for the path argument while it runs.
 * <p>
 * The path argument is the parameter annotated {@link DevicePath}, or else the
 * parameter named {@link #pathParam()}. Methods returning
 * {@link io.smallrye.mutiny.Uni} are gated asynchronously.
 */
@InterceptorBinding
@Inherited
@Target({METHOD, TYPE})
@Retention(RUNTIME)
public @interface IoBound {

    @Nonbinding
    String pathParam() default "filepath";
}

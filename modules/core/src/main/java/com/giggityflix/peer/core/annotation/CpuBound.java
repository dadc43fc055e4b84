package com.giggityflix.peer.core.annotation;

import jakarta.interceptor.InterceptorBinding;

import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Marks a method as CPU-bound: each call runs on a CPU pool worker, or
 * inline when already called from one.
 */
@InterceptorBinding
@Inherited
@Target({METHOD, TYPE})
@Retention(RUNTIME)
public @interface CpuBound {
}

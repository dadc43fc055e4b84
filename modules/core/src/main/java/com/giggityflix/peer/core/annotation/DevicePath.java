package com.giggityflix.peer.core.annotation;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Identifies the argument of an {@link IoBound} method that holds the path to
 * gate on. Takes precedence over {@link IoBound#pathParam()}.
 */
@Target(PARAMETER)
@Retention(RUNTIME)
public @interface DevicePath {
}

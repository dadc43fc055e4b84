package com.giggityflix.peer.core.pool;

/**
 * Thrown when work is submitted after the pool has begun draining.
 */
public class ShutdownInProgressException extends RuntimeException {

    public ShutdownInProgressException(String message) {
        super(message);
    }
}

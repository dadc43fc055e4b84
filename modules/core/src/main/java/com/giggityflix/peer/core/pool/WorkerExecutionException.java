package com.giggityflix.peer.core.pool;

/**
 * Wraps a failure raised by a callable running on a CPU pool worker.
 * The original failure is available as {@link #getCause()}.
 */
public class WorkerExecutionException extends RuntimeException {

    private final String operation;

    public WorkerExecutionException(String operation, Throwable cause) {
        super("CPU-bound operation '" + operation + "' failed: " + cause, cause);
        this.operation = operation;
    }

    public String operation() {
        return operation;
    }
}

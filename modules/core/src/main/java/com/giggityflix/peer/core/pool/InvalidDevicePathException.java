package com.giggityflix.peer.core.pool;

/**
 * Thrown when a path cannot be resolved to a storage device.
 * Fatal to the call, never to the registry.
 */
public class InvalidDevicePathException extends RuntimeException {

    private final String path;

    public InvalidDevicePathException(String path, String reason) {
        super("Cannot resolve device for path '" + path + "': " + reason);
        this.path = path;
    }

    public InvalidDevicePathException(String path, Throwable cause) {
        super("Cannot resolve device for path '" + path + "': " + cause.getMessage(), cause);
        this.path = path;
    }

    public String path() {
        return path;
    }
}

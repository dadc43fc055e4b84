package com.giggityflix.peer.core.pool;

/**
 * Maps a filesystem path to the storage device that holds it.
 * Paths on the same device must resolve to equal identifiers.
 */
public interface DeviceResolver {

    /**
     * @throws InvalidDevicePathException if the path is empty or malformed
     */
    DeviceIdentifier resolve(String path);
}

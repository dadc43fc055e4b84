package com.giggityflix.peer.core.pool;

import com.giggityflix.peer.util.DevicePaths;

import java.util.Objects;

/**
 * Normalized key of a storage device: a drive such as {@code C:} or a mount
 * point such as {@code /mnt/data}. Computed per call, never stored by callers.
 */
public record DeviceIdentifier(String value) {

    public DeviceIdentifier {
        Objects.requireNonNull(value, "value cannot be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Device identifier must not be blank");
        }
    }

    public static DeviceIdentifier of(String value) {
        return new DeviceIdentifier(value);
    }

    /** Key used by {@code PEER_DRIVE_<KEY>_IO} environment overrides. */
    public String envKey() {
        return DevicePaths.envKey(value);
    }

    @Override
    public String toString() {
        return value;
    }
}

package com.giggityflix.peer.core.pool;

import com.giggityflix.peer.util.DevicePaths;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Resolves drive-letter paths to their drive and rooted paths to the longest
 * configured mount point containing them, falling back to {@code /}.
 */
public class MountPointDeviceResolver implements DeviceResolver {

    private static final DeviceIdentifier ROOT = DeviceIdentifier.of(DevicePaths.ROOT);

    private final List<Path> mounts;

    public MountPointDeviceResolver(Collection<String> mountPoints) {
        List<Path> parsed = new ArrayList<>();
        for (String mount : mountPoints) {
            parsed.add(DevicePaths.normalize(mount));
        }
        this.mounts = List.copyOf(parsed);
    }

    @Override
    public DeviceIdentifier resolve(String path) {
        if (path == null || path.isBlank()) {
            throw new InvalidDevicePathException(String.valueOf(path), "path is empty");
        }
        if (DevicePaths.isDriveLetterPath(path)) {
            return DeviceIdentifier.of(DevicePaths.driveOf(path));
        }

        Path normalized;
        try {
            normalized = DevicePaths.normalize(path);
        } catch (IllegalArgumentException e) {
            throw new InvalidDevicePathException(path, e);
        }

        Optional<Path> mount = DevicePaths.longestMount(normalized, mounts);
        if (mount.isPresent()) {
            return DeviceIdentifier.of(mount.get().toString());
        }

        // Drive roots on platforms where absolute paths carry one
        Path root = normalized.getRoot();
        if (root != null && DevicePaths.isDriveLetterPath(root.toString())) {
            return DeviceIdentifier.of(DevicePaths.driveOf(root.toString()));
        }
        return ROOT;
    }

    public List<Path> mounts() {
        return mounts;
    }
}

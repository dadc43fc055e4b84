package com.giggityflix.peer.util;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Path helpers for mapping filesystem paths onto storage devices.
 *
 * <p>Two path families are recognised: drive-letter paths ({@code C:\media},
 * {@code d:/x}) whose device is the drive, and rooted paths whose device is
 * the longest mount point containing them.
 */
public final class DevicePaths {

    /** Device id used for rooted paths that match no known mount point. */
    public static final String ROOT = "/";

    private static final Pattern DRIVE_LETTER = Pattern.compile("^[A-Za-z]:([\\\\/].*)?$");
    private static final Pattern NON_ALNUM = Pattern.compile("[^A-Z0-9]+");

    private DevicePaths() {}

    public static boolean isDriveLetterPath(String raw) {
        return raw != null && DRIVE_LETTER.matcher(raw).matches();
    }

    /**
     * Returns the upper-case drive of a drive-letter path, e.g. {@code C:}.
     *
     * @throws IllegalArgumentException if {@code raw} is not a drive-letter path
     */
    public static String driveOf(String raw) {
        if (!isDriveLetterPath(raw)) {
            throw new IllegalArgumentException("Not a drive-letter path: " + raw);
        }
        return raw.substring(0, 2).toUpperCase(Locale.ROOT);
    }

    /**
     * Parses, absolutizes and normalizes a path string.
     *
     * @throws IllegalArgumentException if the string is null, blank or not a valid path
     */
    public static Path normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Path must not be empty");
        }
        try {
            return Path.of(raw).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("Malformed path: " + e.getMessage(), e);
        }
    }

    /**
     * Finds the longest mount point that contains {@code path}. Matching is
     * per path component, so {@code /mnt/data2} is not under {@code /mnt/data}.
     */
    public static Optional<Path> longestMount(Path path, Collection<Path> mounts) {
        Objects.requireNonNull(path, "path cannot be null");
        Path best = null;
        for (Path mount : mounts) {
            if (path.startsWith(mount)
                    && (best == null || mount.getNameCount() > best.getNameCount())) {
                best = mount;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Environment-variable form of a device id: upper case, runs of
     * non-alphanumerics collapsed to {@code _}, trimmed.
     * {@code C:} becomes {@code C}, {@code /mnt/data} becomes {@code MNT_DATA},
     * and the root becomes {@code ROOT}.
     */
    public static String envKey(String deviceId) {
        Objects.requireNonNull(deviceId, "deviceId cannot be null");
        String key = NON_ALNUM.matcher(deviceId.toUpperCase(Locale.ROOT)).replaceAll("_");
        int start = 0;
        int end = key.length();
        while (start < end && key.charAt(start) == '_') start++;
        while (end > start && key.charAt(end - 1) == '_') end--;
        key = key.substring(start, end);
        return key.isEmpty() ? "ROOT" : key;
    }
}

package com.platform.servicehost.security;

import com.platform.servicehost.config.ServiceHostProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Validates user-supplied filesystem paths.
 *
 * Rejects empty input, {@code ..} segments, UNC paths, reserved device names as the
 * last component, over-long paths, characters the target filesystem forbids, and
 * (when a root is configured) anything resolving outside that root.
 *
 * Deterministic and free of I/O; whether the target exists is the caller's check.
 */
@Component
public class PathGuard {
    
    public static final int DEFAULT_MAX_LENGTH = 260;
    
    private static final Set<String> RESERVED_DEVICE_NAMES = Set.of(
        "CON", "PRN", "AUX", "NUL",
        "COM1", "COM2", "COM3", "COM4", "COM5", "COM6", "COM7", "COM8", "COM9",
        "LPT1", "LPT2", "LPT3", "LPT4", "LPT5", "LPT6", "LPT7", "LPT8", "LPT9"
    );
    
    private static final Pattern SEGMENT_SEPARATOR = Pattern.compile("[\\\\/]+");
    
    // Drive-letter colon is the only colon allowed
    private static final Pattern FORBIDDEN_CHARS = Pattern.compile("[<>\"|?*\\x00-\\x1F]");
    private static final Pattern DRIVE_PREFIX = Pattern.compile("^[A-Za-z]:");
    
    private final Path allowedRoot;
    private final int maxLength;
    
    @Autowired
    public PathGuard(ServiceHostProperties properties) {
        this(rootOf(properties.getPaths().getAllowedRoot()), properties.getPaths().getMaxLength());
    }
    
    public PathGuard(Path allowedRoot, int maxLength) {
        this.allowedRoot = allowedRoot != null ? allowedRoot.toAbsolutePath().normalize() : null;
        this.maxLength = maxLength;
    }
    
    /**
     * Structural checks only: no root restriction, default length limit.
     */
    public static PathGuard structural() {
        return new PathGuard((Path) null, DEFAULT_MAX_LENGTH);
    }
    
    public GuardResult validate(String path) {
        if (path == null || path.isBlank()) {
            return GuardResult.reject("Path is empty");
        }
        if (path.length() > maxLength) {
            return GuardResult.reject("Path exceeds maximum length of " + maxLength);
        }
        if (path.startsWith("\\\\") || path.startsWith("//")) {
            return GuardResult.reject("UNC paths are not allowed");
        }
        if (FORBIDDEN_CHARS.matcher(path).find()) {
            return GuardResult.reject("Path contains forbidden characters");
        }
        String withoutDrive = DRIVE_PREFIX.matcher(path).replaceFirst("");
        if (withoutDrive.indexOf(':') >= 0) {
            return GuardResult.reject("Path contains forbidden characters");
        }
        
        String[] segments = SEGMENT_SEPARATOR.split(withoutDrive);
        for (String segment : segments) {
            if (segment.equals("..")) {
                return GuardResult.reject("Parent directory segments are not allowed");
            }
        }
        
        String last = lastNonEmpty(segments);
        if (last != null && isReservedDeviceName(last)) {
            return GuardResult.reject("Reserved device name: " + last);
        }
        
        if (allowedRoot != null) {
            try {
                Path resolved = Path.of(path).toAbsolutePath().normalize();
                if (!resolved.startsWith(allowedRoot)) {
                    return GuardResult.reject("Path is outside the allowed root");
                }
            } catch (InvalidPathException e) {
                return GuardResult.reject("Path cannot be resolved: " + e.getReason());
            }
        }
        
        return GuardResult.accept();
    }
    
    public boolean isValid(String path) {
        return validate(path).accepted();
    }
    
    public Path getAllowedRoot() {
        return allowedRoot;
    }
    
    static boolean isReservedDeviceName(String fileName) {
        // Windows ignores trailing dots and spaces, and "NUL.txt" still opens the device
        String trimmed = fileName.replaceAll("[. ]+$", "");
        int dot = trimmed.indexOf('.');
        String stem = dot >= 0 ? trimmed.substring(0, dot) : trimmed;
        return RESERVED_DEVICE_NAMES.contains(stem.trim().toUpperCase(Locale.ROOT));
    }
    
    private static String lastNonEmpty(String[] segments) {
        for (int i = segments.length - 1; i >= 0; i--) {
            if (!segments[i].isEmpty()) {
                return segments[i];
            }
        }
        return null;
    }
    
    private static Path rootOf(String configured) {
        return configured == null || configured.isBlank() ? null : Path.of(configured);
    }
}

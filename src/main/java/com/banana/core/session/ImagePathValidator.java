package com.banana.core.session;

import com.banana.logging.AppLogger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Gatekeeper for paths arriving from drops, pastes and file dialogs before they reach a slot.
 */
public final class ImagePathValidator {
    private static final Logger LOGGER = AppLogger.get();

    public static final long DEFAULT_MAX_BYTES = 100L * 1024 * 1024;

    private static final Set<String> IMAGE_EXTENSIONS =
        Set.of(".png", ".jpg", ".jpeg", ".bmp", ".gif", ".tiff", ".webp");
    private static final List<String> TRAVERSAL_PATTERNS =
        List.of("../", "..\\", "~/", "$HOME", "%USERPROFILE%");

    private final long maxBytes;

    public ImagePathValidator() {
        this(DEFAULT_MAX_BYTES);
    }

    public ImagePathValidator(long maxBytes) {
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive");
        }
        this.maxBytes = maxBytes;
    }

    public static boolean isImageFile(String path) {
        if (path == null || path.isBlank()) {
            return false;
        }
        String lower = path.toLowerCase(Locale.ROOT);
        int dot = lower.lastIndexOf('.');
        return dot >= 0 && IMAGE_EXTENSIONS.contains(lower.substring(dot));
    }

    public boolean isValid(String path) {
        return rejectionReason(path).isEmpty();
    }

    /**
     * @return why the path cannot be used, or empty when it is acceptable
     */
    public Optional<String> rejectionReason(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return Optional.of("empty path");
        }
        for (String pattern : TRAVERSAL_PATTERNS) {
            if (rawPath.contains(pattern)) {
                LOGGER.warning("Blocked path pattern " + pattern + " in " + rawPath);
                return Optional.of("path contains " + pattern);
            }
        }
        if (!isImageFile(rawPath)) {
            return Optional.of("not an image file");
        }

        Path path;
        try {
            path = Path.of(rawPath).toAbsolutePath().normalize();
        } catch (InvalidPathException ex) {
            return Optional.of("invalid path: " + ex.getReason());
        }
        if (!Files.exists(path)) {
            return Optional.of("file does not exist");
        }
        if (!Files.isRegularFile(path)) {
            return Optional.of("not a regular file");
        }
        try {
            long size = Files.size(path);
            if (size > maxBytes) {
                return Optional.of("file too large (%d bytes)".formatted(size));
            }
        } catch (IOException ex) {
            return Optional.of("cannot read file size: " + ex.getMessage());
        }
        return Optional.empty();
    }
}

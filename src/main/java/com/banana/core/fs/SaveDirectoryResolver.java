package com.banana.core.fs;

import com.banana.core.model.GenerationRequest;

import java.nio.file.Path;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Picks the directory a batch saves into and later scans for recovery.
 */
@FunctionalInterface
public interface SaveDirectoryResolver {

    Path resolve(GenerationRequest request);

    static SaveDirectoryResolver fixed(Path directory) {
        Objects.requireNonNull(directory, "directory");
        return request -> directory;
    }

    /**
     * Saves next to the first reference image while {@code saveOnOriginal} is on, otherwise into
     * {@code fallback}. Text-only requests always use the fallback.
     */
    static SaveDirectoryResolver nextToFirstReference(Path fallback, BooleanSupplier saveOnOriginal) {
        Objects.requireNonNull(fallback, "fallback");
        Objects.requireNonNull(saveOnOriginal, "saveOnOriginal");
        return request -> {
            if (saveOnOriginal.getAsBoolean() && !request.imageRefs().isEmpty()) {
                Path parent = request.imageRefs().get(0).toAbsolutePath().getParent();
                if (parent != null) {
                    return parent;
                }
            }
            return fallback;
        };
    }
}

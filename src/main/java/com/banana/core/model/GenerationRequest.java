package com.banana.core.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * One user submission. Built once per action and shared read-only by every worker of the batch.
 *
 * @param promptText  prompt sent to the service, including any "Image N" reference note
 * @param imageRefs   reference images in slot order, at most {@link #MAX_REFERENCE_IMAGES}
 * @param mode        generation flavour
 * @param aspectRatio requested output ratio
 * @param workerCount number of concurrent workers, 1 to {@link #MAX_WORKERS}
 */
public record GenerationRequest(String promptText,
                                List<Path> imageRefs,
                                GenerationMode mode,
                                AspectRatio aspectRatio,
                                int workerCount) {

    public static final int MAX_REFERENCE_IMAGES = 3;
    public static final int MAX_WORKERS = 4;

    public GenerationRequest {
        if (promptText == null || promptText.isBlank()) {
            throw new IllegalArgumentException("Prompt text is required");
        }
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(aspectRatio, "aspectRatio");
        imageRefs = imageRefs == null ? List.of() : List.copyOf(imageRefs);
        if (imageRefs.size() > MAX_REFERENCE_IMAGES) {
            throw new IllegalArgumentException(
                "At most %d reference images are supported, got %d".formatted(MAX_REFERENCE_IMAGES, imageRefs.size()));
        }
        if (mode.usesReferenceImages() && imageRefs.isEmpty()) {
            throw new IllegalArgumentException(mode + " requires at least one reference image");
        }
        if (workerCount < 1 || workerCount > MAX_WORKERS) {
            throw new IllegalArgumentException(
                "Worker count must be between 1 and %d, got %d".formatted(MAX_WORKERS, workerCount));
        }
    }

    public static GenerationRequest textToImage(String prompt, AspectRatio aspectRatio, int workerCount) {
        return new GenerationRequest(prompt, List.of(), GenerationMode.TEXT_TO_IMAGE, aspectRatio, workerCount);
    }
}

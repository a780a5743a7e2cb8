package com.banana.core.request;

import com.banana.core.model.AspectRatio;
import com.banana.core.model.GenerationMode;
import com.banana.core.model.GenerationRequest;
import com.banana.core.session.ImageSlot;
import com.banana.core.session.SlotSessionManager;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns the slot session and the user's input into a {@link GenerationRequest}.
 */
public final class GenerationRequestBuilder {

    private GenerationRequestBuilder() {
    }

    /**
     * @throws IllegalArgumentException when the prompt is blank or the count is out of range
     * @throws IllegalStateException    when an edit is requested with no image, or with more than
     *                                  {@link GenerationRequest#MAX_REFERENCE_IMAGES} images
     */
    public static GenerationRequest build(SlotSessionManager session,
                                          String prompt,
                                          GenerationMode mode,
                                          AspectRatio aspectRatio,
                                          int workerCount) {
        Objects.requireNonNull(session, "session");
        Objects.requireNonNull(mode, "mode");
        String trimmed = prompt == null ? "" : prompt.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Please enter a prompt");
        }
        AspectRatio ratio = aspectRatio == null ? AspectRatio.SQUARE : aspectRatio;

        if (!mode.usesReferenceImages()) {
            return new GenerationRequest(trimmed, List.of(), mode, ratio, workerCount);
        }

        List<ImageSlot> active = session.activeSlots();
        if (active.isEmpty()) {
            throw new IllegalStateException("Select at least one image to edit");
        }
        if (active.size() > GenerationRequest.MAX_REFERENCE_IMAGES) {
            throw new IllegalStateException("Image editing accepts at most %d images, %d selected"
                .formatted(GenerationRequest.MAX_REFERENCE_IMAGES, active.size()));
        }

        List<Path> refs = new ArrayList<>(active.size());
        for (ImageSlot slot : active) {
            refs.add(Path.of(slot.path()));
        }
        return new GenerationRequest(withImageReferences(trimmed, active), refs, mode, ratio, workerCount);
    }

    /**
     * Appends {@code [Images: Image 1, Image 3 (Total: 2 images)]} when more than one slot is in
     * use, so the prompt can name images by slot number.
     */
    static String withImageReferences(String prompt, List<ImageSlot> active) {
        if (active.size() <= 1) {
            return prompt;
        }
        List<String> refs = new ArrayList<>(active.size());
        for (ImageSlot slot : active) {
            refs.add("Image " + slot.displayNumber());
        }
        return prompt + "\n\n[Images: " + String.join(", ", refs) + " (Total: " + active.size() + " images)]";
    }
}

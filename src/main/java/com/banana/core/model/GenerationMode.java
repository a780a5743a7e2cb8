package com.banana.core.model;

import java.util.Locale;

/**
 * Generation flavours offered by the editor.
 */
public enum GenerationMode {
    /** Edit or combine the reference images in the slot session. */
    IMAGE_EDIT(true),
    /** Text prompt only, answered by the multimodal Gemini model. */
    TEXT_TO_IMAGE(false),
    /** Text prompt only, answered by the Imagen prediction endpoint. */
    IMAGEN(false);

    private final boolean usesReferenceImages;

    GenerationMode(boolean usesReferenceImages) {
        this.usesReferenceImages = usesReferenceImages;
    }

    public boolean usesReferenceImages() {
        return usesReferenceImages;
    }

    public static GenerationMode fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Generation mode is required");
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return switch (normalized) {
            case "EDIT", "IMAGE_EDIT", "IMAGE_TO_IMAGE", "IMG_TO_IMG" -> IMAGE_EDIT;
            case "TEXT", "TEXT_TO_IMAGE", "TXT_TO_IMG" -> TEXT_TO_IMAGE;
            case "IMAGEN", "IMAGEN4" -> IMAGEN;
            default -> throw new IllegalArgumentException("Unknown generation mode: " + label);
        };
    }
}

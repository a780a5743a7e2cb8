package com.banana.core.model;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class GenerationRequestTest {

    @Test
    void rejectsInvalidWorkerCounts() {
        assertThrows(IllegalArgumentException.class, () -> GenerationRequest.textToImage("cat", AspectRatio.SQUARE, 0));
        assertThrows(IllegalArgumentException.class, () -> GenerationRequest.textToImage("cat", AspectRatio.SQUARE, 5));
    }

    @Test
    void editRequiresBetweenOneAndThreeImages() {
        assertThrows(IllegalArgumentException.class,
            () -> new GenerationRequest("edit", List.of(), GenerationMode.IMAGE_EDIT, AspectRatio.SQUARE, 1));

        List<Path> four = List.of(Path.of("1.png"), Path.of("2.png"), Path.of("3.png"), Path.of("4.png"));
        assertThrows(IllegalArgumentException.class,
            () -> new GenerationRequest("edit", four, GenerationMode.IMAGE_EDIT, AspectRatio.SQUARE, 1));
    }

    @Test
    void rejectsBlankPrompt() {
        assertThrows(IllegalArgumentException.class, () -> GenerationRequest.textToImage("  ", AspectRatio.SQUARE, 1));
    }

    @Test
    void labelsResolveToEnums() {
        assertEquals(AspectRatio.LANDSCAPE_WIDE, AspectRatio.fromLabel("16:9 (Wide)"));
        assertEquals(AspectRatio.SQUARE, AspectRatio.fromLabel("weird"));
        assertEquals(GenerationMode.IMAGEN, GenerationMode.fromLabel("imagen"));
        assertEquals(GenerationMode.IMAGE_EDIT, GenerationMode.fromLabel("edit"));
        assertThrows(IllegalArgumentException.class, () -> GenerationMode.fromLabel("video"));
    }
}

package com.banana.core.request;

import com.banana.TestImages;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ReferenceImageLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void downscalesLongestSideAndDropsAlpha() throws IOException {
        BufferedImage source = TestImages.noise(200, 100, 1, BufferedImage.TYPE_INT_ARGB);
        Path file = tempDir.resolve("wide.png");
        Files.write(file, TestImages.encode(source, "png"));

        ReferenceImage loaded = new ReferenceImageLoader(50).load(file);

        assertEquals("image/png", loaded.mimeType());
        assertEquals(50, loaded.width());
        assertEquals(25, loaded.height());
        BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(loaded.data()));
        assertEquals(50, decoded.getWidth());
        assertFalse(decoded.getColorModel().hasAlpha());
    }

    @Test
    void keepsSmallImagesAtOriginalSize() throws IOException {
        Path file = tempDir.resolve("small.png");
        Files.write(file, TestImages.noisePng(40, 30, 2));

        ReferenceImage loaded = new ReferenceImageLoader().load(file);

        assertEquals(40, loaded.width());
        assertEquals(30, loaded.height());
    }

    @Test
    void rejectsMissingOrUndecodableFiles() throws IOException {
        Path garbage = Files.write(tempDir.resolve("broken.png"), new byte[]{1, 2, 3});
        ReferenceImageLoader loader = new ReferenceImageLoader();

        assertThrows(IOException.class, () -> loader.load(tempDir.resolve("missing.png")));
        assertThrows(IOException.class, () -> loader.load(garbage));
    }
}

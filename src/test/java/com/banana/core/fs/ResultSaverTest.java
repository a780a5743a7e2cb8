package com.banana.core.fs;

import com.banana.TestImages;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResultSaverTest {

    private static final ArtifactNamePattern PATTERN =
        new ArtifactNamePattern("banana", DateBucket.of(LocalDate.of(2025, 9, 1)), "png");

    @TempDir
    Path tempDir;

    @Test
    void savesEachResultUnderConsecutiveNames() throws IOException {
        Files.write(tempDir.resolve("banana_1sep_001.png"), new byte[]{0});
        byte[] first = TestImages.noisePng(16, 16, 1);
        byte[] second = TestImages.noisePng(16, 16, 2);

        SaveReport report = new ResultSaver().save(tempDir, PATTERN, List.of(first, second));

        assertEquals(List.of(tempDir.resolve("banana_1sep_002.png"), tempDir.resolve("banana_1sep_003.png")),
            report.savedFiles());
        assertArrayEquals(first, Files.readAllBytes(report.savedFiles().get(0)));
        assertArrayEquals(second, Files.readAllBytes(report.savedFiles().get(1)));
        assertTrue(report.failures().isEmpty());
    }

    @Test
    void skipsTinyPayloads() {
        byte[] real = TestImages.noisePng(16, 16, 3);

        SaveReport report = new ResultSaver().save(tempDir, PATTERN, List.of(new byte[50], real, new byte[100]));

        assertEquals(1, report.savedFiles().size());
        assertEquals(2, report.skipped());
        assertEquals("banana_1sep_001.png", report.savedFiles().get(0).getFileName().toString());
    }

    @Test
    void reencodesOtherFormatsAsPng() throws IOException {
        byte[] bmp = TestImages.noiseBmp(8, 8, 4);

        SaveReport report = new ResultSaver().save(tempDir, PATTERN, List.of(bmp));

        Path saved = report.savedFiles().get(0);
        assertTrue(ResultSaver.isPng(Files.readAllBytes(saved)));
        assertNotNull(ImageIO.read(saved.toFile()));
    }

    @Test
    void undecodablePayloadFailsOnlyItself() {
        byte[] garbage = new byte[500];
        byte[] real = TestImages.noisePng(16, 16, 5);

        SaveReport report = new ResultSaver().save(tempDir, PATTERN, List.of(garbage, real));

        assertEquals(1, report.failures().size());
        assertTrue(report.failures().get(0).startsWith("result 1"));
        assertEquals(List.of(tempDir.resolve("banana_1sep_002.png")), report.savedFiles());
    }

    @Test
    void createsMissingDirectory() {
        Path target = tempDir.resolve("nested").resolve("banana");

        SaveReport report = new ResultSaver().save(target, PATTERN, List.of(TestImages.noisePng(16, 16, 7)));

        assertTrue(Files.isRegularFile(target.resolve("banana_1sep_001.png")));
        assertEquals(1, report.savedFiles().size());
    }
}

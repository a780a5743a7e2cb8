package com.banana.core.fs;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SequentialNamerTest {

    private static final DateBucket BUCKET = DateBucket.of(LocalDate.of(2025, 9, 1));

    @TempDir
    Path tempDir;

    private final SequentialNamer namer = new SequentialNamer();

    @Test
    void startsAtOneForEmptyOrMissingDirectory() {
        assertEquals(1, namer.nextSequence(tempDir, "banana", BUCKET, "png"));
        assertEquals(1, namer.nextSequence(tempDir.resolve("missing"), "banana", BUCKET, "png"));
    }

    @Test
    void continuesAfterHighestNumberAndIgnoresGaps() throws IOException {
        touch("banana_1sep_001.png", "banana_1sep_002.png", "banana_1sep_003.png", "banana_1sep_005.png");

        assertEquals(6, namer.nextSequence(tempDir, "banana", BUCKET, "png"));
    }

    @Test
    void ignoresOtherBucketsAndNonNumericNames() throws IOException {
        touch("banana_1sep_002.png", "banana_2sep_009.png", "banana_1sep_final.png", "banana_1sep_004.jpg");

        assertEquals(3, namer.nextSequence(tempDir, "banana", BUCKET, "png"));
    }

    @Test
    void batchAllocationTakesConsecutiveNumbers() throws IOException, NamingExhaustedException {
        touch("banana_1sep_001.png", "banana_1sep_002.png", "banana_1sep_003.png", "banana_1sep_005.png");
        int start = namer.nextSequence(tempDir, "banana", BUCKET, "png");

        for (int i = 0; i < 3; i++) {
            Path allocated = namer.allocate(tempDir, "banana", BUCKET, "png", start + i);
            Files.write(allocated, new byte[]{1});
        }

        assertEquals(9, namer.nextSequence(tempDir, "banana", BUCKET, "png"));
        assertTrue(Files.exists(tempDir.resolve("banana_1sep_006.png")));
        assertTrue(Files.exists(tempDir.resolve("banana_1sep_008.png")));
    }

    @Test
    void stepsPastOccupiedNames() throws IOException, NamingExhaustedException {
        touch("banana_1sep_004.png", "banana_1sep_005.png");

        Path allocated = namer.allocate(tempDir, "banana", BUCKET, "png", 4);

        assertEquals("banana_1sep_006.png", allocated.getFileName().toString());
    }

    @Test
    void failsWhenRetriesAreExhausted() throws IOException {
        touch("banana_1sep_001.png", "banana_1sep_002.png", "banana_1sep_003.png");
        SequentialNamer limited = new SequentialNamer(2);

        NamingExhaustedException ex = assertThrows(NamingExhaustedException.class,
            () -> limited.allocate(tempDir, "banana", BUCKET, "png", 1));
        assertEquals("banana_1sep_001.png", ex.getFirstCandidate());
        assertEquals(2, ex.getAttempts());
    }

    private void touch(String... names) throws IOException {
        for (String name : names) {
            Files.write(tempDir.resolve(name), new byte[]{0});
        }
    }
}

package com.banana.core.batch;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GenerationErrorLogTest {

    @TempDir
    Path tempDir;

    @Test
    void writesHeaderOnceAndQuotesMessages() throws IOException {
        Path file = tempDir.resolve("logs").resolve("errors.csv");
        GenerationErrorLog log = GenerationErrorLog.at(file, Clock.fixed(Instant.parse("2025-09-01T10:00:00Z"), ZoneId.of("UTC")));

        log.logFailure("worker", "batch-1", 0, "IMAGE_EDIT", tempDir, "PERMISSION_DENIED: bad key, \"expired\"");
        log.logFailure("save", "batch-1", -1, "IMAGE_EDIT", null, "disk full");

        List<String> rows = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(3, rows.size());
        assertEquals("timestamp,stage,batch_id,worker,mode,save_dir,message", rows.get(0));
        assertTrue(rows.get(1).endsWith(",\"PERMISSION_DENIED: bad key, \"\"expired\"\"\""));
        assertTrue(rows.get(2).contains(",save,batch-1,,IMAGE_EDIT,,disk full"));
    }

    @Test
    void noneWritesNothing() {
        GenerationErrorLog.none().logFailure("worker", "batch-1", 0, "IMAGE_EDIT", tempDir, "boom");

        assertFalse(Files.exists(tempDir.resolve("generation-errors.csv")));
    }
}

package com.banana.cli;

import com.banana.TestImages;
import com.banana.core.batch.BatchOrchestrator;
import com.banana.core.batch.BatchSettings;
import com.banana.core.batch.GenerationErrorLog;
import com.banana.core.batch.GenerationTaskFactory;
import com.banana.core.fs.ResultReconciler;
import com.banana.core.fs.ResultSaver;
import com.banana.core.fs.SaveDirectoryResolver;
import com.banana.core.model.AspectRatio;
import com.banana.core.model.GenerationMode;
import com.banana.core.model.GenerationRequest;
import com.banana.history.PromptHistory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchGenerateToolTest {

    @TempDir
    Path tempDir;

    private Path outDir;
    private BatchOrchestrator orchestrator;
    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
    private PrintStream out;
    private PrintStream err;

    @BeforeEach
    void setUp() {
        outDir = tempDir.resolve("out");
        orchestrator = new BatchOrchestrator(
            BatchSettings.defaults(),
            SaveDirectoryResolver.fixed(outDir),
            new ResultReconciler(),
            new ResultSaver(),
            GenerationErrorLog.at(tempDir.resolve("errors.csv")),
            Clock.systemDefaultZone());
        out = new PrintStream(outBytes, true, StandardCharsets.UTF_8);
        err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);
    }

    @AfterEach
    void tearDown() {
        orchestrator.close();
    }

    @Test
    void parsesAllOptions() {
        BatchGenerateTool.Options options = BatchGenerateTool.Options.parse(new String[]{
            "--prompt", "add a hat", "--image", "a.png", "--image", "b.png", "--mode", "edit",
            "--aspect", "16:9", "--count", "3", "--out", "results", "--timeout", "30", "--remember"
        }, AspectRatio.SQUARE, 1);

        assertEquals("add a hat", options.prompt());
        assertEquals(List.of("a.png", "b.png"), options.images());
        assertEquals(GenerationMode.IMAGE_EDIT, options.mode());
        assertEquals(AspectRatio.LANDSCAPE_WIDE, options.aspect());
        assertEquals(3, options.count());
        assertEquals(Path.of("results"), options.outputDirectory());
        assertEquals(30, options.timeoutSeconds());
        assertTrue(options.remember());
    }

    @Test
    void fallsBackToStoredDefaults() {
        BatchGenerateTool.Options options = BatchGenerateTool.Options.parse(
            new String[]{"--prompt", "a fox"}, AspectRatio.PORTRAIT, 2);

        assertEquals(AspectRatio.PORTRAIT, options.aspect());
        assertEquals(2, options.count());
        assertEquals(null, options.mode());
    }

    @Test
    void parsesSavePreferenceOptions() {
        BatchGenerateTool.Options options = BatchGenerateTool.Options.parse(new String[]{
            "--prompt", "a fox", "--save-dir", "shelf", "--save-on-original", "OFF"
        }, AspectRatio.SQUARE, 1);

        assertEquals(Path.of("shelf"), options.saveDirectory());
        assertEquals(Boolean.FALSE, options.saveOnOriginal());

        BatchGenerateTool.Options untouched = BatchGenerateTool.Options.parse(
            new String[]{"--prompt", "a fox"}, AspectRatio.SQUARE, 1);
        assertEquals(null, untouched.saveDirectory());
        assertEquals(null, untouched.saveOnOriginal());
        assertThrows(IllegalArgumentException.class, () -> BatchGenerateTool.Options.parse(
            new String[]{"--prompt", "a fox", "--save-on-original", "maybe"}, AspectRatio.SQUARE, 1));
    }

    @Test
    void modeLabelsParseUnderTurkishLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            BatchGenerateTool.Options options = BatchGenerateTool.Options.parse(
                new String[]{"--prompt", "a fox", "--mode", "edit", "--save-on-original", "on"}, AspectRatio.SQUARE, 1);

            assertEquals(GenerationMode.IMAGE_EDIT, options.mode());
            assertEquals(Boolean.TRUE, options.saveOnOriginal());
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void rejectsBadArguments() {
        assertThrows(IllegalArgumentException.class,
            () -> BatchGenerateTool.Options.parse(new String[]{"--count", "2"}, AspectRatio.SQUARE, 1));
        assertThrows(IllegalArgumentException.class,
            () -> BatchGenerateTool.Options.parse(new String[]{"--prompt", "x", "--count", "5"}, AspectRatio.SQUARE, 1));
        assertThrows(IllegalArgumentException.class,
            () -> BatchGenerateTool.Options.parse(new String[]{"--prompt", "x", "--count", "two"}, AspectRatio.SQUARE, 1));
        assertThrows(IllegalArgumentException.class,
            () -> BatchGenerateTool.Options.parse(new String[]{"--prompt", "x", "--verbose"}, AspectRatio.SQUARE, 1));
        assertThrows(IllegalArgumentException.class,
            () -> BatchGenerateTool.Options.parse(new String[]{"--prompt"}, AspectRatio.SQUARE, 1));
    }

    @Test
    void editRunSavesEveryResultAndRemembersPrompt() throws Exception {
        Path image = Files.write(tempDir.resolve("cat.png"), TestImages.noisePng(16, 16, 1));
        List<GenerationRequest> seen = new CopyOnWriteArrayList<>();
        GenerationTaskFactory factory = (request, workerIndex) -> status -> {
            seen.add(request);
            status.accept("working");
            return List.of(TestImages.noisePng(32, 32, 10 + workerIndex));
        };
        PromptHistory history = new PromptHistory(tempDir.resolve("history.json"));
        BatchGenerateTool.Options options = BatchGenerateTool.Options.parse(new String[]{
            "--prompt", "add a hat", "--image", image.toString(), "--count", "2"
        }, AspectRatio.SQUARE, 1);

        int exit = BatchGenerateTool.run(options, out, err, factory, orchestrator, history);

        assertEquals(BatchGenerateTool.EXIT_FULL_SUCCESS, exit);
        assertEquals(2, seen.size());
        assertEquals(GenerationMode.IMAGE_EDIT, seen.get(0).mode());
        assertEquals(List.of(image), seen.get(0).imageRefs());
        try (Stream<Path> files = Files.list(outDir)) {
            assertEquals(2, files.count());
        }
        String printed = outBytes.toString(StandardCharsets.UTF_8);
        assertTrue(printed.contains("Result: 2/2 FULL_SUCCESS"), printed);
        assertTrue(printed.contains("Prompt saved to history"), printed);
        assertEquals("add a hat", history.items().get(0).text());
    }

    @Test
    void partialRunExitsWithOne() {
        GenerationTaskFactory factory = (request, workerIndex) -> status -> {
            if (workerIndex == 0) {
                throw new IllegalStateException("INTERNAL: backend hiccup");
            }
            return List.of(TestImages.noisePng(32, 32, workerIndex));
        };
        BatchGenerateTool.Options options = BatchGenerateTool.Options.parse(
            new String[]{"--prompt", "a lighthouse", "--count", "3"}, AspectRatio.SQUARE, 1);

        int exit = BatchGenerateTool.run(options, out, err, factory, orchestrator, null);

        assertEquals(BatchGenerateTool.EXIT_PARTIAL_SUCCESS, exit);
        assertTrue(outBytes.toString(StandardCharsets.UTF_8).contains("Result: 2/3 PARTIAL_SUCCESS"));
    }

    @Test
    void totalFailurePrintsTranslatedErrors() throws Exception {
        GenerationTaskFactory factory = (request, workerIndex) -> status -> {
            throw new IllegalStateException("RESOURCE_EXHAUSTED: Quota exceeded");
        };
        BatchGenerateTool.Options options = BatchGenerateTool.Options.parse(
            new String[]{"--prompt", "a lighthouse", "--count", "2"}, AspectRatio.SQUARE, 1);

        int exit = BatchGenerateTool.run(options, out, err, factory, orchestrator, null);

        assertEquals(BatchGenerateTool.EXIT_TOTAL_FAILURE, exit);
        assertTrue(outBytes.toString(StandardCharsets.UTF_8).contains("Result: 0/2 TOTAL_FAILURE"));
        String errors = errBytes.toString(StandardCharsets.UTF_8);
        assertTrue(errors.contains("Rate limit reached"), errors);
        assertTrue(errors.contains("RESOURCE_EXHAUSTED: Quota exceeded"), errors);
        assertEquals(3, Files.readAllLines(tempDir.resolve("errors.csv")).size());
    }

    @Test
    void editWithoutImagesIsAUsageError() {
        GenerationTaskFactory factory = (request, workerIndex) -> status -> List.of();
        BatchGenerateTool.Options options = BatchGenerateTool.Options.parse(new String[]{
            "--prompt", "add a hat", "--mode", "edit", "--image", tempDir.resolve("missing.png").toString()
        }, AspectRatio.SQUARE, 1);

        int exit = BatchGenerateTool.run(options, out, err, factory, orchestrator, null);

        assertEquals(BatchGenerateTool.EXIT_USAGE, exit);
        String errors = errBytes.toString(StandardCharsets.UTF_8);
        assertTrue(errors.contains("Skipped invalid image"), errors);
    }

    @Test
    void timeoutStopsWaitingOnASilentWorker() {
        GenerationTaskFactory factory = (request, workerIndex) -> status -> {
            Thread.sleep(10_000);
            return List.of();
        };
        BatchGenerateTool.Options options = BatchGenerateTool.Options.parse(
            new String[]{"--prompt", "a lighthouse", "--timeout", "1"}, AspectRatio.SQUARE, 1);

        int exit = BatchGenerateTool.run(options, out, err, factory, orchestrator, null);

        assertEquals(BatchGenerateTool.EXIT_TOTAL_FAILURE, exit);
        assertTrue(errBytes.toString(StandardCharsets.UTF_8).contains("Gave up after 1s"));
    }
}

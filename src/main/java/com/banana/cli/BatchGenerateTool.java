package com.banana.cli;

import com.banana.config.ConfigService;
import com.banana.core.batch.BatchJobHandle;
import com.banana.core.batch.BatchListener;
import com.banana.core.batch.BatchOrchestrator;
import com.banana.core.batch.BatchOutcome;
import com.banana.core.batch.BatchProgress;
import com.banana.core.batch.BatchSettings;
import com.banana.core.batch.BatchStatus;
import com.banana.core.batch.GenerationErrorLog;
import com.banana.core.batch.GenerationTaskFactory;
import com.banana.core.batch.WorkerStatus;
import com.banana.core.fs.ResultReconciler;
import com.banana.core.fs.ResultSaver;
import com.banana.core.fs.SaveDirectoryResolver;
import com.banana.core.model.AspectRatio;
import com.banana.core.model.GenerationMode;
import com.banana.core.model.GenerationRequest;
import com.banana.core.request.GenerationRequestBuilder;
import com.banana.core.session.ImagePathValidator;
import com.banana.core.session.SlotInputCollector;
import com.banana.core.session.SlotSessionManager;
import com.banana.history.PromptHistory;
import com.banana.integration.gemini.ErrorTranslator;
import com.banana.integration.gemini.GeminiImageClient;
import com.banana.integration.gemini.GeminiSettings;
import com.banana.integration.gemini.GeminiTaskFactory;
import com.banana.integration.gemini.TranslatedError;

import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Headless front end: fills the slot session from {@code --image} arguments, runs one batch and
 * prints the outcome.
 * <pre>
 * java -jar banana-editor.jar --prompt "add a hat" --image cat.png --count 3
 * </pre>
 * Exit codes: 0 full success, 1 partial success, 2 total failure, 64 bad arguments.
 */
public final class BatchGenerateTool {

    static final int EXIT_FULL_SUCCESS = 0;
    static final int EXIT_PARTIAL_SUCCESS = 1;
    static final int EXIT_TOTAL_FAILURE = 2;
    static final int EXIT_USAGE = 64;

    private static final String USAGE = String.join(System.lineSeparator(),
        "Usage: banana-editor --prompt TEXT [options]",
        "  --prompt TEXT     what to generate or how to edit (or -Dbanana.prompt=...)",
        "  --image PATH      reference image, repeatable, up to 3 for edits",
        "  --mode MODE       edit | text | imagen (default: edit with images, text without)",
        "  --aspect RATIO    1:1 | 16:9 | 9:16 | 4:3 | 3:4",
        "  --count N         concurrent workers, 1-4",
        "  --out DIR         save directory for this run only",
        "  --save-dir DIR    remember DIR as the default save directory",
        "  --save-on-original on|off",
        "                    remember whether results go next to the first image",
        "  --timeout SEC     stop waiting after SEC seconds",
        "  --remember        add the prompt to the prompt history");

    private BatchGenerateTool() {
    }

    public static void main(String[] args) {
        System.exit(execute(args, System.out, System.err));
    }

    static int execute(String[] args, PrintStream out, PrintStream err) {
        ConfigService config = ConfigService.getInstance();
        Options options;
        try {
            options = Options.parse(args, config.getAspectRatio(), config.getBatchCount());
        } catch (IllegalArgumentException ex) {
            err.println(ex.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }

        applySavePreferences(options, config);
        GenerationTaskFactory factory = new GeminiTaskFactory(new GeminiImageClient(GeminiSettings.from(config)));
        PromptHistory history = options.remember() ? PromptHistory.open(config.getHistoryFile()) : null;
        try (BatchOrchestrator orchestrator = orchestratorFor(options, config)) {
            int exitCode = run(options, out, err, factory, orchestrator, history);
            if (exitCode != EXIT_USAGE) {
                config.setBatchCount(options.count());
                config.setAspectRatio(options.aspect());
            }
            return exitCode;
        }
    }

    static void applySavePreferences(Options options, ConfigService config) {
        if (options.saveDirectory() != null) {
            config.setDefaultSaveDirectory(options.saveDirectory());
        }
        if (options.saveOnOriginal() != null) {
            config.setSaveOnOriginal(options.saveOnOriginal());
        }
    }

    static BatchOrchestrator orchestratorFor(Options options, ConfigService config) {
        if (options.outputDirectory() == null) {
            return BatchOrchestrator.fromConfig(config);
        }
        return new BatchOrchestrator(
            BatchSettings.from(config),
            SaveDirectoryResolver.fixed(options.outputDirectory()),
            new ResultReconciler(),
            new ResultSaver(),
            GenerationErrorLog.at(config.getErrorLogFile()),
            Clock.systemDefaultZone());
    }

    static int run(Options options,
                   PrintStream out,
                   PrintStream err,
                   GenerationTaskFactory factory,
                   BatchOrchestrator orchestrator,
                   PromptHistory history) {
        SlotSessionManager session = new SlotSessionManager();
        SlotInputCollector collector = new SlotInputCollector(session, new ImagePathValidator());
        SlotInputCollector.AddReport report = collector.addAll(options.images(), SlotInputCollector.FullSlotPolicy.REJECT);
        report.rejected().forEach(path -> err.println("Skipped invalid image: " + path));
        report.skipped().forEach(path -> err.println("Skipped, all " + SlotSessionManager.SLOT_COUNT + " slots full: " + path));

        GenerationMode mode = options.mode() != null
            ? options.mode()
            : (session.count() > 0 ? GenerationMode.IMAGE_EDIT : GenerationMode.TEXT_TO_IMAGE);

        GenerationRequest request;
        try {
            request = GenerationRequestBuilder.build(session, options.prompt(), mode, options.aspect(), options.count());
        } catch (IllegalArgumentException | IllegalStateException ex) {
            err.println(ex.getMessage());
            return EXIT_USAGE;
        }

        if (history != null && history.add(options.prompt())) {
            out.println("Prompt saved to history");
        }

        out.printf("Generating %d image(s) with %s, aspect %s%n", request.workerCount(), mode, request.aspectRatio());
        BatchJobHandle handle = orchestrator.start(request, factory, new ConsoleListener(out));

        BatchOutcome outcome;
        try {
            outcome = options.timeoutSeconds() > 0
                ? handle.outcome().get(options.timeoutSeconds(), TimeUnit.SECONDS)
                : handle.outcome().get();
        } catch (TimeoutException ex) {
            err.printf("Gave up after %ds, %d/%d worker(s) reported%n",
                options.timeoutSeconds(), handle.completedWorkers(), handle.totalWorkers());
            return EXIT_TOTAL_FAILURE;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            err.println("Interrupted while waiting for " + handle.id());
            return EXIT_TOTAL_FAILURE;
        } catch (ExecutionException ex) {
            err.println("Batch failed: " + ex.getCause());
            return EXIT_TOTAL_FAILURE;
        }

        printOutcome(outcome, out, err);
        return switch (outcome.status()) {
            case FULL_SUCCESS -> EXIT_FULL_SUCCESS;
            case PARTIAL_SUCCESS -> EXIT_PARTIAL_SUCCESS;
            case TOTAL_FAILURE -> EXIT_TOTAL_FAILURE;
        };
    }

    private static void printOutcome(BatchOutcome outcome, PrintStream out, PrintStream err) {
        out.println("Result: " + outcome.summary() + " " + outcome.status());
        outcome.savedFiles().forEach(file -> out.println("  " + file));
        for (String failure : outcome.saveFailures()) {
            err.println("Save failed: " + failure);
        }
        if (outcome.status() == BatchStatus.TOTAL_FAILURE) {
            for (String failure : outcome.workerFailures()) {
                TranslatedError translated = ErrorTranslator.translate(failure);
                err.println(translated.title() + ": " + translated.description());
                err.println("  " + translated.original());
                translated.solutions().forEach(solution -> err.println("  - " + solution));
            }
        }
    }

    private static final class ConsoleListener implements BatchListener {
        private final PrintStream out;

        private ConsoleListener(PrintStream out) {
            this.out = out;
        }

        @Override
        public void onWorkerStatus(String batchId, int workerIndex, String message) {
            out.println("Worker " + (workerIndex + 1) + ": " + message);
        }

        @Override
        public void onWorkerFinished(BatchProgress progress) {
            String detail = progress.workerStatus() == WorkerStatus.FAILED
                ? "failed (" + ErrorTranslator.translate(progress.errorMessage()).title() + ")"
                : "done";
            out.printf("Worker %d %s [%d/%d]%n",
                progress.workerIndex() + 1, detail, progress.completedWorkers(), progress.totalWorkers());
        }
    }

    record Options(String prompt,
                   List<String> images,
                   GenerationMode mode,
                   AspectRatio aspect,
                   int count,
                   Path outputDirectory,
                   long timeoutSeconds,
                   boolean remember,
                   Path saveDirectory,
                   Boolean saveOnOriginal) {

        static Options parse(String[] args, AspectRatio defaultAspect, int defaultCount) {
            String prompt = null;
            List<String> images = new ArrayList<>();
            GenerationMode mode = null;
            AspectRatio aspect = defaultAspect;
            int count = defaultCount;
            Path out = null;
            long timeout = 0;
            boolean remember = false;
            Path saveDirectory = null;
            Boolean saveOnOriginal = null;

            String[] safeArgs = args == null ? new String[0] : args;
            for (int i = 0; i < safeArgs.length; i++) {
                String arg = safeArgs[i];
                switch (arg) {
                    case "--prompt" -> prompt = value(safeArgs, ++i, arg);
                    case "--image" -> images.add(value(safeArgs, ++i, arg));
                    case "--mode" -> mode = GenerationMode.fromLabel(value(safeArgs, ++i, arg));
                    case "--aspect" -> aspect = AspectRatio.fromLabel(value(safeArgs, ++i, arg));
                    case "--count" -> count = parseInt(value(safeArgs, ++i, arg), arg);
                    case "--out" -> out = Path.of(value(safeArgs, ++i, arg));
                    case "--timeout" -> timeout = parseInt(value(safeArgs, ++i, arg), arg);
                    case "--remember" -> remember = true;
                    case "--save-dir" -> saveDirectory = Path.of(value(safeArgs, ++i, arg));
                    case "--save-on-original" -> saveOnOriginal = parseSwitch(value(safeArgs, ++i, arg), arg);
                    default -> throw new IllegalArgumentException("Unknown option: " + arg);
                }
            }

            if (prompt == null || prompt.isBlank()) {
                prompt = System.getProperty("banana.prompt");
            }
            if (prompt == null || prompt.isBlank()) {
                throw new IllegalArgumentException("Missing --prompt");
            }
            if (count < 1 || count > GenerationRequest.MAX_WORKERS) {
                throw new IllegalArgumentException(
                    "--count must be between 1 and " + GenerationRequest.MAX_WORKERS + ", got " + count);
            }
            return new Options(prompt, List.copyOf(images), mode, aspect, count, out, timeout, remember,
                saveDirectory, saveOnOriginal);
        }

        private static String value(String[] args, int index, String option) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + option);
            }
            return args[index];
        }

        private static boolean parseSwitch(String raw, String option) {
            return switch (raw.trim().toLowerCase(Locale.ROOT)) {
                case "on", "true", "yes" -> true;
                case "off", "false", "no" -> false;
                default -> throw new IllegalArgumentException(option + " expects on or off, got '" + raw + "'");
            };
        }

        private static int parseInt(String raw, String option) {
            try {
                return Integer.parseInt(raw.trim());
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException(option + " expects a number, got '" + raw + "'");
            }
        }
    }
}

package com.banana.core.batch;

import com.banana.config.ConfigService;
import com.banana.core.fs.ArtifactNamePattern;
import com.banana.core.fs.DateBucket;
import com.banana.core.fs.ResultReconciler;
import com.banana.core.fs.ResultSaver;
import com.banana.core.fs.SaveDirectoryResolver;
import com.banana.core.fs.SaveReport;
import com.banana.core.fs.SavedArtifact;
import com.banana.core.model.GenerationRequest;
import com.banana.logging.AppLogger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs every worker of a request at once and turns their reports into one {@link BatchOutcome}.
 * <p>
 * Worker reports are funnelled through a single coordinator thread; job counters, the accumulated
 * results and all listener callbacks are touched only there. The outcome is decided exactly once,
 * on the report that completes the batch:
 * <ol>
 *     <li>in-memory results are auto-saved and win ({@code FULL_SUCCESS} or {@code PARTIAL_SUCCESS})</li>
 *     <li>otherwise recent matching files in the save directory are recovered ({@code PARTIAL_SUCCESS})</li>
 *     <li>otherwise {@code TOTAL_FAILURE}</li>
 * </ol>
 * There is no timeout and no cancellation: a worker that never reports keeps its batch collecting.
 */
public final class BatchOrchestrator implements AutoCloseable {

    private static final Logger LOGGER = AppLogger.get();

    static final String NO_IMAGES_MESSAGE = "No images received from API";

    private final BatchSettings settings;
    private final SaveDirectoryResolver saveDirectoryResolver;
    private final ResultReconciler reconciler;
    private final ResultSaver saver;
    private final GenerationErrorLog errorLog;
    private final Clock clock;
    private final ExecutorService coordinator;
    private final AtomicInteger batchSequence = new AtomicInteger();

    public BatchOrchestrator(BatchSettings settings,
                             SaveDirectoryResolver saveDirectoryResolver,
                             ResultReconciler reconciler,
                             ResultSaver saver,
                             GenerationErrorLog errorLog,
                             Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.saveDirectoryResolver = Objects.requireNonNull(saveDirectoryResolver, "saveDirectoryResolver");
        this.reconciler = Objects.requireNonNull(reconciler, "reconciler");
        this.saver = Objects.requireNonNull(saver, "saver");
        this.errorLog = errorLog == null ? GenerationErrorLog.none() : errorLog;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.coordinator = Executors.newSingleThreadExecutor(daemonThreads("batch-coordinator"));
    }

    public static BatchOrchestrator fromConfig(ConfigService config) {
        return new BatchOrchestrator(
            BatchSettings.from(config),
            SaveDirectoryResolver.nextToFirstReference(config.getDefaultSaveDirectory(), config::isSaveOnOriginal),
            new ResultReconciler(),
            new ResultSaver(),
            GenerationErrorLog.at(config.getErrorLogFile()),
            Clock.systemDefaultZone());
    }

    public BatchJobHandle start(GenerationRequest request, GenerationTaskFactory taskFactory) {
        return start(request, taskFactory, BatchListener.NONE);
    }

    /**
     * Launches {@code request.workerCount()} workers immediately, each on its own thread.
     */
    public BatchJobHandle start(GenerationRequest request, GenerationTaskFactory taskFactory, BatchListener listener) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(taskFactory, "taskFactory");
        BatchListener callbacks = listener == null ? BatchListener.NONE : listener;

        String batchId = "batch-" + batchSequence.incrementAndGet();
        Path saveDirectory = saveDirectoryResolver.resolve(request);
        BatchJob job = new BatchJob(batchId, request, saveDirectory, clock.instant());
        LOGGER.info("Starting %s: %d worker(s), mode %s, saving to %s".formatted(
            batchId, request.workerCount(), request.mode(), saveDirectory));

        ExecutorService workers = Executors.newFixedThreadPool(request.workerCount(), daemonThreads(batchId + "-worker"));
        for (int i = 0; i < request.workerCount(); i++) {
            final int workerIndex = i;
            workers.execute(() -> runWorker(job, workerIndex, taskFactory, callbacks));
        }
        workers.shutdown();
        return job;
    }

    private void runWorker(BatchJob job, int workerIndex, GenerationTaskFactory taskFactory, BatchListener listener) {
        post(() -> job.markRunning(workerIndex));
        Consumer<String> status = message -> post(() -> notifyStatus(listener, job, workerIndex, message));
        try {
            GenerationTask task = taskFactory.create(job.request(), workerIndex);
            List<byte[]> images = task.generate(status);
            List<byte[]> kept = new ArrayList<>();
            if (images != null) {
                for (byte[] image : images) {
                    if (image != null && image.length > 0) {
                        kept.add(image);
                    }
                }
            }
            if (kept.isEmpty()) {
                deliver(job, workerIndex, null, NO_IMAGES_MESSAGE, listener);
            } else {
                deliver(job, workerIndex, kept, null, listener);
            }
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            deliver(job, workerIndex, null, describe(interrupted), listener);
        } catch (Exception ex) {
            LOGGER.log(Level.WARNING, job.id() + " worker " + (workerIndex + 1) + " failed", ex);
            deliver(job, workerIndex, null, describe(ex), listener);
        }
    }

    /**
     * Hands one worker report to the coordinator. Exactly one of {@code images} and
     * {@code errorMessage} is non-null. Reports for a worker that already reported, or for a
     * finished batch, are dropped.
     */
    void deliver(BatchJob job, int workerIndex, List<byte[]> images, String errorMessage, BatchListener listener) {
        post(() -> handleDelivery(job, workerIndex, images, errorMessage, listener));
    }

    private void handleDelivery(BatchJob job, int workerIndex, List<byte[]> images, String errorMessage,
                                BatchListener listener) {
        BatchJob.Delivery delivery = images != null
            ? job.recordSuccess(workerIndex, images)
            : job.recordFailure(workerIndex, errorMessage);
        if (delivery == BatchJob.Delivery.IGNORED) {
            LOGGER.fine("Ignoring late report from " + job.id() + " worker " + (workerIndex + 1));
            return;
        }

        WorkerTask worker = job.worker(workerIndex);
        if (worker.status() == WorkerStatus.FAILED) {
            LOGGER.warning("%s worker %d failed: %s".formatted(job.id(), workerIndex + 1, errorMessage));
            errorLog.logFailure("worker", job.id(), workerIndex, job.request().mode().name(),
                job.saveDirectory(), errorMessage);
        } else {
            LOGGER.info("%s worker %d returned %d image(s)".formatted(job.id(), workerIndex + 1, images.size()));
        }

        BatchProgress progress = new BatchProgress(job.id(), workerIndex, worker.status(), worker.errorMessage(),
            job.completedWorkers(), job.totalWorkers());
        notifySafely(() -> listener.onWorkerFinished(progress));

        if (delivery == BatchJob.Delivery.COMPLETED) {
            finalizeJob(job, listener);
        }
    }

    private void finalizeJob(BatchJob job, BatchListener listener) {
        job.beginReconciling();
        BatchOutcome outcome;
        try {
            outcome = decideOutcome(job);
        } catch (RuntimeException ex) {
            LOGGER.log(Level.SEVERE, "Finalizing " + job.id() + " failed", ex);
            errorLog.logFailure("finalize", job.id(), -1, job.request().mode().name(), job.saveDirectory(),
                describe(ex));
            outcome = totalFailure(job);
        }
        job.markDone();
        LOGGER.info("%s finished in %ds: %s %s".formatted(job.id(),
            Duration.between(job.startedAt(), clock.instant()).toSeconds(), outcome.status(), outcome.summary()));
        BatchOutcome finished = outcome;
        notifySafely(() -> listener.onBatchFinished(finished));
        job.publish(finished);
    }

    private BatchOutcome decideOutcome(BatchJob job) {
        Path saveDirectory = job.saveDirectory();
        ArtifactNamePattern pattern = new ArtifactNamePattern(
            settings.filePrefix(), DateBucket.today(clock), settings.fileExtension());

        List<byte[]> results = job.accumulatedResults();
        if (!results.isEmpty()) {
            BatchStatus status = job.failedWorkers() == 0 ? BatchStatus.FULL_SUCCESS : BatchStatus.PARTIAL_SUCCESS;
            SaveReport report = saver.save(saveDirectory, pattern, results);
            for (String failure : report.failures()) {
                errorLog.logFailure("save", job.id(), -1, job.request().mode().name(), saveDirectory, failure);
            }
            return new BatchOutcome(job.id(), status, job.totalWorkers(), job.succeededWorkers(), job.failedWorkers(),
                results, report.savedFiles(), saveDirectory, job.failureMessages(), report.failures(), false);
        }

        List<SavedArtifact> recovered = reconciler.scan(
            saveDirectory, pattern, settings.recoveryWindow(), job.totalWorkers());
        RecoveredFiles readable = readRecovered(recovered);
        if (!readable.files().isEmpty()) {
            LOGGER.info("%s: no in-memory results, recovered %d file(s) from %s".formatted(
                job.id(), readable.files().size(), saveDirectory));
            return new BatchOutcome(job.id(), BatchStatus.PARTIAL_SUCCESS, job.totalWorkers(), job.succeededWorkers(),
                job.failedWorkers(), readable.images(), readable.files(), saveDirectory, job.failureMessages(),
                List.of(), true);
        }

        return totalFailure(job);
    }

    /**
     * Reads the bytes of each recovered file. A file that vanished or cannot be read since the scan
     * is dropped from both lists, so {@code images.get(i)} is always the content of {@code files.get(i)}.
     */
    static RecoveredFiles readRecovered(List<SavedArtifact> artifacts) {
        List<Path> files = new ArrayList<>();
        List<byte[]> images = new ArrayList<>();
        for (SavedArtifact artifact : artifacts) {
            try {
                byte[] bytes = Files.readAllBytes(artifact.path());
                images.add(bytes);
                files.add(artifact.path());
            } catch (IOException ex) {
                LOGGER.warning("Cannot read recovered file " + artifact.path() + ": " + ex.getMessage());
            }
        }
        return new RecoveredFiles(List.copyOf(files), List.copyOf(images));
    }

    record RecoveredFiles(List<Path> files, List<byte[]> images) {
    }

    private static BatchOutcome totalFailure(BatchJob job) {
        return new BatchOutcome(job.id(), BatchStatus.TOTAL_FAILURE, job.totalWorkers(), job.succeededWorkers(),
            job.failedWorkers(), List.of(), List.of(), job.saveDirectory(), job.failureMessages(), List.of(), false);
    }

    private void notifyStatus(BatchListener listener, BatchJob job, int workerIndex, String message) {
        if (job.state() != BatchState.COLLECTING || job.worker(workerIndex).status().isTerminal()) {
            return;
        }
        notifySafely(() -> listener.onWorkerStatus(job.id(), workerIndex, message));
    }

    private void post(Runnable action) {
        try {
            coordinator.execute(action);
        } catch (RejectedExecutionException ex) {
            LOGGER.warning("Orchestrator closed, dropping batch event: " + ex.getMessage());
        }
    }

    private static void notifySafely(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException ex) {
            LOGGER.log(Level.WARNING, "Batch listener failed", ex);
        }
    }

    /**
     * Waits until every event queued so far has been handled by the coordinator.
     */
    void drainCoordinator() throws Exception {
        CompletableFuture.runAsync(() -> { }, coordinator).get();
    }

    private static String describe(Exception ex) {
        String message = ex.getMessage();
        return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
    }

    private static ThreadFactory daemonThreads(String namePrefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }

    @Override
    public void close() {
        coordinator.shutdown();
    }
}

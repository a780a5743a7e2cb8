package com.banana.core.batch;

import com.banana.core.model.GenerationRequest;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Mutable per-request aggregate. All mutators run on the coordinator thread only; readers on other
 * threads see the volatile counters.
 */
final class BatchJob implements BatchJobHandle {

    enum Delivery {
        /** Counted, more reports outstanding. */
        RECORDED,
        /** Counted, and it was the last one. */
        COMPLETED,
        /** Duplicate or late; nothing changed. */
        IGNORED
    }

    private final String id;
    private final GenerationRequest request;
    private final Path saveDirectory;
    private final Instant startedAt;
    private final WorkerTask[] workers;
    private final List<byte[]> accumulatedResults = new ArrayList<>();
    private final CompletableFuture<BatchOutcome> outcome = new CompletableFuture<>();

    private volatile int completedWorkers;
    private volatile BatchState state = BatchState.COLLECTING;

    BatchJob(String id, GenerationRequest request, Path saveDirectory, Instant startedAt) {
        this.id = id;
        this.request = request;
        this.saveDirectory = saveDirectory;
        this.startedAt = startedAt;
        this.workers = new WorkerTask[request.workerCount()];
        for (int i = 0; i < workers.length; i++) {
            workers[i] = WorkerTask.pending(i);
        }
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public int totalWorkers() {
        return workers.length;
    }

    @Override
    public int completedWorkers() {
        return completedWorkers;
    }

    @Override
    public BatchState state() {
        return state;
    }

    @Override
    public CompletableFuture<BatchOutcome> outcome() {
        return outcome.copy();
    }

    GenerationRequest request() {
        return request;
    }

    Path saveDirectory() {
        return saveDirectory;
    }

    Instant startedAt() {
        return startedAt;
    }

    void markRunning(int workerIndex) {
        if (state == BatchState.COLLECTING && workers[workerIndex].status() == WorkerStatus.PENDING) {
            workers[workerIndex] = workers[workerIndex].running();
        }
    }

    Delivery recordSuccess(int workerIndex, List<byte[]> images) {
        if (!accepts(workerIndex)) {
            return Delivery.IGNORED;
        }
        workers[workerIndex] = workers[workerIndex].succeeded(images);
        accumulatedResults.addAll(images);
        return countCompletion();
    }

    Delivery recordFailure(int workerIndex, String message) {
        if (!accepts(workerIndex)) {
            return Delivery.IGNORED;
        }
        workers[workerIndex] = workers[workerIndex].failed(message);
        return countCompletion();
    }

    private boolean accepts(int workerIndex) {
        return state == BatchState.COLLECTING
            && workerIndex >= 0
            && workerIndex < workers.length
            && !workers[workerIndex].status().isTerminal();
    }

    private Delivery countCompletion() {
        int completed = completedWorkers + 1;
        completedWorkers = completed;
        return completed == workers.length ? Delivery.COMPLETED : Delivery.RECORDED;
    }

    void beginReconciling() {
        state = BatchState.RECONCILING;
    }

    void markDone() {
        state = BatchState.DONE;
    }

    void publish(BatchOutcome result) {
        outcome.complete(result);
    }

    WorkerTask worker(int workerIndex) {
        return workers[workerIndex];
    }

    List<byte[]> accumulatedResults() {
        return List.copyOf(accumulatedResults);
    }

    int succeededWorkers() {
        return countStatus(WorkerStatus.SUCCEEDED);
    }

    int failedWorkers() {
        return countStatus(WorkerStatus.FAILED);
    }

    List<String> failureMessages() {
        List<String> messages = new ArrayList<>();
        for (WorkerTask worker : workers) {
            if (worker.status() == WorkerStatus.FAILED) {
                messages.add("Worker " + (worker.workerIndex() + 1) + ": " + worker.errorMessage());
            }
        }
        return messages;
    }

    private int countStatus(WorkerStatus status) {
        int count = 0;
        for (WorkerTask worker : workers) {
            if (worker.status() == status) {
                count++;
            }
        }
        return count;
    }
}

package com.banana.core.batch;

import java.util.List;

/**
 * Snapshot of one worker inside a batch. A terminal snapshot carries either images or an error message.
 */
public record WorkerTask(int workerIndex, WorkerStatus status, List<byte[]> images, String errorMessage) {

    public WorkerTask {
        images = images == null ? List.of() : List.copyOf(images);
    }

    static WorkerTask pending(int workerIndex) {
        return new WorkerTask(workerIndex, WorkerStatus.PENDING, List.of(), null);
    }

    WorkerTask running() {
        return new WorkerTask(workerIndex, WorkerStatus.RUNNING, List.of(), null);
    }

    WorkerTask succeeded(List<byte[]> results) {
        return new WorkerTask(workerIndex, WorkerStatus.SUCCEEDED, results, null);
    }

    WorkerTask failed(String message) {
        return new WorkerTask(workerIndex, WorkerStatus.FAILED, List.of(), message);
    }
}

package com.banana.core.batch;

/**
 * Batch callbacks. All of them run on the coordinator thread, one at a time; a UI listener must
 * hop to its own event thread. Methods are no-ops by default so callers can override selectively.
 */
public interface BatchListener {

    BatchListener NONE = new BatchListener() {
    };

    default void onWorkerStatus(String batchId, int workerIndex, String message) {
    }

    default void onWorkerFinished(BatchProgress progress) {
    }

    default void onBatchFinished(BatchOutcome outcome) {
    }
}

package com.banana.core.batch;

import java.util.concurrent.CompletableFuture;

/**
 * Caller's view of a running batch. The orchestrator sets no deadline: a caller that needs one
 * bounds its own wait on {@link #outcome()}.
 */
public interface BatchJobHandle {

    String id();

    int totalWorkers();

    int completedWorkers();

    BatchState state();

    /**
     * @return a future completed once with the batch outcome; cancelling or completing the
     * returned copy does not affect the batch
     */
    CompletableFuture<BatchOutcome> outcome();
}

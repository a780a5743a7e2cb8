package com.banana.core.batch;

/**
 * Emitted once per accepted worker report.
 */
public record BatchProgress(String batchId,
                            int workerIndex,
                            WorkerStatus workerStatus,
                            String errorMessage,
                            int completedWorkers,
                            int totalWorkers) {
}

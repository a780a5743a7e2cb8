package com.banana.core.batch;

import java.nio.file.Path;
import java.util.List;

/**
 * Final result of one batch.
 *
 * @param images         result set: in-memory results, or bytes read back from recovered files
 * @param savedFiles     files written by auto-save, or the recovered files
 * @param workerFailures one message per failed worker
 * @param saveFailures   one message per result that could not be saved
 * @param recovered      whether the result set came from the save directory instead of the workers
 */
public record BatchOutcome(String batchId,
                           BatchStatus status,
                           int totalWorkers,
                           int succeededWorkers,
                           int failedWorkers,
                           List<byte[]> images,
                           List<Path> savedFiles,
                           Path saveDirectory,
                           List<String> workerFailures,
                           List<String> saveFailures,
                           boolean recovered) {

    public BatchOutcome {
        images = List.copyOf(images);
        savedFiles = List.copyOf(savedFiles);
        workerFailures = List.copyOf(workerFailures);
        saveFailures = List.copyOf(saveFailures);
    }

    public int resultCount() {
        return recovered ? savedFiles.size() : images.size();
    }

    /**
     * Short count line, e.g. {@code 3/3}, {@code 2/3}, {@code 2/2 (recovered)} or {@code 0/2}.
     */
    public String summary() {
        if (recovered) {
            return "%d/%d (recovered)".formatted(savedFiles.size(), totalWorkers);
        }
        if (status == BatchStatus.TOTAL_FAILURE) {
            return "0/" + totalWorkers;
        }
        return succeededWorkers + "/" + totalWorkers;
    }
}

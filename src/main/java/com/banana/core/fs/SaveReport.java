package com.banana.core.fs;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of persisting one batch of results.
 *
 * @param savedFiles files written, in result order
 * @param skipped    payloads dropped as too small to be an image
 * @param failures   one message per artifact that could not be written
 */
public record SaveReport(List<Path> savedFiles, int skipped, List<String> failures) {
    public SaveReport {
        savedFiles = List.copyOf(savedFiles);
        failures = List.copyOf(failures);
    }
}

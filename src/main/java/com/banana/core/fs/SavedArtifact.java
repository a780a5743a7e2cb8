package com.banana.core.fs;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A result file observed on disk. Never created by the core, only discovered.
 */
public record SavedArtifact(Path path, int sequenceNumber, DateBucket dateBucket, Instant modTime) {
}

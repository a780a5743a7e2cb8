package com.banana.core.fs;

import com.banana.logging.AppLogger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.OptionalInt;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Derives result file names from a snapshot of the save directory.
 * <p>
 * There is no persisted counter: {@link #nextSequence} rescans the directory on every call, so two
 * callers that scan before either writes compute the same start. Only the existence check in
 * {@link #allocate} separates them, and that check is not a lock.
 */
public final class SequentialNamer {
    private static final Logger LOGGER = AppLogger.get();

    public static final int MAX_COLLISION_RETRIES = 1000;

    private final int maxRetries;

    public SequentialNamer() {
        this(MAX_COLLISION_RETRIES);
    }

    SequentialNamer(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public int nextSequence(Path directory, String prefix, DateBucket dateBucket, String extension) {
        return nextSequence(directory, new ArtifactNamePattern(prefix, dateBucket, extension));
    }

    /**
     * @return one past the highest sequence on disk for this pattern, or 1 when none exist.
     * Gaps are not reused.
     */
    public int nextSequence(Path directory, ArtifactNamePattern pattern) {
        if (directory == null || !Files.isDirectory(directory)) {
            return 1;
        }
        try (Stream<Path> files = Files.list(directory)) {
            int highest = files
                .filter(Files::isRegularFile)
                .map(path -> pattern.parseSequence(path.getFileName().toString()))
                .filter(OptionalInt::isPresent)
                .mapToInt(OptionalInt::getAsInt)
                .max()
                .orElse(0);
            return highest + 1;
        } catch (IOException | UncheckedIOException ex) {
            LOGGER.warning("Cannot scan " + directory + " for " + pattern.glob() + ": " + ex.getMessage());
            return 1;
        }
    }

    public Path allocate(Path directory, String prefix, DateBucket dateBucket, String extension, int sequence)
        throws NamingExhaustedException {
        return allocate(directory, new ArtifactNamePattern(prefix, dateBucket, extension), sequence);
    }

    /**
     * Returns the first free path at or after {@code sequence}, stepping forward past occupied names.
     *
     * @throws NamingExhaustedException when the candidate and every retry are occupied
     */
    public Path allocate(Path directory, ArtifactNamePattern pattern, int sequence) throws NamingExhaustedException {
        int candidate = sequence;
        for (int retry = 0; retry <= maxRetries; retry++, candidate++) {
            Path path = directory.resolve(pattern.fileName(candidate));
            if (!Files.exists(path)) {
                if (retry > 0) {
                    LOGGER.info("Name collision at " + pattern.fileName(sequence) + ", using " + path.getFileName());
                }
                return path;
            }
        }
        throw new NamingExhaustedException(pattern.fileName(sequence), maxRetries);
    }
}

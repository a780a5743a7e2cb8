package com.banana.core.fs;

import com.banana.logging.AppLogger;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.logging.Logger;

/**
 * Recovers a result set from the save directory when no worker reported images in memory.
 * <p>
 * The match is a heuristic: the most recently modified files of today's bucket inside the
 * recovery window are assumed to belong to the current batch. Nothing proves which worker wrote
 * which file, and a concurrent batch writing into the same directory can be picked up too.
 */
public final class ResultReconciler {
    private static final Logger LOGGER = AppLogger.get();

    public static final Duration DEFAULT_MAX_AGE = Duration.ofMinutes(5);

    private static final Comparator<SavedArtifact> NEWEST_FIRST =
        Comparator.comparing(SavedArtifact::modTime)
            .thenComparingInt(SavedArtifact::sequenceNumber)
            .reversed();

    private final Clock clock;

    public ResultReconciler() {
        this(Clock.systemDefaultZone());
    }

    public ResultReconciler(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @param maxAge files modified earlier than {@code now - maxAge} are ignored
     * @param limit  maximum number of artifacts returned, normally the batch worker count
     * @return matching artifacts, newest first
     */
    public List<SavedArtifact> scan(Path directory, ArtifactNamePattern pattern, Duration maxAge, int limit) {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(maxAge, "maxAge");
        if (limit <= 0 || directory == null || !Files.isDirectory(directory)) {
            return List.of();
        }

        Instant cutoff = clock.instant().minus(maxAge);
        List<SavedArtifact> recent = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory)) {
            for (Path entry : entries) {
                OptionalInt sequence = pattern.parseSequence(entry.getFileName().toString());
                if (sequence.isEmpty() || !Files.isRegularFile(entry)) {
                    continue;
                }
                Instant modified = lastModified(entry);
                if (modified != null && modified.isAfter(cutoff)) {
                    recent.add(new SavedArtifact(entry, sequence.getAsInt(), pattern.dateBucket(), modified));
                }
            }
        } catch (IOException ex) {
            LOGGER.warning("Cannot scan " + directory + " for recovered results: " + ex.getMessage());
            return List.of();
        }

        recent.sort(NEWEST_FIRST);
        List<SavedArtifact> result = recent.size() > limit ? recent.subList(0, limit) : recent;
        LOGGER.info("Recovered %d file(s) matching %s in %s".formatted(result.size(), pattern.glob(), directory));
        return List.copyOf(result);
    }

    private static Instant lastModified(Path file) {
        try {
            return Files.getLastModifiedTime(file).toInstant();
        } catch (IOException ex) {
            LOGGER.fine("Skipping " + file + ": " + ex.getMessage());
            return null;
        }
    }
}

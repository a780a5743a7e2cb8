package com.banana.core.fs;

import java.util.Objects;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The {@code {prefix}_{dateBucket}_{seq}.{extension}} naming scheme for saved results.
 * Sequence numbers are zero-padded to three digits and grow wider past 999.
 */
public final class ArtifactNamePattern {
    private static final int MAX_SEQUENCE_DIGITS = 9;

    private final String prefix;
    private final DateBucket dateBucket;
    private final String extension;
    private final Pattern sequencePattern;

    public ArtifactNamePattern(String prefix, DateBucket dateBucket, String extension) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("File prefix is required");
        }
        if (extension == null || extension.isBlank()) {
            throw new IllegalArgumentException("File extension is required");
        }
        this.prefix = prefix;
        this.dateBucket = Objects.requireNonNull(dateBucket, "dateBucket");
        this.extension = extension.startsWith(".") ? extension.substring(1) : extension;
        this.sequencePattern = Pattern.compile(
            Pattern.quote(this.prefix + "_" + dateBucket.value() + "_")
                + "(\\d{1," + MAX_SEQUENCE_DIGITS + "})"
                + Pattern.quote("." + this.extension));
    }

    public String prefix() {
        return prefix;
    }

    public DateBucket dateBucket() {
        return dateBucket;
    }

    public String extension() {
        return extension;
    }

    public String fileName(int sequence) {
        if (sequence < 1) {
            throw new IllegalArgumentException("Sequence numbers start at 1, got " + sequence);
        }
        return "%s_%s_%03d.%s".formatted(prefix, dateBucket.value(), sequence, extension);
    }

    /**
     * @return the numeric segment of a file name produced by this scheme, or empty for anything else
     */
    public OptionalInt parseSequence(String fileName) {
        if (fileName == null) {
            return OptionalInt.empty();
        }
        Matcher matcher = sequencePattern.matcher(fileName);
        if (!matcher.matches()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(Integer.parseInt(matcher.group(1)));
    }

    public boolean matches(String fileName) {
        return parseSequence(fileName).isPresent();
    }

    /** Glob form, for log messages. */
    public String glob() {
        return "%s_%s_*.%s".formatted(prefix, dateBucket.value(), extension);
    }

    @Override
    public String toString() {
        return glob();
    }
}

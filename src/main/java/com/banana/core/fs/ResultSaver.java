package com.banana.core.fs;

import com.banana.logging.AppLogger;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Auto-saves generated images under sequential names.
 * <p>
 * One {@link SequentialNamer#nextSequence} snapshot is taken per batch and artifact {@code i} is
 * allocated {@code start + i}. A failure on one artifact never stops its siblings.
 */
public final class ResultSaver {
    private static final Logger LOGGER = AppLogger.get();

    /** Payloads at or below this size are treated as empty responses. */
    public static final int MIN_PAYLOAD_BYTES = 100;

    private static final byte[] PNG_SIGNATURE = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n'};

    private final SequentialNamer namer;

    public ResultSaver() {
        this(new SequentialNamer());
    }

    public ResultSaver(SequentialNamer namer) {
        this.namer = Objects.requireNonNull(namer, "namer");
    }

    public SaveReport save(Path directory, ArtifactNamePattern pattern, List<byte[]> results) {
        Objects.requireNonNull(directory, "directory");
        Objects.requireNonNull(pattern, "pattern");

        List<byte[]> valid = new ArrayList<>();
        int skipped = 0;
        for (byte[] data : results) {
            if (data != null && data.length > MIN_PAYLOAD_BYTES) {
                valid.add(data);
            } else {
                skipped++;
            }
        }
        if (valid.isEmpty()) {
            LOGGER.info("No valid image data to save, skipped " + skipped);
            return new SaveReport(List.of(), skipped, List.of());
        }

        try {
            Files.createDirectories(directory);
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Cannot create save directory " + directory, ex);
            List<String> failures = new ArrayList<>();
            for (int i = 0; i < valid.size(); i++) {
                failures.add("result " + (i + 1) + ": cannot create " + directory + ": " + ex.getMessage());
            }
            return new SaveReport(List.of(), skipped, failures);
        }

        int start = namer.nextSequence(directory, pattern);
        List<Path> saved = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        for (int i = 0; i < valid.size(); i++) {
            try {
                Path target = namer.allocate(directory, pattern, start + i);
                write(target, valid.get(i));
                saved.add(target);
            } catch (NamingExhaustedException ex) {
                LOGGER.warning("Result " + (i + 1) + " not saved: " + ex.getMessage());
                failures.add("result " + (i + 1) + ": " + ex.getMessage());
            } catch (IOException ex) {
                LOGGER.log(Level.WARNING, "Result " + (i + 1) + " not saved", ex);
                failures.add("result " + (i + 1) + ": " + ex.getMessage());
            }
        }
        LOGGER.info("Auto-saved %d file(s) in %s".formatted(saved.size(), directory));
        return new SaveReport(saved, skipped, failures);
    }

    private static void write(Path target, byte[] data) throws IOException {
        if (isPng(data)) {
            Files.write(target, data);
            return;
        }
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(data));
        if (image == null) {
            throw new IOException("Unsupported image data (" + data.length + " bytes)");
        }
        if (!ImageIO.write(image, "png", target.toFile())) {
            throw new IOException("No PNG writer available");
        }
    }

    static boolean isPng(byte[] data) {
        return data.length >= PNG_SIGNATURE.length
            && Arrays.equals(data, 0, PNG_SIGNATURE.length, PNG_SIGNATURE, 0, PNG_SIGNATURE.length);
    }
}

package com.banana.core.batch;

import com.banana.logging.AppLogger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Appends worker and save failures to a CSV so failed batches can be reviewed after the fact.
 */
public final class GenerationErrorLog {

    private static final String HEADER = "timestamp,stage,batch_id,worker,mode,save_dir,message";
    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
            .withZone(ZoneId.systemDefault());

    private static final GenerationErrorLog NONE = new GenerationErrorLog(null, Clock.systemDefaultZone());

    private final Path logFile;
    private final Clock clock;

    private GenerationErrorLog(Path logFile, Clock clock) {
        this.logFile = logFile;
        this.clock = clock;
    }

    public static GenerationErrorLog at(Path logFile) {
        return at(logFile, Clock.systemDefaultZone());
    }

    public static GenerationErrorLog at(Path logFile, Clock clock) {
        return new GenerationErrorLog(Objects.requireNonNull(logFile, "logFile"), Objects.requireNonNull(clock, "clock"));
    }

    /** Discards everything. */
    public static GenerationErrorLog none() {
        return NONE;
    }

    public Path logFile() {
        return logFile;
    }

    /**
     * @param workerIndex zero-based worker, or a negative value for batch-level rows
     */
    public void logFailure(String stage, String batchId, int workerIndex, String mode, Path saveDirectory, String message) {
        if (logFile == null) {
            return;
        }
        String[] columns = {
            TIMESTAMP_FORMAT.format(clock.instant()),
            stage,
            batchId,
            workerIndex < 0 ? "" : Integer.toString(workerIndex + 1),
            mode,
            saveDirectory == null ? "" : saveDirectory.toString(),
            message
        };
        writeRow(columns);
    }

    private synchronized void writeRow(String[] columns) {
        try {
            if (logFile.getParent() != null) {
                Files.createDirectories(logFile.getParent());
            }
            boolean fileExists = Files.exists(logFile);
            try (BufferedWriter writer = Files.newBufferedWriter(
                logFile,
                StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.APPEND
            )) {
                if (!fileExists) {
                    writer.write(HEADER);
                    writer.newLine();
                }
                writer.write(toCsv(columns));
                writer.newLine();
            }
        } catch (IOException ioEx) {
            AppLogger.get().warning("Failed to write generation error log " + logFile + ": " + ioEx.getMessage());
        }
    }

    static String toCsv(String[] columns) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < columns.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(escape(columns[i]));
        }
        return sb.toString();
    }

    private static String escape(String value) {
        if (value == null) {
            return "";
        }
        boolean needsQuotes = value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r");
        String escaped = value.replace("\"", "\"\"");
        return needsQuotes ? "\"" + escaped + "\"" : escaped;
    }
}

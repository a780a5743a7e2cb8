package com.banana.core.batch;

import com.banana.config.ConfigService;
import com.banana.core.fs.ResultReconciler;

import java.time.Duration;
import java.util.Objects;

/**
 * Naming and recovery parameters shared by every batch of one orchestrator.
 */
public record BatchSettings(String filePrefix, String fileExtension, Duration recoveryWindow) {

    public BatchSettings {
        Objects.requireNonNull(filePrefix, "filePrefix");
        Objects.requireNonNull(fileExtension, "fileExtension");
        Objects.requireNonNull(recoveryWindow, "recoveryWindow");
    }

    public static BatchSettings defaults() {
        return new BatchSettings(ConfigService.FILE_PREFIX, ConfigService.FILE_EXTENSION,
            ResultReconciler.DEFAULT_MAX_AGE);
    }

    public static BatchSettings from(ConfigService config) {
        return new BatchSettings(config.getFilePrefix(), config.getFileExtension(), config.getRecoveryWindow());
    }
}

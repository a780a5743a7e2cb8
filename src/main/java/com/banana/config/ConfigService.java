package com.banana.config;

import com.banana.core.model.AspectRatio;
import com.banana.core.model.GenerationRequest;
import com.banana.logging.AppLogger;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Central entry point for resolving configuration values with overrides and persisted preferences.
 * <p>
 * Lookup order per key: system property, environment variable, {@code banana-editor.properties}
 * on the classpath, then the built-in default. The API key may also come from a {@code .env}
 * file in the working directory.
 */
public final class ConfigService {
    private static final Logger LOGGER = AppLogger.get();

    public static final String DEFAULT_API_BASE = "https://generativelanguage.googleapis.com/v1beta";
    public static final String DEFAULT_GEMINI_MODEL = "gemini-2.5-flash-image-preview";
    public static final String DEFAULT_IMAGEN_MODEL = "imagen-4.0-generate-preview-06-06";
    public static final String FILE_PREFIX = "banana";
    public static final String FILE_EXTENSION = "png";

    private static final String PROPERTIES_RESOURCE = "banana-editor.properties";
    private static final String DOTENV_FILE = ".env";
    private static final long DEFAULT_RECOVERY_SECONDS = 300;

    private static final String PREF_SAVE_ON_ORIGINAL = "save.onOriginal";
    private static final String PREF_BATCH_COUNT = "batch.count";
    private static final String PREF_ASPECT_RATIO = "batch.aspectRatio";
    private static final String PREF_SAVE_DIR = "save.dir";

    private static final ConfigService INSTANCE = new ConfigService(
        PreferencesStore.global(),
        loadClasspathProperties(),
        System.getenv(),
        Paths.get("").toAbsolutePath());

    private final PreferencesStore preferences;
    private final Properties fileProperties;
    private final Map<String, String> environment;
    private final Path workingDirectory;

    ConfigService(PreferencesStore preferences,
                  Properties fileProperties,
                  Map<String, String> environment,
                  Path workingDirectory) {
        this.preferences = Objects.requireNonNull(preferences, "preferences");
        this.fileProperties = fileProperties == null ? new Properties() : fileProperties;
        this.environment = environment == null ? Map.of() : environment;
        this.workingDirectory = workingDirectory;
    }

    public static ConfigService getInstance() {
        return INSTANCE;
    }

    /**
     * @return the Gemini API key, or empty when none is configured anywhere
     */
    public Optional<String> getApiKey() {
        String key = resolve("gemini.apiKey", "GEMINI_API_KEY");
        if (key == null) {
            key = readDotEnv().getProperty("GEMINI_API_KEY");
        }
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(stripQuotes(key.trim()));
    }

    /**
     * Explicit {@code -Dbanana.saveDir} or {@code BANANA_SAVE_DIR} wins, then the folder the user
     * last chose, then the classpath default.
     */
    public Path getDefaultSaveDirectory() {
        String override = override("banana.saveDir", "BANANA_SAVE_DIR");
        if (override != null) {
            return Paths.get(override);
        }
        Optional<Path> persisted = preferences.getPath(PREF_SAVE_DIR);
        if (persisted.isPresent()) {
            return persisted.get();
        }
        String configured = fileProperties.getProperty("banana.saveDir");
        return configured != null && !configured.isBlank() ? Paths.get(configured.trim()) : Paths.get("banana");
    }

    public void setDefaultSaveDirectory(Path directory) {
        if (directory == null) return;
        preferences.putPath(PREF_SAVE_DIR, directory);
    }

    public boolean isSaveOnOriginal() {
        return preferences.getBoolean(PREF_SAVE_ON_ORIGINAL, true);
    }

    public void setSaveOnOriginal(boolean saveOnOriginal) {
        preferences.putBoolean(PREF_SAVE_ON_ORIGINAL, saveOnOriginal);
    }

    public String getFilePrefix() {
        return FILE_PREFIX;
    }

    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    public Duration getRecoveryWindow() {
        String configured = resolve("banana.recoveryWindowSeconds", "BANANA_RECOVERY_WINDOW_SECONDS");
        if (configured == null) {
            return Duration.ofSeconds(DEFAULT_RECOVERY_SECONDS);
        }
        try {
            long seconds = Long.parseLong(configured);
            return Duration.ofSeconds(seconds > 0 ? seconds : DEFAULT_RECOVERY_SECONDS);
        } catch (NumberFormatException ex) {
            LOGGER.warning("Invalid recovery window '" + configured + "', using " + DEFAULT_RECOVERY_SECONDS + "s");
            return Duration.ofSeconds(DEFAULT_RECOVERY_SECONDS);
        }
    }

    public int getBatchCount() {
        int stored = preferences.getInt(PREF_BATCH_COUNT, 1);
        return Math.max(1, Math.min(GenerationRequest.MAX_WORKERS, stored));
    }

    public void setBatchCount(int count) {
        preferences.putInt(PREF_BATCH_COUNT, Math.max(1, Math.min(GenerationRequest.MAX_WORKERS, count)));
    }

    public AspectRatio getAspectRatio() {
        return preferences.getString(PREF_ASPECT_RATIO)
            .map(AspectRatio::fromLabel)
            .orElse(AspectRatio.SQUARE);
    }

    public void setAspectRatio(AspectRatio aspectRatio) {
        if (aspectRatio == null) return;
        preferences.putString(PREF_ASPECT_RATIO, aspectRatio.label());
    }

    public Path getErrorLogFile() {
        String configured = resolve("banana.errorLog", "BANANA_ERROR_LOG");
        return configured != null ? Paths.get(configured) : Paths.get("target", "generation-errors.csv");
    }

    public Path getHistoryFile() {
        String configured = resolve("banana.historyFile", "BANANA_HISTORY_FILE");
        return configured != null ? Paths.get(configured) : Paths.get("banana_history.json");
    }

    public URI getApiBase() {
        String configured = resolve("gemini.apiBase", "GEMINI_API_BASE");
        return URI.create(configured != null ? configured : DEFAULT_API_BASE);
    }

    public String getGeminiModel() {
        String configured = resolve("gemini.model", "GEMINI_MODEL");
        return configured != null ? configured : DEFAULT_GEMINI_MODEL;
    }

    public String getImagenModel() {
        String configured = resolve("imagen.model", "IMAGEN_MODEL");
        return configured != null ? configured : DEFAULT_IMAGEN_MODEL;
    }

    private String resolve(String propertyKey, String envKey) {
        String value = override(propertyKey, envKey);
        if (value == null) {
            value = fileProperties.getProperty(propertyKey);
        }
        return value == null || value.isBlank() ? null : value.trim();
    }

    private String override(String propertyKey, String envKey) {
        String value = System.getProperty(propertyKey);
        if (value == null || value.isBlank()) {
            value = environment.get(envKey);
        }
        return value == null || value.isBlank() ? null : value.trim();
    }

    private Properties readDotEnv() {
        Properties dotEnv = new Properties();
        if (workingDirectory == null) {
            return dotEnv;
        }
        Path file = workingDirectory.resolve(DOTENV_FILE);
        if (!Files.isRegularFile(file)) {
            return dotEnv;
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            dotEnv.load(reader);
        } catch (IOException ex) {
            LOGGER.warning("Cannot read " + file + ": " + ex.getMessage());
        }
        return dotEnv;
    }

    private static String stripQuotes(String value) {
        if (value.length() >= 2
            && (value.startsWith("\"") && value.endsWith("\"") || value.startsWith("'") && value.endsWith("'"))) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    private static Properties loadClasspathProperties() {
        Properties props = new Properties();
        try (InputStream stream = ConfigService.class.getClassLoader().getResourceAsStream(PROPERTIES_RESOURCE)) {
            if (stream != null) {
                props.load(stream);
            }
        } catch (IOException ex) {
            LOGGER.warning("Cannot load " + PROPERTIES_RESOURCE + ": " + ex.getMessage());
        }
        return props;
    }
}

package com.banana.history;

import com.banana.logging.AppLogger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Manually curated prompt list, oldest first, capped at {@link #MAX_ITEMS}. Every change is
 * written straight back to the JSON file.
 */
public final class PromptHistory {
    private static final Logger LOGGER = AppLogger.get();

    public static final int MAX_ITEMS = 30;

    private final Path file;
    private final Clock clock;
    private final List<PromptHistoryItem> items = new ArrayList<>();

    public PromptHistory(Path file) {
        this(file, Clock.systemDefaultZone());
    }

    public PromptHistory(Path file, Clock clock) {
        this.file = Objects.requireNonNull(file, "file");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Opens the history at {@code file}, starting empty when it is missing or unreadable.
     */
    public static PromptHistory open(Path file) {
        PromptHistory history = new PromptHistory(file);
        history.load();
        return history;
    }

    public Path file() {
        return file;
    }

    public synchronized List<PromptHistoryItem> items() {
        return List.copyOf(items);
    }

    /**
     * @return {@code false} for blank text or a repeat of the newest item
     */
    public synchronized boolean add(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String stripped = text.strip();
        if (!items.isEmpty() && items.get(items.size() - 1).text().equals(stripped)) {
            return false;
        }
        items.add(new PromptHistoryItem(stripped, LocalDateTime.now(clock)));
        while (items.size() > MAX_ITEMS) {
            items.remove(0);
        }
        save();
        return true;
    }

    public synchronized boolean remove(PromptHistoryItem item) {
        if (!items.remove(item)) {
            return false;
        }
        save();
        return true;
    }

    public synchronized void load() {
        items.clear();
        if (!Files.isRegularFile(file)) {
            return;
        }
        try {
            JSONObject root = new JSONObject(Files.readString(file, StandardCharsets.UTF_8));
            JSONArray array = root.optJSONArray("items");
            if (array == null) {
                return;
            }
            for (int i = 0; i < array.length(); i++) {
                items.add(PromptHistoryItem.fromJson(array.getJSONObject(i)));
            }
            while (items.size() > MAX_ITEMS) {
                items.remove(0);
            }
        } catch (IOException | JSONException | DateTimeParseException ex) {
            LOGGER.warning("Error loading prompt history " + file + ": " + ex.getMessage());
            items.clear();
        }
    }

    public synchronized void save() {
        JSONArray array = new JSONArray();
        for (PromptHistoryItem item : items) {
            array.put(item.toJson());
        }
        JSONObject root = new JSONObject();
        root.put("items", array);
        root.put("created", LocalDateTime.now(clock).toString());
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(
                file,
                root.toString(2),
                StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE
            );
        } catch (IOException ex) {
            LOGGER.warning("Error saving prompt history " + file + ": " + ex.getMessage());
        }
    }
}

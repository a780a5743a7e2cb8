package com.banana.config;

import com.banana.logging.AppLogger;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;

/**
 * Thin wrapper around {@link Preferences} for the last-used batch settings and the save toggle.
 */
public final class PreferencesStore {
    private static final String ROOT_NODE = "com/banana/editor";

    private final Preferences delegate;

    private PreferencesStore(Preferences delegate) {
        this.delegate = delegate;
    }

    public static PreferencesStore global() {
        return new PreferencesStore(Preferences.userRoot().node(ROOT_NODE));
    }

    static PreferencesStore forNode(Preferences node) {
        return new PreferencesStore(Objects.requireNonNull(node, "node"));
    }

    public Optional<Path> getPath(String key) {
        return getString(key).map(Path::of);
    }

    public void putPath(String key, Path path) {
        if (path == null) return;
        putString(key, path.toString());
    }

    public Optional<String> getString(String key) {
        String value = delegate.get(key, null);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value);
    }

    public void putString(String key, String value) {
        if (key == null || key.isBlank() || value == null) return;
        delegate.put(key, value);
        flush();
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        return delegate.getBoolean(key, defaultValue);
    }

    public void putBoolean(String key, boolean value) {
        if (key == null || key.isBlank()) return;
        delegate.putBoolean(key, value);
        flush();
    }

    public int getInt(String key, int defaultValue) {
        return delegate.getInt(key, defaultValue);
    }

    public void putInt(String key, int value) {
        if (key == null || key.isBlank()) return;
        delegate.putInt(key, value);
        flush();
    }

    private void flush() {
        try {
            delegate.flush();
        } catch (BackingStoreException ex) {
            AppLogger.get().fine("Preferences not flushed: " + ex.getMessage());
        }
    }
}

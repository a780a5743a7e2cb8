package com.banana.core.session;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Owns the four reference-image slots of the editor session.
 * <p>
 * Pure in-memory state: paths are neither checked for existence nor read. Callers validate
 * input first (see {@link ImagePathValidator}) and decide what to do when every slot is taken.
 * Slot indices are stable; a path never moves to another slot unless it is removed and added again.
 */
public final class SlotSessionManager {
    public static final int SLOT_COUNT = 4;

    private final String[] paths = new String[SLOT_COUNT];

    /**
     * Fills the lowest empty slot.
     *
     * @return {@code false}, leaving the session untouched, when all slots are occupied
     */
    public synchronized boolean addToNextAvailable(String path) {
        Objects.requireNonNull(path, "path");
        for (int i = 0; i < SLOT_COUNT; i++) {
            if (paths[i] == null) {
                paths[i] = path;
                return true;
            }
        }
        return false;
    }

    /**
     * Overwrites one slot explicitly, whether or not it was occupied.
     */
    public synchronized void replaceAt(int index, String path) {
        checkIndex(index);
        paths[index] = Objects.requireNonNull(path, "path");
    }

    public synchronized void removeAt(int index) {
        checkIndex(index);
        paths[index] = null;
    }

    public synchronized void clearAll() {
        Arrays.fill(paths, null);
    }

    /**
     * Occupied paths in ascending slot order. The order fixes both the "Image N" references of a
     * multi-image prompt and the order images are attached to the outgoing request.
     */
    public synchronized List<String> activePaths() {
        List<String> active = new ArrayList<>(SLOT_COUNT);
        for (String path : paths) {
            if (path != null) {
                active.add(path);
            }
        }
        return List.copyOf(active);
    }

    public synchronized List<ImageSlot> activeSlots() {
        List<ImageSlot> active = new ArrayList<>(SLOT_COUNT);
        for (int i = 0; i < SLOT_COUNT; i++) {
            if (paths[i] != null) {
                active.add(new ImageSlot(i, paths[i]));
            }
        }
        return List.copyOf(active);
    }

    public synchronized List<ImageSlot> slots() {
        List<ImageSlot> all = new ArrayList<>(SLOT_COUNT);
        for (int i = 0; i < SLOT_COUNT; i++) {
            all.add(new ImageSlot(i, paths[i]));
        }
        return List.copyOf(all);
    }

    public synchronized ImageSlot slot(int index) {
        checkIndex(index);
        return new ImageSlot(index, paths[index]);
    }

    public synchronized int count() {
        int occupied = 0;
        for (String path : paths) {
            if (path != null) {
                occupied++;
            }
        }
        return occupied;
    }

    public synchronized boolean isFull() {
        return count() == SLOT_COUNT;
    }

    private static void checkIndex(int index) {
        if (index < 0 || index >= SLOT_COUNT) {
            throw new IllegalArgumentException("Slot index must be between 0 and %d, got %d".formatted(SLOT_COUNT - 1, index));
        }
    }
}

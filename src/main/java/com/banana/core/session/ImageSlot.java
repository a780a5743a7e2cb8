package com.banana.core.session;

/**
 * Immutable view of one input slot.
 *
 * @param index slot position, 0 to 3
 * @param path  image path, {@code null} when the slot is empty
 */
public record ImageSlot(int index, String path) {

    public boolean isOccupied() {
        return path != null;
    }

    /** 1-based number shown to users and used in "Image N" prompt references. */
    public int displayNumber() {
        return index + 1;
    }
}

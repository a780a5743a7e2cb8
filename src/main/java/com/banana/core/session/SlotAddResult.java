package com.banana.core.session;

/**
 * What happened to one path offered to the slot session.
 */
public enum SlotAddResult {
    ADDED,
    /** Every slot was taken and the caller policy overwrote slot 0. */
    REPLACED_FIRST,
    SLOT_FULL,
    REJECTED
}

package com.banana.core.batch;

public enum BatchState {
    /** Waiting for worker reports. */
    COLLECTING,
    /** Every worker has reported; the outcome is being decided. */
    RECONCILING,
    DONE
}

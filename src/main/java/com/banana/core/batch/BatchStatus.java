package com.banana.core.batch;

/**
 * Final verdict of a batch. Every batch ends in exactly one of these.
 */
public enum BatchStatus {
    FULL_SUCCESS,
    PARTIAL_SUCCESS,
    TOTAL_FAILURE
}

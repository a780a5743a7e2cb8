package com.banana.core.fs;

/**
 * Raised when every candidate name for one artifact was already taken.
 */
public final class NamingExhaustedException extends Exception {
    private final String firstCandidate;
    private final int attempts;

    NamingExhaustedException(String firstCandidate, int attempts) {
        super("No free file name after %d attempts starting at %s".formatted(attempts, firstCandidate));
        this.firstCandidate = firstCandidate;
        this.attempts = attempts;
    }

    public String getFirstCandidate() {
        return firstCandidate;
    }

    public int getAttempts() {
        return attempts;
    }
}

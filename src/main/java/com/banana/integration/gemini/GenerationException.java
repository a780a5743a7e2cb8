package com.banana.integration.gemini;

/**
 * The generation service rejected a call or returned nothing usable.
 */
public class GenerationException extends Exception {
    private final int statusCode;

    public GenerationException(String message) {
        this(message, -1, null);
    }

    public GenerationException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public GenerationException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * @return the HTTP status, or -1 when the failure did not come from an HTTP response
     */
    public int getStatusCode() {
        return statusCode;
    }
}

package com.banana.integration.gemini;

import java.util.List;

/**
 * User-facing explanation of a raw failure message.
 */
public record TranslatedError(String title, String description, List<String> solutions, String original) {

    public TranslatedError {
        solutions = List.copyOf(solutions);
    }
}

package com.banana.integration.gemini;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps raw worker failure messages to readable explanations. Markers are matched
 * case-insensitively, first match wins.
 */
public final class ErrorTranslator {

    private static final Map<String, Entry> PATTERNS = new LinkedHashMap<>();

    static {
        PATTERNS.put("GEMINI_API_KEY", new Entry(
            "API key missing",
            "No Gemini API key is configured.",
            List.of(
                "Set the GEMINI_API_KEY environment variable",
                "Or add GEMINI_API_KEY=your_api_key_here to a .env file in the working directory",
                "Or pass -Dgemini.apiKey=... on the command line")));
        PATTERNS.put("PERMISSION_DENIED", new Entry(
            "Authentication problem",
            "The API key is invalid or has no access to the Gemini API.",
            List.of(
                "Check the API key in .env or the environment",
                "Create a fresh key in Google AI Studio",
                "Make sure the key is allowed to call the Gemini API")));
        PATTERNS.put("RESOURCE_EXHAUSTED", new Entry(
            "Rate limit reached",
            "Too many requests for the current quota.",
            List.of(
                "Wait a moment and try again",
                "Generate fewer images per batch",
                "Check the project's quota and billing")));
        PATTERNS.put("INVALID_ARGUMENT", new Entry(
            "Request or content rejected",
            "The request is malformed or the content was blocked by policy.",
            List.of(
                "Rephrase the prompt",
                "Avoid content that may be blocked",
                "Check the reference images are valid")));
        PATTERNS.put("INTERNAL", new Entry(
            "Google server error",
            "The service failed internally.",
            List.of(
                "Wait a moment and try again",
                "Check the Google Cloud status page",
                "Try another model for now")));
        PATTERNS.put("UNAVAILABLE", new Entry(
            "Service unavailable",
            "The service is overloaded or under maintenance.",
            List.of(
                "Wait a moment and try again",
                "Try again at a quieter time")));
        PATTERNS.put("No image data", new Entry(
            "No image received",
            "The API answered without image data, often because of a safety filter.",
            List.of(
                "Make the prompt more explicit",
                "Ask for an image explicitly",
                "Avoid words that may be blocked")));
        PATTERNS.put("No images received", new Entry(
            "No image received",
            "The worker finished without any image.",
            List.of(
                "Try a different prompt",
                "Simplify the request")));
        PATTERNS.put("No candidates", new Entry(
            "Incomplete response",
            "The API response had no candidates.",
            List.of(
                "Check the network connection",
                "Send the request again",
                "Check the API key billing and quota")));
        PATTERNS.put("No content", new Entry(
            "Empty response",
            "The API answered without content.",
            List.of(
                "Send the request again",
                "Check the prompt was not blocked")));
        PATTERNS.put("No parts", new Entry(
            "Incomplete data",
            "The API answered but the content had no parts.",
            List.of(
                "Send the request again",
                "Shorten the prompt")));
        PATTERNS.put("Connection", new Entry(
            "Connection problem",
            "The server could not be reached.",
            List.of(
                "Check the internet connection",
                "Try again in a moment",
                "Check firewall or proxy settings")));
    }

    private static final Entry UNKNOWN = new Entry(
        "Unknown error",
        "The cause of the failure could not be identified.",
        List.of(
            "Send the request again",
            "Check the internet connection",
            "Check the API key"));

    private ErrorTranslator() {
    }

    public static TranslatedError translate(String message) {
        String original = message == null ? "" : message;
        String haystack = original.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Entry> pattern : PATTERNS.entrySet()) {
            if (haystack.contains(pattern.getKey().toLowerCase(Locale.ROOT))) {
                return pattern.getValue().toTranslated(original);
            }
        }
        return UNKNOWN.toTranslated(original);
    }

    private record Entry(String title, String description, List<String> solutions) {
        TranslatedError toTranslated(String original) {
            return new TranslatedError(title, description, solutions, original);
        }
    }
}

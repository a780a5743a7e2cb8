package com.banana.integration.gemini;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class ErrorTranslatorTest {

    @Test
    void matchesKnownMarkersIgnoringCase() {
        assertEquals("Authentication problem", ErrorTranslator.translate("403 permission_denied").title());
        assertEquals("Rate limit reached", ErrorTranslator.translate("RESOURCE_EXHAUSTED: Quota exceeded").title());
        assertEquals("No image received", ErrorTranslator.translate("No image data found in response").title());
        assertEquals("Incomplete response", ErrorTranslator.translate("No candidates received from API").title());
        assertEquals("Connection problem", ErrorTranslator.translate("Connection error: refused").title());
        assertEquals("API key missing",
            ErrorTranslator.translate("GEMINI_API_KEY not found in environment variables").title());
    }

    @Test
    void keepsOriginalMessageAndFallsBack() {
        TranslatedError translated = ErrorTranslator.translate("something odd");

        assertEquals("Unknown error", translated.title());
        assertEquals("something odd", translated.original());
        assertFalse(translated.solutions().isEmpty());
        assertEquals("", ErrorTranslator.translate(null).original());
    }
}

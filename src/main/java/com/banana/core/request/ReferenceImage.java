package com.banana.core.request;

/**
 * Encoded reference image ready to be sent inline.
 */
public record ReferenceImage(byte[] data, String mimeType, int width, int height) {
}

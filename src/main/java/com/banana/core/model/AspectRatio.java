package com.banana.core.model;

/**
 * Output aspect ratios accepted by the generation service.
 */
public enum AspectRatio {
    SQUARE("1:1"),
    LANDSCAPE_WIDE("16:9"),
    PORTRAIT_TALL("9:16"),
    LANDSCAPE("4:3"),
    PORTRAIT("3:4");

    private final String label;

    AspectRatio(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Resolves a combo-box style label such as {@code "16:9 (Wide)"}. Unknown labels fall back
     * to {@link #SQUARE}.
     */
    public static AspectRatio fromLabel(String text) {
        if (text == null) {
            return SQUARE;
        }
        for (AspectRatio ratio : values()) {
            if (text.contains(ratio.label)) {
                return ratio;
            }
        }
        return SQUARE;
    }

    @Override
    public String toString() {
        return label;
    }
}

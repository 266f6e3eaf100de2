package io.hearthwarrio.cascadium.core.layout;

import io.hearthwarrio.cascadium.core.style.ComputedStyle;

/**
 * Approximates text width as character count times a fixed fraction of the font size.
 */
public final class SimpleTextMetrics implements TextMetrics {

    public static final double DEFAULT_ADVANCE = 0.5;

    private final double advance;

    public SimpleTextMetrics() {
        this(DEFAULT_ADVANCE);
    }

    /**
     * @param advance width of one character as a fraction of the font size
     */
    public SimpleTextMetrics(double advance) {
        if (!(advance > 0)) {
            throw new IllegalArgumentException("advance must be positive: " + advance);
        }
        this.advance = advance;
    }

    @Override
    public double textWidth(String text, ComputedStyle style) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return text.codePointCount(0, text.length()) * advance * style.getFontSize();
    }
}

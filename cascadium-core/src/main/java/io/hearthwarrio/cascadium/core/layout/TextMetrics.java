package io.hearthwarrio.cascadium.core.layout;

import io.hearthwarrio.cascadium.core.style.ComputedStyle;

import java.util.ArrayList;
import java.util.List;

/**
 * Measures text for intrinsic sizing. Implemented by the painter's font backend; {@link SimpleTextMetrics}
 * is used when none is configured.
 */
public interface TextMetrics {

    /**
     * Width of the text rendered on a single line, in px.
     */
    double textWidth(String text, ComputedStyle style);

    /**
     * Height of one line, in px.
     */
    default double lineHeight(ComputedStyle style) {
        return style.getLineHeight();
    }

    /**
     * Breaks text into lines no wider than {@code maxWidth}, at spaces. A word wider than the limit gets a
     * line of its own.
     */
    default List<String> breakLines(String text, ComputedStyle style, double maxWidth) {
        List<String> lines = new ArrayList<>();
        StringBuilder line = new StringBuilder();
        for (String word : text.trim().split(" +")) {
            if (word.isEmpty()) {
                continue;
            }
            if (line.length() == 0) {
                line.append(word);
                continue;
            }
            String candidate = line + " " + word;
            if (textWidth(candidate, style) <= maxWidth) {
                line.setLength(0);
                line.append(candidate);
            } else {
                lines.add(line.toString());
                line.setLength(0);
                line.append(word);
            }
        }
        if (line.length() > 0) {
            lines.add(line.toString());
        }
        return lines;
    }
}

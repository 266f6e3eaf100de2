package io.hearthwarrio.cascadium.core.layout;

import io.hearthwarrio.cascadium.core.dom.Document;
import io.hearthwarrio.cascadium.core.style.ComputedStyle;

import java.util.List;
import java.util.Objects;

/**
 * Computes box geometry for every element from its computed style.
 * <p>
 * {@code display} selects the algorithm for an element's children: block flow with inline-block lines,
 * or single-line flexbox. Layout is total: it never fails on style input, clamping negative sizes to zero.
 */
public final class LayoutEngine {

    private final TextMetrics textMetrics;

    public LayoutEngine() {
        this(new SimpleTextMetrics());
    }

    public LayoutEngine(TextMetrics textMetrics) {
        this.textMetrics = Objects.requireNonNull(textMetrics, "textMetrics must not be null");
    }

    public TextMetrics getTextMetrics() {
        return textMetrics;
    }

    /**
     * Lays out the whole document.
     *
     * @param document              element tree
     * @param styles                computed styles indexed like the document's elements
     * @param containingBlockWidth  width of the root's containing block (viewport), px
     * @param containingBlockHeight height of the root's containing block, px, or {@code NaN} when unbounded
     * @return complete layout tree
     */
    public LayoutTree layout(
            Document document,
            List<ComputedStyle> styles,
            double containingBlockWidth,
            double containingBlockHeight
    ) {
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(styles, "styles must not be null");
        if (styles.size() != document.size()) {
            throw new IllegalArgumentException(
                    "Expected " + document.size() + " styles, got " + styles.size()
            );
        }
        if (Double.isNaN(containingBlockWidth) || Double.isInfinite(containingBlockWidth)) {
            throw new IllegalArgumentException("containingBlockWidth must be finite: " + containingBlockWidth);
        }
        double height = Double.isNaN(containingBlockHeight) ? Double.NaN : Math.max(0, containingBlockHeight);
        return new LayoutPass(document, styles, textMetrics).run(Math.max(0, containingBlockWidth), height);
    }
}

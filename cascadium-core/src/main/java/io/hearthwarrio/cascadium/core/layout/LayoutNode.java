package io.hearthwarrio.cascadium.core.layout;

import io.hearthwarrio.cascadium.core.dom.Element;
import io.hearthwarrio.cascadium.core.style.ComputedStyle;

import java.util.Objects;

/**
 * Element with its computed style and box, as produced by one reflow.
 */
public final class LayoutNode {

    private final Element element;
    private final ComputedStyle style;
    private final Display display;
    private final Box box;
    private final Rect textBounds;
    private final boolean rendered;

    LayoutNode(Element element, ComputedStyle style, Display display, Box box, Rect textBounds, boolean rendered) {
        this.element = Objects.requireNonNull(element, "element must not be null");
        this.style = Objects.requireNonNull(style, "style must not be null");
        this.display = Objects.requireNonNull(display, "display must not be null");
        this.box = Objects.requireNonNull(box, "box must not be null");
        this.textBounds = textBounds;
        this.rendered = rendered;
    }

    public Element getElement() {
        return element;
    }

    public ComputedStyle getStyle() {
        return style;
    }

    public Display getDisplay() {
        return display;
    }

    public Box getBox() {
        return box;
    }

    /**
     * Area occupied by the element's own text, or {@code null} when it has none or generates no box.
     */
    public Rect getTextBounds() {
        return textBounds;
    }

    /**
     * Whether the node was laid out: false for {@code display: none} and its descendants.
     */
    public boolean isRendered() {
        return rendered;
    }

    @Override
    public String toString() {
        return "LayoutNode{" +
                "element=" + element.describe() +
                ", display=" + display +
                ", box=" + box +
                '}';
    }
}

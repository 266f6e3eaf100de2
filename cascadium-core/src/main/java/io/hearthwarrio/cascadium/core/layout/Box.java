package io.hearthwarrio.cascadium.core.layout;

import java.util.Objects;

/**
 * Box model of one element: content, padding, border and margin rectangles.
 * <p>
 * Each rectangle encloses the previous one; the gap on every side equals that side's padding, border width
 * or margin.
 */
public final class Box {

    private final Rect content;
    private final Edges padding;
    private final Edges border;
    private final Edges margin;

    private Box(Rect content, Edges padding, Edges border, Edges margin) {
        this.content = content;
        this.padding = padding;
        this.border = border;
        this.margin = margin;
    }

    public static Box of(Rect content, Edges padding, Edges border, Edges margin) {
        return new Box(
                Objects.requireNonNull(content, "content must not be null"),
                Objects.requireNonNull(padding, "padding must not be null"),
                Objects.requireNonNull(border, "border must not be null"),
                Objects.requireNonNull(margin, "margin must not be null")
        );
    }

    /**
     * Zero-size box at the given point, used for elements that generate no box.
     */
    public static Box empty(double x, double y) {
        return new Box(new Rect(x, y, 0, 0), Edges.ZERO, Edges.ZERO, Edges.ZERO);
    }

    public Rect getContentBox() {
        return content;
    }

    public Rect getPaddingBox() {
        return content.outset(padding);
    }

    public Rect getBorderBox() {
        return getPaddingBox().outset(border);
    }

    public Rect getMarginBox() {
        return getBorderBox().outset(margin);
    }

    public Edges getPadding() {
        return padding;
    }

    public Edges getBorder() {
        return border;
    }

    public Edges getMargin() {
        return margin;
    }

    public Box translate(double dx, double dy) {
        if (dx == 0 && dy == 0) {
            return this;
        }
        return new Box(content.translate(dx, dy), padding, border, margin);
    }

    @Override
    public String toString() {
        return "Box{" +
                "content=" + content +
                ", padding=" + padding +
                ", border=" + border +
                ", margin=" + margin +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Box)) return false;
        Box that = (Box) o;
        return content.equals(that.content) &&
                padding.equals(that.padding) &&
                border.equals(that.border) &&
                margin.equals(that.margin);
    }

    @Override
    public int hashCode() {
        return Objects.hash(content, padding, border, margin);
    }
}

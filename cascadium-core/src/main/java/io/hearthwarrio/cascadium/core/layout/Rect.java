package io.hearthwarrio.cascadium.core.layout;

import java.util.Objects;

/**
 * Axis-aligned rectangle in document coordinates (px). Width and height are never negative.
 */
public final class Rect {

    private final double x;
    private final double y;
    private final double width;
    private final double height;

    public Rect(double x, double y, double width, double height) {
        this.x = x;
        this.y = y;
        this.width = Math.max(0, width);
        this.height = Math.max(0, height);
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    public double getRight() {
        return x + width;
    }

    public double getBottom() {
        return y + height;
    }

    public boolean isEmpty() {
        return width == 0 || height == 0;
    }

    /**
     * Whether the point lies inside; left and top edges are inclusive, right and bottom exclusive.
     */
    public boolean contains(double px, double py) {
        return px >= x && px < x + width && py >= y && py < y + height;
    }

    /**
     * Whether {@code other} lies completely inside this rectangle.
     */
    public boolean encloses(Rect other) {
        return other.x >= x && other.y >= y && other.getRight() <= getRight() && other.getBottom() <= getBottom();
    }

    public Rect translate(double dx, double dy) {
        if (dx == 0 && dy == 0) {
            return this;
        }
        return new Rect(x + dx, y + dy, width, height);
    }

    /**
     * Grows the rectangle by the given edges (negative values shrink it).
     */
    public Rect outset(Edges edges) {
        return new Rect(
                x - edges.getLeft(),
                y - edges.getTop(),
                width + edges.getHorizontal(),
                height + edges.getVertical()
        );
    }

    @Override
    public String toString() {
        return "(" + format(x) + ", " + format(y) + ", " + format(width) + "x" + format(height) + ")";
    }

    static String format(double v) {
        double rounded = Math.round(v * 100.0) / 100.0;
        if (rounded == Math.rint(rounded)) {
            return Long.toString((long) rounded);
        }
        return Double.toString(rounded);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Rect)) return false;
        Rect that = (Rect) o;
        return Double.compare(x, that.x) == 0 &&
                Double.compare(y, that.y) == 0 &&
                Double.compare(width, that.width) == 0 &&
                Double.compare(height, that.height) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, width, height);
    }
}

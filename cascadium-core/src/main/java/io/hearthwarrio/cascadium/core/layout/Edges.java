package io.hearthwarrio.cascadium.core.layout;

import java.util.Objects;

/**
 * Per-side thickness of a margin, border or padding (px).
 */
public final class Edges {

    public static final Edges ZERO = new Edges(0, 0, 0, 0);

    private final double top;
    private final double right;
    private final double bottom;
    private final double left;

    public Edges(double top, double right, double bottom, double left) {
        this.top = top;
        this.right = right;
        this.bottom = bottom;
        this.left = left;
    }

    public double getTop() {
        return top;
    }

    public double getRight() {
        return right;
    }

    public double getBottom() {
        return bottom;
    }

    public double getLeft() {
        return left;
    }

    public double getHorizontal() {
        return left + right;
    }

    public double getVertical() {
        return top + bottom;
    }

    public Edges plus(Edges other) {
        return new Edges(top + other.top, right + other.right, bottom + other.bottom, left + other.left);
    }

    Edges withLeftRight(double newLeft, double newRight) {
        return new Edges(top, newRight, bottom, newLeft);
    }

    @Override
    public String toString() {
        return "[" + Rect.format(top) + " " + Rect.format(right) + " " + Rect.format(bottom) + " " + Rect.format(left) + "]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Edges)) return false;
        Edges that = (Edges) o;
        return Double.compare(top, that.top) == 0 &&
                Double.compare(right, that.right) == 0 &&
                Double.compare(bottom, that.bottom) == 0 &&
                Double.compare(left, that.left) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(top, right, bottom, left);
    }
}

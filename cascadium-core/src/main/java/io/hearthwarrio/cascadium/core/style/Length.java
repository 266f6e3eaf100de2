package io.hearthwarrio.cascadium.core.style;

import java.util.Objects;

/**
 * Computed length: absolute pixels, an unresolved percentage of the containing block, {@code auto} or {@code none}.
 * Relative units ({@code em}, {@code rem}, {@code pt}) are converted to pixels before a {@code Length} is created.
 */
public final class Length implements StyleValue {

    public enum Unit {
        PX,
        PERCENT,
        AUTO,
        NONE
    }

    public static final Length ZERO = new Length(0, Unit.PX);
    public static final Length AUTO = new Length(0, Unit.AUTO);
    public static final Length NONE = new Length(0, Unit.NONE);

    private final double value;
    private final Unit unit;

    private Length(double value, Unit unit) {
        this.value = value;
        this.unit = unit;
    }

    public static Length px(double value) {
        return value == 0 ? ZERO : new Length(value, Unit.PX);
    }

    public static Length percent(double value) {
        return new Length(value, Unit.PERCENT);
    }

    public double getValue() {
        return value;
    }

    public Unit getUnit() {
        return unit;
    }

    public boolean isAuto() {
        return unit == Unit.AUTO;
    }

    public boolean isNone() {
        return unit == Unit.NONE;
    }

    public boolean isPercent() {
        return unit == Unit.PERCENT;
    }

    public boolean isPx() {
        return unit == Unit.PX;
    }

    /**
     * Whether the length resolves to a number against {@code base}: pixels always, percentages only
     * when the base is known.
     */
    public boolean isDefinite(double base) {
        return unit == Unit.PX || (unit == Unit.PERCENT && !Double.isNaN(base));
    }

    /**
     * Resolves to pixels.
     *
     * @param base     containing block dimension for percentages, {@code NaN} when indefinite
     * @param fallback value for {@code auto} and {@code none}
     * @return pixels; a percentage of an indefinite base resolves to 0
     */
    public double resolve(double base, double fallback) {
        switch (unit) {
            case PX:
                return value;
            case PERCENT:
                return Double.isNaN(base) ? 0 : base * value / 100.0;
            default:
                return fallback;
        }
    }

    @Override
    public String toCss() {
        switch (unit) {
            case PX:
                return format(value) + "px";
            case PERCENT:
                return format(value) + "%";
            case AUTO:
                return "auto";
            default:
                return "none";
        }
    }

    static String format(double v) {
        if (v == Math.rint(v) && !Double.isInfinite(v)) {
            return Long.toString((long) v);
        }
        return Double.toString(v);
    }

    @Override
    public String toString() {
        return toCss();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Length)) return false;
        Length that = (Length) o;
        return Double.compare(value, that.value) == 0 && unit == that.unit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, unit);
    }
}

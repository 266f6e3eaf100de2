package io.hearthwarrio.cascadium.core.style;

/**
 * Unitless number ({@code flex-grow}, {@code opacity}, {@code font-weight}, unitless {@code line-height}).
 */
public final class NumberValue implements StyleValue {

    private final double value;

    private NumberValue(double value) {
        this.value = value;
    }

    public static NumberValue of(double value) {
        return new NumberValue(value);
    }

    public double getValue() {
        return value;
    }

    @Override
    public String toCss() {
        return Length.format(value);
    }

    @Override
    public String toString() {
        return toCss();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NumberValue)) return false;
        return Double.compare(value, ((NumberValue) o).value) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }
}

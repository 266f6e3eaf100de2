package io.hearthwarrio.cascadium.core.style;

import java.util.Objects;

/**
 * Free-form text kept as written, e.g. a {@code font-family} list.
 */
public final class TextValue implements StyleValue {

    private final String text;

    private TextValue(String text) {
        this.text = text;
    }

    public static TextValue of(String text) {
        return new TextValue(Objects.requireNonNull(text, "text must not be null").trim());
    }

    public String getText() {
        return text;
    }

    @Override
    public String toCss() {
        return text;
    }

    @Override
    public String toString() {
        return text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TextValue)) return false;
        return text.equals(((TextValue) o).text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }
}

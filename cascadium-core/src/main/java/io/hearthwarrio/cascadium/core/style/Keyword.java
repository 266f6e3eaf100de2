package io.hearthwarrio.cascadium.core.style;

import java.util.Locale;
import java.util.Objects;

/**
 * Identifier value such as {@code block} or {@code space-between}, stored lower-case.
 */
public final class Keyword implements StyleValue {

    private final String name;

    private Keyword(String name) {
        this.name = name;
    }

    public static Keyword of(String name) {
        return new Keyword(Objects.requireNonNull(name, "name must not be null").trim().toLowerCase(Locale.ROOT));
    }

    public String getName() {
        return name;
    }

    public boolean is(String other) {
        return name.equals(other);
    }

    @Override
    public String toCss() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Keyword)) return false;
        return name.equals(((Keyword) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }
}

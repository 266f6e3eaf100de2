package io.hearthwarrio.cascadium.core.css;

import java.util.Locale;
import java.util.Objects;

/**
 * Single {@code property: value [!important]} pair. The value is kept as raw text and typed during the cascade.
 */
public final class Declaration {

    private final String property;
    private final String value;
    private final boolean important;

    public Declaration(String property, String value, boolean important) {
        this.property = Objects.requireNonNull(property, "property must not be null").trim().toLowerCase(Locale.ROOT);
        this.value = Objects.requireNonNull(value, "value must not be null").trim();
        this.important = important;
    }

    public String getProperty() {
        return property;
    }

    public String getValue() {
        return value;
    }

    public boolean isImportant() {
        return important;
    }

    /**
     * Returns a declaration for another property with the same importance.
     */
    public Declaration withProperty(String otherProperty, String otherValue) {
        return new Declaration(otherProperty, otherValue, important);
    }

    @Override
    public String toString() {
        return property + ": " + value + (important ? " !important" : "");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Declaration)) return false;
        Declaration that = (Declaration) o;
        return important == that.important &&
                property.equals(that.property) &&
                value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(property, value, important);
    }
}

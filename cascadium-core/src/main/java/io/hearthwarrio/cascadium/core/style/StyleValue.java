package io.hearthwarrio.cascadium.core.style;

/**
 * Typed value of a computed property.
 */
public interface StyleValue {

    /**
     * Serializes the value back to CSS text.
     */
    String toCss();
}

package io.hearthwarrio.cascadium.core.style;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Resolved style of one element: exactly one typed value per {@link Property} plus the values of registered
 * extension properties, kept as opaque strings.
 * <p>
 * Instances are immutable. Two styles computed from the same rules and the same parent style are equal.
 */
public final class ComputedStyle {

    private static final ComputedStyle INITIAL;

    static {
        Map<Property, StyleValue> values = new EnumMap<>(Property.class);
        for (Property p : Property.values()) {
            StyleValue v = p.initialValue();
            values.put(p, v instanceof Keyword && ((Keyword) v).is("currentcolor") ? Color.BLACK : v);
        }
        INITIAL = new ComputedStyle(values, Map.of());
    }

    private final Map<Property, StyleValue> values;
    private final Map<String, String> extensions;

    ComputedStyle(Map<Property, StyleValue> values, Map<String, String> extensions) {
        if (values.size() != Property.values().length) {
            throw new IllegalArgumentException("Every property needs a value, got " + values.size());
        }
        this.values = Collections.unmodifiableMap(new EnumMap<>(values));
        this.extensions = Collections.unmodifiableMap(new LinkedHashMap<>(extensions));
    }

    /**
     * Style holding every property's initial value and no extensions. Serves as the root's parent style.
     */
    public static ComputedStyle initial() {
        return INITIAL;
    }

    public StyleValue get(Property property) {
        return values.get(Objects.requireNonNull(property, "property must not be null"));
    }

    /**
     * @throws IllegalArgumentException if the property does not hold a length
     */
    public Length getLength(Property property) {
        return typed(property, Length.class);
    }

    public Color getColor(Property property) {
        return typed(property, Color.class);
    }

    public String getKeyword(Property property) {
        return typed(property, Keyword.class).getName();
    }

    public double getNumber(Property property) {
        return typed(property, NumberValue.class).getValue();
    }

    private <T extends StyleValue> T typed(Property property, Class<T> type) {
        StyleValue v = get(property);
        if (!type.isInstance(v)) {
            throw new IllegalArgumentException(property.cssName() + " holds " + v + ", not a " + type.getSimpleName());
        }
        return type.cast(v);
    }

    public String getDisplay() {
        return getKeyword(Property.DISPLAY);
    }

    /**
     * Computed font size in px.
     */
    public double getFontSize() {
        return getLength(Property.FONT_SIZE).getValue();
    }

    public double getFontWeight() {
        return getNumber(Property.FONT_WEIGHT);
    }

    public String getFontFamily() {
        return ((TextValue) get(Property.FONT_FAMILY)).getText();
    }

    /**
     * Used line height in px: a unitless line height multiplies the font size.
     */
    public double getLineHeight() {
        StyleValue v = get(Property.LINE_HEIGHT);
        if (v instanceof NumberValue) {
            return ((NumberValue) v).getValue() * getFontSize();
        }
        return ((Length) v).getValue();
    }

    public boolean isVisible() {
        return "visible".equals(getKeyword(Property.VISIBILITY));
    }

    /**
     * Value of a registered extension property, or {@code null} when no rule set it.
     */
    public String getExtension(String name) {
        return extensions.get(name);
    }

    public Map<String, String> getExtensions() {
        return extensions;
    }

    /**
     * Serializes every property, e.g. for diagnostics.
     */
    public Map<String, String> toCssMap() {
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<Property, StyleValue> e : values.entrySet()) {
            out.put(e.getKey().cssName(), e.getValue().toCss());
        }
        out.putAll(extensions);
        return out;
    }

    @Override
    public String toString() {
        return "ComputedStyle{" +
                "display=" + getDisplay() +
                ", width=" + get(Property.WIDTH) +
                ", height=" + get(Property.HEIGHT) +
                ", color=" + get(Property.COLOR) +
                ", fontSize=" + get(Property.FONT_SIZE) +
                (extensions.isEmpty() ? "" : ", extensions=" + extensions) +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ComputedStyle)) return false;
        ComputedStyle that = (ComputedStyle) o;
        return values.equals(that.values) && extensions.equals(that.extensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values, extensions);
    }
}

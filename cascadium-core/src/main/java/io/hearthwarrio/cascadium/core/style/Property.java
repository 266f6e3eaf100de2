package io.hearthwarrio.cascadium.core.style;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Built-in longhand properties with their value type, inheritance and initial value.
 * Shorthands are expanded by {@link Shorthands} and never appear here.
 */
public enum Property {

    DISPLAY("display", false, ValueType.KEYWORD, Keyword.of("block"), 0,
            "block", "inline", "inline-block", "flex", "inline-flex", "none", "list-item"),
    BOX_SIZING("box-sizing", false, ValueType.KEYWORD, Keyword.of("content-box"), 0,
            "content-box", "border-box"),
    VISIBILITY("visibility", true, ValueType.KEYWORD, Keyword.of("visible"), 0,
            "visible", "hidden", "collapse"),
    OVERFLOW("overflow", false, ValueType.KEYWORD, Keyword.of("visible"), 0,
            "visible", "hidden", "scroll", "auto", "clip"),
    POSITION("position", false, ValueType.KEYWORD, Keyword.of("static"), 0,
            "static", "relative", "absolute", "fixed"),

    WIDTH("width", false, ValueType.LENGTH, Length.AUTO, Flags.AUTO | Flags.PERCENT),
    HEIGHT("height", false, ValueType.LENGTH, Length.AUTO, Flags.AUTO | Flags.PERCENT),
    MIN_WIDTH("min-width", false, ValueType.LENGTH, Length.ZERO, Flags.AUTO | Flags.PERCENT),
    MIN_HEIGHT("min-height", false, ValueType.LENGTH, Length.ZERO, Flags.AUTO | Flags.PERCENT),
    MAX_WIDTH("max-width", false, ValueType.LENGTH, Length.NONE, Flags.NONE | Flags.PERCENT),
    MAX_HEIGHT("max-height", false, ValueType.LENGTH, Length.NONE, Flags.NONE | Flags.PERCENT),

    TOP("top", false, ValueType.LENGTH, Length.AUTO, Flags.AUTO | Flags.PERCENT | Flags.NEGATIVE),
    RIGHT("right", false, ValueType.LENGTH, Length.AUTO, Flags.AUTO | Flags.PERCENT | Flags.NEGATIVE),
    BOTTOM("bottom", false, ValueType.LENGTH, Length.AUTO, Flags.AUTO | Flags.PERCENT | Flags.NEGATIVE),
    LEFT("left", false, ValueType.LENGTH, Length.AUTO, Flags.AUTO | Flags.PERCENT | Flags.NEGATIVE),

    MARGIN_TOP("margin-top", false, ValueType.LENGTH, Length.ZERO, Flags.AUTO | Flags.PERCENT),
    MARGIN_RIGHT("margin-right", false, ValueType.LENGTH, Length.ZERO, Flags.AUTO | Flags.PERCENT),
    MARGIN_BOTTOM("margin-bottom", false, ValueType.LENGTH, Length.ZERO, Flags.AUTO | Flags.PERCENT),
    MARGIN_LEFT("margin-left", false, ValueType.LENGTH, Length.ZERO, Flags.AUTO | Flags.PERCENT),

    PADDING_TOP("padding-top", false, ValueType.LENGTH, Length.ZERO, Flags.PERCENT),
    PADDING_RIGHT("padding-right", false, ValueType.LENGTH, Length.ZERO, Flags.PERCENT),
    PADDING_BOTTOM("padding-bottom", false, ValueType.LENGTH, Length.ZERO, Flags.PERCENT),
    PADDING_LEFT("padding-left", false, ValueType.LENGTH, Length.ZERO, Flags.PERCENT),

    BORDER_TOP_WIDTH("border-top-width", false, ValueType.BORDER_WIDTH, Length.px(3), 0),
    BORDER_RIGHT_WIDTH("border-right-width", false, ValueType.BORDER_WIDTH, Length.px(3), 0),
    BORDER_BOTTOM_WIDTH("border-bottom-width", false, ValueType.BORDER_WIDTH, Length.px(3), 0),
    BORDER_LEFT_WIDTH("border-left-width", false, ValueType.BORDER_WIDTH, Length.px(3), 0),

    BORDER_TOP_STYLE("border-top-style", false, ValueType.KEYWORD, Keyword.of("none"), 0, Flags.BORDER_STYLES),
    BORDER_RIGHT_STYLE("border-right-style", false, ValueType.KEYWORD, Keyword.of("none"), 0, Flags.BORDER_STYLES),
    BORDER_BOTTOM_STYLE("border-bottom-style", false, ValueType.KEYWORD, Keyword.of("none"), 0, Flags.BORDER_STYLES),
    BORDER_LEFT_STYLE("border-left-style", false, ValueType.KEYWORD, Keyword.of("none"), 0, Flags.BORDER_STYLES),

    BORDER_TOP_COLOR("border-top-color", false, ValueType.COLOR, Keyword.of("currentcolor"), 0),
    BORDER_RIGHT_COLOR("border-right-color", false, ValueType.COLOR, Keyword.of("currentcolor"), 0),
    BORDER_BOTTOM_COLOR("border-bottom-color", false, ValueType.COLOR, Keyword.of("currentcolor"), 0),
    BORDER_LEFT_COLOR("border-left-color", false, ValueType.COLOR, Keyword.of("currentcolor"), 0),

    BORDER_RADIUS("border-radius", false, ValueType.LENGTH, Length.ZERO, Flags.PERCENT),

    COLOR("color", true, ValueType.COLOR, Color.BLACK, 0),
    BACKGROUND_COLOR("background-color", false, ValueType.COLOR, Color.TRANSPARENT, 0),
    OPACITY("opacity", false, ValueType.NUMBER, NumberValue.of(1), 0),

    FONT_FAMILY("font-family", true, ValueType.TEXT, TextValue.of("sans-serif"), 0),
    FONT_SIZE("font-size", true, ValueType.FONT_SIZE, Length.px(16), Flags.PERCENT),
    FONT_WEIGHT("font-weight", true, ValueType.FONT_WEIGHT, NumberValue.of(400), 0),
    LINE_HEIGHT("line-height", true, ValueType.LINE_HEIGHT, NumberValue.of(1.2), Flags.PERCENT),
    TEXT_ALIGN("text-align", true, ValueType.KEYWORD, Keyword.of("left"), 0,
            "left", "right", "center", "justify", "start", "end"),

    FLEX_DIRECTION("flex-direction", false, ValueType.KEYWORD, Keyword.of("row"), 0,
            "row", "row-reverse", "column", "column-reverse"),
    FLEX_GROW("flex-grow", false, ValueType.NUMBER, NumberValue.of(0), 0),
    FLEX_SHRINK("flex-shrink", false, ValueType.NUMBER, NumberValue.of(1), 0),
    FLEX_BASIS("flex-basis", false, ValueType.LENGTH, Length.AUTO, Flags.AUTO | Flags.PERCENT),
    JUSTIFY_CONTENT("justify-content", false, ValueType.KEYWORD, Keyword.of("flex-start"), 0,
            "flex-start", "flex-end", "center", "space-between", "space-around", "space-evenly"),
    ALIGN_ITEMS("align-items", false, ValueType.KEYWORD, Keyword.of("stretch"), 0,
            "stretch", "flex-start", "flex-end", "center"),
    ALIGN_SELF("align-self", false, ValueType.KEYWORD, Keyword.of("auto"), 0,
            "auto", "stretch", "flex-start", "flex-end", "center"),
    ORDER("order", false, ValueType.INTEGER, NumberValue.of(0), Flags.NEGATIVE),
    ROW_GAP("row-gap", false, ValueType.LENGTH, Length.ZERO, Flags.PERCENT),
    COLUMN_GAP("column-gap", false, ValueType.LENGTH, Length.ZERO, Flags.PERCENT);

    /**
     * How raw text is coerced into a {@link StyleValue}.
     */
    public enum ValueType {
        LENGTH,
        BORDER_WIDTH,
        COLOR,
        KEYWORD,
        NUMBER,
        INTEGER,
        TEXT,
        FONT_SIZE,
        FONT_WEIGHT,
        LINE_HEIGHT
    }

    private static final class Flags {
        static final int AUTO = 1;
        static final int NONE = 2;
        static final int PERCENT = 4;
        static final int NEGATIVE = 8;

        static final String[] BORDER_STYLES = {
                "none", "hidden", "solid", "dashed", "dotted", "double", "groove", "ridge", "inset", "outset"
        };
    }

    private static final Map<String, Property> BY_NAME = new HashMap<>();

    static {
        for (Property p : values()) {
            BY_NAME.put(p.cssName, p);
        }
    }

    private final String cssName;
    private final boolean inherited;
    private final ValueType type;
    private final StyleValue initialValue;
    private final int flags;
    private final Set<String> keywords;

    Property(String cssName, boolean inherited, ValueType type, StyleValue initialValue, int flags, String... keywords) {
        this.cssName = cssName;
        this.inherited = inherited;
        this.type = type;
        this.initialValue = initialValue;
        this.flags = flags;
        this.keywords = Collections.unmodifiableSet(new LinkedHashSet<>(List.of(keywords)));
    }

    public String cssName() {
        return cssName;
    }

    public boolean isInherited() {
        return inherited;
    }

    public ValueType type() {
        return type;
    }

    /**
     * Static initial value. For border colors this is the {@code currentcolor} keyword, resolved per element.
     */
    public StyleValue initialValue() {
        return initialValue;
    }

    public boolean allowsAuto() {
        return (flags & Flags.AUTO) != 0;
    }

    public boolean allowsNone() {
        return (flags & Flags.NONE) != 0;
    }

    public boolean allowsPercent() {
        return (flags & Flags.PERCENT) != 0;
    }

    public boolean allowsNegative() {
        return (flags & Flags.NEGATIVE) != 0;
    }

    /**
     * Accepted identifiers for {@link ValueType#KEYWORD} properties.
     */
    public Set<String> keywords() {
        return keywords;
    }

    /**
     * Looks up a property by its CSS name.
     *
     * @return property or {@code null} when the name is not a built-in longhand
     */
    public static Property byName(String name) {
        if (name == null) {
            return null;
        }
        return BY_NAME.get(name.trim().toLowerCase(Locale.ROOT));
    }
}

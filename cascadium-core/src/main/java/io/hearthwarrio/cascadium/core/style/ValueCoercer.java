package io.hearthwarrio.cascadium.core.style;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts raw declaration values into typed {@link StyleValue}s.
 * <p>
 * Relative units are converted to pixels here: {@code em} against the element's font size (the parent's for
 * {@code font-size} itself), {@code rem} against the root font size, {@code pt} at 96/72. Percentages stay
 * unresolved except for {@code font-size} and {@code line-height}, which resolve against a font size.
 */
public final class ValueCoercer {

    /**
     * Font size {@code rem} units resolve against.
     */
    public static final double ROOT_FONT_SIZE = 16.0;

    private static final Pattern DIMENSION =
            Pattern.compile("^([+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:e[+-]?\\d+)?)(px|%|em|rem|pt)?$");

    private ValueCoercer() {
    }

    /**
     * Values of the element being computed that coercion depends on.
     */
    public static final class Context {

        /**
         * Context of a root element without author styles. Used to validate values at parse time.
         */
        public static final Context DEFAULT = new Context(ROOT_FONT_SIZE, ComputedStyle.initial(), Color.BLACK);

        private final double fontSize;
        private final ComputedStyle parent;
        private final Color currentColor;

        /**
         * @param fontSize     computed font size of the element in px
         * @param parent       parent's computed style ({@link ComputedStyle#initial()} for the root)
         * @param currentColor computed {@code color} of the element
         */
        public Context(double fontSize, ComputedStyle parent, Color currentColor) {
            this.fontSize = fontSize;
            this.parent = Objects.requireNonNull(parent, "parent must not be null");
            this.currentColor = Objects.requireNonNull(currentColor, "currentColor must not be null");
        }
    }

    /**
     * Whether {@code raw} is an acceptable value for the property, independent of any element.
     */
    public static boolean isValid(Property property, String raw) {
        return coerce(property, raw, Context.DEFAULT) != null;
    }

    /**
     * Coerces a raw value. CSS-wide keywords ({@code inherit}, {@code initial}, {@code unset}) are handled by
     * the cascade and are not accepted here.
     *
     * @return typed value, or {@code null} when the value is invalid for the property
     */
    public static StyleValue coerce(Property property, String raw, Context context) {
        Objects.requireNonNull(property, "property must not be null");
        Objects.requireNonNull(context, "context must not be null");
        if (raw == null) {
            return null;
        }
        String v = raw.trim();
        if (v.isEmpty()) {
            return null;
        }
        String lower = v.toLowerCase(Locale.ROOT);

        switch (property.type()) {
            case LENGTH:
                return coerceLength(property, lower, context.fontSize);
            case BORDER_WIDTH:
                return coerceBorderWidth(lower, context.fontSize);
            case COLOR:
                if ("currentcolor".equals(lower)) {
                    return property == Property.COLOR ? context.parent.getColor(Property.COLOR) : context.currentColor;
                }
                return Color.parse(lower);
            case KEYWORD:
                return property.keywords().contains(lower) ? Keyword.of(lower) : null;
            case NUMBER:
                return coerceNumber(property, lower);
            case INTEGER:
                try {
                    return NumberValue.of(Integer.parseInt(lower));
                } catch (NumberFormatException e) {
                    return null;
                }
            case TEXT:
                return TextValue.of(v);
            case FONT_SIZE:
                return coerceFontSize(lower, context.parent.getFontSize());
            case FONT_WEIGHT:
                return coerceFontWeight(lower, context.parent.getFontWeight());
            case LINE_HEIGHT:
                return coerceLineHeight(lower, context.fontSize);
            default:
                return null;
        }
    }

    private static Length coerceLength(Property property, String v, double fontSize) {
        if ("auto".equals(v)) {
            return property.allowsAuto() ? Length.AUTO : null;
        }
        if ("none".equals(v)) {
            return property.allowsNone() ? Length.NONE : null;
        }
        if ("normal".equals(v) && (property == Property.ROW_GAP || property == Property.COLUMN_GAP)) {
            return Length.ZERO;
        }
        if ("content".equals(v) && property == Property.FLEX_BASIS) {
            return Length.AUTO;
        }
        Length length = parseDimension(v, fontSize);
        if (length == null) {
            return null;
        }
        if (length.isPercent() && !property.allowsPercent()) {
            return null;
        }
        if (length.getValue() < 0 && !property.allowsNegative()) {
            return null;
        }
        return length;
    }

    private static Length coerceBorderWidth(String v, double fontSize) {
        switch (v) {
            case "thin":
                return Length.px(1);
            case "medium":
                return Length.px(3);
            case "thick":
                return Length.px(5);
            default:
                Length length = parseDimension(v, fontSize);
                if (length == null || length.isPercent() || length.getValue() < 0) {
                    return null;
                }
                return length;
        }
    }

    private static NumberValue coerceNumber(Property property, String v) {
        double d;
        try {
            if (property == Property.OPACITY && v.endsWith("%")) {
                d = Double.parseDouble(v.substring(0, v.length() - 1)) / 100.0;
            } else {
                d = Double.parseDouble(v);
            }
        } catch (NumberFormatException e) {
            return null;
        }
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return null;
        }
        if (property == Property.OPACITY) {
            return NumberValue.of(Math.max(0.0, Math.min(1.0, d)));
        }
        if (d < 0) {
            return null;
        }
        return NumberValue.of(d);
    }

    private static Length coerceFontSize(String v, double parentFontSize) {
        switch (v) {
            case "xx-small":
                return Length.px(9);
            case "x-small":
                return Length.px(10);
            case "small":
                return Length.px(13);
            case "medium":
                return Length.px(16);
            case "large":
                return Length.px(18);
            case "x-large":
                return Length.px(24);
            case "xx-large":
                return Length.px(32);
            case "smaller":
                return Length.px(parentFontSize / 1.2);
            case "larger":
                return Length.px(parentFontSize * 1.2);
            default:
                Length length = parseDimension(v, parentFontSize);
                if (length == null || length.getValue() < 0) {
                    return null;
                }
                if (length.isPercent()) {
                    return finitePx(parentFontSize * length.getValue() / 100.0);
                }
                return length;
        }
    }

    private static NumberValue coerceFontWeight(String v, double parentWeight) {
        switch (v) {
            case "normal":
                return NumberValue.of(400);
            case "bold":
                return NumberValue.of(700);
            case "bolder":
                return NumberValue.of(parentWeight < 400 ? 400 : parentWeight < 600 ? 700 : 900);
            case "lighter":
                return NumberValue.of(parentWeight < 600 ? 100 : parentWeight < 800 ? 400 : 700);
            default:
                try {
                    double d = Double.parseDouble(v);
                    return d >= 1 && d <= 1000 ? NumberValue.of(d) : null;
                } catch (NumberFormatException e) {
                    return null;
                }
        }
    }

    private static StyleValue coerceLineHeight(String v, double fontSize) {
        if ("normal".equals(v)) {
            return NumberValue.of(1.2);
        }
        Matcher m = DIMENSION.matcher(v);
        if (!m.matches()) {
            return null;
        }
        double d = Double.parseDouble(m.group(1));
        if (d < 0 || Double.isInfinite(d)) {
            return null;
        }
        if (m.group(2) == null) {
            return NumberValue.of(d);
        }
        Length length = parseDimension(v, fontSize);
        if (length == null) {
            return null;
        }
        if (length.isPercent()) {
            return finitePx(fontSize * length.getValue() / 100.0);
        }
        return length;
    }

    /**
     * Parses a dimension. A unitless number is only accepted when it is zero.
     *
     * @param fontSize font size {@code em} units resolve against
     * @return pixel or percentage length, or {@code null}
     */
    static Length parseDimension(String v, double fontSize) {
        Matcher m = DIMENSION.matcher(v);
        if (!m.matches()) {
            return null;
        }
        double d;
        try {
            d = Double.parseDouble(m.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return null;
        }
        String unit = m.group(2);
        if (unit == null) {
            return d == 0 ? Length.ZERO : null;
        }
        if ("%".equals(unit)) {
            return Length.percent(d);
        }
        double px;
        switch (unit) {
            case "px":
                px = d;
                break;
            case "em":
                px = d * fontSize;
                break;
            case "rem":
                px = d * ROOT_FONT_SIZE;
                break;
            case "pt":
                px = d * 96.0 / 72.0;
                break;
            default:
                return null;
        }
        return finitePx(px);
    }

    private static Length finitePx(double px) {
        return Double.isInfinite(px) || Double.isNaN(px) ? null : Length.px(px);
    }
}

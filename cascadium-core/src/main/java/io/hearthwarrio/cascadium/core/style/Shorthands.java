package io.hearthwarrio.cascadium.core.style;

import io.hearthwarrio.cascadium.core.css.Declaration;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Expands shorthand declarations into longhands. Every longhand keeps the importance of its shorthand.
 */
public final class Shorthands {

    private static final List<Property> MARGIN = List.of(
            Property.MARGIN_TOP, Property.MARGIN_RIGHT, Property.MARGIN_BOTTOM, Property.MARGIN_LEFT);
    private static final List<Property> PADDING = List.of(
            Property.PADDING_TOP, Property.PADDING_RIGHT, Property.PADDING_BOTTOM, Property.PADDING_LEFT);
    private static final List<Property> BORDER_WIDTH = List.of(
            Property.BORDER_TOP_WIDTH, Property.BORDER_RIGHT_WIDTH, Property.BORDER_BOTTOM_WIDTH, Property.BORDER_LEFT_WIDTH);
    private static final List<Property> BORDER_STYLE = List.of(
            Property.BORDER_TOP_STYLE, Property.BORDER_RIGHT_STYLE, Property.BORDER_BOTTOM_STYLE, Property.BORDER_LEFT_STYLE);
    private static final List<Property> BORDER_COLOR = List.of(
            Property.BORDER_TOP_COLOR, Property.BORDER_RIGHT_COLOR, Property.BORDER_BOTTOM_COLOR, Property.BORDER_LEFT_COLOR);

    private static final Set<String> NAMES = Set.of(
            "margin", "padding", "border", "border-top", "border-right", "border-bottom", "border-left",
            "border-width", "border-style", "border-color", "flex", "flex-flow", "gap", "font", "background"
    );

    private static final Set<String> CSS_WIDE = Set.of("inherit", "initial", "unset");

    private Shorthands() {
    }

    public static boolean isShorthand(String property) {
        return property != null && NAMES.contains(property);
    }

    public static boolean isCssWideKeyword(String value) {
        return value != null && CSS_WIDE.contains(value.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Longhand properties a shorthand sets.
     */
    public static List<Property> longhands(String shorthand) {
        switch (shorthand) {
            case "margin":
                return MARGIN;
            case "padding":
                return PADDING;
            case "border-width":
                return BORDER_WIDTH;
            case "border-style":
                return BORDER_STYLE;
            case "border-color":
                return BORDER_COLOR;
            case "border":
                return concat(BORDER_WIDTH, BORDER_STYLE, BORDER_COLOR);
            case "border-top":
                return side(0);
            case "border-right":
                return side(1);
            case "border-bottom":
                return side(2);
            case "border-left":
                return side(3);
            case "flex":
                return List.of(Property.FLEX_GROW, Property.FLEX_SHRINK, Property.FLEX_BASIS);
            case "flex-flow":
                return List.of(Property.FLEX_DIRECTION);
            case "gap":
                return List.of(Property.ROW_GAP, Property.COLUMN_GAP);
            case "font":
                return List.of(Property.FONT_WEIGHT, Property.FONT_SIZE, Property.LINE_HEIGHT, Property.FONT_FAMILY);
            case "background":
                return List.of(Property.BACKGROUND_COLOR);
            default:
                return List.of();
        }
    }

    /**
     * Expands a shorthand declaration.
     *
     * @param declaration declaration whose property is a shorthand
     * @return longhand declarations, or {@code null} when the value is invalid for the shorthand
     */
    public static List<Declaration> expand(Declaration declaration) {
        String name = declaration.getProperty();
        String value = declaration.getValue();
        if (!isShorthand(name)) {
            throw new IllegalArgumentException(name + " is not a shorthand");
        }
        if (isCssWideKeyword(value)) {
            List<Declaration> out = new ArrayList<>();
            for (Property p : longhands(name)) {
                out.add(declaration.withProperty(p.cssName(), value));
            }
            return out;
        }
        List<String> tokens = tokenize(value);
        if (tokens.isEmpty()) {
            return null;
        }
        switch (name) {
            case "margin":
            case "padding":
            case "border-width":
            case "border-style":
            case "border-color":
                return box(declaration, longhands(name), tokens);
            case "border":
                return border(declaration, tokens, 0, 1, 2, 3);
            case "border-top":
                return border(declaration, tokens, 0);
            case "border-right":
                return border(declaration, tokens, 1);
            case "border-bottom":
                return border(declaration, tokens, 2);
            case "border-left":
                return border(declaration, tokens, 3);
            case "flex":
                return flex(declaration, tokens);
            case "flex-flow":
                return flexFlow(declaration, tokens);
            case "gap":
                return gap(declaration, tokens);
            case "font":
                return font(declaration, tokens);
            case "background":
                return background(declaration, tokens);
            default:
                return null;
        }
    }

    private static List<Declaration> box(Declaration d, List<Property> sides, List<String> tokens) {
        if (tokens.size() > 4) {
            return null;
        }
        String top = tokens.get(0);
        String right = tokens.size() > 1 ? tokens.get(1) : top;
        String bottom = tokens.size() > 2 ? tokens.get(2) : top;
        String left = tokens.size() > 3 ? tokens.get(3) : right;
        String[] values = {top, right, bottom, left};
        List<Declaration> out = new ArrayList<>(4);
        for (int i = 0; i < 4; i++) {
            if (!ValueCoercer.isValid(sides.get(i), values[i])) {
                return null;
            }
            out.add(d.withProperty(sides.get(i).cssName(), values[i]));
        }
        return out;
    }

    private static List<Declaration> border(Declaration d, List<String> tokens, int... sides) {
        if (tokens.size() > 3) {
            return null;
        }
        String width = null;
        String style = null;
        String color = null;
        for (String t : tokens) {
            if (width == null && ValueCoercer.isValid(Property.BORDER_TOP_WIDTH, t)) {
                width = t;
            } else if (style == null && ValueCoercer.isValid(Property.BORDER_TOP_STYLE, t)) {
                style = t;
            } else if (color == null && ValueCoercer.isValid(Property.BORDER_TOP_COLOR, t)) {
                color = t;
            } else {
                return null;
            }
        }
        List<Declaration> out = new ArrayList<>();
        for (int side : sides) {
            out.add(d.withProperty(BORDER_WIDTH.get(side).cssName(), width == null ? "medium" : width));
            out.add(d.withProperty(BORDER_STYLE.get(side).cssName(), style == null ? "none" : style));
            out.add(d.withProperty(BORDER_COLOR.get(side).cssName(), color == null ? "currentcolor" : color));
        }
        return out;
    }

    private static List<Declaration> flex(Declaration d, List<String> tokens) {
        String grow;
        String shrink = "1";
        String basis = "0%";
        if (tokens.size() == 1) {
            String t = tokens.get(0).toLowerCase(Locale.ROOT);
            switch (t) {
                case "none":
                    return flexDeclarations(d, "0", "0", "auto");
                case "auto":
                    return flexDeclarations(d, "1", "1", "auto");
                default:
                    if (isFactor(t)) {
                        grow = t;
                    } else if (ValueCoercer.isValid(Property.FLEX_BASIS, t)) {
                        grow = "1";
                        basis = t;
                    } else {
                        return null;
                    }
                    return flexDeclarations(d, grow, shrink, basis);
            }
        }
        if (tokens.size() > 3 || !isFactor(tokens.get(0))) {
            return null;
        }
        grow = tokens.get(0);
        if (tokens.size() == 2) {
            if (isFactor(tokens.get(1))) {
                shrink = tokens.get(1);
            } else if (ValueCoercer.isValid(Property.FLEX_BASIS, tokens.get(1))) {
                basis = tokens.get(1);
            } else {
                return null;
            }
        } else {
            if (!isFactor(tokens.get(1)) || !ValueCoercer.isValid(Property.FLEX_BASIS, tokens.get(2))) {
                return null;
            }
            shrink = tokens.get(1);
            basis = tokens.get(2);
        }
        return flexDeclarations(d, grow, shrink, basis);
    }

    private static boolean isFactor(String token) {
        return ValueCoercer.isValid(Property.FLEX_GROW, token);
    }

    private static List<Declaration> flexDeclarations(Declaration d, String grow, String shrink, String basis) {
        return List.of(
                d.withProperty(Property.FLEX_GROW.cssName(), grow),
                d.withProperty(Property.FLEX_SHRINK.cssName(), shrink),
                d.withProperty(Property.FLEX_BASIS.cssName(), basis)
        );
    }

    private static List<Declaration> flexFlow(Declaration d, List<String> tokens) {
        String direction = "row";
        boolean sawDirection = false;
        boolean sawWrap = false;
        for (String t : tokens) {
            String lower = t.toLowerCase(Locale.ROOT);
            if (!sawDirection && ValueCoercer.isValid(Property.FLEX_DIRECTION, lower)) {
                direction = lower;
                sawDirection = true;
            } else if (!sawWrap && ("nowrap".equals(lower) || "wrap".equals(lower) || "wrap-reverse".equals(lower))) {
                sawWrap = true;
            } else {
                return null;
            }
        }
        return List.of(d.withProperty(Property.FLEX_DIRECTION.cssName(), direction));
    }

    private static List<Declaration> gap(Declaration d, List<String> tokens) {
        if (tokens.size() > 2) {
            return null;
        }
        String row = tokens.get(0);
        String column = tokens.size() > 1 ? tokens.get(1) : row;
        if (!ValueCoercer.isValid(Property.ROW_GAP, row) || !ValueCoercer.isValid(Property.COLUMN_GAP, column)) {
            return null;
        }
        return List.of(
                d.withProperty(Property.ROW_GAP.cssName(), row),
                d.withProperty(Property.COLUMN_GAP.cssName(), column)
        );
    }

    private static List<Declaration> font(Declaration d, List<String> tokens) {
        String weight = "normal";
        String size = null;
        String lineHeight = "normal";
        int i = 0;
        for (; i < tokens.size(); i++) {
            String t = tokens.get(i).toLowerCase(Locale.ROOT);
            String sizePart = t;
            String linePart = null;
            int slash = t.indexOf('/');
            if (slash >= 0) {
                sizePart = t.substring(0, slash);
                linePart = t.substring(slash + 1);
                if (linePart.isEmpty() && i + 1 < tokens.size()) {
                    linePart = tokens.get(++i);
                }
            } else if (i + 1 < tokens.size() && tokens.get(i + 1).startsWith("/")) {
                linePart = tokens.get(i + 1).substring(1);
                i++;
                if (linePart.isEmpty() && i + 1 < tokens.size()) {
                    linePart = tokens.get(++i);
                }
            }
            if (ValueCoercer.isValid(Property.FONT_SIZE, sizePart) && !"normal".equals(sizePart)) {
                size = sizePart;
                if (linePart != null) {
                    if (!ValueCoercer.isValid(Property.LINE_HEIGHT, linePart)) {
                        return null;
                    }
                    lineHeight = linePart;
                }
                i++;
                break;
            }
            if (linePart != null) {
                return null;
            }
            if ("bold".equals(t) || "bolder".equals(t) || "lighter".equals(t) || t.matches("\\d{3}")) {
                weight = t;
            } else if (!"normal".equals(t) && !"italic".equals(t) && !"oblique".equals(t) && !"small-caps".equals(t)) {
                return null;
            }
        }
        if (size == null || i >= tokens.size()) {
            return null;
        }
        String family = String.join(" ", tokens.subList(i, tokens.size()));
        return List.of(
                d.withProperty(Property.FONT_WEIGHT.cssName(), weight),
                d.withProperty(Property.FONT_SIZE.cssName(), size),
                d.withProperty(Property.LINE_HEIGHT.cssName(), lineHeight),
                d.withProperty(Property.FONT_FAMILY.cssName(), family)
        );
    }

    private static List<Declaration> background(Declaration d, List<String> tokens) {
        String color = null;
        for (String t : tokens) {
            if (ValueCoercer.isValid(Property.BACKGROUND_COLOR, t)) {
                if (color != null) {
                    return null;
                }
                color = t;
            } else if (!"none".equalsIgnoreCase(t) && !t.contains("(") && !isBackgroundKeyword(t)) {
                return null;
            }
        }
        return List.of(d.withProperty(Property.BACKGROUND_COLOR.cssName(), color == null ? "transparent" : color));
    }

    private static boolean isBackgroundKeyword(String token) {
        switch (token.toLowerCase(Locale.ROOT)) {
            case "repeat":
            case "no-repeat":
            case "repeat-x":
            case "repeat-y":
            case "center":
            case "top":
            case "bottom":
            case "left":
            case "right":
            case "cover":
            case "contain":
            case "fixed":
            case "scroll":
                return true;
            default:
                return false;
        }
    }

    /**
     * Splits on whitespace outside parentheses and quotes, so {@code rgb(0, 0, 0)} stays one token.
     */
    static List<String> tokenize(String value) {
        List<String> out = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (quote != 0) {
                current.append(ch);
                if (ch == quote) {
                    quote = 0;
                }
                continue;
            }
            if (ch == '"' || ch == '\'') {
                quote = ch;
                current.append(ch);
            } else if (ch == '(') {
                depth++;
                current.append(ch);
            } else if (ch == ')') {
                depth = Math.max(0, depth - 1);
                current.append(ch);
            } else if (Character.isWhitespace(ch) && depth == 0) {
                if (current.length() > 0) {
                    out.add(current.toString());
                    current.setLength(0);
                }
            } else {
                current.append(ch);
            }
        }
        if (current.length() > 0) {
            out.add(current.toString());
        }
        return out;
    }

    private static List<Property> side(int side) {
        return List.of(BORDER_WIDTH.get(side), BORDER_STYLE.get(side), BORDER_COLOR.get(side));
    }

    @SafeVarargs
    private static List<Property> concat(List<Property>... lists) {
        List<Property> out = new ArrayList<>();
        for (List<Property> l : lists) {
            out.addAll(l);
        }
        return out;
    }
}

package io.hearthwarrio.cascadium.core.css;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses selector text into {@link Selector} instances.
 * <p>
 * Supported: type and universal selectors, {@code #id}, {@code .class}, attribute selectors with all CSS3
 * operators, the pseudo-classes listed in {@link PseudoClass.Kind}, and the descendant, child ({@code >}),
 * adjacent-sibling ({@code +}) and general-sibling ({@code ~}) combinators.
 * Pseudo-elements, namespaces and unknown pseudo-classes are rejected with {@link UnsupportedSelectorException}.
 */
public final class SelectorParser {

    private static final Pattern NTH = Pattern.compile("^([+-]?\\d*)n([+-]\\d+)?$");

    /**
     * Parses a single complex selector.
     *
     * @throws UnsupportedSelectorException if the text is malformed or uses unsupported syntax
     */
    public Selector parse(String text) {
        if (text == null || text.isBlank()) {
            throw new UnsupportedSelectorException("Empty selector");
        }
        Cursor c = new Cursor(text.trim());
        List<CompoundSelector> compounds = new ArrayList<>();
        List<Combinator> combinators = new ArrayList<>();

        compounds.add(parseCompound(c));
        while (true) {
            boolean sawWhitespace = c.skipWhitespace();
            if (c.atEnd()) {
                break;
            }
            Combinator combinator;
            char ch = c.peek();
            if (ch == '>') {
                combinator = Combinator.CHILD;
            } else if (ch == '+') {
                combinator = Combinator.ADJACENT_SIBLING;
            } else if (ch == '~') {
                combinator = Combinator.GENERAL_SIBLING;
            } else if (sawWhitespace) {
                combinator = Combinator.DESCENDANT;
            } else {
                throw c.error("Unexpected character '" + ch + "'");
            }
            if (combinator != Combinator.DESCENDANT) {
                c.advance();
                c.skipWhitespace();
            }
            if (c.atEnd()) {
                throw c.error("Selector ends with a combinator");
            }
            combinators.add(combinator);
            compounds.add(parseCompound(c));
        }
        return new Selector(compounds, combinators);
    }

    /**
     * Splits a selector list on top-level commas. Commas inside brackets, parentheses and strings are kept.
     *
     * @param text selector list text
     * @return trimmed member texts (possibly blank when the list is malformed)
     */
    public List<String> splitList(String text) {
        List<String> out = new ArrayList<>();
        if (text == null) {
            return out;
        }
        int depth = 0;
        char quote = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (quote != 0) {
                if (ch == '\\') {
                    i++;
                } else if (ch == quote) {
                    quote = 0;
                }
                continue;
            }
            if (ch == '"' || ch == '\'') {
                quote = ch;
            } else if (ch == '(' || ch == '[') {
                depth++;
            } else if (ch == ')' || ch == ']') {
                depth = Math.max(0, depth - 1);
            } else if (ch == ',' && depth == 0) {
                out.add(text.substring(start, i).trim());
                start = i + 1;
            }
        }
        out.add(text.substring(start).trim());
        return out;
    }

    private CompoundSelector parseCompound(Cursor c) {
        String tag = null;
        String id = null;
        List<String> classes = new ArrayList<>();
        List<AttributeCondition> attributes = new ArrayList<>();
        List<PseudoClass> pseudoClasses = new ArrayList<>();
        boolean any = false;

        if (!c.atEnd() && c.peek() == '*') {
            c.advance();
            any = true;
        } else if (!c.atEnd() && isIdentChar(c.peek()) && !Character.isDigit(c.peek())) {
            tag = c.readIdent().toLowerCase(Locale.ROOT);
            any = true;
        }
        if (!c.atEnd() && c.peek() == '|') {
            throw c.error("Namespace prefixes are not supported");
        }

        while (!c.atEnd()) {
            char ch = c.peek();
            if (ch == '#') {
                c.advance();
                String value = requireIdent(c, "id");
                if (id != null && !id.equals(value)) {
                    throw c.error("Compound selector with two different ids");
                }
                id = value;
            } else if (ch == '.') {
                c.advance();
                classes.add(requireIdent(c, "class name"));
            } else if (ch == '[') {
                attributes.add(parseAttribute(c));
            } else if (ch == ':') {
                pseudoClasses.add(parsePseudoClass(c));
            } else {
                break;
            }
            any = true;
        }

        if (!any) {
            throw c.error(c.atEnd() ? "Expected a selector" : "Unexpected character '" + c.peek() + "'");
        }
        return new CompoundSelector(tag, id, classes, attributes, pseudoClasses);
    }

    private AttributeCondition parseAttribute(Cursor c) {
        c.expect('[');
        c.skipWhitespace();
        String name = requireIdent(c, "attribute name").toLowerCase(Locale.ROOT);
        c.skipWhitespace();
        if (c.atEnd()) {
            throw c.error("Unterminated attribute selector");
        }
        if (c.peek() == ']') {
            c.advance();
            return new AttributeCondition(name, AttributeCondition.Operator.EXISTS, null);
        }

        AttributeCondition.Operator operator = null;
        for (AttributeCondition.Operator op : AttributeCondition.Operator.values()) {
            if (op != AttributeCondition.Operator.EXISTS && op.symbol().length() == 2 && c.startsWith(op.symbol())) {
                operator = op;
                break;
            }
        }
        if (operator == null && c.peek() == '=') {
            operator = AttributeCondition.Operator.EQUALS;
        }
        if (operator == null) {
            throw c.error("Unknown attribute operator");
        }
        c.skip(operator.symbol().length());
        c.skipWhitespace();

        String value;
        if (!c.atEnd() && (c.peek() == '"' || c.peek() == '\'')) {
            value = c.readQuoted();
        } else {
            value = requireIdent(c, "attribute value");
        }
        c.skipWhitespace();
        if (!c.atEnd() && Character.toLowerCase(c.peek()) == 'i') {
            throw c.error("Attribute selector flags are not supported");
        }
        c.expect(']');
        return new AttributeCondition(name, operator, value);
    }

    private PseudoClass parsePseudoClass(Cursor c) {
        c.expect(':');
        if (!c.atEnd() && c.peek() == ':') {
            throw c.error("Pseudo-elements are not supported");
        }
        String name = requireIdent(c, "pseudo-class");
        PseudoClass.Kind kind = PseudoClass.Kind.byName(name);
        if (kind == null) {
            throw c.error("Unsupported pseudo-class :" + name);
        }
        boolean hasArgument = !c.atEnd() && c.peek() == '(';
        if (!kind.takesArgument()) {
            if (hasArgument) {
                throw c.error(":" + name + " does not take an argument");
            }
            return PseudoClass.simple(kind);
        }
        if (!hasArgument) {
            throw c.error(":" + name + " requires an argument");
        }
        String argument = c.readParenthesized().trim();
        if (kind == PseudoClass.Kind.NOT) {
            Cursor inner = new Cursor(argument);
            CompoundSelector negated = parseCompound(inner);
            inner.skipWhitespace();
            if (!inner.atEnd()) {
                throw c.error(":not() accepts a single compound selector");
            }
            return PseudoClass.not(negated);
        }
        int[] ab = parseNth(argument, c);
        return PseudoClass.nth(kind, ab[0], ab[1]);
    }

    private int[] parseNth(String argument, Cursor c) {
        String expr = argument.replace(" ", "").toLowerCase(Locale.ROOT);
        if ("odd".equals(expr)) {
            return new int[]{2, 1};
        }
        if ("even".equals(expr)) {
            return new int[]{2, 0};
        }
        try {
            if (!expr.contains("n")) {
                return new int[]{0, Integer.parseInt(expr)};
            }
            Matcher m = NTH.matcher(expr);
            if (m.matches()) {
                String a = m.group(1);
                String b = m.group(2);
                int step;
                if (a.isEmpty() || "+".equals(a)) {
                    step = 1;
                } else if ("-".equals(a)) {
                    step = -1;
                } else {
                    step = Integer.parseInt(a);
                }
                int offset = b == null ? 0 : Integer.parseInt(b);
                return new int[]{step, offset};
            }
        } catch (NumberFormatException e) {
            throw c.error("Invalid an+b expression '" + argument + "'");
        }
        throw c.error("Invalid an+b expression '" + argument + "'");
    }

    private String requireIdent(Cursor c, String what) {
        String ident = c.atEnd() ? "" : c.readIdent();
        if (ident.isEmpty()) {
            throw c.error("Expected " + what);
        }
        return ident;
    }

    static boolean isIdentChar(char ch) {
        return Character.isLetterOrDigit(ch) || ch == '-' || ch == '_' || ch == '\\' || ch >= 0x80;
    }

    private static final class Cursor {
        private final String text;
        private int pos;

        Cursor(String text) {
            this.text = text;
        }

        boolean atEnd() {
            return pos >= text.length();
        }

        char peek() {
            return text.charAt(pos);
        }

        void advance() {
            pos++;
        }

        void skip(int n) {
            pos += n;
        }

        boolean startsWith(String s) {
            return text.startsWith(s, pos);
        }

        void expect(char ch) {
            if (atEnd() || peek() != ch) {
                throw error("Expected '" + ch + "'");
            }
            pos++;
        }

        boolean skipWhitespace() {
            int start = pos;
            while (!atEnd() && Character.isWhitespace(peek())) {
                pos++;
            }
            return pos > start;
        }

        String readIdent() {
            StringBuilder sb = new StringBuilder();
            while (!atEnd() && isIdentChar(peek())) {
                char ch = peek();
                if (ch == '\\') {
                    pos++;
                    if (atEnd()) {
                        throw error("Dangling escape");
                    }
                    sb.append(peek());
                } else {
                    sb.append(ch);
                }
                pos++;
            }
            return sb.toString();
        }

        String readQuoted() {
            char quote = peek();
            pos++;
            StringBuilder sb = new StringBuilder();
            while (!atEnd()) {
                char ch = peek();
                pos++;
                if (ch == '\\' && !atEnd()) {
                    sb.append(peek());
                    pos++;
                } else if (ch == quote) {
                    return sb.toString();
                } else {
                    sb.append(ch);
                }
            }
            throw error("Unterminated string");
        }

        String readParenthesized() {
            expect('(');
            int depth = 1;
            int start = pos;
            while (!atEnd()) {
                char ch = peek();
                if (ch == '(') {
                    depth++;
                } else if (ch == ')') {
                    depth--;
                    if (depth == 0) {
                        String inner = text.substring(start, pos);
                        pos++;
                        return inner;
                    }
                }
                pos++;
            }
            throw error("Unterminated parenthesis");
        }

        UnsupportedSelectorException error(String message) {
            return new UnsupportedSelectorException(message + " at position " + pos + " in '" + text + "'");
        }
    }
}

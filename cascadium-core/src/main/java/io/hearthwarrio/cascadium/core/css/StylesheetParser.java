package io.hearthwarrio.cascadium.core.css;

import io.hearthwarrio.cascadium.core.UnresolvedReferenceWarning;
import io.hearthwarrio.cascadium.core.WarningSink;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Parses CSS text into {@link Stylesheet}s.
 * <p>
 * Only structural problems are fatal ({@link StylesheetParseException}): an unterminated block or comment,
 * a {@code '}'} without an opening block, or selector text that never opens a block. Everything else that
 * cannot be used (unsupported selectors, at-rules, declarations rejected by the {@link DeclarationProcessor})
 * is skipped and reported to the {@link WarningSink}.
 */
public final class StylesheetParser {

    private final DeclarationProcessor declarationProcessor;
    private final WarningSink warnings;
    private final SelectorParser selectorParser = new SelectorParser();

    public StylesheetParser() {
        this(DeclarationProcessor.ACCEPT_ALL, WarningSink.IGNORE);
    }

    public StylesheetParser(DeclarationProcessor declarationProcessor, WarningSink warnings) {
        this.declarationProcessor = Objects.requireNonNull(declarationProcessor, "declarationProcessor must not be null");
        this.warnings = Objects.requireNonNull(warnings, "warnings must not be null");
    }

    public Stylesheet parse(String text, Origin origin) {
        return parse(text, origin, 0);
    }

    /**
     * Parses a stylesheet whose rule blocks are numbered starting at {@code firstSourceOrder}.
     *
     * @param text             stylesheet text
     * @param origin           origin of every rule
     * @param firstSourceOrder source order index of the first rule block
     * @return parsed stylesheet
     * @throws StylesheetParseException if the text is structurally malformed
     */
    public Stylesheet parse(String text, Origin origin, int firstSourceOrder) {
        Objects.requireNonNull(origin, "origin must not be null");
        Scanner s = new Scanner(text == null ? "" : text);
        List<Rule> rules = new ArrayList<>();
        int order = firstSourceOrder;

        while (true) {
            s.skipWhitespaceAndComments(rules, origin, order);
            if (s.atEnd()) {
                break;
            }
            char ch = s.peek();
            if (ch == '}') {
                throw error("Unexpected '}'", s.line, origin, rules, order);
            }
            if (ch == '@') {
                skipAtRule(s, origin, rules, order);
                continue;
            }

            int selectorLine = s.line;
            String selectorText = s.readUntilBlockStart(origin, rules, order);
            if (selectorText == null) {
                throw error("Missing '{' after selector", selectorLine, origin, rules, order);
            }
            if (selectorText.isBlank()) {
                throw error("Empty selector", selectorLine, origin, rules, order);
            }
            int bodyLine = s.line;
            String body = s.readBlockBody(origin, rules, order);
            if (body == null) {
                throw error("Missing '}'", bodyLine, origin, rules, order);
            }

            List<Declaration> declarations = parseDeclarations(body);
            for (String member : selectorParser.splitList(selectorText)) {
                try {
                    rules.add(new Rule(selectorParser.parse(member), declarations, origin, order));
                } catch (UnsupportedSelectorException e) {
                    warnings.warn(UnresolvedReferenceWarning.Kind.UNSUPPORTED_SELECTOR, member, e.getMessage());
                }
            }
            order++;
        }
        return new Stylesheet(origin, rules, order);
    }

    /**
     * Parses a declaration list without braces, as found in a {@code style} attribute.
     * Malformed entries are skipped with a warning.
     */
    public List<Declaration> parseDeclarations(String text) {
        List<Declaration> out = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return out;
        }
        for (String part : splitDeclarations(stripComments(text))) {
            String entry = part.trim();
            if (entry.isEmpty()) {
                continue;
            }
            int colon = entry.indexOf(':');
            if (colon <= 0) {
                warnings.warn(UnresolvedReferenceWarning.Kind.INVALID_VALUE, entry, "Declaration without ':'");
                continue;
            }
            String property = entry.substring(0, colon).trim();
            String value = entry.substring(colon + 1).trim();
            boolean important = false;
            int bang = value.lastIndexOf('!');
            if (bang >= 0 && "important".equals(value.substring(bang + 1).trim().toLowerCase(Locale.ROOT))) {
                important = true;
                value = value.substring(0, bang).trim();
            }
            if (value.isEmpty()) {
                warnings.warn(UnresolvedReferenceWarning.Kind.INVALID_VALUE, property, "Empty value");
                continue;
            }
            out.addAll(declarationProcessor.process(new Declaration(property, value, important), warnings));
        }
        return out;
    }

    private void skipAtRule(Scanner s, Origin origin, List<Rule> rules, int order) {
        int startLine = s.line;
        int start = s.pos;
        s.advance();
        while (!s.atEnd() && SelectorParser.isIdentChar(s.peek())) {
            s.advance();
        }
        String name = s.text.substring(start, s.pos);
        while (!s.atEnd()) {
            char ch = s.peek();
            if (ch == ';') {
                s.advance();
                warnAtRule(name);
                return;
            }
            if (ch == '{') {
                if (s.readBlockBody(origin, rules, order) == null) {
                    throw error("Unterminated " + name + " block", startLine, origin, rules, order);
                }
                warnAtRule(name);
                return;
            }
            if (ch == '}') {
                throw error("Unexpected '}' in " + name, s.line, origin, rules, order);
            }
            if (ch == '/' && s.peekNext() == '*') {
                s.skipComment(origin, rules, order);
            } else {
                s.advance();
            }
        }
        warnAtRule(name);
    }

    private void warnAtRule(String name) {
        warnings.warn(UnresolvedReferenceWarning.Kind.UNSUPPORTED_AT_RULE, name, "At-rule skipped");
    }

    private static List<String> splitDeclarations(String text) {
        List<String> out = new ArrayList<>();
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
            } else if (ch == '"' || ch == '\'') {
                quote = ch;
            } else if (ch == '(') {
                depth++;
            } else if (ch == ')') {
                depth = Math.max(0, depth - 1);
            } else if (ch == ';' && depth == 0) {
                out.add(text.substring(start, i));
                start = i + 1;
            }
        }
        out.add(text.substring(start));
        return out;
    }

    private static String stripComments(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            if (text.startsWith("/*", i)) {
                int end = text.indexOf("*/", i + 2);
                if (end < 0) {
                    break;
                }
                sb.append(' ');
                i = end + 2;
            } else {
                sb.append(text.charAt(i));
                i++;
            }
        }
        return sb.toString();
    }

    private static StylesheetParseException error(String message, int line, Origin origin, List<Rule> rules, int order) {
        return new StylesheetParseException(message, line, new Stylesheet(origin, rules, order));
    }

    private static final class Scanner {
        private final String text;
        private int pos;
        private int line = 1;

        Scanner(String text) {
            this.text = text;
        }

        boolean atEnd() {
            return pos >= text.length();
        }

        char peek() {
            return text.charAt(pos);
        }

        char peekNext() {
            return pos + 1 < text.length() ? text.charAt(pos + 1) : 0;
        }

        void advance() {
            if (text.charAt(pos) == '\n') {
                line++;
            }
            pos++;
        }

        void skipWhitespaceAndComments(List<Rule> rules, Origin origin, int order) {
            while (!atEnd()) {
                char ch = peek();
                if (Character.isWhitespace(ch)) {
                    advance();
                } else if (ch == '/' && peekNext() == '*') {
                    skipComment(origin, rules, order);
                } else {
                    return;
                }
            }
        }

        void skipComment(Origin origin, List<Rule> rules, int order) {
            int startLine = line;
            advance();
            advance();
            while (!atEnd()) {
                if (peek() == '*' && peekNext() == '/') {
                    advance();
                    advance();
                    return;
                }
                advance();
            }
            throw error("Unterminated comment", startLine, origin, rules, order);
        }

        void skipString() {
            char quote = peek();
            advance();
            while (!atEnd()) {
                char ch = peek();
                advance();
                if (ch == '\\' && !atEnd()) {
                    advance();
                } else if (ch == quote || ch == '\n') {
                    return;
                }
            }
        }

        /**
         * Reads selector text up to and including '{'. Returns {@code null} when no block opens.
         */
        String readUntilBlockStart(Origin origin, List<Rule> rules, int order) {
            StringBuilder sb = new StringBuilder();
            while (!atEnd()) {
                char ch = peek();
                if (ch == '{') {
                    advance();
                    return sb.toString().trim();
                }
                if (ch == '}') {
                    throw error("Unexpected '}' after selector", line, origin, rules, order);
                }
                if (ch == '/' && peekNext() == '*') {
                    skipComment(origin, rules, order);
                    sb.append(' ');
                } else if (ch == '"' || ch == '\'') {
                    int start = pos;
                    skipString();
                    sb.append(text, start, pos);
                } else {
                    sb.append(ch);
                    advance();
                }
            }
            return null;
        }

        /**
         * Reads a block body up to the matching '}', with comments removed. If positioned on '{' it is consumed
         * first. Returns {@code null} when the block is unterminated.
         */
        String readBlockBody(Origin origin, List<Rule> rules, int order) {
            if (!atEnd() && peek() == '{') {
                advance();
            }
            StringBuilder sb = new StringBuilder();
            int depth = 1;
            while (!atEnd()) {
                char ch = peek();
                if (ch == '/' && peekNext() == '*') {
                    skipComment(origin, rules, order);
                    sb.append(' ');
                    continue;
                }
                if (ch == '"' || ch == '\'') {
                    int start = pos;
                    skipString();
                    sb.append(text, start, pos);
                    continue;
                }
                if (ch == '{') {
                    depth++;
                } else if (ch == '}') {
                    depth--;
                    if (depth == 0) {
                        advance();
                        return sb.toString();
                    }
                }
                sb.append(ch);
                advance();
            }
            return null;
        }
    }
}

package io.hearthwarrio.cascadium.core.css;

import java.util.List;

/**
 * Thrown when stylesheet text is structurally malformed (unterminated block or comment, stray {@code '}'},
 * selector without a block).
 * <p>
 * Carries the rules parsed before the malformed region so callers can still apply them.
 */
public class StylesheetParseException extends RuntimeException {

    private final int line;
    private final transient Stylesheet recovered;

    public StylesheetParseException(String message, int line, Stylesheet recovered) {
        super("Line " + line + ": " + message);
        this.line = line;
        this.recovered = recovered;
    }

    /**
     * 1-based line where the malformed region starts.
     */
    public int getLine() {
        return line;
    }

    public Stylesheet getRecovered() {
        return recovered;
    }

    public List<Rule> getRecoveredRules() {
        return recovered.getRules();
    }
}

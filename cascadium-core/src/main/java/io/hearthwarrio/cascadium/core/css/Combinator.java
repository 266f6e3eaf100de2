package io.hearthwarrio.cascadium.core.css;

/**
 * Relation between two adjacent compound selectors.
 */
public enum Combinator {
    DESCENDANT(" "),
    CHILD(">"),
    ADJACENT_SIBLING("+"),
    GENERAL_SIBLING("~");

    private final String symbol;

    Combinator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}

package io.hearthwarrio.cascadium.core.css;

/**
 * Thrown by {@link SelectorParser} when selector text is malformed or uses unsupported syntax.
 * The stylesheet parser turns it into a warning and skips the selector.
 */
public class UnsupportedSelectorException extends RuntimeException {
    public UnsupportedSelectorException(String message) {
        super(message);
    }
}

package io.hearthwarrio.cascadium.html;

/**
 * Thrown when markup cannot be read at all.
 * <p>
 * Ordinary HTML errors (unclosed tags, misnested elements) are repaired by the parser and never cause this.
 */
public class MarkupParseException extends RuntimeException {

    public MarkupParseException(String message, Throwable cause) {
        super(message, cause);
    }
}

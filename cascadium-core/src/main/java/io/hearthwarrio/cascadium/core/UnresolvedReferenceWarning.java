package io.hearthwarrio.cascadium.core;

import java.util.Objects;

/**
 * Non-fatal diagnostic produced while parsing stylesheets or resolving styles.
 * <p>
 * Warnings never abort a reflow: the offending id, property, value or selector is ignored.
 */
public final class UnresolvedReferenceWarning {

    /**
     * What was ignored.
     */
    public enum Kind {
        /**
         * An id attribute value used by more than one element.
         */
        DUPLICATE_ID,
        /**
         * A property that is neither built in nor registered as an extension.
         */
        UNKNOWN_PROPERTY,
        /**
         * A recognized property with a value that cannot be coerced to the property's type.
         */
        INVALID_VALUE,
        /**
         * A selector using syntax the matcher does not support.
         */
        UNSUPPORTED_SELECTOR,
        /**
         * An at-rule ({@code @media}, {@code @import}, ...), skipped as a whole.
         */
        UNSUPPORTED_AT_RULE
    }

    private final Kind kind;
    private final String subject;
    private final String message;

    public UnresolvedReferenceWarning(Kind kind, String subject, String message) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.subject = subject == null ? "" : subject;
        this.message = message == null ? "" : message;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * The offending id, property name, value or selector text.
     */
    public String getSubject() {
        return subject;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return kind + " '" + subject + "': " + message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UnresolvedReferenceWarning)) return false;
        UnresolvedReferenceWarning that = (UnresolvedReferenceWarning) o;
        return kind == that.kind &&
                Objects.equals(subject, that.subject) &&
                Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, subject, message);
    }
}

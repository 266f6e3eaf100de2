package io.hearthwarrio.cascadium.core;

/**
 * Receives non-fatal warnings from the stylesheet parser and the cascade.
 */
@FunctionalInterface
public interface WarningSink {

    /**
     * Sink that drops every warning.
     */
    WarningSink IGNORE = warning -> {
    };

    void warn(UnresolvedReferenceWarning warning);

    /**
     * Convenience for {@link #warn(UnresolvedReferenceWarning)}.
     */
    default void warn(UnresolvedReferenceWarning.Kind kind, String subject, String message) {
        warn(new UnresolvedReferenceWarning(kind, subject, message));
    }
}

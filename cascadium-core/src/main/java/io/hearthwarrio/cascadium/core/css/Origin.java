package io.hearthwarrio.cascadium.core.css;

/**
 * Where a declaration comes from. Declared in ascending cascade rank.
 */
public enum Origin {
    USER_AGENT,
    STYLESHEET,
    INLINE;

    /**
     * Cascade rank; higher wins among declarations of equal importance.
     */
    public int rank() {
        return ordinal();
    }
}

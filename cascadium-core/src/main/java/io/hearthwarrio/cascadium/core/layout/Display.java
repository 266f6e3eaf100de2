package io.hearthwarrio.cascadium.core.layout;

/**
 * Layout behavior selected by the computed {@code display} value.
 */
public enum Display {
    BLOCK,
    INLINE_BLOCK,
    FLEX,
    INLINE_FLEX,
    NONE;

    /**
     * Maps a computed {@code display} keyword. {@code inline} is laid out as {@code inline-block},
     * {@code list-item} and unknown values as {@code block}.
     */
    public static Display of(String keyword) {
        if (keyword == null) {
            return BLOCK;
        }
        switch (keyword) {
            case "inline":
            case "inline-block":
                return INLINE_BLOCK;
            case "flex":
                return FLEX;
            case "inline-flex":
                return INLINE_FLEX;
            case "none":
                return NONE;
            default:
                return BLOCK;
        }
    }

    /**
     * Whether the box flows horizontally with its siblings.
     */
    public boolean isInlineLevel() {
        return this == INLINE_BLOCK || this == INLINE_FLEX;
    }

    public boolean isFlexContainer() {
        return this == FLEX || this == INLINE_FLEX;
    }
}

package io.hearthwarrio.cascadium.core.css;

import io.hearthwarrio.cascadium.core.dom.Element;

/**
 * Answers dynamic pseudo-classes. Implemented by the input dispatcher that tracks pointer and focus.
 */
public interface InteractionState {

    /**
     * No element is hovered, focused or active.
     */
    InteractionState NONE = new InteractionState() {
    };

    default boolean isHovered(Element element) {
        return false;
    }

    default boolean isFocused(Element element) {
        return false;
    }

    default boolean isActive(Element element) {
        return false;
    }
}

package io.hearthwarrio.cascadium.core.css;

import java.util.List;
import java.util.Objects;

/**
 * Selector with its declarations, tagged with origin and position in the cascade's source order.
 */
public final class Rule {

    private final Selector selector;
    private final List<Declaration> declarations;
    private final Origin origin;
    private final int sourceOrder;

    public Rule(Selector selector, List<Declaration> declarations, Origin origin, int sourceOrder) {
        this.selector = Objects.requireNonNull(selector, "selector must not be null");
        this.declarations = List.copyOf(Objects.requireNonNull(declarations, "declarations must not be null"));
        this.origin = Objects.requireNonNull(origin, "origin must not be null");
        this.sourceOrder = sourceOrder;
    }

    public Selector getSelector() {
        return selector;
    }

    public List<Declaration> getDeclarations() {
        return declarations;
    }

    public Origin getOrigin() {
        return origin;
    }

    /**
     * Position of the rule's block among all blocks of one reflow. Members of a selector list share it.
     */
    public int getSourceOrder() {
        return sourceOrder;
    }

    public Specificity specificity() {
        return selector.specificity();
    }

    @Override
    public String toString() {
        return selector + " " + declarations + " (" + origin + ", #" + sourceOrder + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Rule)) return false;
        Rule that = (Rule) o;
        return sourceOrder == that.sourceOrder &&
                selector.equals(that.selector) &&
                declarations.equals(that.declarations) &&
                origin == that.origin;
    }

    @Override
    public int hashCode() {
        return Objects.hash(selector, declarations, origin, sourceOrder);
    }
}

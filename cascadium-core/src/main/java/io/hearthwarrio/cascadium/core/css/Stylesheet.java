package io.hearthwarrio.cascadium.core.css;

import java.util.List;
import java.util.Objects;

/**
 * Ordered rules parsed from one stylesheet text.
 */
public final class Stylesheet {

    private final Origin origin;
    private final List<Rule> rules;
    private final int nextSourceOrder;

    public Stylesheet(Origin origin, List<Rule> rules, int nextSourceOrder) {
        this.origin = Objects.requireNonNull(origin, "origin must not be null");
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules must not be null"));
        this.nextSourceOrder = nextSourceOrder;
    }

    public static Stylesheet empty(Origin origin) {
        return new Stylesheet(origin, List.of(), 0);
    }

    public Origin getOrigin() {
        return origin;
    }

    public List<Rule> getRules() {
        return rules;
    }

    /**
     * Source order index to hand to the next stylesheet of the same reflow.
     */
    public int getNextSourceOrder() {
        return nextSourceOrder;
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    @Override
    public String toString() {
        return "Stylesheet{" +
                "origin=" + origin +
                ", rules=" + rules.size() +
                '}';
    }
}

package io.hearthwarrio.cascadium.core.css;

import java.util.List;
import java.util.Objects;

/**
 * Complex selector: compound selectors joined by combinators, written left to right.
 * The last compound is the subject, i.e. the element the selector styles.
 */
public final class Selector {

    private final List<CompoundSelector> compounds;
    private final List<Combinator> combinators;
    private final Specificity specificity;

    /**
     * @param compounds   compound selectors, left to right (at least one)
     * @param combinators combinators; {@code combinators.get(i)} joins compounds {@code i} and {@code i + 1}
     */
    public Selector(List<CompoundSelector> compounds, List<Combinator> combinators) {
        Objects.requireNonNull(compounds, "compounds must not be null");
        Objects.requireNonNull(combinators, "combinators must not be null");
        if (compounds.isEmpty()) {
            throw new IllegalArgumentException("Selector needs at least one compound selector");
        }
        if (combinators.size() != compounds.size() - 1) {
            throw new IllegalArgumentException(
                    "Expected " + (compounds.size() - 1) + " combinators, got " + combinators.size()
            );
        }
        this.compounds = List.copyOf(compounds);
        this.combinators = List.copyOf(combinators);

        Specificity s = Specificity.ZERO;
        for (CompoundSelector c : this.compounds) {
            s = s.plus(c.specificity());
        }
        this.specificity = s;
    }

    public List<CompoundSelector> getCompounds() {
        return compounds;
    }

    public List<Combinator> getCombinators() {
        return combinators;
    }

    public CompoundSelector getSubject() {
        return compounds.get(compounds.size() - 1);
    }

    /**
     * Specificity computed from the selector structure alone.
     */
    public Specificity specificity() {
        return specificity;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(compounds.get(0).toString());
        for (int i = 0; i < combinators.size(); i++) {
            Combinator c = combinators.get(i);
            if (c == Combinator.DESCENDANT) {
                sb.append(' ');
            } else {
                sb.append(' ').append(c.symbol()).append(' ');
            }
            sb.append(compounds.get(i + 1));
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Selector)) return false;
        Selector that = (Selector) o;
        return compounds.equals(that.compounds) && combinators.equals(that.combinators);
    }

    @Override
    public int hashCode() {
        return Objects.hash(compounds, combinators);
    }
}

package io.hearthwarrio.cascadium.core.css;

import java.util.Locale;
import java.util.Objects;

/**
 * Pseudo-class requirement of a compound selector.
 * <p>
 * Structural pseudo-classes ({@code :nth-child(2n+1)} and friends) carry an {@code an+b} pair, {@code :not(...)}
 * carries the negated compound selector. Dynamic pseudo-classes ({@code :hover}, {@code :focus}, {@code :active})
 * are answered by an {@link InteractionState}.
 */
public final class PseudoClass {

    public enum Kind {
        FIRST_CHILD("first-child"),
        LAST_CHILD("last-child"),
        ONLY_CHILD("only-child"),
        EMPTY("empty"),
        NTH_CHILD("nth-child"),
        NTH_LAST_CHILD("nth-last-child"),
        NTH_OF_TYPE("nth-of-type"),
        NOT("not"),
        DISABLED("disabled"),
        ENABLED("enabled"),
        CHECKED("checked"),
        REQUIRED("required"),
        OPTIONAL("optional"),
        HOVER("hover"),
        FOCUS("focus"),
        ACTIVE("active");

        private final String cssName;

        Kind(String cssName) {
            this.cssName = cssName;
        }

        public String cssName() {
            return cssName;
        }

        public boolean takesArgument() {
            return this == NTH_CHILD || this == NTH_LAST_CHILD || this == NTH_OF_TYPE || this == NOT;
        }

        /**
         * Looks up a pseudo-class by its CSS name.
         *
         * @return kind or {@code null} when unsupported
         */
        public static Kind byName(String name) {
            String n = name == null ? "" : name.toLowerCase(Locale.ROOT);
            for (Kind k : values()) {
                if (k.cssName.equals(n)) {
                    return k;
                }
            }
            return null;
        }
    }

    private final Kind kind;
    private final int stepA;
    private final int offsetB;
    private final CompoundSelector negated;

    private PseudoClass(Kind kind, int stepA, int offsetB, CompoundSelector negated) {
        this.kind = kind;
        this.stepA = stepA;
        this.offsetB = offsetB;
        this.negated = negated;
    }

    public static PseudoClass simple(Kind kind) {
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind.takesArgument()) {
            throw new IllegalArgumentException(":" + kind.cssName() + " requires an argument");
        }
        return new PseudoClass(kind, 0, 0, null);
    }

    /**
     * Creates an {@code an+b} structural pseudo-class.
     */
    public static PseudoClass nth(Kind kind, int a, int b) {
        if (kind != Kind.NTH_CHILD && kind != Kind.NTH_LAST_CHILD && kind != Kind.NTH_OF_TYPE) {
            throw new IllegalArgumentException(kind + " is not an nth pseudo-class");
        }
        return new PseudoClass(kind, a, b, null);
    }

    public static PseudoClass not(CompoundSelector negated) {
        return new PseudoClass(Kind.NOT, 0, 0, Objects.requireNonNull(negated, "negated must not be null"));
    }

    public Kind getKind() {
        return kind;
    }

    public int getStepA() {
        return stepA;
    }

    public int getOffsetB() {
        return offsetB;
    }

    /**
     * Argument of {@code :not(...)}, otherwise {@code null}.
     */
    public CompoundSelector getNegated() {
        return negated;
    }

    /**
     * Whether a 1-based position satisfies {@code a*n + b} for some {@code n >= 0}.
     */
    public boolean matchesPosition(int position) {
        if (stepA == 0) {
            return position == offsetB;
        }
        int diff = position - offsetB;
        if (diff % stepA != 0) {
            return false;
        }
        return diff / stepA >= 0;
    }

    Specificity specificity() {
        if (kind == Kind.NOT) {
            return negated.specificity();
        }
        return Specificity.of(0, 1, 0);
    }

    @Override
    public String toString() {
        switch (kind) {
            case NOT:
                return ":not(" + negated + ")";
            case NTH_CHILD:
            case NTH_LAST_CHILD:
            case NTH_OF_TYPE:
                return ":" + kind.cssName() + "(" + stepA + "n" + (offsetB >= 0 ? "+" : "") + offsetB + ")";
            default:
                return ":" + kind.cssName();
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PseudoClass)) return false;
        PseudoClass that = (PseudoClass) o;
        return kind == that.kind && stepA == that.stepA && offsetB == that.offsetB &&
                Objects.equals(negated, that.negated);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, stepA, offsetB, negated);
    }
}

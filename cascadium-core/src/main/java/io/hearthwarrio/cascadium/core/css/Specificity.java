package io.hearthwarrio.cascadium.core.css;

/**
 * Selector weight (ids, classes + attributes + pseudo-classes, tags), compared lexicographically.
 */
public final class Specificity implements Comparable<Specificity> {

    public static final Specificity ZERO = new Specificity(0, 0, 0);

    /**
     * Weight used for inline declarations: above any selector.
     */
    public static final Specificity INLINE = new Specificity(Integer.MAX_VALUE, 0, 0);

    private final int ids;
    private final int classes;
    private final int tags;

    private Specificity(int ids, int classes, int tags) {
        this.ids = ids;
        this.classes = classes;
        this.tags = tags;
    }

    public static Specificity of(int ids, int classes, int tags) {
        if (ids < 0 || classes < 0 || tags < 0) {
            throw new IllegalArgumentException("Specificity components must not be negative");
        }
        return new Specificity(ids, classes, tags);
    }

    public Specificity plus(Specificity other) {
        return new Specificity(ids + other.ids, classes + other.classes, tags + other.tags);
    }

    public int getIds() {
        return ids;
    }

    public int getClasses() {
        return classes;
    }

    public int getTags() {
        return tags;
    }

    @Override
    public int compareTo(Specificity o) {
        int c = Integer.compare(ids, o.ids);
        if (c != 0) {
            return c;
        }
        c = Integer.compare(classes, o.classes);
        if (c != 0) {
            return c;
        }
        return Integer.compare(tags, o.tags);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Specificity)) return false;
        Specificity that = (Specificity) o;
        return ids == that.ids && classes == that.classes && tags == that.tags;
    }

    @Override
    public int hashCode() {
        return 31 * (31 * ids + classes) + tags;
    }

    @Override
    public String toString() {
        return "(" + ids + "," + classes + "," + tags + ")";
    }
}

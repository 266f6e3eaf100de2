package io.hearthwarrio.cascadium.core.css;

import java.util.List;
import java.util.Objects;

/**
 * Requirements on a single element: optional tag, optional id, classes, attribute conditions and pseudo-classes.
 * All requirements must hold for a match.
 */
public final class CompoundSelector {

    private final String tagName;
    private final String id;
    private final List<String> classes;
    private final List<AttributeCondition> attributes;
    private final List<PseudoClass> pseudoClasses;

    /**
     * @param tagName       lower-case tag name, or {@code null} for any element ({@code *} or omitted)
     * @param id            required id, or {@code null}
     * @param classes       required classes
     * @param attributes    attribute conditions
     * @param pseudoClasses pseudo-class conditions
     */
    public CompoundSelector(
            String tagName,
            String id,
            List<String> classes,
            List<AttributeCondition> attributes,
            List<PseudoClass> pseudoClasses
    ) {
        this.tagName = tagName;
        this.id = id;
        this.classes = List.copyOf(Objects.requireNonNull(classes, "classes must not be null"));
        this.attributes = List.copyOf(Objects.requireNonNull(attributes, "attributes must not be null"));
        this.pseudoClasses = List.copyOf(Objects.requireNonNull(pseudoClasses, "pseudoClasses must not be null"));
    }

    public String getTagName() {
        return tagName;
    }

    public String getId() {
        return id;
    }

    public List<String> getClasses() {
        return classes;
    }

    public List<AttributeCondition> getAttributes() {
        return attributes;
    }

    public List<PseudoClass> getPseudoClasses() {
        return pseudoClasses;
    }

    public Specificity specificity() {
        Specificity s = Specificity.of(
                id == null ? 0 : 1,
                classes.size() + attributes.size(),
                tagName == null ? 0 : 1
        );
        for (PseudoClass p : pseudoClasses) {
            s = s.plus(p.specificity());
        }
        return s;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (tagName != null) {
            sb.append(tagName);
        }
        if (id != null) {
            sb.append('#').append(id);
        }
        for (String c : classes) {
            sb.append('.').append(c);
        }
        for (AttributeCondition a : attributes) {
            sb.append(a);
        }
        for (PseudoClass p : pseudoClasses) {
            sb.append(p);
        }
        return sb.length() == 0 ? "*" : sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CompoundSelector)) return false;
        CompoundSelector that = (CompoundSelector) o;
        return Objects.equals(tagName, that.tagName) &&
                Objects.equals(id, that.id) &&
                classes.equals(that.classes) &&
                attributes.equals(that.attributes) &&
                pseudoClasses.equals(that.pseudoClasses);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tagName, id, classes, attributes, pseudoClasses);
    }
}

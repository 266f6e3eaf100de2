package io.hearthwarrio.cascadium.core.dom;

import java.util.AbstractList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Node of a {@link Document}.
 * <p>
 * Elements live in the document arena and refer to each other by index: the parent index is a non-owning
 * back-reference, the child indices are owned by the parent. Instances are immutable once the document is built.
 * <p>
 * {@code id}, {@code class} and {@code style} are ordinary attributes; the dedicated accessors are derived from them.
 */
public final class Element {

    private final Document document;
    private final int index;
    private final int parentIndex;
    private final int siblingPosition;
    private final String tagName;
    private final Map<String, String> attributes;
    private final Set<String> classes;
    private final String textContent;
    private final int[] childIndices;

    Element(
            Document document,
            int index,
            int parentIndex,
            int siblingPosition,
            String tagName,
            Map<String, String> attributes,
            String textContent,
            int[] childIndices
    ) {
        this.document = document;
        this.index = index;
        this.parentIndex = parentIndex;
        this.siblingPosition = siblingPosition;
        this.tagName = tagName;
        this.attributes = Collections.unmodifiableMap(attributes);
        this.classes = Collections.unmodifiableSet(splitClasses(attributes.get("class")));
        this.textContent = textContent == null ? "" : textContent;
        this.childIndices = childIndices;
    }

    private static Set<String> splitClasses(String raw) {
        Set<String> out = new LinkedHashSet<>();
        if (raw == null || raw.isBlank()) {
            return out;
        }
        for (String token : raw.trim().split("\\s+")) {
            if (!token.isEmpty()) {
                out.add(token);
            }
        }
        return out;
    }

    public Document getDocument() {
        return document;
    }

    /**
     * Position of this element in document order (0 is the root).
     */
    public int getIndex() {
        return index;
    }

    public String getTagName() {
        return tagName;
    }

    /**
     * Returns the id attribute, or an empty string when absent.
     */
    public String getId() {
        String id = attributes.get("id");
        return id == null ? "" : id;
    }

    public Set<String> getClasses() {
        return classes;
    }

    public boolean hasClass(String className) {
        return classes.contains(className);
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    /**
     * Returns the attribute value, or {@code null} when the attribute is absent.
     */
    public String getAttribute(String name) {
        return attributes.get(name);
    }

    public boolean hasAttribute(String name) {
        return attributes.containsKey(name);
    }

    /**
     * Returns the raw {@code style} attribute text, or an empty string.
     */
    public String getInlineStyle() {
        String style = attributes.get("style");
        return style == null ? "" : style;
    }

    /**
     * Text directly owned by this element (not including descendants' text).
     */
    public String getTextContent() {
        return textContent;
    }

    public boolean isRoot() {
        return parentIndex < 0;
    }

    /**
     * Returns the parent element, or {@code null} for the root.
     */
    public Element getParent() {
        return parentIndex < 0 ? null : document.element(parentIndex);
    }

    int getParentIndex() {
        return parentIndex;
    }

    public List<Element> getChildren() {
        if (childIndices.length == 0) {
            return List.of();
        }
        return new AbstractList<Element>() {
            @Override
            public Element get(int i) {
                return document.element(childIndices[i]);
            }

            @Override
            public int size() {
                return childIndices.length;
            }
        };
    }

    public int getChildCount() {
        return childIndices.length;
    }

    /**
     * Zero-based position among the parent's children.
     */
    public int getSiblingPosition() {
        return siblingPosition;
    }

    /**
     * Returns the previous sibling element, or {@code null} when this is the first child (or the root).
     */
    public Element getPreviousSibling() {
        if (parentIndex < 0 || siblingPosition == 0) {
            return null;
        }
        return document.element(parentIndex).getChildren().get(siblingPosition - 1);
    }

    /**
     * Returns the next sibling element, or {@code null} when this is the last child (or the root).
     */
    public Element getNextSibling() {
        if (parentIndex < 0) {
            return null;
        }
        Element parent = document.element(parentIndex);
        if (siblingPosition + 1 >= parent.getChildCount()) {
            return null;
        }
        return parent.getChildren().get(siblingPosition + 1);
    }

    /**
     * Short selector-like description, e.g. {@code div#main.card.wide}.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder(tagName);
        String id = getId();
        if (!id.isEmpty()) {
            sb.append('#').append(id);
        }
        for (String c : classes) {
            sb.append('.').append(c);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "Element{" +
                "index=" + index +
                ", tagName='" + tagName + '\'' +
                ", attributes=" + attributes +
                ", children=" + childIndices.length +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Element)) return false;
        Element that = (Element) o;
        return document == that.document && index == that.index;
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(document), index);
    }
}

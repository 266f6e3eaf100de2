package io.hearthwarrio.cascadium.core.dom;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Element tree stored as an arena in document order.
 * <p>
 * Documents are produced by an external markup parser through {@link DocumentBuilder} and are read-only afterwards.
 * Style and layout results are kept outside the document (see {@code LayoutTree}) and are recomputed on every reflow.
 */
public final class Document {

    private final List<Element> elements;

    Document(List<DocumentBuilder.NodeSpec> specs) {
        List<Element> out = new ArrayList<>(specs.size());
        for (int i = 0; i < specs.size(); i++) {
            DocumentBuilder.NodeSpec spec = specs.get(i);
            int[] children = new int[spec.children.size()];
            for (int c = 0; c < children.length; c++) {
                children[c] = spec.children.get(c);
            }
            out.add(new Element(
                    this,
                    i,
                    spec.parent,
                    spec.siblingPosition,
                    spec.tagName,
                    new LinkedHashMap<>(spec.attributes),
                    spec.text.toString(),
                    children
            ));
        }
        this.elements = Collections.unmodifiableList(out);
    }

    /**
     * Starts a new document whose root element has the given tag.
     *
     * @param rootTag root tag name, e.g. {@code html}
     * @return builder positioned inside the root element
     */
    public static DocumentBuilder builder(String rootTag) {
        return new DocumentBuilder(rootTag);
    }

    public Element getRoot() {
        return elements.get(0);
    }

    public Element element(int index) {
        return elements.get(index);
    }

    /**
     * All elements in document (pre-)order.
     */
    public List<Element> getElements() {
        return elements;
    }

    public int size() {
        return elements.size();
    }

    /**
     * Returns the first element with the given id, or {@code null}.
     */
    public Element getElementById(String id) {
        if (id == null || id.isEmpty()) {
            return null;
        }
        for (Element e : elements) {
            if (id.equals(e.getId())) {
                return e;
            }
        }
        return null;
    }

    /**
     * Ids used by more than one element. Ids are expected to be unique, but a violation only produces a warning.
     *
     * @return duplicated ids in first-occurrence order
     */
    public Set<String> findDuplicateIds() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Element e : elements) {
            String id = e.getId();
            if (!id.isEmpty()) {
                counts.merge(id, 1, Integer::sum);
            }
        }
        Set<String> out = new LinkedHashSet<>();
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > 1) {
                out.add(entry.getKey());
            }
        }
        return out;
    }
}

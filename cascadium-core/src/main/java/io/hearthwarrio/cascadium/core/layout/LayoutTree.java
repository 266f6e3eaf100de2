package io.hearthwarrio.cascadium.core.layout;

import io.hearthwarrio.cascadium.core.dom.Document;
import io.hearthwarrio.cascadium.core.dom.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Result of one reflow: a {@link LayoutNode} per element, in document order.
 * <p>
 * Read-only. Painters walk {@link #nodes()} in order; hit-testers use {@link #hitTest(double, double)}.
 */
public final class LayoutTree {

    private final Document document;
    private final List<LayoutNode> nodes;
    private final double viewportWidth;
    private final double viewportHeight;

    LayoutTree(Document document, List<LayoutNode> nodes, double viewportWidth, double viewportHeight) {
        this.document = document;
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
        this.viewportWidth = viewportWidth;
        this.viewportHeight = viewportHeight;
    }

    public Document getDocument() {
        return document;
    }

    public double getViewportWidth() {
        return viewportWidth;
    }

    public double getViewportHeight() {
        return viewportHeight;
    }

    public List<LayoutNode> nodes() {
        return nodes;
    }

    public LayoutNode root() {
        return nodes.get(0);
    }

    /**
     * @throws IllegalArgumentException if the element belongs to another document
     */
    public LayoutNode node(Element element) {
        Objects.requireNonNull(element, "element must not be null");
        if (element.getDocument() != document) {
            throw new IllegalArgumentException("Element " + element.describe() + " belongs to another document");
        }
        return nodes.get(element.getIndex());
    }

    public LayoutNode node(int index) {
        return nodes.get(index);
    }

    public List<LayoutNode> children(LayoutNode node) {
        List<Element> children = node.getElement().getChildren();
        List<LayoutNode> out = new ArrayList<>(children.size());
        for (Element c : children) {
            out.add(nodes.get(c.getIndex()));
        }
        return out;
    }

    /**
     * Returns the parent node, or {@code null} for the root.
     */
    public LayoutNode parent(LayoutNode node) {
        Element parent = node.getElement().getParent();
        return parent == null ? null : nodes.get(parent.getIndex());
    }

    /**
     * Finds the topmost rendered, visible node whose border box contains the point. Nodes later in document
     * order paint over earlier ones, so descendants win over ancestors and later siblings over earlier ones.
     *
     * @return hit node, or {@code null} when the point hits nothing
     */
    public LayoutNode hitTest(double x, double y) {
        for (int i = nodes.size() - 1; i >= 0; i--) {
            LayoutNode n = nodes.get(i);
            if (n.isRendered() && n.getStyle().isVisible() && n.getBox().getBorderBox().contains(x, y)) {
                return n;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "LayoutTree{" +
                "nodes=" + nodes.size() +
                ", viewport=" + Rect.format(viewportWidth) + "x" + Rect.format(viewportHeight) +
                '}';
    }
}

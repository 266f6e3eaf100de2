package io.hearthwarrio.cascadium.webdriver;

import io.hearthwarrio.cascadium.core.layout.LayoutNode;
import io.hearthwarrio.cascadium.core.layout.LayoutTree;
import io.hearthwarrio.cascadium.core.layout.Rect;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Compares a Cascadium layout with the rectangles a browser computed for the same page.
 * <p>
 * Only elements rendered by Cascadium are compared. Elements the browser did not render report an empty
 * rectangle at the origin and show up as mismatches.
 */
public final class LayoutComparison {

    public static final double DEFAULT_TOLERANCE = 1.0;

    private LayoutComparison() {
        // utility class
    }

    public static List<LayoutMismatch> compare(LayoutTree tree, PageSnapshot snapshot) {
        return compare(tree, snapshot, DEFAULT_TOLERANCE);
    }

    /**
     * @param tree      layout computed for {@code snapshot.getDocument()}
     * @param snapshot  browser snapshot
     * @param tolerance allowed difference per coordinate, px
     * @return mismatches in document order; empty when layouts agree
     */
    public static List<LayoutMismatch> compare(LayoutTree tree, PageSnapshot snapshot, double tolerance) {
        Objects.requireNonNull(tree, "tree must not be null");
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        if (tree.getDocument() != snapshot.getDocument()) {
            throw new IllegalArgumentException("Layout tree was computed for a different document");
        }
        if (!(tolerance >= 0)) {
            throw new IllegalArgumentException("tolerance must be >= 0, got " + tolerance);
        }

        List<LayoutMismatch> out = new ArrayList<>();
        for (LayoutNode node : tree.nodes()) {
            if (!node.isRendered()) {
                continue;
            }
            Rect computed = node.getBox().getBorderBox();
            Rect browser = snapshot.getBrowserBox(node.getElement().getIndex());
            if (maxDelta(computed, browser) > tolerance) {
                out.add(new LayoutMismatch(node.getElement(), computed, browser));
            }
        }
        return out;
    }

    static double maxDelta(Rect a, Rect b) {
        double d = Math.abs(a.getX() - b.getX());
        d = Math.max(d, Math.abs(a.getY() - b.getY()));
        d = Math.max(d, Math.abs(a.getWidth() - b.getWidth()));
        return Math.max(d, Math.abs(a.getHeight() - b.getHeight()));
    }
}

package io.hearthwarrio.cascadium.core.layout;

import io.hearthwarrio.cascadium.core.dom.Document;
import io.hearthwarrio.cascadium.core.dom.Element;
import io.hearthwarrio.cascadium.core.style.ComputedStyle;
import io.hearthwarrio.cascadium.core.style.Length;
import io.hearthwarrio.cascadium.core.style.Property;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * One layout of a document. Widths flow top-down, heights bottom-up, in a single traversal; boxes are first
 * placed relative to wherever their position is known and moved with {@link #translate} once it is.
 * <p>
 * Elements are addressed by document index, so the subtree of element {@code i} is the index range
 * {@code [i, subtreeEnd[i])}.
 */
final class LayoutPass {

    private final Document document;
    private final List<ComputedStyle> styles;
    private final TextMetrics metrics;
    private final Display[] displays;
    private final int[] subtreeEnd;
    private final Box[] boxes;
    private final Rect[] textBounds;
    private final boolean[] rendered;
    private final boolean[] outOfFlow;
    private final double[] maxContent;
    private final FlexLayout flex;

    LayoutPass(Document document, List<ComputedStyle> styles, TextMetrics metrics) {
        this.document = document;
        this.styles = styles;
        this.metrics = metrics;
        int n = document.size();
        this.displays = new Display[n];
        this.subtreeEnd = new int[n];
        this.boxes = new Box[n];
        this.textBounds = new Rect[n];
        this.rendered = new boolean[n];
        this.outOfFlow = new boolean[n];
        this.maxContent = new double[n];
        Arrays.fill(maxContent, Double.NaN);
        for (int i = 0; i < n; i++) {
            displays[i] = Display.of(styles.get(i).getDisplay());
            String position = styles.get(i).getKeyword(Property.POSITION);
            outOfFlow[i] = i > 0 && ("absolute".equals(position) || "fixed".equals(position));
        }
        for (int i = n - 1; i >= 0; i--) {
            Element e = document.element(i);
            int count = e.getChildCount();
            subtreeEnd[i] = count == 0 ? i + 1 : subtreeEnd[e.getChildren().get(count - 1).getIndex()];
        }
        this.flex = new FlexLayout(this);
    }

    LayoutTree run(double viewportWidth, double viewportHeight) {
        if (displays[0] == Display.NONE) {
            collapse(0, 0, 0);
        } else {
            layout(0, 0, 0, viewportWidth, viewportHeight, Constraint.block(viewportWidth));
            applyPositioning(viewportWidth, viewportHeight);
        }
        List<LayoutNode> nodes = new ArrayList<>(document.size());
        for (int i = 0; i < document.size(); i++) {
            nodes.add(new LayoutNode(document.element(i), styles.get(i), displays[i], boxes[i], textBounds[i], rendered[i]));
        }
        return new LayoutTree(document, nodes, viewportWidth, viewportHeight);
    }

    /**
     * Lays out element {@code i} and its subtree with the element's margin box at {@code (x, y)}.
     *
     * @param cbWidth  containing block width for percentages
     * @param cbHeight containing block height for percentages, {@code NaN} when indefinite
     */
    void layout(int i, double x, double y, double cbWidth, double cbHeight, Constraint c) {
        ComputedStyle s = styles.get(i);
        rendered[i] = true;
        Edges margin = margin(s, cbWidth);
        Edges padding = padding(s, cbWidth);
        Edges border = border(s);
        double pbH = padding.getHorizontal() + border.getHorizontal();
        double pbV = padding.getVertical() + border.getVertical();
        boolean borderBox = isBorderBox(s);

        double contentW;
        if (!Double.isNaN(c.forcedWidth)) {
            contentW = c.forcedWidth - pbH;
        } else {
            Length width = s.getLength(Property.WIDTH);
            if (!width.isAuto()) {
                contentW = width.resolve(cbWidth, 0) - (borderBox ? pbH : 0);
            } else if (c.shrinkToFit) {
                contentW = Math.min(maxContentWidth(i), c.availableWidth - margin.getHorizontal() - pbH);
            } else {
                contentW = c.availableWidth - margin.getHorizontal() - pbH;
            }
            contentW = clamp(contentW,
                    minSize(s.getLength(Property.MIN_WIDTH), cbWidth, pbH, borderBox),
                    maxSize(s.getLength(Property.MAX_WIDTH), cbWidth, pbH, borderBox));
        }
        contentW = Math.max(0, contentW);

        if (c.centerAutoMargins) {
            margin = distributeAutoMargins(s, margin, c.availableWidth - contentW - pbH - margin.getHorizontal());
        }

        double definiteH = Double.NaN;
        if (!Double.isNaN(c.forcedHeight)) {
            definiteH = Math.max(0, c.forcedHeight - pbV);
        } else {
            Length height = s.getLength(Property.HEIGHT);
            if (!height.isAuto()) {
                definiteH = Math.max(0, clampHeight(s, height.resolve(cbHeight, 0) - (borderBox ? pbV : 0),
                        cbHeight, pbV, borderBox));
            }
        }

        double cx = x + margin.getLeft() + border.getLeft() + padding.getLeft();
        double cy = y + margin.getTop() + border.getTop() + padding.getTop();

        double autoH = displays[i].isFlexContainer()
                ? flex.layout(i, cx, cy, contentW, definiteH)
                : flow(i, cx, cy, contentW, definiteH);
        double contentH = Double.isNaN(definiteH)
                ? Math.max(0, clampHeight(s, autoH, cbHeight, pbV, borderBox))
                : definiteH;

        boxes[i] = Box.of(new Rect(cx, cy, contentW, contentH), padding, border, margin);
    }

    /**
     * Block and inline-block flow of the children of {@code i} inside its content box.
     *
     * @return height used by the children
     */
    private double flow(int i, double cx, double cy, double contentW, double definiteH) {
        Element e = document.element(i);
        ComputedStyle s = styles.get(i);
        Line line = new Line(i, cx, contentW, s.getKeyword(Property.TEXT_ALIGN));
        double cursor = cy;

        String text = e.getTextContent();
        if (!text.isEmpty()) {
            double lineHeight = metrics.lineHeight(s);
            double textWidth = metrics.textWidth(text, s);
            if (textWidth <= contentW) {
                line.add(-1, textWidth, lineHeight);
            } else {
                List<String> lines = metrics.breakLines(text, s, contentW);
                double widest = 0;
                for (String l : lines) {
                    widest = Math.max(widest, metrics.textWidth(l, s));
                }
                line.add(-1, widest, lines.size() * lineHeight);
            }
        }

        for (Element child : e.getChildren()) {
            int c = child.getIndex();
            Display d = displays[c];
            if (d == Display.NONE) {
                collapse(c, cx, cy);
                continue;
            }
            if (outOfFlow[c]) {
                // static position; moved by applyPositioning
                layout(c, cx, cursor, contentW, definiteH, Constraint.inline(contentW));
                continue;
            }
            if (d.isInlineLevel()) {
                layout(c, 0, 0, contentW, definiteH, Constraint.inline(contentW));
                Rect marginBox = boxes[c].getMarginBox();
                if (!line.isEmpty() && line.used + marginBox.getWidth() > contentW) {
                    cursor = line.flush(cursor);
                }
                line.add(c, marginBox.getWidth(), marginBox.getHeight());
            } else {
                cursor = line.flush(cursor);
                layout(c, cx, cursor, contentW, definiteH, Constraint.block(contentW));
                cursor += boxes[c].getMarginBox().getHeight();
            }
        }
        cursor = line.flush(cursor);
        return cursor - cy;
    }

    /**
     * Max-content width of the content box of {@code i}: no wrapping of text or inline-level children.
     */
    double maxContentWidth(int i) {
        if (!Double.isNaN(maxContent[i])) {
            return maxContent[i];
        }
        Element e = document.element(i);
        ComputedStyle s = styles.get(i);
        String text = e.getTextContent();
        double textWidth = text.isEmpty() ? 0 : metrics.textWidth(text, s);

        double result;
        if (displays[i].isFlexContainer()) {
            boolean row = s.getKeyword(Property.FLEX_DIRECTION).startsWith("row");
            Length gap = s.getLength(Property.COLUMN_GAP);
            double sum = textWidth;
            double max = textWidth;
            int count = text.isEmpty() ? 0 : 1;
            for (Element child : e.getChildren()) {
                int c = child.getIndex();
                if (displays[c] == Display.NONE || outOfFlow[c]) {
                    continue;
                }
                double outer = outerMaxContentWidth(c);
                sum += outer;
                max = Math.max(max, outer);
                count++;
            }
            result = row ? sum + (gap.isPx() ? gap.getValue() : 0) * Math.max(0, count - 1) : max;
        } else {
            double line = textWidth;
            double best = 0;
            for (Element child : e.getChildren()) {
                int c = child.getIndex();
                if (displays[c] == Display.NONE || outOfFlow[c]) {
                    continue;
                }
                double outer = outerMaxContentWidth(c);
                if (displays[c].isInlineLevel()) {
                    line += outer;
                } else {
                    best = Math.max(best, Math.max(line, outer));
                    line = 0;
                }
            }
            result = Math.max(best, line);
        }
        maxContent[i] = result;
        return result;
    }

    private double outerMaxContentWidth(int i) {
        ComputedStyle s = styles.get(i);
        Edges margin = margin(s, Double.NaN);
        Edges padding = padding(s, Double.NaN);
        Edges border = border(s);
        double pb = padding.getHorizontal() + border.getHorizontal();
        boolean borderBox = isBorderBox(s);
        Length width = s.getLength(Property.WIDTH);
        double content = width.isPx() ? width.getValue() - (borderBox ? pb : 0) : maxContentWidth(i);
        content = clamp(content,
                minSize(s.getLength(Property.MIN_WIDTH), Double.NaN, pb, borderBox),
                maxSize(s.getLength(Property.MAX_WIDTH), Double.NaN, pb, borderBox));
        return Math.max(0, content) + pb + margin.getHorizontal();
    }

    /**
     * Gives the subtree of {@code i} zero-size boxes at {@code (x, y)}.
     */
    void collapse(int i, double x, double y) {
        for (int j = i; j < subtreeEnd[i]; j++) {
            boxes[j] = Box.empty(x, y);
            textBounds[j] = null;
            rendered[j] = false;
        }
    }

    /**
     * Moves the laid-out subtree of {@code i}.
     */
    void translate(int i, double dx, double dy) {
        if (dx == 0 && dy == 0) {
            return;
        }
        for (int j = i; j < subtreeEnd[i]; j++) {
            boxes[j] = boxes[j].translate(dx, dy);
            if (textBounds[j] != null) {
                textBounds[j] = textBounds[j].translate(dx, dy);
            }
        }
    }

    /**
     * Applies {@code position} offsets once every box is in its final place. Runs in document order so
     * containing blocks have already moved.
     * <ul>
     *   <li>{@code relative}: shifted by {@code left}/{@code top} (or {@code -right}/{@code -bottom}),
     *       percentages against the parent's content box;</li>
     *   <li>{@code absolute}: placed in the padding box of the nearest positioned ancestor, or the viewport;</li>
     *   <li>{@code fixed}: placed in the viewport.</li>
     * </ul>
     * Absolute and fixed boxes keep their static position on an axis where both offsets are {@code auto}.
     */
    private void applyPositioning(double viewportWidth, double viewportHeight) {
        for (int i = 0; i < boxes.length; i++) {
            if (!rendered[i]) {
                continue;
            }
            ComputedStyle s = styles.get(i);
            switch (s.getKeyword(Property.POSITION)) {
                case "relative": {
                    Element parent = document.element(i).getParent();
                    double baseW = parent == null ? viewportWidth : boxes[parent.getIndex()].getContentBox().getWidth();
                    double baseH = parent == null ? viewportHeight : boxes[parent.getIndex()].getContentBox().getHeight();
                    translate(i,
                            relativeOffset(s.getLength(Property.LEFT), s.getLength(Property.RIGHT), baseW),
                            relativeOffset(s.getLength(Property.TOP), s.getLength(Property.BOTTOM), baseH));
                    break;
                }
                case "absolute":
                    if (outOfFlow[i]) {
                        Rect cb = positionedAncestorPaddingBox(i);
                        if (cb == null) {
                            place(i, 0, 0, viewportWidth, viewportHeight);
                        } else {
                            place(i, cb.getX(), cb.getY(), cb.getWidth(), cb.getHeight());
                        }
                    }
                    break;
                case "fixed":
                    if (outOfFlow[i]) {
                        place(i, 0, 0, viewportWidth, viewportHeight);
                    }
                    break;
                default:
                    break;
            }
        }
    }

    private static double relativeOffset(Length start, Length end, double base) {
        if (!start.isAuto()) {
            return start.resolve(base, 0);
        }
        if (!end.isAuto()) {
            return -end.resolve(base, 0);
        }
        return 0;
    }

    private Rect positionedAncestorPaddingBox(int i) {
        for (Element p = document.element(i).getParent(); p != null; p = p.getParent()) {
            if (!"static".equals(styles.get(p.getIndex()).getKeyword(Property.POSITION))) {
                return boxes[p.getIndex()].getPaddingBox();
            }
        }
        return null;
    }

    /**
     * Moves the margin box of {@code i} inside the containing block {@code (cbX, cbY, cbW, cbH)};
     * {@code cbH} is {@code NaN} for an unbounded viewport.
     */
    private void place(int i, double cbX, double cbY, double cbW, double cbH) {
        ComputedStyle s = styles.get(i);
        Rect marginBox = boxes[i].getMarginBox();
        Length left = s.getLength(Property.LEFT);
        Length right = s.getLength(Property.RIGHT);
        Length top = s.getLength(Property.TOP);
        Length bottom = s.getLength(Property.BOTTOM);

        double x = marginBox.getX();
        if (!left.isAuto()) {
            x = cbX + left.resolve(cbW, 0);
        } else if (!right.isAuto()) {
            x = cbX + cbW - right.resolve(cbW, 0) - marginBox.getWidth();
        }
        double y = marginBox.getY();
        if (!top.isAuto()) {
            y = cbY + top.resolve(cbH, 0);
        } else if (!bottom.isAuto() && !Double.isNaN(cbH)) {
            y = cbY + cbH - bottom.resolve(cbH, 0) - marginBox.getHeight();
        }
        translate(i, x - marginBox.getX(), y - marginBox.getY());
    }

    /**
     * Whether laying out {@code i} at a forced height equal to its auto height could give a different result:
     * a min/max height is set, or percentages inside it resolve against its height.
     */
    boolean dependsOnDefiniteHeight(int i) {
        ComputedStyle s = styles.get(i);
        Length minHeight = s.getLength(Property.MIN_HEIGHT);
        if (!(minHeight.isAuto() || (minHeight.isPx() && minHeight.getValue() == 0))
                || !s.getLength(Property.MAX_HEIGHT).isNone()) {
            return true;
        }
        boolean flexContainer = displays[i].isFlexContainer();
        if (flexContainer && (s.getLength(Property.ROW_GAP).isPercent() || s.getLength(Property.COLUMN_GAP).isPercent())) {
            return true;
        }
        for (Element child : document.element(i).getChildren()) {
            ComputedStyle cs = styles.get(child.getIndex());
            if (cs.getLength(Property.HEIGHT).isPercent()
                    || cs.getLength(Property.MIN_HEIGHT).isPercent()
                    || cs.getLength(Property.MAX_HEIGHT).isPercent()
                    || (flexContainer && cs.getLength(Property.FLEX_BASIS).isPercent())) {
                return true;
            }
        }
        return false;
    }

    boolean isOutOfFlow(int i) {
        return outOfFlow[i];
    }

    Element element(int i) {
        return document.element(i);
    }

    ComputedStyle style(int i) {
        return styles.get(i);
    }

    Display display(int i) {
        return displays[i];
    }

    Box box(int i) {
        return boxes[i];
    }

    TextMetrics metrics() {
        return metrics;
    }

    void setTextBounds(int i, Rect bounds) {
        textBounds[i] = bounds;
    }

    static Edges margin(ComputedStyle s, double cbWidth) {
        return new Edges(
                s.getLength(Property.MARGIN_TOP).resolve(cbWidth, 0),
                s.getLength(Property.MARGIN_RIGHT).resolve(cbWidth, 0),
                s.getLength(Property.MARGIN_BOTTOM).resolve(cbWidth, 0),
                s.getLength(Property.MARGIN_LEFT).resolve(cbWidth, 0)
        );
    }

    static Edges padding(ComputedStyle s, double cbWidth) {
        return new Edges(
                s.getLength(Property.PADDING_TOP).resolve(cbWidth, 0),
                s.getLength(Property.PADDING_RIGHT).resolve(cbWidth, 0),
                s.getLength(Property.PADDING_BOTTOM).resolve(cbWidth, 0),
                s.getLength(Property.PADDING_LEFT).resolve(cbWidth, 0)
        );
    }

    static Edges border(ComputedStyle s) {
        return new Edges(
                s.getLength(Property.BORDER_TOP_WIDTH).getValue(),
                s.getLength(Property.BORDER_RIGHT_WIDTH).getValue(),
                s.getLength(Property.BORDER_BOTTOM_WIDTH).getValue(),
                s.getLength(Property.BORDER_LEFT_WIDTH).getValue()
        );
    }

    static boolean isBorderBox(ComputedStyle s) {
        return "border-box".equals(s.getKeyword(Property.BOX_SIZING));
    }

    /**
     * Content-box size for a {@code min-*} value; {@code auto} and unresolvable percentages give 0.
     */
    static double minSize(Length min, double base, double pb, boolean borderBox) {
        if (min.isAuto() || min.isNone()) {
            return 0;
        }
        return Math.max(0, min.resolve(base, 0) - (borderBox ? pb : 0));
    }

    /**
     * Content-box size for a {@code max-*} value; {@code none} and unresolvable percentages give infinity.
     */
    static double maxSize(Length max, double base, double pb, boolean borderBox) {
        if (max.isNone() || max.isAuto() || (max.isPercent() && Double.isNaN(base))) {
            return Double.POSITIVE_INFINITY;
        }
        return Math.max(0, max.resolve(base, 0) - (borderBox ? pb : 0));
    }

    /**
     * Clamps into {@code [min, max]}; when the bounds conflict, {@code min} wins.
     */
    static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static double clampHeight(ComputedStyle s, double value, double cbHeight, double pbV, boolean borderBox) {
        return clamp(value,
                minSize(s.getLength(Property.MIN_HEIGHT), cbHeight, pbV, borderBox),
                maxSize(s.getLength(Property.MAX_HEIGHT), cbHeight, pbV, borderBox));
    }

    private static Edges distributeAutoMargins(ComputedStyle s, Edges margin, double free) {
        boolean left = s.getLength(Property.MARGIN_LEFT).isAuto();
        boolean right = s.getLength(Property.MARGIN_RIGHT).isAuto();
        if (free <= 0 || (!left && !right)) {
            return margin;
        }
        if (left && right) {
            return margin.withLeftRight(margin.getLeft() + free / 2, margin.getRight() + free / 2);
        }
        if (left) {
            return margin.withLeftRight(margin.getLeft() + free, margin.getRight());
        }
        return margin.withLeftRight(margin.getLeft(), margin.getRight() + free);
    }

    /**
     * Sizing mode for one element.
     */
    static final class Constraint {
        final double availableWidth;
        final boolean shrinkToFit;
        final boolean centerAutoMargins;
        final double forcedWidth;
        final double forcedHeight;

        private Constraint(double availableWidth, boolean shrinkToFit, boolean centerAutoMargins,
                           double forcedWidth, double forcedHeight) {
            this.availableWidth = availableWidth;
            this.shrinkToFit = shrinkToFit;
            this.centerAutoMargins = centerAutoMargins;
            this.forcedWidth = forcedWidth;
            this.forcedHeight = forcedHeight;
        }

        /**
         * Block-level box: auto width fills the available width, auto margins center.
         */
        static Constraint block(double availableWidth) {
            return new Constraint(availableWidth, false, true, Double.NaN, Double.NaN);
        }

        /**
         * Inline-level box: auto width shrinks to fit.
         */
        static Constraint inline(double availableWidth) {
            return new Constraint(availableWidth, true, false, Double.NaN, Double.NaN);
        }

        /**
         * Flex item: border-box sizes decided by the container; {@code NaN} leaves a dimension to the item.
         */
        static Constraint forced(double availableWidth, double borderWidth, double borderHeight) {
            return new Constraint(availableWidth, true, false, borderWidth, borderHeight);
        }
    }

    /**
     * Inline-level boxes of one line, placed when the line is complete.
     */
    private final class Line {
        private final int owner;
        private final double x;
        private final double width;
        private final String align;
        private final List<double[]> items = new ArrayList<>();
        private double used;

        Line(int owner, double x, double width, String align) {
            this.owner = owner;
            this.x = x;
            this.width = width;
            this.align = align;
        }

        boolean isEmpty() {
            return items.isEmpty();
        }

        /**
         * @param index element index, or -1 for the owner's text
         */
        void add(int index, double w, double h) {
            items.add(new double[]{index, w, h});
            used += w;
        }

        /**
         * Places the line's boxes at {@code y} and starts a new line.
         *
         * @return y below the line
         */
        double flush(double y) {
            if (items.isEmpty()) {
                return y;
            }
            double height = 0;
            for (double[] item : items) {
                height = Math.max(height, item[2]);
            }
            double offset;
            switch (align) {
                case "right":
                case "end":
                    offset = width - used;
                    break;
                case "center":
                    offset = (width - used) / 2;
                    break;
                default:
                    offset = 0;
                    break;
            }
            double ix = x + Math.max(0, offset);
            for (double[] item : items) {
                int index = (int) item[0];
                if (index < 0) {
                    textBounds[owner] = new Rect(ix, y, item[1], item[2]);
                } else {
                    translate(index, ix, y);
                }
                ix += item[1];
            }
            items.clear();
            used = 0;
            return y + height;
        }
    }
}

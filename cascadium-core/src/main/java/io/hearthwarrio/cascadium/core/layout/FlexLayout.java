package io.hearthwarrio.cascadium.core.layout;

import io.hearthwarrio.cascadium.core.dom.Element;
import io.hearthwarrio.cascadium.core.style.ComputedStyle;
import io.hearthwarrio.cascadium.core.style.Length;
import io.hearthwarrio.cascadium.core.style.Property;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Single-line flexbox layout.
 * <p>
 * Sizes are handled as border-box sizes along the main axis. Free space is distributed by {@code flex-grow}
 * or {@code flex-shrink}; items whose target violates {@code min-*}/{@code max-*} are frozen at the bound and
 * the remaining space is distributed again, which ends after at most one round per item.
 */
final class FlexLayout {

    private static final double EPSILON = 1e-9;

    private final LayoutPass pass;

    FlexLayout(LayoutPass pass) {
        this.pass = pass;
    }

    /**
     * Lays out the children of a flex container inside its content box.
     *
     * @return content height used by the items
     */
    double layout(int container, double cx, double cy, double contentW, double definiteH) {
        ComputedStyle cs = pass.style(container);
        String direction = cs.getKeyword(Property.FLEX_DIRECTION);
        boolean row = direction.startsWith("row");
        boolean reverse = direction.endsWith("reverse");
        double mainSize = row ? contentW : definiteH;
        double crossSize = row ? definiteH : contentW;
        double gap = cs.getLength(row ? Property.COLUMN_GAP : Property.ROW_GAP).resolve(mainSize, 0);
        String alignItems = cs.getKeyword(Property.ALIGN_ITEMS);

        Element element = pass.element(container);
        List<Item> items = new ArrayList<>();
        String text = element.getTextContent();
        if (!text.isEmpty()) {
            double textWidth = pass.metrics().textWidth(text, cs);
            double lineHeight = pass.metrics().lineHeight(cs);
            items.add(Item.text(row ? textWidth : lineHeight, row ? lineHeight : textWidth));
        }
        for (Element child : element.getChildren()) {
            int c = child.getIndex();
            if (pass.display(c) == Display.NONE) {
                pass.collapse(c, cx, cy);
                continue;
            }
            if (pass.isOutOfFlow(c)) {
                pass.layout(c, cx, cy, contentW, definiteH, LayoutPass.Constraint.inline(contentW));
                continue;
            }
            items.add(createItem(c, row, mainSize, crossSize, contentW, definiteH, alignItems));
        }
        items.sort(Comparator.comparingInt(it -> it.order));
        if (items.isEmpty()) {
            return row && !Double.isNaN(crossSize) ? crossSize : 0;
        }

        double gaps = gap * (items.size() - 1);
        if (Double.isNaN(mainSize)) {
            for (Item it : items) {
                it.target = it.hypothetical;
            }
        } else {
            resolveFlexibleLengths(items, mainSize - gaps);
        }

        for (Item it : items) {
            if (it.index < 0) {
                continue;
            }
            if (it.measured && same(it.target, it.measuredMain) && same(it.cross, it.measuredCross)) {
                // the measuring layout already has the final size
                Rect borderBox = pass.box(it.index).getBorderBox();
                it.cross = row ? borderBox.getHeight() : borderBox.getWidth();
            } else {
                layoutItem(it, row, contentW, definiteH, it.cross);
            }
        }

        double lineCross = crossSize;
        if (Double.isNaN(lineCross)) {
            lineCross = 0;
            for (Item it : items) {
                lineCross = Math.max(lineCross, it.cross + it.crossMargins());
            }
            for (Item it : items) {
                if (it.index >= 0 && !it.explicitCross && "stretch".equals(it.align)) {
                    double stretched = LayoutPass.clamp(lineCross - it.crossMargins(), it.minCross, it.maxCross);
                    if (Math.abs(stretched - it.cross) > EPSILON) {
                        layoutItem(it, row, contentW, definiteH, stretched);
                    }
                }
            }
        }

        double used = gaps;
        for (Item it : items) {
            used += it.target + it.mainMargins();
        }
        double effectiveMain = Double.isNaN(mainSize) ? used : mainSize;
        double free = effectiveMain - used;
        double start = 0;
        double between = gap;
        int n = items.size();
        switch (cs.getKeyword(Property.JUSTIFY_CONTENT)) {
            case "flex-end":
                start = free;
                break;
            case "center":
                start = free / 2;
                break;
            case "space-between":
                if (free > 0 && n > 1) {
                    between = gap + free / (n - 1);
                }
                break;
            case "space-around":
                if (free > 0) {
                    start = free / n / 2;
                    between = gap + free / n;
                } else {
                    start = free / 2;
                }
                break;
            case "space-evenly":
                if (free > 0) {
                    start = free / (n + 1);
                    between = gap + free / (n + 1);
                } else {
                    start = free / 2;
                }
                break;
            default:
                break;
        }

        double pos = start;
        for (Item it : items) {
            double main = reverse
                    ? effectiveMain - pos - it.marginMainEnd - it.target
                    : pos + it.marginMainStart;
            pos += it.mainMargins() + it.target + between;

            double outerCross = it.cross + it.crossMargins();
            double cross;
            switch (it.align) {
                case "flex-end":
                    cross = lineCross - outerCross + it.marginCrossStart;
                    break;
                case "center":
                    cross = (lineCross - outerCross) / 2 + it.marginCrossStart;
                    break;
                default:
                    cross = it.marginCrossStart;
                    break;
            }

            double bx = cx + (row ? main : cross);
            double by = cy + (row ? cross : main);
            if (it.index < 0) {
                pass.setTextBounds(container, new Rect(bx, by, row ? it.target : it.cross, row ? it.cross : it.target));
            } else {
                Rect borderBox = pass.box(it.index).getBorderBox();
                pass.translate(it.index, bx - borderBox.getX(), by - borderBox.getY());
            }
        }

        return row ? lineCross : effectiveMain;
    }

    private Item createItem(int c, boolean row, double mainSize, double crossSize,
                            double contentW, double definiteH, String alignItems) {
        ComputedStyle s = pass.style(c);
        Edges margin = LayoutPass.margin(s, contentW);
        Edges padding = LayoutPass.padding(s, contentW);
        Edges border = LayoutPass.border(s);
        boolean borderBox = LayoutPass.isBorderBox(s);
        double pbW = padding.getHorizontal() + border.getHorizontal();
        double pbH = padding.getVertical() + border.getVertical();

        Item it = new Item(c);
        it.order = (int) s.getNumber(Property.ORDER);
        it.grow = s.getNumber(Property.FLEX_GROW);
        it.shrink = s.getNumber(Property.FLEX_SHRINK);
        it.marginMainStart = row ? margin.getLeft() : margin.getTop();
        it.marginMainEnd = row ? margin.getRight() : margin.getBottom();
        it.marginCrossStart = row ? margin.getTop() : margin.getLeft();
        it.marginCrossEnd = row ? margin.getBottom() : margin.getRight();
        double pbMain = row ? pbW : pbH;
        double pbCross = row ? pbH : pbW;

        String alignSelf = s.getKeyword(Property.ALIGN_SELF);
        it.align = "auto".equals(alignSelf) ? alignItems : alignSelf;

        it.minMain = LayoutPass.minSize(s.getLength(row ? Property.MIN_WIDTH : Property.MIN_HEIGHT),
                mainSize, pbMain, borderBox) + pbMain;
        it.maxMain = LayoutPass.maxSize(s.getLength(row ? Property.MAX_WIDTH : Property.MAX_HEIGHT),
                mainSize, pbMain, borderBox) + pbMain;
        it.minCross = LayoutPass.minSize(s.getLength(row ? Property.MIN_HEIGHT : Property.MIN_WIDTH),
                crossSize, pbCross, borderBox) + pbCross;
        it.maxCross = LayoutPass.maxSize(s.getLength(row ? Property.MAX_HEIGHT : Property.MAX_WIDTH),
                crossSize, pbCross, borderBox) + pbCross;

        Length crossLength = s.getLength(row ? Property.HEIGHT : Property.WIDTH);
        it.explicitCross = !crossLength.isAuto();
        if (it.explicitCross) {
            it.cross = LayoutPass.clamp(crossLength.resolve(crossSize, 0) + (borderBox ? 0 : pbCross),
                    it.minCross, it.maxCross);
        } else if ("stretch".equals(it.align) && !Double.isNaN(crossSize)) {
            it.cross = LayoutPass.clamp(crossSize - it.crossMargins(), it.minCross, it.maxCross);
        } else {
            it.cross = Double.NaN;
        }

        Length basis = s.getLength(Property.FLEX_BASIS);
        Length mainLength = s.getLength(row ? Property.WIDTH : Property.HEIGHT);
        if (!basis.isAuto() && basis.isDefinite(mainSize)) {
            it.base = basis.resolve(mainSize, 0) + (borderBox ? 0 : pbMain);
        } else if (!mainLength.isAuto() && mainLength.isDefinite(mainSize)) {
            it.base = mainLength.resolve(mainSize, 0) + (borderBox ? 0 : pbMain);
        } else if (row) {
            it.base = pass.maxContentWidth(c) + pbMain;
        } else {
            layoutItem(it, false, contentW, definiteH, Double.NaN, it.cross);
            it.base = pass.box(c).getBorderBox().getHeight();
            it.measured = !pass.dependsOnDefiniteHeight(c);
            it.measuredMain = it.base;
            it.measuredCross = it.cross;
        }
        it.base = Math.max(pbMain, it.base);
        it.hypothetical = LayoutPass.clamp(it.base, it.minMain, it.maxMain);
        return it;
    }

    private static void resolveFlexibleLengths(List<Item> items, double available) {
        double hypotheticalTotal = 0;
        for (Item it : items) {
            hypotheticalTotal += it.hypothetical + it.mainMargins();
        }
        boolean growing = hypotheticalTotal < available;
        for (Item it : items) {
            double factor = growing ? it.grow : it.shrink;
            it.frozen = factor == 0
                    || Math.abs(hypotheticalTotal - available) < EPSILON
                    || (growing && it.base > it.hypothetical)
                    || (!growing && it.base < it.hypothetical);
            it.target = it.hypothetical;
        }

        for (int round = 0; round <= items.size(); round++) {
            double used = 0;
            double factors = 0;
            boolean anyUnfrozen = false;
            for (Item it : items) {
                used += it.mainMargins() + (it.frozen ? it.target : it.base);
                if (!it.frozen) {
                    factors += growing ? it.grow : it.shrink;
                    anyUnfrozen = true;
                }
            }
            if (!anyUnfrozen) {
                return;
            }
            double free = available - used;
            double totalViolation = 0;
            for (Item it : items) {
                if (it.frozen) {
                    continue;
                }
                double factor = growing ? it.grow : it.shrink;
                double target = it.base + free * factor / factors;
                double clamped = LayoutPass.clamp(target, it.minMain, it.maxMain);
                it.violation = clamped - target;
                it.target = clamped;
                totalViolation += it.violation;
            }
            for (Item it : items) {
                if (it.frozen) {
                    continue;
                }
                if (Math.abs(totalViolation) < EPSILON
                        || (totalViolation > 0 && it.violation > 0)
                        || (totalViolation < 0 && it.violation < 0)) {
                    it.frozen = true;
                }
            }
        }
    }

    private static boolean same(double a, double b) {
        return Double.isNaN(a) ? Double.isNaN(b) : Math.abs(a - b) < EPSILON;
    }

    private void layoutItem(Item it, boolean row, double contentW, double definiteH, double cross) {
        layoutItem(it, row, contentW, definiteH, it.target, cross);
        Rect borderBox = pass.box(it.index).getBorderBox();
        it.cross = row ? borderBox.getHeight() : borderBox.getWidth();
    }

    private void layoutItem(Item it, boolean row, double contentW, double definiteH, double main, double cross) {
        double width = row ? main : cross;
        double height = row ? cross : main;
        pass.layout(it.index, 0, 0, contentW, definiteH, LayoutPass.Constraint.forced(contentW, width, height));
    }

    /**
     * Flex item state; {@code index} is -1 for the container's own text.
     */
    private static final class Item {
        final int index;
        int order;
        double grow;
        double shrink;
        double marginMainStart;
        double marginMainEnd;
        double marginCrossStart;
        double marginCrossEnd;
        String align = "flex-start";
        boolean explicitCross;
        double base;
        double hypothetical;
        double minMain;
        double maxMain = Double.POSITIVE_INFINITY;
        double minCross;
        double maxCross = Double.POSITIVE_INFINITY;
        double target;
        double cross;
        double violation;
        boolean frozen;
        boolean measured;
        double measuredMain;
        double measuredCross;

        Item(int index) {
            this.index = index;
        }

        static Item text(double main, double cross) {
            Item it = new Item(-1);
            it.base = main;
            it.hypothetical = main;
            it.cross = cross;
            it.explicitCross = true;
            return it;
        }

        double mainMargins() {
            return marginMainStart + marginMainEnd;
        }

        double crossMargins() {
            return marginCrossStart + marginCrossEnd;
        }
    }
}

package io.hearthwarrio.cascadium.core.layout;

/**
 * Renders a layout tree as indented text, one node per line.
 * <pre>
 * html block border=(0, 0, 800x116)
 *   body block border=(8, 8, 784x100) margin=[8 8 8 8]
 * </pre>
 */
public final class LayoutTreeDump {

    private LayoutTreeDump() {
    }

    public static String render(LayoutTree tree) {
        StringBuilder sb = new StringBuilder();
        render(tree, tree.root(), 0, sb);
        return sb.toString();
    }

    private static void render(LayoutTree tree, LayoutNode node, int depth, StringBuilder sb) {
        for (int i = 0; i < depth; i++) {
            sb.append("  ");
        }
        sb.append(node.getElement().describe())
                .append(' ')
                .append(node.getStyle().getDisplay());
        if (!node.isRendered()) {
            sb.append(" (not rendered)\n");
            return;
        }
        Box box = node.getBox();
        sb.append(" border=").append(box.getBorderBox());
        if (!box.getMargin().equals(Edges.ZERO)) {
            sb.append(" margin=").append(box.getMargin());
        }
        if (!box.getPadding().equals(Edges.ZERO)) {
            sb.append(" padding=").append(box.getPadding());
        }
        if (node.getTextBounds() != null) {
            sb.append(" text=").append(node.getTextBounds());
        }
        sb.append('\n');
        for (LayoutNode child : tree.children(node)) {
            render(tree, child, depth + 1, sb);
        }
    }
}

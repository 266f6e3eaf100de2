package io.hearthwarrio.cascadium.core.layout;

import io.hearthwarrio.cascadium.core.dom.Document;
import io.hearthwarrio.cascadium.core.style.CascadeResolver;
import io.hearthwarrio.cascadium.core.style.ComputedStyle;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.hearthwarrio.cascadium.core.layout.LayoutTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

public class LayoutTreeTest {

    private final Document doc = Document.builder("html")
            .open("div").id("panel")
                .open("span").id("icon").close()
                .open("span").id("ghost").close()
            .close()
            .open("div").id("gone").close()
            .build();

    private static final String CSS = "#panel { height: 100px }"
            + " span { display: inline-block; width: 50px; height: 50px }"
            + " #ghost { visibility: hidden }"
            + " #gone { display: none }";

    @Test
    void navigatesLikeTheDocument() {
        LayoutTree tree = layout(doc, CSS, 800, 600);
        LayoutNode panel = tree.node(doc.getElementById("panel"));

        assertSame(tree.root(), tree.parent(panel));
        assertNull(tree.parent(tree.root()));
        assertEquals(2, tree.children(panel).size());
        assertSame(tree.node(doc.getElementById("icon")), tree.children(panel).get(0));
        assertEquals(doc.size(), tree.nodes().size());
        assertEquals(800, tree.getViewportWidth());
    }

    @Test
    void rejectsElementsOfOtherDocuments() {
        LayoutTree tree = layout(doc, CSS, 800, 600);
        Document other = Document.builder("html").build();

        assertThrows(IllegalArgumentException.class, () -> tree.node(other.getRoot()));
    }

    @Test
    void hitTestPrefersDeepestVisibleNode() {
        LayoutTree tree = layout(doc, CSS, 800, 600);

        assertEquals("icon", tree.hitTest(10, 10).getElement().getId());
        assertEquals("panel", tree.hitTest(60, 10).getElement().getId());
        assertEquals("panel", tree.hitTest(300, 90).getElement().getId());
        assertNull(tree.hitTest(10, 150));
        assertNull(tree.hitTest(-1, 10));
    }

    @Test
    void childrenStayInsideParentsContentBox() {
        LayoutTree tree = layout(doc, CSS + " #panel { padding: 7px; border: 1px solid }", 800, 600);

        for (LayoutNode node : tree.nodes()) {
            LayoutNode parent = tree.parent(node);
            if (parent == null || !node.isRendered()) {
                continue;
            }
            assertTrue(parent.getBox().getContentBox().encloses(node.getBox().getMarginBox()),
                    node.getElement().describe() + " escapes " + parent.getElement().describe());
        }
    }

    @Test
    void dumpListsEveryNodeIndented() {
        String dump = LayoutTreeDump.render(layout(doc, CSS, 800, 600));
        String[] lines = dump.split("\n");

        assertEquals(doc.size(), lines.length);
        assertEquals("html block border=(0, 0, 800x100)", lines[0]);
        assertEquals("  div#panel block border=(0, 0, 800x100)", lines[1]);
        assertEquals("    span#icon inline-block border=(0, 0, 50x50)", lines[2]);
        assertEquals("  div#gone none (not rendered)", lines[4]);
    }

    @Test
    void engineValidatesArguments() {
        LayoutEngine engine = new LayoutEngine();
        List<ComputedStyle> styles = new CascadeResolver(List.of()).resolve(doc);

        assertThrows(IllegalArgumentException.class, () -> engine.layout(doc, styles.subList(0, 2), 800, 600));
        assertThrows(IllegalArgumentException.class, () -> engine.layout(doc, styles, Double.NaN, 600));
        assertNotNull(engine.layout(doc, styles, 800, Double.NaN));
    }
}

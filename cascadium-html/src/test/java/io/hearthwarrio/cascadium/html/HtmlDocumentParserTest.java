package io.hearthwarrio.cascadium.html;

import io.hearthwarrio.cascadium.core.ReflowEngine;
import io.hearthwarrio.cascadium.core.dom.Document;
import io.hearthwarrio.cascadium.core.dom.Element;
import io.hearthwarrio.cascadium.core.layout.LayoutTree;
import io.hearthwarrio.cascadium.core.layout.Rect;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class HtmlDocumentParserTest {

    private static final String PAGE = "<!DOCTYPE html>\n" +
            "<html>\n" +
            "<head><title>Sample</title>\n" +
            "<style>#box { width: 100px; height: 40px; }</style>\n" +
            "</head>\n" +
            "<body>\n" +
            "<div id=\"box\" class=\"card wide\" data-role=\"panel\">Hello   <b>big</b> world</div>\n" +
            "<script>var ignored = '<p>';</script>\n" +
            "<style>.card { color: red; }</style>\n" +
            "</body>\n" +
            "</html>";

    private final HtmlDocumentParser parser = new HtmlDocumentParser();

    @Test
    void buildsElementTreeInDocumentOrder() {
        Document doc = parser.parseDocument(PAGE);

        assertEquals("html", doc.getRoot().getTagName());
        assertEquals("head", doc.element(1).getTagName());
        assertEquals("title", doc.element(2).getTagName());

        Element box = doc.getElementById("box");
        assertNotNull(box);
        assertEquals("body", box.getParent().getTagName());
        assertTrue(box.hasClass("card"));
        assertTrue(box.hasClass("wide"));
        assertEquals("panel", box.getAttribute("data-role"));
        assertEquals("b", box.getChildren().get(0).getTagName());
    }

    @Test
    void collapsesWhitespaceInText() {
        Element box = parser.parseDocument(PAGE).getElementById("box");

        assertEquals("Hello world", box.getTextContent());
        assertEquals("big", box.getChildren().get(0).getTextContent());
    }

    @Test
    void collectsStyleTextAndDropsScriptText() {
        HtmlPage page = parser.parse(PAGE);

        assertEquals(List.of("#box { width: 100px; height: 40px; }", ".card { color: red; }"), page.getStylesheets());

        Element script = null;
        for (Element e : page.getDocument().getElements()) {
            if ("script".equals(e.getTagName())) {
                script = e;
            }
        }
        assertNotNull(script);
        assertEquals("", script.getTextContent());
        assertTrue(script.getChildren().isEmpty());
    }

    @Test
    void insertsImpliedElementsForFragments() {
        Document doc = parser.parseDocument("<p id=x>unclosed<p id=y>second");

        assertEquals("html", doc.getRoot().getTagName());
        Element x = doc.getElementById("x");
        Element y = doc.getElementById("y");
        assertEquals("body", x.getParent().getTagName());
        assertSame(x, y.getPreviousSibling());
        assertEquals("second", y.getTextContent());
    }

    @Test
    void parsedPageCanBeLaidOut() {
        HtmlPage page = parser.parse(PAGE);

        LayoutTree tree = new ReflowEngine().reflow(page.getDocument(), page.getStylesheets(), 800, 600);

        Rect box = tree.node(page.getDocument().getElementById("box")).getBox().getBorderBox();
        assertEquals(8, box.getX(), 1e-6);
        assertEquals(8, box.getY(), 1e-6);
        assertEquals(100, box.getWidth(), 1e-6);
        assertEquals(40, box.getHeight(), 1e-6);
        assertFalse(tree.node(page.getDocument().element(1)).isRendered());
    }

    @Test
    void rejectsNullInput() {
        assertThrows(NullPointerException.class, () -> parser.parse(null));
    }
}

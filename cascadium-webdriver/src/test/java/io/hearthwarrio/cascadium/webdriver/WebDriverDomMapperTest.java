package io.hearthwarrio.cascadium.webdriver;

import io.hearthwarrio.cascadium.core.dom.Document;
import io.hearthwarrio.cascadium.core.dom.Element;
import io.hearthwarrio.cascadium.core.layout.Rect;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.hearthwarrio.cascadium.webdriver.SnapshotFixtures.attrs;
import static org.junit.jupiter.api.Assertions.*;

public class WebDriverDomMapperTest {

    private Map<String, Object> sample() {
        return new SnapshotFixtures()
                .element("html", 0, attrs(), "\n", 0L, 0L, 800L, 120L)
                .element("body", 1, attrs("class", "page"), "", 8L, 8L, 784L, 104L)
                .element("div", 2, attrs("id", "a", "class", "card wide"), "  Hello\n world ", 8L, 8L, 100.5, 50L)
                .element("span", 3, attrs(), "inner", 8L, 8L, 20L, 19.2)
                .element("p", 2, attrs("style", "color: red"), "para", 8L, 58L, 784L, 20L)
                .stylesheet("#a { width: 100px; }")
                .viewport(800L, 600.5)
                .build();
    }

    @Test
    void rebuildsTreeFromDepths() {
        PageSnapshot snapshot = WebDriverDomMapper.fromScriptResult(sample());
        Document doc = snapshot.getDocument();

        assertEquals(5, doc.size());
        Element body = doc.element(1);
        Element div = doc.getElementById("a");
        Element p = doc.element(4);

        assertEquals("body", body.getTagName());
        assertSame(body, div.getParent());
        assertSame(body, p.getParent());
        assertSame(div, doc.element(3).getParent());
        assertSame(div, p.getPreviousSibling());
    }

    @Test
    void copiesAttributesAndText() {
        Document doc = WebDriverDomMapper.fromScriptResult(sample()).getDocument();
        Element div = doc.getElementById("a");

        assertTrue(div.hasClass("card"));
        assertTrue(div.hasClass("wide"));
        assertEquals("Hello world", div.getTextContent());
        assertEquals("color: red", doc.element(4).getInlineStyle());
        assertEquals("", doc.getRoot().getTextContent());
    }

    @Test
    void keepsBrowserBoxesStylesheetsAndViewport() {
        PageSnapshot snapshot = WebDriverDomMapper.fromScriptResult(sample());

        assertEquals(List.of("#a { width: 100px; }"), snapshot.getStylesheets());
        assertEquals(800, snapshot.getViewportWidth(), 1e-9);
        assertEquals(600.5, snapshot.getViewportHeight(), 1e-9);

        Rect div = snapshot.getBrowserBox(2);
        assertEquals(8, div.getX(), 1e-9);
        assertEquals(100.5, div.getWidth(), 1e-9);
        assertEquals(19.2, snapshot.getBrowserBox(3).getHeight(), 1e-9);
    }

    @Test
    void snapshotUsesDriverScript() {
        WebDriverDomMapper mapper = new WebDriverDomMapper(SnapshotFixtures.scriptedDriver(sample()));

        assertEquals(5, mapper.snapshot().getDocument().size());
    }

    @Test
    void rejectsMalformedResults() {
        assertThrows(DomSnapshotException.class, () -> WebDriverDomMapper.fromScriptResult(null));
        assertThrows(DomSnapshotException.class, () -> WebDriverDomMapper.fromScriptResult(new SnapshotFixtures().build()));

        Map<String, Object> skipped = new SnapshotFixtures()
                .element("html", 0, attrs(), "", 0L, 0L, 800L, 0L)
                .element("div", 2, attrs(), "", 0L, 0L, 800L, 0L)
                .build();
        assertThrows(DomSnapshotException.class, () -> WebDriverDomMapper.fromScriptResult(skipped));

        Map<String, Object> badRect = new SnapshotFixtures()
                .element("html", 0, attrs(), "", 0L, 0L, 800L)
                .build();
        assertThrows(DomSnapshotException.class, () -> WebDriverDomMapper.fromScriptResult(badRect));
    }

    @Test
    void rejectsNullDriver() {
        assertThrows(NullPointerException.class, () -> new WebDriverDomMapper(null));
    }
}

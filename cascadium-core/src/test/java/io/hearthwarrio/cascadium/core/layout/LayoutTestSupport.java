package io.hearthwarrio.cascadium.core.layout;

import io.hearthwarrio.cascadium.core.WarningSink;
import io.hearthwarrio.cascadium.core.css.Origin;
import io.hearthwarrio.cascadium.core.css.Stylesheet;
import io.hearthwarrio.cascadium.core.css.StylesheetParser;
import io.hearthwarrio.cascadium.core.dom.Document;
import io.hearthwarrio.cascadium.core.style.CascadeResolver;
import io.hearthwarrio.cascadium.core.style.PropertyRegistry;
import io.hearthwarrio.cascadium.core.style.StyleDeclarationProcessor;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Cascade + layout without user-agent defaults, so every element starts as an unstyled block.
 */
final class LayoutTestSupport {

    static final double EPS = 1e-6;

    private LayoutTestSupport() {
    }

    static LayoutTree layout(Document doc, String css, double width, double height) {
        Stylesheet sheet = new StylesheetParser(new StyleDeclarationProcessor(new PropertyRegistry()), WarningSink.IGNORE)
                .parse(css, Origin.STYLESHEET);
        return new LayoutEngine().layout(doc, new CascadeResolver(List.of(sheet)).resolve(doc), width, height);
    }

    static Rect border(LayoutTree tree, String id) {
        return tree.node(tree.getDocument().getElementById(id)).getBox().getBorderBox();
    }

    static void assertRect(double x, double y, double w, double h, Rect actual) {
        String message = "actual " + actual;
        assertEquals(x, actual.getX(), EPS, message);
        assertEquals(y, actual.getY(), EPS, message);
        assertEquals(w, actual.getWidth(), EPS, message);
        assertEquals(h, actual.getHeight(), EPS, message);
    }
}

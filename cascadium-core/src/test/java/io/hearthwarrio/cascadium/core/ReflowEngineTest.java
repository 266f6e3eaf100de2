package io.hearthwarrio.cascadium.core;

import io.hearthwarrio.cascadium.core.css.InteractionState;
import io.hearthwarrio.cascadium.core.css.Stylesheet;
import io.hearthwarrio.cascadium.core.css.StylesheetParseException;
import io.hearthwarrio.cascadium.core.dom.Document;
import io.hearthwarrio.cascadium.core.dom.Element;
import io.hearthwarrio.cascadium.core.layout.LayoutNode;
import io.hearthwarrio.cascadium.core.layout.LayoutTree;
import io.hearthwarrio.cascadium.core.style.Color;
import io.hearthwarrio.cascadium.core.style.PropertyRegistry;
import io.hearthwarrio.cascadium.core.style.Property;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ReflowEngineTest {

    private final Document doc = Document.builder("html")
            .open("body")
                .open("div").id("main").classes("card")
                    .open("p").text("Hello").close()
                    .open("button").id("ok").text("OK").close()
                .close()
            .close()
            .build();

    @Test
    void reflowPublishesLayoutWithUserAgentDefaults() {
        ReflowEngine engine = new ReflowEngine();
        assertNull(engine.getLastLayout());

        LayoutTree tree = engine.reflow(doc, ".card { padding: 4px }", 800, 600);

        assertSame(tree, engine.getLastLayout());
        LayoutNode body = tree.node(doc.element(1));
        assertEquals(8, body.getBox().getBorderBox().getX(), 1e-9);
        assertEquals(784, body.getBox().getBorderBox().getWidth(), 1e-9);
        LayoutNode main = tree.node(doc.getElementById("main"));
        assertEquals(12, main.getBox().getContentBox().getX(), 1e-9);
        assertTrue(engine.getLastWarnings().isEmpty());
    }

    @Test
    void reflowIsIdempotent() {
        ReflowEngine engine = new ReflowEngine();
        String css = "#main { display: flex } p { flex-grow: 1; margin: 0 } button { width: 60px }";

        LayoutTree first = engine.reflow(doc, css, 640, 480);
        LayoutTree second = engine.reflow(doc, css, 640, 480);

        assertNotSame(first, second);
        for (Element e : doc.getElements()) {
            assertEquals(first.node(e).getBox(), second.node(e).getBox(), e.describe());
            assertEquals(first.node(e).getStyle(), second.node(e).getStyle(), e.describe());
        }
    }

    @Test
    void malformedStylesheetStillAppliesRecoveredRules() {
        RecordingReflowLogger logger = new RecordingReflowLogger(ReflowLogDetail.SUMMARY);
        ReflowEngine engine = new ReflowEngine().withLogger(logger).withUserAgentStylesheet(false);

        LayoutTree tree = engine.reflow(doc, List.of("p { color: red } div { color: blue", "button { color: green }"),
                800, 600);

        assertEquals(1, logger.parseErrors.size());
        assertEquals(1, logger.parseErrors.get(0).getLine());
        assertEquals(Color.rgb(255, 0, 0), tree.node(doc.element(3)).getStyle().getColor(Property.COLOR));
        assertEquals(Color.BLACK, tree.node(doc.getElementById("main")).getStyle().getColor(Property.COLOR));
        assertEquals(Color.rgb(0, 128, 0), tree.node(doc.getElementById("ok")).getStyle().getColor(Property.COLOR));
        assertEquals(1, logger.stats.get(0).getParseErrorCount());
        assertEquals(2, logger.stats.get(0).getStylesheetCount());
    }

    @Test
    void warningsAreCollectedAndForwarded() {
        Document duplicated = Document.builder("html")
                .open("div").id("x").close()
                .open("div").id("x").close()
                .build();
        RecordingReflowLogger logger = new RecordingReflowLogger(ReflowLogDetail.NONE);
        ReflowEngine engine = new ReflowEngine().withLogger(logger);

        engine.reflow(duplicated, "div { width: wide; glow: 1 } a::after { color: red } @media print { }", 800, 600);

        List<UnresolvedReferenceWarning> warnings = engine.getLastWarnings();
        assertEquals(5, warnings.size());
        assertEquals(UnresolvedReferenceWarning.Kind.DUPLICATE_ID, warnings.get(0).getKind());
        assertEquals("x", warnings.get(0).getSubject());
        assertEquals(UnresolvedReferenceWarning.Kind.INVALID_VALUE, warnings.get(1).getKind());
        assertEquals(UnresolvedReferenceWarning.Kind.UNKNOWN_PROPERTY, warnings.get(2).getKind());
        assertEquals(UnresolvedReferenceWarning.Kind.UNSUPPORTED_SELECTOR, warnings.get(3).getKind());
        assertEquals(UnresolvedReferenceWarning.Kind.UNSUPPORTED_AT_RULE, warnings.get(4).getKind());
        assertEquals(warnings, logger.warnings);
        assertEquals(5, logger.stats.get(0).getWarningCount());
    }

    @Test
    void treeDetailRendersDump() {
        RecordingReflowLogger tree = new RecordingReflowLogger(ReflowLogDetail.TREE);
        RecordingReflowLogger summary = new RecordingReflowLogger(ReflowLogDetail.SUMMARY);

        new ReflowEngine().withLogger(tree).reflow(doc, "", 800, 600);
        new ReflowEngine().withLogger(summary).reflow(doc, "", 800, 600);

        assertTrue(tree.dumps.get(0).startsWith("html block border=(0, 0, 800x"), tree.dumps.get(0));
        assertTrue(tree.dumps.get(0).contains("button#ok inline-block"));
        assertNull(summary.dumps.get(0));
        assertEquals(doc.size(), summary.stats.get(0).getElementCount());
    }

    @Test
    void interactionStateDrivesDynamicPseudoClasses() {
        Element button = doc.getElementById("ok");
        ReflowEngine engine = new ReflowEngine().withInteractionState(new InteractionState() {
            @Override
            public boolean isHovered(Element element) {
                return element.equals(button);
            }
        });

        LayoutTree tree = engine.reflow(doc, "button:hover { background-color: yellow }", 800, 600);

        assertEquals(Color.rgb(255, 255, 0), tree.node(button).getStyle().getColor(Property.BACKGROUND_COLOR));
    }

    @Test
    void registeredExtensionPropertiesReachComputedStyle() {
        ReflowEngine engine = new ReflowEngine().withPropertyRegistry(PropertyRegistry.withSpriteProperties());

        LayoutTree tree = engine.reflow(doc, "p { sprite-scale: 2 }", 800, 600);

        assertEquals("2", tree.node(doc.element(3)).getStyle().getExtension("sprite-scale"));
        assertTrue(engine.getLastWarnings().isEmpty());
    }

    @Test
    void parseStylesheetThrowsOnMalformedText() {
        ReflowEngine engine = new ReflowEngine();

        Stylesheet sheet = engine.parseStylesheet("p { color: red }", WarningSink.IGNORE);
        assertEquals(1, sheet.getRules().size());

        assertThrows(StylesheetParseException.class, () -> engine.parseStylesheet("p { color: red", WarningSink.IGNORE));
    }

    @Test
    void failedReflowKeepsPreviousLayout() {
        ReflowEngine engine = new ReflowEngine();
        LayoutTree first = engine.reflow(doc, "", 800, 600);

        assertThrows(IllegalArgumentException.class, () -> engine.reflow(doc, "", Double.NaN, 600));

        assertSame(first, engine.getLastLayout());
    }
}

package io.hearthwarrio.cascadium.core.css;

import io.hearthwarrio.cascadium.core.dom.Document;
import io.hearthwarrio.cascadium.core.dom.Element;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SelectorMatcherTest {

    private final SelectorParser parser = new SelectorParser();
    private final SelectorMatcher matcher = new SelectorMatcher();

    /**
     * html > body > [div.outer > [p#direct, span > p#nested], ul > [li.a, li.b, li.c, li.d], form > [input, input]]
     */
    private final Document doc = Document.builder("html")
            .open("body")
                .open("div").classes("outer")
                    .open("p").id("direct").close()
                    .open("span")
                        .open("p").id("nested").close()
                    .close()
                .close()
                .open("ul")
                    .open("li").classes("a").text("one").close()
                    .open("li").classes("b").close()
                    .open("li").classes("c").close()
                    .open("li").classes("d").close()
                .close()
                .open("form")
                    .open("input").attribute("type", "text").attribute("required", "").close()
                    .open("input").attribute("type", "checkbox").attribute("disabled", "").attribute("checked", "").close()
                .close()
            .close()
            .build();

    private Element byId(String id) {
        return doc.getElementById(id);
    }

    private Element li(int position) {
        return doc.getElementById("direct").getParent().getParent().getChildren().get(1).getChildren().get(position);
    }

    private Element input(int position) {
        return doc.getRoot().getChildren().get(0).getChildren().get(2).getChildren().get(position);
    }

    private boolean matches(String selector, Element element) {
        return matcher.matches(parser.parse(selector), element);
    }

    @Test
    void childCombinatorRequiresDirectParent() {
        assertTrue(matches("div > p", byId("direct")));
        assertFalse(matches("div > p", byId("nested")));
    }

    @Test
    void descendantCombinatorWalksAllAncestors() {
        assertTrue(matches("div span p", byId("nested")));
        assertFalse(matches("div span p", byId("direct")));
        assertTrue(matches("html p", byId("nested")));
        assertTrue(matches("div p", byId("direct")));
    }

    @Test
    void descendantCombinatorBacktracks() {
        assertTrue(matches("body div > span > p", byId("nested")));
        assertTrue(matches(".outer * p", byId("nested")));
        assertFalse(matches(".outer * p", byId("direct")));
    }

    @Test
    void siblingCombinators() {
        assertTrue(matches(".a + .b", li(1)));
        assertFalse(matches(".a + .c", li(2)));
        assertTrue(matches(".a ~ .c", li(2)));
        assertFalse(matches(".c ~ .a", li(0)));
        assertTrue(matches("p + span > p", byId("nested")));
    }

    @Test
    void structuralPseudoClasses() {
        assertTrue(matches("li:first-child", li(0)));
        assertFalse(matches("li:first-child", li(1)));
        assertTrue(matches("li:last-child", li(3)));
        assertTrue(matches("p:only-child", byId("nested")));
        assertFalse(matches("p:only-child", byId("direct")));
        assertTrue(matches("li:nth-child(odd)", li(2)));
        assertFalse(matches("li:nth-child(odd)", li(1)));
        assertTrue(matches("li:nth-child(2n)", li(3)));
        assertTrue(matches("li:nth-last-child(1)", li(3)));
        assertTrue(matches("li:nth-child(-n+2)", li(1)));
        assertFalse(matches("li:nth-child(-n+2)", li(2)));
        assertTrue(matches("p:nth-of-type(1)", byId("direct")));
        assertTrue(matches("li:empty", li(1)));
        assertFalse(matches("li:empty", li(0)));
    }

    @Test
    void rootHasNoStructuralPosition() {
        assertFalse(matches(":first-child", doc.getRoot()));
        assertTrue(matches("html", doc.getRoot()));
    }

    @Test
    void negationAndAttributes() {
        assertTrue(matches("li:not(.a)", li(1)));
        assertFalse(matches("li:not(.a)", li(0)));
        assertTrue(matches("[type=text]", input(0)));
        assertTrue(matches("[type^=check]", input(1)));
        assertTrue(matches("[type$=box]", input(1)));
        assertTrue(matches("[type*=eckb]", input(1)));
        assertTrue(matches("li[class~=b]", li(1)));
        assertFalse(matches("[type=text]", input(1)));
    }

    @Test
    void formStatePseudoClasses() {
        assertTrue(matches("input:required", input(0)));
        assertTrue(matches("input:optional", input(1)));
        assertTrue(matches("input:enabled", input(0)));
        assertTrue(matches("input:disabled", input(1)));
        assertTrue(matches("input:checked", input(1)));
        assertFalse(matches("li:enabled", li(0)));
    }

    @Test
    void dynamicPseudoClassesUseInteractionState() {
        Element hovered = li(2);
        SelectorMatcher hovering = new SelectorMatcher(new InteractionState() {
            @Override
            public boolean isHovered(Element element) {
                return element.equals(hovered);
            }
        });

        assertTrue(hovering.matches(parser.parse("li:hover"), hovered));
        assertFalse(hovering.matches(parser.parse("li:hover"), li(1)));
        assertFalse(hovering.matches(parser.parse("li:focus"), hovered));
        assertFalse(matches("li:hover", hovered));
    }
}

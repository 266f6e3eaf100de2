package io.hearthwarrio.cascadium.core.dom;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class DocumentBuilderTest {

    private Document sample() {
        return Document.builder("html")
                .open("body")
                    .open("DIV").id("main").classes("card", "wide")
                        .open("p").text("  Hello \n  world ").close()
                        .open("span").close()
                    .close()
                    .open("div").id("main").close()
                .close()
                .build();
    }

    @Test
    void storesElementsInDocumentOrder() {
        Document doc = sample();

        assertEquals(6, doc.size());
        assertEquals("html", doc.getRoot().getTagName());
        assertEquals("body", doc.element(1).getTagName());
        assertEquals("div", doc.element(2).getTagName());
        assertEquals("p", doc.element(3).getTagName());
        assertEquals("span", doc.element(4).getTagName());
        for (int i = 0; i < doc.size(); i++) {
            assertEquals(i, doc.element(i).getIndex());
        }
    }

    @Test
    void linksParentsChildrenAndSiblings() {
        Document doc = sample();
        Element div = doc.element(2);
        Element p = doc.element(3);
        Element span = doc.element(4);

        assertTrue(doc.getRoot().isRoot());
        assertNull(doc.getRoot().getParent());
        assertSame(div, p.getParent());
        assertEquals(2, div.getChildCount());
        assertSame(span, p.getNextSibling());
        assertSame(p, span.getPreviousSibling());
        assertNull(p.getPreviousSibling());
        assertNull(span.getNextSibling());
        assertEquals(1, span.getSiblingPosition());
    }

    @Test
    void exposesIdClassesAndCollapsedText() {
        Document doc = sample();
        Element div = doc.element(2);

        assertEquals("main", div.getId());
        assertTrue(div.hasClass("card"));
        assertTrue(div.hasClass("wide"));
        assertFalse(div.hasClass("narrow"));
        assertEquals("div#main.card.wide", div.describe());
        assertEquals("Hello world", doc.element(3).getTextContent());
        assertEquals("", doc.element(4).getId());
        assertNull(doc.element(4).getAttribute("title"));
    }

    @Test
    void reportsDuplicateIdsAndReturnsFirstMatch() {
        Document doc = sample();

        assertEquals(Set.of("main"), doc.findDuplicateIds());
        assertSame(doc.element(2), doc.getElementById("main"));
        assertNull(doc.getElementById("missing"));
    }

    @Test
    void rejectsClosingRootAndReuse() {
        DocumentBuilder builder = Document.builder("html");

        assertThrows(IllegalStateException.class, builder::close);

        builder.build();
        assertThrows(IllegalStateException.class, () -> builder.open("div"));
    }

    @Test
    void leavesUnclosedElementsOpenUntilBuild() {
        Document doc = Document.builder("html").open("body").open("div").build();

        assertEquals(3, doc.size());
        assertSame(doc.element(1), doc.element(2).getParent());
    }
}

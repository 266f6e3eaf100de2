package io.hearthwarrio.cascadium.core.layout;

import io.hearthwarrio.cascadium.core.dom.Document;
import org.junit.jupiter.api.Test;

import static io.hearthwarrio.cascadium.core.layout.LayoutTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

public class InlineBlockLayoutTest {

    private static final String BOXES = "span { display: inline-block; width: 100px; height: 20px } #c { width: 300px }";

    @Test
    void placesBoxesSideBySideAndWrapsWhenLineIsFull() {
        Document doc = Document.builder("html")
                .open("div").id("c")
                    .open("span").id("s1").close()
                    .open("span").id("s2").close()
                    .open("span").id("s3").close()
                    .open("span").id("s4").close()
                .close()
                .build();

        LayoutTree tree = layout(doc, BOXES, 800, 600);

        assertRect(0, 0, 100, 20, border(tree, "s1"));
        assertRect(100, 0, 100, 20, border(tree, "s2"));
        assertRect(200, 0, 100, 20, border(tree, "s3"));
        assertRect(0, 20, 100, 20, border(tree, "s4"));
        assertEquals(40, border(tree, "c").getHeight(), EPS);
    }

    @Test
    void blockSiblingBreaksTheLine() {
        Document doc = Document.builder("html")
                .open("div").id("c")
                    .open("span").id("a").close()
                    .open("div").id("b").close()
                    .open("span").id("d").close()
                .close()
                .build();

        LayoutTree tree = layout(doc, BOXES + " #b { height: 10px }", 800, 600);

        assertRect(0, 0, 100, 20, border(tree, "a"));
        assertRect(0, 20, 300, 10, border(tree, "b"));
        assertRect(0, 30, 100, 20, border(tree, "d"));
        assertEquals(50, border(tree, "c").getHeight(), EPS);
    }

    @Test
    void lineIsAsTallAsItsTallestBox() {
        Document doc = Document.builder("html")
                .open("div").id("c")
                    .open("span").id("short").close()
                    .open("span").id("tall").close()
                .close()
                .open("div").id("after").close()
                .build();

        LayoutTree tree = layout(doc, BOXES + " #tall { height: 40px }", 800, 600);

        assertEquals(0, border(tree, "short").getY(), EPS);
        assertEquals(40, border(tree, "c").getHeight(), EPS);
        assertEquals(40, border(tree, "after").getY(), EPS);
    }

    @Test
    void autoWidthShrinksToContent() {
        Document doc = Document.builder("html")
                .open("span").id("label").text("abcd").close()
                .open("span").id("outer")
                    .open("span").close()
                    .open("span").close()
                .close()
                .build();

        LayoutTree tree = layout(doc,
                "span { display: inline-block } #outer span { width: 50px; height: 10px }", 800, 600);

        assertRect(0, 0, 32, 19.2, border(tree, "label"));
        assertRect(32, 0, 100, 10, border(tree, "outer"));
    }

    @Test
    void inlineIsLaidOutLikeInlineBlock() {
        Document doc = Document.builder("html")
                .open("em").id("word").text("ab").close()
                .build();

        LayoutTree tree = layout(doc, "em { display: inline }", 800, 600);

        assertEquals(Display.INLINE_BLOCK, tree.node(doc.getElementById("word")).getDisplay());
        assertEquals(16, border(tree, "word").getWidth(), EPS);
    }

    @Test
    void textAlignOffsetsTheLine() {
        Document doc = Document.builder("html")
                .open("div").id("c")
                    .open("span").id("centered").close()
                .close()
                .open("div").id("r")
                    .open("span").id("right").close()
                .close()
                .build();

        LayoutTree tree = layout(doc, BOXES + " #c { text-align: center } #r { width: 300px; text-align: right }", 800, 600);

        assertEquals(100, border(tree, "centered").getX(), EPS);
        assertEquals(200, border(tree, "right").getX(), EPS);
    }

    @Test
    void marginsArePartOfTheLine() {
        Document doc = Document.builder("html")
                .open("div").id("c")
                    .open("span").id("a").close()
                    .open("span").id("b").close()
                .close()
                .build();

        LayoutTree tree = layout(doc, BOXES + " #a { margin: 5px 10px }", 800, 600);

        assertRect(10, 5, 100, 20, border(tree, "a"));
        assertRect(120, 0, 100, 20, border(tree, "b"));
        assertEquals(30, border(tree, "c").getHeight(), EPS);
    }
}

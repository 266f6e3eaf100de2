package io.hearthwarrio.cascadium.core.layout;

import io.hearthwarrio.cascadium.core.dom.Document;
import io.hearthwarrio.cascadium.core.dom.DocumentBuilder;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static io.hearthwarrio.cascadium.core.layout.LayoutTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

public class FlexLayoutTest {

    /**
     * html > div#row > div#i1 .. div#iN
     */
    private static Document row(int items) {
        DocumentBuilder b = Document.builder("html").open("div").id("row");
        for (int i = 1; i <= items; i++) {
            b.open("div").id("i" + i).close();
        }
        return b.build();
    }

    @Test
    void growDistributesFreeSpaceByFactor() {
        LayoutTree tree = layout(row(3),
                "#row { display: flex } #i1 { flex-grow: 1 } #i2 { flex-grow: 2 } #i3 { flex-grow: 1 }", 400, 300);

        assertRect(0, 0, 100, 0, border(tree, "i1"));
        assertRect(100, 0, 200, 0, border(tree, "i2"));
        assertRect(300, 0, 100, 0, border(tree, "i3"));
    }

    @Test
    void flexShorthandUsesZeroBasis() {
        LayoutTree tree = layout(row(2),
                "#row { display: flex; width: 300px } #i1 { flex: 1; width: 250px } #i2 { flex: 2 }", 800, 600);

        assertEquals(100, border(tree, "i1").getWidth(), EPS);
        assertEquals(200, border(tree, "i2").getWidth(), EPS);
    }

    @Test
    void shrinkIsProportionalToShrinkFactor() {
        LayoutTree tree = layout(row(3),
                "#row { display: flex; width: 300px } #row div { width: 200px } #i1 { flex-shrink: 2 }", 800, 600);

        assertRect(0, 0, 50, 0, border(tree, "i1"));
        assertRect(50, 0, 125, 0, border(tree, "i2"));
        assertRect(175, 0, 125, 0, border(tree, "i3"));
    }

    @Test
    void itemAtMaxIsFrozenAndRestIsRedistributed() {
        LayoutTree tree = layout(row(2),
                "#row { display: flex } #row div { flex-grow: 1 } #i1 { max-width: 100px }", 400, 300);

        assertEquals(100, border(tree, "i1").getWidth(), EPS);
        assertRect(100, 0, 300, 0, border(tree, "i2"));
    }

    @Test
    void itemAtMinIsFrozenWhenShrinking() {
        LayoutTree tree = layout(row(2),
                "#row { display: flex; width: 200px } #row div { width: 200px } #i1 { min-width: 150px }", 800, 600);

        assertEquals(150, border(tree, "i1").getWidth(), EPS);
        assertEquals(50, border(tree, "i2").getWidth(), EPS);
    }

    @Test
    void justifyContentPositionsItems() {
        String items = " #row div { width: 50px }";

        LayoutTree center = layout(row(2), "#row { display: flex; justify-content: center }" + items, 400, 300);
        assertEquals(150, border(center, "i1").getX(), EPS);
        assertEquals(200, border(center, "i2").getX(), EPS);

        LayoutTree end = layout(row(2), "#row { display: flex; justify-content: flex-end }" + items, 400, 300);
        assertEquals(300, border(end, "i1").getX(), EPS);

        LayoutTree between = layout(row(3), "#row { display: flex; justify-content: space-between }" + items, 400, 300);
        assertEquals(0, border(between, "i1").getX(), EPS);
        assertEquals(175, border(between, "i2").getX(), EPS);
        assertEquals(350, border(between, "i3").getX(), EPS);

        LayoutTree evenly = layout(row(3), "#row { display: flex; justify-content: space-evenly }" + items, 400, 300);
        assertEquals(62.5, border(evenly, "i1").getX(), EPS);
        assertEquals(175, border(evenly, "i2").getX(), EPS);
    }

    @Test
    void spaceBetweenFallsBackToStartOnOverflow() {
        LayoutTree tree = layout(row(2),
                "#row { display: flex; width: 100px; justify-content: space-between }"
                        + " #row div { width: 80px; flex-shrink: 0 }", 800, 600);

        assertEquals(0, border(tree, "i1").getX(), EPS);
        assertEquals(80, border(tree, "i2").getX(), EPS);
    }

    @Test
    void gapSeparatesItems() {
        LayoutTree tree = layout(row(2),
                "#row { display: flex; width: 410px; column-gap: 10px } #row div { flex-grow: 1 }", 800, 600);

        assertRect(0, 0, 200, 0, border(tree, "i1"));
        assertRect(210, 0, 200, 0, border(tree, "i2"));
    }

    @Test
    void stretchMatchesTallestItemWhenContainerHeightIsAuto() {
        LayoutTree tree = layout(row(2),
                "#row { display: flex } #i1 { height: 50px; width: 10px } #i2 { width: 10px }", 400, 300);

        assertRect(0, 0, 10, 50, border(tree, "i1"));
        assertRect(10, 0, 10, 50, border(tree, "i2"));
        assertEquals(50, border(tree, "row").getHeight(), EPS);
    }

    @Test
    void alignItemsAndAlignSelf() {
        LayoutTree tree = layout(row(3),
                "#row { display: flex; height: 100px; align-items: center } #row div { width: 10px; height: 20px }"
                        + " #i2 { align-self: flex-end } #row #i3 { align-self: stretch; height: auto }", 400, 300);

        assertEquals(40, border(tree, "i1").getY(), EPS);
        assertEquals(80, border(tree, "i2").getY(), EPS);
        assertRect(20, 0, 10, 100, border(tree, "i3"));
    }

    @Test
    void columnDirectionStacksAndStretchesWidth() {
        LayoutTree tree = layout(row(2),
                "#row { display: flex; flex-direction: column } #i1 { height: 30px } #i2 { height: 50px }", 400, 300);

        assertRect(0, 0, 400, 30, border(tree, "i1"));
        assertRect(0, 30, 400, 50, border(tree, "i2"));
        assertEquals(80, border(tree, "row").getHeight(), EPS);
    }

    @Test
    void columnGrowUsesDefiniteHeight() {
        LayoutTree tree = layout(row(2),
                "#row { display: flex; flex-direction: column; height: 300px } #i1 { flex-grow: 1 } #i2 { height: 100px }",
                400, 300);

        assertRect(0, 0, 400, 200, border(tree, "i1"));
        assertRect(0, 200, 400, 100, border(tree, "i2"));
    }

    @Test
    void reverseDirectionMirrorsMainAxis() {
        LayoutTree tree = layout(row(2),
                "#row { display: flex; flex-direction: row-reverse } #row div { width: 100px }", 400, 300);

        assertEquals(300, border(tree, "i1").getX(), EPS);
        assertEquals(200, border(tree, "i2").getX(), EPS);
    }

    @Test
    void reverseDirectionPutsEndMarginAtMainStart() {
        Document doc = Document.builder("html")
                .open("div").id("row").open("div").id("i").close().close()
                .build();

        LayoutTree tree = layout(doc,
                "#row { display: flex; flex-direction: row-reverse; width: 100px }" +
                        " #i { width: 20px; margin-left: 10px }", 800, 600);
        assertEquals(80, border(tree, "i").getX(), EPS);

        tree = layout(doc,
                "#row { display: flex; flex-direction: row-reverse; width: 100px }" +
                        " #i { width: 20px; margin-right: 10px }", 800, 600);
        assertEquals(70, border(tree, "i").getX(), EPS);

        tree = layout(doc,
                "#row { display: flex; flex-direction: column-reverse; height: 100px }" +
                        " #i { height: 20px; margin-top: 5px; margin-bottom: 15px }", 800, 600);
        assertEquals(65, border(tree, "i").getY(), EPS);
    }

    @Test
    void orderRearrangesItems() {
        LayoutTree tree = layout(row(3),
                "#row { display: flex } #row div { width: 100px } #i3 { order: -1 } #i1 { order: 2 }", 400, 300);

        assertEquals(0, border(tree, "i3").getX(), EPS);
        assertEquals(100, border(tree, "i2").getX(), EPS);
        assertEquals(200, border(tree, "i1").getX(), EPS);
    }

    @Test
    void hiddenItemsTakeNoSpace() {
        LayoutTree tree = layout(row(3),
                "#row { display: flex } #row div { flex-grow: 1 } #i2 { display: none }", 400, 300);

        assertEquals(200, border(tree, "i1").getWidth(), EPS);
        assertFalse(tree.node(tree.getDocument().getElementById("i2")).isRendered());
        assertEquals(200, border(tree, "i3").getX(), EPS);
    }

    @Test
    void itemMarginsAndPaddingCountTowardsMainSize() {
        LayoutTree tree = layout(row(2),
                "#row { display: flex } #i1 { margin: 0 10px; padding: 5px; width: 50px } #i2 { flex-grow: 1 }", 400, 300);

        assertRect(10, 0, 60, 10, border(tree, "i1"));
        assertRect(80, 0, 320, 10, border(tree, "i2"));
    }

    @Test
    void inlineFlexShrinksToContent() {
        LayoutTree tree = layout(row(2),
                "#row { display: inline-flex } #row div { width: 40px; height: 10px }", 400, 300);

        assertRect(0, 0, 80, 10, border(tree, "row"));
        assertEquals(40, border(tree, "i2").getX(), EPS);
    }

    @Test
    void nestedColumnContainersLayOutInLinearTime() {
        int depth = 24;
        DocumentBuilder b = Document.builder("html");
        for (int d = 1; d <= depth; d++) {
            b.open("div").classes("f").id("f" + d)
                    .open("div").classes("tall").close();
        }
        Document doc = b.build();

        LayoutTree tree = assertTimeout(Duration.ofSeconds(2), () -> layout(doc,
                ".f { display: flex; flex-direction: column } .tall { height: 10px }", 800, 600));

        assertRect(0, 0, 800, 240, border(tree, "f1"));
        assertRect(0, 230, 800, 10, border(tree, "f24"));
    }

    @Test
    void percentageHeightsInsideAutoItemResolveAgainstItsSize() {
        Document doc = Document.builder("html")
                .open("div").id("col")
                    .open("div").id("item")
                        .open("div").id("tall").close()
                        .open("div").id("half").close()
                    .close()
                .close()
                .build();

        LayoutTree tree = layout(doc,
                "#col { display: flex; flex-direction: column } #tall { height: 40px } #half { height: 50% }", 800, 600);

        assertEquals(40, border(tree, "item").getHeight(), EPS);
        assertEquals(20, border(tree, "half").getHeight(), EPS);
    }
}

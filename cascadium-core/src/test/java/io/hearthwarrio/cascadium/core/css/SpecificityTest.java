package io.hearthwarrio.cascadium.core.css;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SpecificityTest {

    private final SelectorParser parser = new SelectorParser();

    @Test
    void countsIdsClassesAndTypes() {
        assertEquals(Specificity.of(1, 0, 0), specificity("#a"));
        assertEquals(Specificity.of(0, 2, 0), specificity(".b.c"));
        assertEquals(Specificity.of(0, 0, 1), specificity("div"));
        assertEquals(Specificity.of(1, 2, 2), specificity("ul#nav li.item[data-x]"));
        assertEquals(Specificity.of(0, 1, 1), specificity("li:first-child"));
        assertEquals(Specificity.ZERO, specificity("*"));
    }

    @Test
    void negationCountsItsArgumentOnly() {
        assertEquals(Specificity.of(1, 0, 1), specificity("p:not(#x)"));
        assertEquals(Specificity.of(0, 1, 1), specificity("p:not(.x)"));
    }

    @Test
    void comparesLexicographically() {
        assertTrue(specificity("#a").compareTo(specificity(".b.c")) > 0);
        assertTrue(specificity(".b.c").compareTo(specificity("div")) > 0);
        assertTrue(specificity(".a").compareTo(specificity("div p span em")) > 0);
        assertEquals(0, specificity("div.a").compareTo(specificity("p.b")));
    }

    @Test
    void inlineOutranksAnySelector() {
        assertTrue(Specificity.INLINE.compareTo(specificity("#a #b #c .d")) > 0);
    }

    private Specificity specificity(String selector) {
        return parser.parse(selector).specificity();
    }
}

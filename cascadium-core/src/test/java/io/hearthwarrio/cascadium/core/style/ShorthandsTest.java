package io.hearthwarrio.cascadium.core.style;

import io.hearthwarrio.cascadium.core.css.Declaration;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ShorthandsTest {

    private static Map<String, String> expand(String property, String value) {
        List<Declaration> declarations = Shorthands.expand(new Declaration(property, value, false));
        if (declarations == null) {
            return null;
        }
        Map<String, String> out = new LinkedHashMap<>();
        for (Declaration d : declarations) {
            out.put(d.getProperty(), d.getValue());
        }
        return out;
    }

    @Test
    void boxShorthandsFollowOneToFourValueRule() {
        Map<String, String> one = expand("margin", "5px");
        assertEquals("5px", one.get("margin-top"));
        assertEquals("5px", one.get("margin-left"));

        Map<String, String> two = expand("padding", "1px 2px");
        assertEquals("1px", two.get("padding-bottom"));
        assertEquals("2px", two.get("padding-left"));

        Map<String, String> three = expand("margin", "1px auto 3px");
        assertEquals("auto", three.get("margin-right"));
        assertEquals("3px", three.get("margin-bottom"));
        assertEquals("auto", three.get("margin-left"));

        Map<String, String> four = expand("border-width", "1px 2px 3px 4px");
        assertEquals("4px", four.get("border-left-width"));

        assertNull(expand("margin", "1px 2px 3px 4px 5px"));
        assertNull(expand("padding", "auto"));
    }

    @Test
    void borderShorthandAcceptsAnyOrderAndDefaultsMissingParts() {
        Map<String, String> all = expand("border", "solid red 2px");
        assertEquals(12, all.size());
        assertEquals("2px", all.get("border-top-width"));
        assertEquals("solid", all.get("border-right-style"));
        assertEquals("red", all.get("border-left-color"));

        Map<String, String> top = expand("border-top", "dashed");
        assertEquals(3, top.size());
        assertEquals("medium", top.get("border-top-width"));
        assertEquals("currentcolor", top.get("border-top-color"));

        assertNull(expand("border", "solid dashed"));
    }

    @Test
    void flexShorthandForms() {
        assertEquals(Map.of("flex-grow", "0", "flex-shrink", "0", "flex-basis", "auto"), expand("flex", "none"));
        assertEquals(Map.of("flex-grow", "1", "flex-shrink", "1", "flex-basis", "auto"), expand("flex", "auto"));
        assertEquals(Map.of("flex-grow", "2", "flex-shrink", "1", "flex-basis", "0%"), expand("flex", "2"));
        assertEquals(Map.of("flex-grow", "1", "flex-shrink", "1", "flex-basis", "100px"), expand("flex", "100px"));
        assertEquals(Map.of("flex-grow", "1", "flex-shrink", "3", "flex-basis", "0%"), expand("flex", "1 3"));
        assertEquals(Map.of("flex-grow", "1", "flex-shrink", "0", "flex-basis", "50%"), expand("flex", "1 0 50%"));
        assertNull(expand("flex", "big"));
    }

    @Test
    void fontShorthandRequiresSizeAndFamily() {
        Map<String, String> font = expand("font", "bold 12px/1.5 \"Open Sans\", sans-serif");
        assertEquals("bold", font.get("font-weight"));
        assertEquals("12px", font.get("font-size"));
        assertEquals("1.5", font.get("line-height"));
        assertEquals("\"Open Sans\", sans-serif", font.get("font-family"));

        assertNull(expand("font", "12px"));
        assertNull(expand("font", "bold Arial"));
    }

    @Test
    void otherShorthands() {
        assertEquals(Map.of("flex-direction", "column"), expand("flex-flow", "column wrap"));
        assertEquals(Map.of("row-gap", "4px", "column-gap", "8px"), expand("gap", "4px 8px"));
        assertEquals(Map.of("background-color", "rgb(1, 2, 3)"), expand("background", "rgb(1, 2, 3) no-repeat"));
        assertNull(expand("flex-flow", "row column"));
    }

    @Test
    void cssWideKeywordAppliesToEveryLonghand() {
        Map<String, String> inherited = expand("padding", "inherit");

        assertEquals(4, inherited.size());
        assertTrue(inherited.values().stream().allMatch("inherit"::equals));
    }

    @Test
    void keepsImportance() {
        List<Declaration> declarations = Shorthands.expand(new Declaration("gap", "1px", true));

        assertTrue(declarations.stream().allMatch(Declaration::isImportant));
    }
}

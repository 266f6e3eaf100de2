package io.hearthwarrio.cascadium.core.style;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ColorTest {

    @Test
    void parsesHexForms() {
        assertEquals(Color.rgb(255, 0, 0), Color.parse("#f00"));
        assertEquals(Color.rgb(0x12, 0x34, 0x56), Color.parse("#123456"));
        assertEquals(Color.rgba(255, 255, 255, 0.0), Color.parse("#ffffff00"));
        assertEquals(Color.rgba(0, 0, 0, 1.0), Color.parse("#000f"));
    }

    @Test
    void parsesFunctionalForms() {
        assertEquals(Color.rgb(10, 20, 30), Color.parse("rgb(10, 20, 30)"));
        assertEquals(Color.rgba(10, 20, 30, 0.5), Color.parse("rgba(10,20,30,0.5)"));
        assertEquals(Color.rgb(255, 128, 0), Color.parse("rgb(100%, 50%, 0%)"));
        assertEquals(Color.rgba(1, 2, 3, 0.25), Color.parse("rgb(1 2 3 / 25%)"));
        assertEquals(Color.rgb(255, 0, 0), Color.parse("rgb(300, -5, 0)"));
    }

    @Test
    void parsesNamedColorsCaseInsensitively() {
        assertEquals(Color.rgb(255, 165, 0), Color.parse("Orange"));
        assertEquals(Color.TRANSPARENT, Color.parse("transparent"));
        assertTrue(Color.parse("transparent").isTransparent());
    }

    @Test
    void rejectsInvalidColors() {
        assertNull(Color.parse("#12"));
        assertNull(Color.parse("#ggg"));
        assertNull(Color.parse("rgb(1, 2)"));
        assertNull(Color.parse("rgb(a, b, c)"));
        assertNull(Color.parse("notacolor"));
        assertNull(Color.parse(""));
    }

    @Test
    void serializesAndPacks() {
        assertEquals("#ff8000", Color.rgb(255, 128, 0).toCss());
        assertEquals("rgba(0, 0, 0, 0.5)", Color.rgba(0, 0, 0, 0.5).toCss());
        assertEquals(0xffff0000, Color.rgb(255, 0, 0).toArgb());
    }
}

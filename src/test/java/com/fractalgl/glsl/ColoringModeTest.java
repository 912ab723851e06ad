package com.fractalgl.glsl;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class ColoringModeTest {

    @ParameterizedTest
    @CsvSource({
            "hue, HUE",
            "grayscale, GRAYSCALE",
            "grayscaleInv, GRAYSCALE_INV",
            "bw, BW",
            "bwInv, BW_INV",
            "domain, DOMAIN"
    })
    public void testLookupByKey(String key, ColoringMode expected) {
        assertEquals(expected, ColoringMode.fromKey(key));
        assertEquals(key, expected.key());
    }

    @Test
    public void testUnknownKey() {
        UnknownColoringModeException e = assertThrows(UnknownColoringModeException.class,
                () -> ColoringMode.fromKey("not-a-real-mode"));
        assertEquals("not-a-real-mode", e.key());
        assertThrows(UnknownColoringModeException.class, () -> ColoringMode.fromKey("Hue"));
        assertThrows(UnknownColoringModeException.class, () -> ColoringMode.fromKey(null));
    }

    @Test
    public void testOnlyDomainTakesTheIterate() {
        for (ColoringMode mode : ColoringMode.values()) {
            assertEquals(mode == ColoringMode.DOMAIN, mode.isDomain());
            assertEquals(mode.isDomain() ? "vec2" : "float", mode.inputType());
        }
    }

    @Test
    public void testEveryBodyReturnsAColor() {
        for (ColoringMode mode : ColoringMode.values()) {
            assertTrue(mode.body().contains("return "), mode.key());
        }
        assertTrue(ColoringMode.HUE.body().contains("hsltorgb"));
        assertTrue(ColoringMode.DOMAIN.body().contains("atan(x.y,x.x)"));
    }
}

package com.fractalgl.settings;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class RenderSettingsTest {

    @Test
    public void testDefaults() {
        RenderSettings defaults = RenderSettings.DEFAULTS;
        assertEquals(500, defaults.iterations());
        assertEquals(10000.0, defaults.breakout());
        assertEquals("hue", defaults.coloring());
        assertEquals(0.0, defaults.bias());
        assertEquals(0.0, defaults.hueShift());
        assertFalse(defaults.julia());
        assertFalse(defaults.smooth());
    }

    @Test
    public void testWithersLeaveOriginalUntouched() {
        RenderSettings changed = RenderSettings.DEFAULTS
                .withIterations(10)
                .withBreakout(4)
                .withColoring("bw")
                .withBias(2)
                .withHueShift(180)
                .withJulia(true)
                .withSmooth(true);

        assertEquals(new RenderSettings(10, 4, "bw", 2, 180, true, true), changed);
        assertEquals(500, RenderSettings.DEFAULTS.iterations());
    }

    @Test
    public void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> RenderSettings.DEFAULTS.withIterations(0));
        assertThrows(IllegalArgumentException.class, () -> RenderSettings.DEFAULTS.withBreakout(0));
        assertThrows(IllegalArgumentException.class, () -> RenderSettings.DEFAULTS.withBreakout(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> RenderSettings.DEFAULTS.withBias(Double.POSITIVE_INFINITY));
        assertThrows(IllegalArgumentException.class, () -> RenderSettings.DEFAULTS.withHueShift(Double.NaN));
        assertThrows(NullPointerException.class, () -> RenderSettings.DEFAULTS.withColoring(null));
    }

    @Test
    public void testBreakoutMustFitInAFloat() {
        assertThrows(IllegalArgumentException.class, () -> RenderSettings.DEFAULTS.withBreakout(1e40));
        assertThrows(IllegalArgumentException.class, () -> RenderSettings.DEFAULTS.withBreakout(Double.POSITIVE_INFINITY));
        assertEquals((double) Float.MAX_VALUE, RenderSettings.DEFAULTS.withBreakout(Float.MAX_VALUE).breakout());
    }
}

package com.fractalgl.settings;

import java.util.Objects;

/**
 * Everything the kernel assembler needs besides the formula. Immutable; each compilation
 * takes one instance and keeps nothing once it returns.
 *
 * @param iterations loop bound baked into the program
 * @param breakout   squared escape radius, at most {@link Float#MAX_VALUE} since the kernel compares in float
 * @param coloring   key of a {@link com.fractalgl.glsl.ColoringMode}
 * @param bias       exponent of the {@code pow(1.1, bias)} curve applied to the escape fraction
 * @param hueShift   hue rotation in degrees
 * @param julia      seed z with c instead of zero
 * @param smooth     apply the continuous iteration count correction
 */
public record RenderSettings(int iterations, double breakout, String coloring, double bias,
                             double hueShift, boolean julia, boolean smooth) {
    public static final RenderSettings DEFAULTS =
            new RenderSettings(500, 10000, "hue", 0, 0, false, false);

    public RenderSettings {
        Objects.requireNonNull(coloring, "coloring");
        if (iterations <= 0) {
            throw new IllegalArgumentException("iterations must be positive: " + iterations);
        }
        if (!(breakout > 0) || breakout > Float.MAX_VALUE) {
            throw new IllegalArgumentException("breakout must be positive and within float range: " + breakout);
        }
        if (!Double.isFinite(bias)) {
            throw new IllegalArgumentException("bias must be finite: " + bias);
        }
        if (!Double.isFinite(hueShift)) {
            throw new IllegalArgumentException("hueShift must be finite: " + hueShift);
        }
    }

    public RenderSettings withIterations(int value) {
        return new RenderSettings(value, breakout, coloring, bias, hueShift, julia, smooth);
    }

    public RenderSettings withBreakout(double value) {
        return new RenderSettings(iterations, value, coloring, bias, hueShift, julia, smooth);
    }

    public RenderSettings withColoring(String value) {
        return new RenderSettings(iterations, breakout, value, bias, hueShift, julia, smooth);
    }

    public RenderSettings withBias(double value) {
        return new RenderSettings(iterations, breakout, coloring, value, hueShift, julia, smooth);
    }

    public RenderSettings withHueShift(double value) {
        return new RenderSettings(iterations, breakout, coloring, bias, value, julia, smooth);
    }

    public RenderSettings withJulia(boolean value) {
        return new RenderSettings(iterations, breakout, coloring, bias, hueShift, value, smooth);
    }

    public RenderSettings withSmooth(boolean value) {
        return new RenderSettings(iterations, breakout, coloring, bias, hueShift, julia, value);
    }
}

package com.fractalgl.reference;

import com.fractalgl.glsl.ColoringMode;
import com.fractalgl.glsl.KernelAssembler;
import com.fractalgl.settings.RenderSettings;

/** CPU version of the coloring routines; colors are packed as 0xRRGGBB. */
public class ColorMapper {
    public static final int BLACK = 0x000000;
    public static final int WHITE = 0xFFFFFF;

    private final ColoringMode mode;
    private final double hueShift;
    private final double biasExponent;

    public ColorMapper(RenderSettings settings) {
        this.mode = ColoringMode.fromKey(settings.coloring());
        this.hueShift = KernelAssembler.emittedValue(settings.hueShift());
        this.biasExponent = Math.pow(1.1, KernelAssembler.emittedValue(settings.bias()));
    }

    public int color(EscapeResult result, int iterations) {
        if (mode.isDomain()) {
            return domainColor(result.finalZ());
        }
        return fractionColor(result.iteration() / iterations);
    }

    /** Applies the bias curve and then the mode's mapping to a normalised escape fraction. */
    public int fractionColor(double fraction) {
        double x = Math.pow(fraction, biasExponent);
        return switch (mode) {
            case HUE -> {
                if (x >= 1.0 || x <= 0.0) {
                    yield BLACK;
                }
                yield hslToRgb(mod(360.0 * x + hueShift, 360.0), 1.0, 0.5);
            }
            case GRAYSCALE -> gray(1.0 - clamp(x));
            case GRAYSCALE_INV -> gray(clamp(x));
            case BW -> x >= 1.0 ? BLACK : WHITE;
            case BW_INV -> x >= 1.0 ? WHITE : BLACK;
            case DOMAIN -> throw new IllegalStateException("Domain coloring takes the final iterate");
        };
    }

    public int domainColor(Complex z) {
        double angle = z.isZero() ? hueShift : Math.toDegrees(Math.atan2(z.im(), z.re())) + hueShift;
        angle = mod(angle, 360.0);
        if (angle >= 360.0 || angle <= 0.0) {
            angle = hueShift;
        }
        return hslToRgb(angle, 1.0, 0.5);
    }

    static int hslToRgb(double hue, double saturation, double lightness) {
        double chroma = (1.0 - Math.abs(2.0 * lightness - 1.0)) * saturation;
        double h1 = hue / 60.0;
        double x = chroma * (1.0 - Math.abs(mod(h1, 2.0) - 1.0));
        double r = 0.0;
        double g = 0.0;
        double b = 0.0;
        if (h1 < 1.0) {
            r = chroma;
            g = x;
        } else if (h1 < 2.0) {
            r = x;
            g = chroma;
        } else if (h1 < 3.0) {
            g = chroma;
            b = x;
        } else if (h1 < 4.0) {
            g = x;
            b = chroma;
        } else if (h1 < 5.0) {
            r = x;
            b = chroma;
        } else if (h1 < 6.0) {
            r = chroma;
            b = x;
        }
        double m = lightness - chroma / 2.0;
        return pack(r + m, g + m, b + m);
    }

    private static int gray(double level) {
        return pack(level, level, level);
    }

    private static int pack(double r, double g, double b) {
        return channel(r) << 16 | channel(g) << 8 | channel(b);
    }

    private static int channel(double value) {
        return (int) Math.round(clamp(value) * 255.0);
    }

    private static double clamp(double value) {
        return Math.min(Math.max(value, 0.0), 1.0);
    }

    // GLSL mod: x - y * floor(x / y)
    private static double mod(double x, double y) {
        return x - y * Math.floor(x / y);
    }
}

package com.fractalgl.glsl;

import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;

/**
 * Closed table of coloring routines. Every body is the inside of
 * {@code vec3 color(<input> x)} and may use {@code shift} and {@code hsltorgb}.
 */
public enum ColoringMode {
    HUE("hue", false, """
            if (x >= 1.0 || x <= 0.0) {
                return vec3(0.0);
            }
            float angle = mod(360.0 * x + shift, 360.0);
            vec3 hsl = vec3(angle, 1.0, 0.5);
            return hsltorgb(hsl);
            """),
    GRAYSCALE("grayscale", false, """
            x = clamp(x,0.0,1.0);
            return vec3(1.0-x);
            """),
    GRAYSCALE_INV("grayscaleInv", false, """
            x = clamp(x,0.0,1.0);
            return vec3(x);
            """),
    BW("bw", false, """
            if (x >= 1.0) {
                return vec3(0.0);
            }
            return vec3(1.0);
            """),
    BW_INV("bwInv", false, """
            if (x >= 1.0) {
                return vec3(1.0);
            }
            return vec3(0.0);
            """),
    DOMAIN("domain", true, """
            float angle;
            if (x == vec2(0.0)) {
                angle = shift;
            } else {
                angle = 180.0/pi * atan(x.y,x.x) + shift;
            }
            angle = mod(angle,360.0);
            if (angle >= 360.0 || angle <= 0.0) {
                angle = shift;
            }
            vec3 hsl = vec3(angle, 1.0, 0.5);
            return hsltorgb(hsl);
            """);

    private static final ImmutableMap<String, ColoringMode> BY_KEY;

    static {
        MutableMap<String, ColoringMode> byKey = Maps.mutable.empty();
        for (ColoringMode mode : values()) {
            byKey.put(mode.key, mode);
        }
        BY_KEY = byKey.toImmutable();
    }

    private final String key;
    private final boolean domain;
    private final String body;

    ColoringMode(String key, boolean domain, String body) {
        this.key = key;
        this.domain = domain;
        this.body = body;
    }

    public String key() {
        return key;
    }

    /**
     * Domain coloring consumes the final iterate instead of the escape fraction, so it
     * runs every iteration and skips the escape test and the bias curve.
     */
    public boolean isDomain() {
        return domain;
    }

    public String inputType() {
        return domain ? "vec2" : "float";
    }

    public String body() {
        return body;
    }

    public static ColoringMode fromKey(String key) {
        ColoringMode mode = key == null ? null : BY_KEY.get(key);
        if (mode == null) {
            throw new UnknownColoringModeException(key);
        }
        return mode;
    }
}

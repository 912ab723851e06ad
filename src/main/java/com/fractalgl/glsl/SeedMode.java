package com.fractalgl.glsl;

public enum SeedMode {
    /** z starts at the origin; c varies per pixel. */
    MANDELBROT,
    /** z starts at the pixel coordinate c. */
    JULIA;

    public static SeedMode of(boolean julia) {
        return julia ? JULIA : MANDELBROT;
    }
}

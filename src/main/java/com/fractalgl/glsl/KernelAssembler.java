package com.fractalgl.glsl;

import com.fractalgl.settings.RenderSettings;

import java.util.Locale;

/**
 * Splices a decomposed iteration expression into the fragment program template. Each
 * settings-dependent block comes from its own method so it can be checked on its own;
 * {@link #assemble} only stitches them together.
 */
public class KernelAssembler {
    private static final String INDENT = "    ";

    private static final String HSL_TO_RGB = """
            vec3 hsltorgb(vec3 colorHSL) {
                float chroma = (1.0-abs(2.0*colorHSL.z-1.0)) * colorHSL.y;
                float h1 = colorHSL.x/60.0;
                float x = chroma * (1.0 - abs(mod(h1,2.0)-1.0));
                vec3 col = vec3(0.0,0.0,0.0);
                if (h1 < 1.0) {
                    col = vec3(chroma,x,0.0);
                } else if (h1 < 2.0) {
                    col = vec3(x,chroma,0.0);
                } else if (h1 < 3.0) {
                    col = vec3(0.0,chroma,x);
                } else if (h1 < 4.0) {
                    col = vec3(0.0,x,chroma);
                } else if (h1 < 5.0) {
                    col = vec3(x,0.0,chroma);
                } else if (h1 < 6.0) {
                    col = vec3(chroma,0.0,x);
                }
                vec3 m = vec3(colorHSL.z-chroma/2.0);
                return vec3(col+m);
            }
            """;

    private static final String VERTEX_PROGRAM = """
            attribute vec4 a_position;
            uniform float u_aspect;

            varying vec2 uv;

            void main() {
                gl_Position = a_position;
                uv = vec2(gl_Position.x * u_aspect,gl_Position.y);
            }
            """;

    public String assemble(String expression, RenderSettings settings) {
        return assemble(expression, settings, SeedMode.of(settings.julia()));
    }

    public String assemble(String expression, RenderSettings settings, SeedMode seedMode) {
        // resolve first: an unknown key must fail before any text exists
        ColoringMode mode = ColoringMode.fromKey(settings.coloring());

        StringBuilder sb = new StringBuilder(16384);
        sb.append("precision highp float;\n");
        sb.append("uniform vec3 u_transform;\n\n");
        sb.append("varying vec2 uv;\n\n");
        sb.append(iterationBound(settings.iterations())).append("\n");
        sb.append(ComplexRuntime.source()).append("\n");
        sb.append(HSL_TO_RGB).append("\n");
        sb.append(iterationFunction(expression)).append("\n");
        sb.append(coloringFunction(mode, settings.hueShift(), settings.bias())).append("\n");

        sb.append("void main() {\n");
        appendIndented(sb, ComplexRuntime.lanczosInitialization(), 1);
        sb.append('\n');
        appendIndented(sb, "vec2 c = uv/u_transform.z + u_transform.xy;\n", 1);
        appendIndented(sb, seedStatement(seedMode), 1);
        appendIndented(sb, "float floatIter = float(iterations);\n", 1);
        appendIndented(sb, "float iter = floatIter;\n", 1);
        appendIndented(sb, "for (int i = 0; i < iterations; i++) {\n", 1);
        appendIndented(sb, escapeTest(mode, settings.breakout()), 2);
        appendIndented(sb, "z = f(z, c);\n", 2);
        appendIndented(sb, "}\n", 1);
        appendIndented(sb, smoothingPass(settings.smooth()), 1);
        appendIndented(sb, "gl_FragColor = vec4(color(" + colorArgument(mode) + "), 1.0);\n", 1);
        sb.append("}\n");
        return sb.toString();
    }

    public String vertexProgram() {
        return VERTEX_PROGRAM;
    }

    static String iterationBound(int iterations) {
        return "const int iterations = " + iterations + ";\n";
    }

    static String iterationFunction(String expression) {
        return "vec2 f(vec2 z, vec2 c) {\n"
                + INDENT + "return " + expression + ";\n"
                + "}\n";
    }

    static String seedStatement(SeedMode seedMode) {
        return switch (seedMode) {
            case JULIA -> "vec2 z = c;\n";
            case MANDELBROT -> "vec2 z = vec2(0.0,0.0);\n";
        };
    }

    /** Empty for domain coloring, which always runs the full loop. */
    static String escapeTest(ColoringMode mode, double breakout) {
        if (mode.isDomain()) {
            return "";
        }
        return "if (z.x*z.x + z.y*z.y > " + formatReal(breakout) + ") {\n"
                + INDENT + "iter = float(i);\n"
                + INDENT + "break;\n"
                + "}\n";
    }

    /** Applied only when the loop exited early; a non-escaping pixel keeps its integer count. */
    static String smoothingPass(boolean smooth) {
        if (!smooth) {
            return "";
        }
        return "if (iter != floatIter) {\n"
                + INDENT + "float log_zn = log(z.x*z.x+z.y*z.y)/2.0;\n"
                + INDENT + "float nu = log(log_zn / log(2.0)) / log(2.0);\n"
                + INDENT + "iter = iter + 1.0 - nu;\n"
                + "}\n";
    }

    static String coloringFunction(ColoringMode mode, double hueShift, double bias) {
        StringBuilder sb = new StringBuilder();
        sb.append("vec3 color(").append(mode.inputType()).append(" x) {\n");
        sb.append(INDENT).append("float shift = ").append(formatReal(hueShift)).append(";\n");
        if (!mode.isDomain()) {
            sb.append(INDENT).append("x = pow(x,pow(1.1,").append(formatReal(bias)).append("));\n");
        }
        appendIndented(sb, mode.body(), 1);
        sb.append("}\n");
        return sb.toString();
    }

    static String colorArgument(ColoringMode mode) {
        return mode.isDomain() ? "z" : "iter/floatIter";
    }

    /** Two decimals, always with a '.', so the literal is a GLSL float. */
    static String formatReal(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    /** The value a real setting takes once printed into the program, e.g. 0.004 becomes 0.0. */
    public static double emittedValue(double value) {
        return Double.parseDouble(formatReal(value));
    }

    private static void appendIndented(StringBuilder sb, String block, int depth) {
        String prefix = INDENT.repeat(depth);
        for (String line : block.split("\n")) {
            if (line.isEmpty()) {
                continue;
            }
            sb.append(prefix).append(line).append('\n');
        }
    }
}

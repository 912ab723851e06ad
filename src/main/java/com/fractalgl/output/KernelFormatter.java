package com.fractalgl.output;

import com.fractalgl.glsl.CompiledKernel;
import com.fractalgl.settings.RenderSettings;

/**
 * Writes a compiled kernel pair as a JSON document, for loaders that want both stages and
 * the settings they were built from in one payload.
 */
public class KernelFormatter {
    private final boolean prettyPrint;

    public KernelFormatter(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
    }

    public String format(String equation, RenderSettings settings, CompiledKernel kernel) {
        StringBuilder sb = new StringBuilder(kernel.fragmentSource().length() + 1024);
        String newline = prettyPrint ? "\n" : "";
        String indent = prettyPrint ? "  " : "";
        String separator = prettyPrint ? ": " : ":";

        sb.append("{").append(newline);
        appendField(sb, indent, separator, "equation", quote(equation)).append(",").append(newline);
        sb.append(indent).append("\"settings\"").append(separator);
        formatSettings(settings, indent, sb);
        sb.append(",").append(newline);
        appendField(sb, indent, separator, "vertex", quote(kernel.vertexSource())).append(",").append(newline);
        appendField(sb, indent, separator, "fragment", quote(kernel.fragmentSource())).append(newline);
        sb.append("}");
        return sb.toString();
    }

    private void formatSettings(RenderSettings settings, String outerIndent, StringBuilder sb) {
        String newline = prettyPrint ? "\n" : "";
        String indent = prettyPrint ? outerIndent + "  " : "";
        String separator = prettyPrint ? ": " : ":";

        sb.append("{").append(newline);
        appendField(sb, indent, separator, "iterations", Integer.toString(settings.iterations())).append(",").append(newline);
        appendField(sb, indent, separator, "breakout", formatNumber(settings.breakout())).append(",").append(newline);
        appendField(sb, indent, separator, "coloring", quote(settings.coloring())).append(",").append(newline);
        appendField(sb, indent, separator, "bias", formatNumber(settings.bias())).append(",").append(newline);
        appendField(sb, indent, separator, "hueShift", formatNumber(settings.hueShift())).append(",").append(newline);
        appendField(sb, indent, separator, "julia", Boolean.toString(settings.julia())).append(",").append(newline);
        appendField(sb, indent, separator, "smooth", Boolean.toString(settings.smooth())).append(newline);
        sb.append(prettyPrint ? outerIndent : "").append("}");
    }

    private StringBuilder appendField(StringBuilder sb, String indent, String separator, String name, String value) {
        return sb.append(indent).append("\"").append(name).append("\"").append(separator).append(value);
    }

    private String formatNumber(double value) {
        // whole numbers print without a fraction, as integers read back
        if (value == (long) value) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    private String quote(String s) {
        return "\"" + escapeString(s) + "\"";
    }

    private String escapeString(String s) {
        boolean needsEscaping = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' || c == '"' || c < 0x20) {
                needsEscaping = true;
                break;
            }
        }

        if (!needsEscaping) {
            return s;
        }

        StringBuilder result = new StringBuilder(s.length() + 64);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> result.append("\\\\");
                case '"' -> result.append("\\\"");
                case '\n' -> result.append("\\n");
                case '\r' -> result.append("\\r");
                case '\t' -> result.append("\\t");
                default -> {
                    if (c < 0x20) {
                        result.append(String.format("\\u%04x", (int) c));
                    } else {
                        result.append(c);
                    }
                }
            }
        }
        return result.toString();
    }
}

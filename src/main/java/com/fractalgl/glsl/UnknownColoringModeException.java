package com.fractalgl.glsl;

public class UnknownColoringModeException extends FractalCompileException {
    private final String key;

    public UnknownColoringModeException(String key) {
        super("Unknown coloring mode: " + key);
        this.key = key;
    }

    public String key() {
        return key;
    }
}

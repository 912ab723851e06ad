package com.fractalgl.glsl;

/**
 * Base class for failures that abort a kernel compilation. No partial program text is
 * produced when one of these is thrown.
 */
public class FractalCompileException extends RuntimeException {
    public FractalCompileException(String message) {
        super(message);
    }
}

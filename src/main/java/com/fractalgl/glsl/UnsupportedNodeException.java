package com.fractalgl.glsl;

/**
 * A parse node that does not match any known variant, operator tag or literal form.
 * Trees produced by {@link com.fractalgl.parse.FormulaParser} never trigger this.
 */
public class UnsupportedNodeException extends FractalCompileException {
    public UnsupportedNodeException(String message) {
        super(message);
    }
}

package com.fractalgl.glsl;

import java.util.Objects;

public record CompiledKernel(String vertexSource, String fragmentSource) {
    public CompiledKernel {
        Objects.requireNonNull(vertexSource, "vertexSource");
        Objects.requireNonNull(fragmentSource, "fragmentSource");
    }
}

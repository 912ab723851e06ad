package com.fractalgl.glsl;

import com.fractalgl.ast.ParseNode;
import com.fractalgl.settings.RenderSettings;

/**
 * Turns a parse tree and a set of render settings into the vertex and fragment programs.
 * Holds no mutable state; one instance may serve concurrent callers.
 */
public class FractalCompiler {
    private final ExpressionDecomposer decomposer;
    private final KernelAssembler assembler;

    public FractalCompiler() {
        this(new ExpressionDecomposer(), new KernelAssembler());
    }

    public FractalCompiler(ExpressionDecomposer decomposer, KernelAssembler assembler) {
        this.decomposer = decomposer;
        this.assembler = assembler;
    }

    public CompiledKernel compile(ParseNode formula, RenderSettings settings) {
        // fails on an unknown coloring key before decomposing
        ColoringMode.fromKey(settings.coloring());
        String expression = decomposer.decompose(formula);
        String fragment = assembler.assemble(expression, settings, SeedMode.of(settings.julia()));
        return new CompiledKernel(assembler.vertexProgram(), fragment);
    }
}

package com.fractalgl.ast;

import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;

import java.util.Optional;

/**
 * The closed set of unary operator tags a {@link ParseNode.UnaryOperatorNode} may carry.
 * Each tag names exactly one routine of the complex-arithmetic runtime.
 */
public enum ComplexFunction {
    NEG("neg"),
    ABS("abs"),
    ARG("arg"),
    LN("ln"),
    EXP("exp"),
    SQRT("sqrt"),
    FLOOR("floor"),
    ROUND("round"),
    CEIL("ceil"),
    RE("Re"),
    IM("Im"),
    SIN("sin"),
    COS("cos"),
    TAN("tan"),
    COT("cot"),
    SEC("sec"),
    CSC("csc"),
    SINH("sinh"),
    COSH("cosh"),
    TANH("tanh"),
    COTH("coth"),
    SECH("sech"),
    CSCH("csch"),
    ARCSIN("arcsin"),
    ARCCOS("arccos"),
    ARCTAN("arctan"),
    ARCCOT("arccot"),
    ARCSEC("arcsec"),
    ARCCSC("arccsc"),
    GAMMA("Gamma");

    private static final ImmutableMap<String, ComplexFunction> BY_TAG;

    static {
        MutableMap<String, ComplexFunction> byTag = Maps.mutable.empty();
        for (ComplexFunction function : values()) {
            byTag.put(function.tag, function);
        }
        BY_TAG = byTag.toImmutable();
    }

    private final String tag;

    ComplexFunction(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static Optional<ComplexFunction> fromTag(String tag) {
        return Optional.ofNullable(BY_TAG.get(tag));
    }
}

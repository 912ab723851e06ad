package com.fractalgl.glsl;

import com.fractalgl.ast.ComplexFunction;
import com.fractalgl.ast.ParseNode;

import java.util.regex.Pattern;

/**
 * Lowers a parse tree into a single GLSL expression over {@code vec2} complex values.
 * The output only refers to the runtime routines declared by {@link ComplexRuntime}
 * and to the free variables {@code z} and {@code c}.
 */
public class ExpressionDecomposer {
    private static final Pattern REAL_LITERAL = Pattern.compile("\\d+(\\.\\d*)?|\\.\\d+");

    public String decompose(ParseNode node) {
        if (node instanceof ParseNode.NumberNode number) {
            return decomposeNumber(number.value());
        }
        if (node instanceof ParseNode.VariableNode variable) {
            return variable.name();
        }
        if (node instanceof ParseNode.BinaryOperatorNode binary) {
            return decomposeBinary(binary);
        }
        if (node instanceof ParseNode.UnaryOperatorNode unary) {
            ComplexFunction function = ComplexFunction.fromTag(unary.operator())
                    .orElseThrow(() -> new UnsupportedNodeException("Unknown unary operator: " + unary.operator()));
            return ComplexRuntime.routineName(function) + "(" + decompose(unary.operand()) + ")";
        }
        throw new UnsupportedNodeException("Unknown node type: " + node);
    }

    private String decomposeNumber(String value) {
        return switch (value) {
            case ParseNode.NumberNode.IMAGINARY_UNIT -> "vec2(0.0,1.0)";
            case ParseNode.NumberNode.EULER -> "vec2(" + ComplexRuntime.EULER_CONSTANT + ",0.0)";
            case ParseNode.NumberNode.PI -> "vec2(" + ComplexRuntime.PI_CONSTANT + ",0.0)";
            default -> decomposeRealLiteral(value);
        };
    }

    private String decomposeRealLiteral(String lexeme) {
        if (!isRealLiteral(lexeme)) {
            throw new UnsupportedNodeException("Invalid number literal: " + lexeme);
        }
        // GLSL ES has no implicit int to float conversion
        if (lexeme.contains(".")) {
            return "vec2(" + lexeme + ",0.0)";
        }
        return "vec2(" + lexeme + ".0,0.0)";
    }

    /** Whether the lexeme is a plain decimal literal the decomposer can emit. */
    public static boolean isRealLiteral(String lexeme) {
        return REAL_LITERAL.matcher(lexeme).matches();
    }

    private String decomposeBinary(ParseNode.BinaryOperatorNode node) {
        String left = decompose(node.left());
        String right = decompose(node.right());
        return switch (node.operator()) {
            case ParseNode.BinaryOperatorNode.ADD -> left + "+" + right;
            case ParseNode.BinaryOperatorNode.SUBTRACT -> isAdditive(node.right())
                    ? left + "-(" + right + ")"
                    : left + "-" + right;
            case ParseNode.BinaryOperatorNode.MULTIPLY -> "cm(" + left + "," + right + ")";
            case ParseNode.BinaryOperatorNode.DIVIDE -> "cd(" + left + "," + right + ")";
            case ParseNode.BinaryOperatorNode.POWER -> "cpow(" + left + "," + right + ")";
            default -> throw new UnsupportedNodeException("Unknown binary operator: " + node.operator());
        };
    }

    // a-(b+c) must not flatten to a-b+c
    private static boolean isAdditive(ParseNode node) {
        return node instanceof ParseNode.BinaryOperatorNode binary
                && (binary.operator().equals(ParseNode.BinaryOperatorNode.ADD)
                    || binary.operator().equals(ParseNode.BinaryOperatorNode.SUBTRACT));
    }
}

package com.fractalgl.reference;

import com.fractalgl.ast.ComplexFunction;
import com.fractalgl.ast.ParseNode;
import com.fractalgl.glsl.ExpressionDecomposer;
import com.fractalgl.glsl.UnsupportedNodeException;

/** Evaluates a parse tree directly, the way the decomposed GLSL expression would. */
public class FormulaEvaluator {

    public Complex evaluate(ParseNode node, Complex z, Complex c) {
        if (node instanceof ParseNode.NumberNode number) {
            return evaluateNumber(number.value());
        }
        if (node instanceof ParseNode.VariableNode variable) {
            return switch (variable.name()) {
                case "z" -> z;
                case "c" -> c;
                default -> throw new UnsupportedNodeException("Unknown variable: " + variable.name());
            };
        }
        if (node instanceof ParseNode.BinaryOperatorNode binary) {
            Complex left = evaluate(binary.left(), z, c);
            Complex right = evaluate(binary.right(), z, c);
            return switch (binary.operator()) {
                case ParseNode.BinaryOperatorNode.ADD -> left.add(right);
                case ParseNode.BinaryOperatorNode.SUBTRACT -> left.subtract(right);
                case ParseNode.BinaryOperatorNode.MULTIPLY -> left.multiply(right);
                case ParseNode.BinaryOperatorNode.DIVIDE -> left.divide(right);
                case ParseNode.BinaryOperatorNode.POWER -> ComplexFunctions.pow(left, right);
                default -> throw new UnsupportedNodeException("Unknown binary operator: " + binary.operator());
            };
        }
        if (node instanceof ParseNode.UnaryOperatorNode unary) {
            ComplexFunction function = ComplexFunction.fromTag(unary.operator())
                    .orElseThrow(() -> new UnsupportedNodeException("Unknown unary operator: " + unary.operator()));
            return ComplexFunctions.apply(function, evaluate(unary.operand(), z, c));
        }
        throw new UnsupportedNodeException("Unknown node type: " + node);
    }

    private Complex evaluateNumber(String value) {
        return switch (value) {
            case ParseNode.NumberNode.IMAGINARY_UNIT -> Complex.I;
            case ParseNode.NumberNode.EULER -> Complex.real(Math.E);
            case ParseNode.NumberNode.PI -> Complex.real(Math.PI);
            default -> {
                // 1e5, NaN or 0x1p3 parse as doubles but have no GLSL form
                if (!ExpressionDecomposer.isRealLiteral(value)) {
                    throw new UnsupportedNodeException("Invalid number literal: " + value);
                }
                yield Complex.real(Double.parseDouble(value));
            }
        };
    }
}

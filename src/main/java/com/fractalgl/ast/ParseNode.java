package com.fractalgl.ast;

import java.util.Objects;

public sealed interface ParseNode {
    record NumberNode(String value) implements ParseNode {
        public static final String IMAGINARY_UNIT = "i";
        public static final String EULER = "e";
        public static final String PI = "\\pi";

        public NumberNode {
            Objects.requireNonNull(value, "value");
        }
    }

    record VariableNode(String name) implements ParseNode {
        public VariableNode {
            Objects.requireNonNull(name, "name");
        }
    }

    // operator is a ComplexFunction tag, e.g. "sin" or "neg"
    record UnaryOperatorNode(String operator, ParseNode operand) implements ParseNode {
        public UnaryOperatorNode {
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(operand, "operand");
        }

        public UnaryOperatorNode(ComplexFunction function, ParseNode operand) {
            this(function.tag(), operand);
        }
    }

    record BinaryOperatorNode(String operator, ParseNode left, ParseNode right) implements ParseNode {
        public static final String ADD = "+";
        public static final String SUBTRACT = "-";
        public static final String MULTIPLY = "*";
        public static final String DIVIDE = "/";
        public static final String POWER = "^";

        public BinaryOperatorNode {
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }
}

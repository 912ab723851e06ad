package com.fractalgl.parse;

import com.fractalgl.ast.ComplexFunction;
import com.fractalgl.ast.ParseNode;
import com.fractalgl.ast.ParseNode.BinaryOperatorNode;
import com.fractalgl.ast.ParseNode.NumberNode;
import com.fractalgl.ast.ParseNode.UnaryOperatorNode;
import com.fractalgl.ast.ParseNode.VariableNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class FormulaParserTest {
    private static final ParseNode Z = new VariableNode("z");
    private static final ParseNode C = new VariableNode("c");

    private final FormulaParser parser = new FormulaParser();

    private static ParseNode num(String value) {
        return new NumberNode(value);
    }

    private static ParseNode bin(String operator, ParseNode left, ParseNode right) {
        return new BinaryOperatorNode(operator, left, right);
    }

    private static ParseNode fn(ComplexFunction function, ParseNode operand) {
        return new UnaryOperatorNode(function, operand);
    }

    @Test
    public void testMandelbrot() {
        assertEquals(bin("+", bin("^", Z, num("2")), C), parser.parse("z^{2}+c"));
        assertEquals(bin("+", bin("^", Z, num("2")), C), parser.parse("z^2 + c"));
    }

    @Test
    public void testLeftAssociativeSubtraction() {
        assertEquals(bin("-", bin("-", Z, C), num("1")), parser.parse("z-c-1"));
    }

    @Test
    public void testPrecedence() {
        assertEquals(bin("+", Z, bin("*", C, num("2"))), parser.parse("z+c*2"));
        assertEquals(bin("/", bin("*", Z, C), num("2")), parser.parse("z*c/2"));
        assertEquals(bin("*", num("2"), bin("^", Z, num("3"))), parser.parse("2z^3"));
    }

    @Test
    public void testRightAssociativePower() {
        assertEquals(bin("^", Z, bin("^", Z, num("2"))), parser.parse("z^{z^{2}}"));
        assertEquals(bin("^", Z, fn(ComplexFunction.NEG, num("1"))), parser.parse("z^-1"));
        assertEquals(bin("^", Z, fn(ComplexFunction.NEG, num("1"))), parser.parse("z^{-1}"));
    }

    @Test
    public void testImplicitMultiplication() {
        assertEquals(bin("*", Z, C), parser.parse("zc"));
        assertEquals(bin("*", num("3.5"), Z), parser.parse("3.5z"));
        assertEquals(bin("*", num("\\pi"), C), parser.parse("\\pi c"));
        assertEquals(bin("*", Z, C), parser.parse("z\\cdot c"));
        assertEquals(bin("*", Z, C), parser.parse("z \\times c"));
    }

    @Test
    public void testConstants() {
        assertEquals(bin("^", num("e"), bin("*", num("i"), Z)), parser.parse("e^{iz}"));
        assertEquals(num("\\pi"), parser.parse("\\pi"));
    }

    @Test
    public void testUnaryMinus() {
        assertEquals(bin("+", fn(ComplexFunction.NEG, bin("^", Z, num("2"))), C), parser.parse("-z^{2}+c"));
        assertEquals(bin("-", Z, fn(ComplexFunction.NEG, C)), parser.parse("z--c"));
    }

    @Test
    public void testFunctions() {
        assertEquals(fn(ComplexFunction.SIN, Z), parser.parse("\\sin(z)"));
        assertEquals(fn(ComplexFunction.SIN, Z), parser.parse("sin(z)"));
        assertEquals(fn(ComplexFunction.SIN, Z), parser.parse("sinz"));
        assertEquals(bin("+", fn(ComplexFunction.SIN, Z), C), parser.parse("\\sin z+c"));
        assertEquals(fn(ComplexFunction.GAMMA, Z), parser.parse("\\Gamma(z)"));
        assertEquals(fn(ComplexFunction.SECH, C), parser.parse("\\sech(c)"));
        assertEquals(fn(ComplexFunction.RE, Z), parser.parse("Re(z)"));
        assertEquals(fn(ComplexFunction.SQRT, bin("+", Z, C)), parser.parse("\\sqrt{z+c}"));
    }

    @Test
    public void testFunctionPowerAppliesToResult() {
        assertEquals(bin("^", fn(ComplexFunction.SIN, Z), num("2")), parser.parse("\\sin(z)^{2}"));
    }

    @Test
    public void testGroupingForms() {
        ParseNode sum = bin("+", Z, C);
        assertEquals(bin("^", sum, num("2")), parser.parse("(z+c)^2"));
        assertEquals(bin("^", sum, num("2")), parser.parse("\\left(z+c\\right)^{2}"));
        assertEquals(bin("/", Z, num("2")), parser.parse("\\frac{z}{2}"));
        assertEquals(fn(ComplexFunction.ABS, Z), parser.parse("|z|"));
        assertEquals(fn(ComplexFunction.ABS, sum), parser.parse("\\left|z+c\\right|"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "z+", "(z+c", "z+c)", "x", "z$2", "\\foo(z)", "\\frac{z}", "1..2"})
    public void testInvalidFormulas(String formula) {
        assertThrows(IllegalArgumentException.class, () -> parser.parse(formula));
    }

    @Test
    public void testNonAsciiDigitsAreRejected() {
        // Arabic-Indic two
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> parser.parse("z^{\u0662}+c"));
        assertTrue(e.getMessage().contains("position 3"), e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> parser.parse("z^{2\u0663}+c"));
    }

    @Test
    public void testDeepNestingIsRejected() {
        String formula = "(".repeat(100_000) + "z" + ")".repeat(100_000);
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> parser.parse(formula));
        assertTrue(e.getMessage().contains("nested too deeply"), e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> parser.parse("-".repeat(100_000) + "z"));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("z" + "^z".repeat(100_000)));
    }

    @Test
    public void testModerateNestingParses() {
        assertEquals(Z, parser.parse("(".repeat(100) + "z" + ")".repeat(100)));
    }

    @Test
    public void testErrorReportsPosition() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> parser.parse("z+)"));
        assertTrue(e.getMessage().contains("position 2"), e.getMessage());
    }

    @Test
    public void testParserIsReusable() {
        parser.parse("z^{2}+c");
        assertEquals(Z, parser.parse("z"));
    }
}

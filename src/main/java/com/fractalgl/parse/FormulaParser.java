package com.fractalgl.parse;

import com.fractalgl.ast.ComplexFunction;
import com.fractalgl.ast.ParseNode;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Optional;

/**
 * Recursive-descent parser for the LaTeX-flavoured formula notation, e.g.
 * {@code z^{2}+c}, {@code \sin(z)\cdot c} or {@code \frac{z^{3}}{2}+c}.
 *
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := unary (('*' | '/' | '\cdot' | '\times' | implicit) unary)*
 * unary      := '-' unary | power
 * power      := primary ('^' (group | primary | '-' primary))?
 * primary    := number | constant | variable | function argument | group
 *             | '\frac' group group | '\sqrt' group | '|' expression '|'
 * </pre>
 */
public class FormulaParser {
    private static final String VARIABLES = "zc";
    // counts open expression, unary and power rules; keeps recursion well inside the thread stack
    private static final int MAX_DEPTH = 600;

    private MutableList<Token> tokens;
    private int position;
    private int depth;

    public ParseNode parse(String formula) {
        if (formula == null || formula.isBlank()) {
            throw new IllegalArgumentException("Empty formula");
        }
        tokens = new FormulaLexer(formula).tokenize();
        position = 0;
        depth = 0;

        ParseNode result = parseExpression();
        if (!check(TokenType.END)) {
            throw error("Unexpected '" + peek().text() + "'");
        }
        return result;
    }

    private ParseNode parseExpression() {
        enter();
        try {
            ParseNode left = parseTerm();
            while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
                String operator = advance().type() == TokenType.PLUS
                        ? ParseNode.BinaryOperatorNode.ADD
                        : ParseNode.BinaryOperatorNode.SUBTRACT;
                left = new ParseNode.BinaryOperatorNode(operator, left, parseTerm());
            }
            return left;
        } finally {
            depth--;
        }
    }

    private ParseNode parseTerm() {
        ParseNode left = parseUnary();
        while (true) {
            if (check(TokenType.STAR) || checkCommand("cdot") || checkCommand("times")) {
                advance();
                left = new ParseNode.BinaryOperatorNode(ParseNode.BinaryOperatorNode.MULTIPLY, left, parseUnary());
            } else if (check(TokenType.SLASH)) {
                advance();
                left = new ParseNode.BinaryOperatorNode(ParseNode.BinaryOperatorNode.DIVIDE, left, parseUnary());
            } else if (startsPrimary()) {
                // implicit multiplication: 2z, zc, 3\sin(z)
                left = new ParseNode.BinaryOperatorNode(ParseNode.BinaryOperatorNode.MULTIPLY, left, parsePower());
            } else {
                return left;
            }
        }
    }

    private ParseNode parseUnary() {
        enter();
        try {
            if (check(TokenType.MINUS)) {
                advance();
                return new ParseNode.UnaryOperatorNode(ComplexFunction.NEG, parseUnary());
            }
            return parsePower();
        } finally {
            depth--;
        }
    }

    private ParseNode parsePower() {
        enter();
        try {
            ParseNode base = parsePrimary();
            if (!check(TokenType.CARET)) {
                return base;
            }
            advance();
            ParseNode exponent;
            if (check(TokenType.MINUS)) {
                advance();
                exponent = new ParseNode.UnaryOperatorNode(ComplexFunction.NEG, parsePower());
            } else {
                // z^{2}^{3} is z^(2^3)
                exponent = parsePower();
            }
            return new ParseNode.BinaryOperatorNode(ParseNode.BinaryOperatorNode.POWER, base, exponent);
        } finally {
            depth--;
        }
    }

    private ParseNode parsePrimary() {
        Token token = peek();
        return switch (token.type()) {
            case NUMBER -> {
                advance();
                yield new ParseNode.NumberNode(token.text());
            }
            case LEFT_PAREN -> parseGroup(TokenType.LEFT_PAREN, TokenType.RIGHT_PAREN);
            case LEFT_BRACE -> parseGroup(TokenType.LEFT_BRACE, TokenType.RIGHT_BRACE);
            case BAR -> {
                advance();
                ParseNode inner = parseExpression();
                expect(TokenType.BAR, "'|'");
                yield new ParseNode.UnaryOperatorNode(ComplexFunction.ABS, inner);
            }
            case WORD -> {
                advance();
                yield parseWord(token.text());
            }
            case COMMAND -> {
                advance();
                yield parseCommand(token.text());
            }
            default -> throw error(token.type() == TokenType.END
                    ? "Unexpected end of formula"
                    : "Unexpected '" + token.text() + "'");
        };
    }

    private ParseNode parseGroup(TokenType open, TokenType close) {
        expect(open, open == TokenType.LEFT_PAREN ? "'('" : "'{'");
        ParseNode inner = parseExpression();
        expect(close, close == TokenType.RIGHT_PAREN ? "')'" : "'}'");
        return inner;
    }

    private ParseNode parseWord(String word) {
        Optional<ComplexFunction> function = ComplexFunction.fromTag(word);
        if (function.isPresent() && function.get() != ComplexFunction.NEG) {
            return new ParseNode.UnaryOperatorNode(function.get(), parseFunctionArgument());
        }
        if (word.equals(ParseNode.NumberNode.IMAGINARY_UNIT) || word.equals(ParseNode.NumberNode.EULER)) {
            return new ParseNode.NumberNode(word);
        }
        if (word.length() == 1 && VARIABLES.contains(word)) {
            return new ParseNode.VariableNode(word);
        }
        throw error("Unknown identifier '" + word + "'");
    }

    private ParseNode parseCommand(String command) {
        if (command.equals("pi")) {
            return new ParseNode.NumberNode(ParseNode.NumberNode.PI);
        }
        if (command.equals("left")) {
            return parseLeftRight();
        }
        if (command.equals("frac")) {
            ParseNode numerator = parseGroup(TokenType.LEFT_BRACE, TokenType.RIGHT_BRACE);
            ParseNode denominator = parseGroup(TokenType.LEFT_BRACE, TokenType.RIGHT_BRACE);
            return new ParseNode.BinaryOperatorNode(ParseNode.BinaryOperatorNode.DIVIDE, numerator, denominator);
        }
        Optional<ComplexFunction> function = ComplexFunction.fromTag(command);
        if (function.isPresent() && function.get() != ComplexFunction.NEG) {
            return new ParseNode.UnaryOperatorNode(function.get(), parseFunctionArgument());
        }
        throw error("Unknown command '\\" + command + "'");
    }

    // \left( ... \right), also with | and [ ] delimiters mapped by the lexer
    private ParseNode parseLeftRight() {
        boolean absolute = check(TokenType.BAR);
        if (!absolute && !check(TokenType.LEFT_PAREN)) {
            throw error("Expected '(' or '|' after \\left");
        }
        advance();
        ParseNode inner = parseExpression();
        if (!checkCommand("right")) {
            throw error("Expected \\right");
        }
        advance();
        expect(absolute ? TokenType.BAR : TokenType.RIGHT_PAREN, absolute ? "'|'" : "')'");
        return absolute ? new ParseNode.UnaryOperatorNode(ComplexFunction.ABS, inner) : inner;
    }

    // the exponent in \sin(z)^{2} applies to the function value, so only the group is taken here
    private ParseNode parseFunctionArgument() {
        if (check(TokenType.LEFT_PAREN) || check(TokenType.LEFT_BRACE) || checkCommand("left")) {
            return parsePrimary();
        }
        // \sin z binds like \sin(z)
        return parseUnary();
    }

    private void enter() {
        if (++depth > MAX_DEPTH) {
            throw error("Formula is nested too deeply");
        }
    }

    private boolean startsPrimary() {
        return switch (peek().type()) {
            case NUMBER, LEFT_PAREN, LEFT_BRACE, WORD -> true;
            case COMMAND -> !checkCommand("cdot") && !checkCommand("times") && !checkCommand("right");
            default -> false;
        };
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean checkCommand(String name) {
        return check(TokenType.COMMAND) && peek().text().equals(name);
    }

    private Token peek() {
        return tokens.get(position);
    }

    private Token advance() {
        Token token = tokens.get(position);
        if (token.type() != TokenType.END) {
            position++;
        }
        return token;
    }

    private void expect(TokenType type, String description) {
        if (!check(type)) {
            throw error("Expected " + description);
        }
        advance();
    }

    private IllegalArgumentException error(String message) {
        return new IllegalArgumentException(message + " at position " + peek().offset());
    }

    enum TokenType {
        NUMBER, WORD, COMMAND, PLUS, MINUS, STAR, SLASH, CARET,
        LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE, BAR, END
    }

    record Token(TokenType type, String text, int offset) {}

    static final class FormulaLexer {
        private final String source;
        private int index;

        FormulaLexer(String source) {
            this.source = source;
        }

        MutableList<Token> tokenize() {
            MutableList<Token> result = Lists.mutable.empty();
            while (index < source.length()) {
                char c = source.charAt(index);
                int start = index;
                if (Character.isWhitespace(c)) {
                    index++;
                } else if (isDigit(c)) {
                    result.add(new Token(TokenType.NUMBER, readNumber(), start));
                } else if (Character.isLetter(c)) {
                    readLetters(result);
                } else if (c == '\\') {
                    index++;
                    String name = readCommandName();
                    if (name.isEmpty()) {
                        // "\ " and "\," are LaTeX spacing
                        if (index < source.length()) {
                            index++;
                        }
                        continue;
                    }
                    result.add(new Token(TokenType.COMMAND, name, start));
                } else {
                    result.add(new Token(symbolType(c, start), String.valueOf(c), start));
                    index++;
                }
            }
            result.add(new Token(TokenType.END, "", source.length()));
            return result;
        }

        private String readNumber() {
            int start = index;
            while (index < source.length() && isDigit(source.charAt(index))) {
                index++;
            }
            if (index + 1 < source.length() && source.charAt(index) == '.'
                    && isDigit(source.charAt(index + 1))) {
                index++;
                while (index < source.length() && isDigit(source.charAt(index))) {
                    index++;
                }
            }
            return source.substring(start, index);
        }

        // ASCII only: the emitted GLSL literal has to be plain decimal
        private static boolean isDigit(char c) {
            return c >= '0' && c <= '9';
        }

        /**
         * A run of plain letters is split into single-letter words unless a prefix of it
         * names a function, so "zc" is z times c while "sinz" is sin(z).
         */
        private void readLetters(MutableList<Token> result) {
            int end = index;
            while (end < source.length() && Character.isLetter(source.charAt(end))) {
                end++;
            }
            while (index < end) {
                String function = longestFunctionPrefix(source.substring(index, end));
                String word = function != null ? function : source.substring(index, index + 1);
                result.add(new Token(TokenType.WORD, word, index));
                index += word.length();
            }
        }

        private static String longestFunctionPrefix(String letters) {
            for (int length = letters.length(); length > 1; length--) {
                String candidate = letters.substring(0, length);
                Optional<ComplexFunction> function = ComplexFunction.fromTag(candidate);
                if (function.isPresent() && function.get() != ComplexFunction.NEG) {
                    return candidate;
                }
            }
            return null;
        }

        private String readCommandName() {
            int start = index;
            while (index < source.length() && Character.isLetter(source.charAt(index))) {
                index++;
            }
            return source.substring(start, index);
        }

        private TokenType symbolType(char c, int offset) {
            return switch (c) {
                case '+' -> TokenType.PLUS;
                case '-' -> TokenType.MINUS;
                case '*' -> TokenType.STAR;
                case '/' -> TokenType.SLASH;
                case '^' -> TokenType.CARET;
                case '(', '[' -> TokenType.LEFT_PAREN;
                case ')', ']' -> TokenType.RIGHT_PAREN;
                case '{' -> TokenType.LEFT_BRACE;
                case '}' -> TokenType.RIGHT_BRACE;
                case '|' -> TokenType.BAR;
                default -> throw new IllegalArgumentException(
                        "Unexpected character '" + c + "' at position " + offset);
            };
        }
    }
}

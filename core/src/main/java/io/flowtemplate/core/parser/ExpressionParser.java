package io.flowtemplate.core.parser;

import io.flowtemplate.core.ast.BinaryOperator;
import io.flowtemplate.core.ast.ExpressionAst;
import io.flowtemplate.core.ast.UnaryOperator;
import io.flowtemplate.core.error.ParseException;
import io.flowtemplate.core.model.DataSource;
import io.flowtemplate.core.model.Value;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for the body of one <code>{{ ... }}</code> segment.
 *
 * <p>
 * Precedence, lowest first: pipeline {@code |}, ternary {@code ?:} (right-associative),
 * {@code ||}/{@code or}, {@code &&}/{@code and}, {@code ==}/{@code !=}, relational
 * ({@code < <= > >= contains startsWith endsWith}), additive, multiplicative, unary
 * ({@code ! not -}), primary.
 *
 * <p>
 * Instances are stateless and reusable; every {@link #parse} call works on its own cursor.
 */
public final class ExpressionParser {

    /** Nesting limit used when none is configured. */
    public static final int DEFAULT_MAX_DEPTH = 64;

    private final int maxDepth;

    public ExpressionParser() {
        this(DEFAULT_MAX_DEPTH);
    }

    public ExpressionParser(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be >= 1, got: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    /** Parses a standalone expression; error positions are relative to {@code expression}. */
    public ExpressionAst parse(String expression) {
        return parse(expression, expression, 0);
    }

    /**
     * Parses an expression embedded in a template.
     *
     * @param expression the trimmed expression text
     * @param template   the full template, reported in errors
     * @param offset     char index of {@code expression} inside {@code template}
     * @throws ParseException if the expression is malformed or nests deeper than allowed
     */
    public ExpressionAst parse(String expression, String template, int offset) {
        List<Token> tokens = new Lexer(expression, template, offset).tokenize();
        Cursor cursor = new Cursor(tokens, template, offset);
        if (cursor.peek().is(TokenType.EOF)) {
            throw cursor.error("Empty expression", cursor.peek());
        }
        ExpressionAst ast = cursor.expression();
        Token trailing = cursor.peek();
        if (!trailing.is(TokenType.EOF)) {
            throw cursor.error("Unexpected token " + trailing, trailing);
        }
        return ast;
    }

    private final class Cursor {

        private final List<Token> tokens;
        private final String template;
        private final int offset;
        private int index;
        private int depth;

        Cursor(List<Token> tokens, String template, int offset) {
            this.tokens = tokens;
            this.template = template;
            this.offset = offset;
        }

        // ── Precedence levels ──

        ExpressionAst expression() {
            enter();
            ExpressionAst input = ternary();
            if (peek().is(TokenType.PIPE)) {
                List<ExpressionAst.Pipeline.Stage> stages = new ArrayList<>();
                while (accept(TokenType.PIPE)) {
                    Token name = expect(TokenType.IDENTIFIER, "Expected function name after '|'");
                    List<ExpressionAst> args = peek().is(TokenType.LPAREN) ? arguments() : List.of();
                    stages.add(new ExpressionAst.Pipeline.Stage(name.text(), args));
                }
                input = new ExpressionAst.Pipeline(input, stages);
            }
            depth--;
            return input;
        }

        private ExpressionAst ternary() {
            ExpressionAst condition = or();
            if (!accept(TokenType.QUESTION)) {
                return condition;
            }
            enter();
            ExpressionAst thenExpr = ternary();
            expect(TokenType.COLON, "Expected ':' in conditional expression");
            ExpressionAst elseExpr = ternary();
            depth--;
            return new ExpressionAst.Ternary(condition, thenExpr, elseExpr);
        }

        // every applied binary operator deepens the left spine of the tree, so it counts as a level
        private ExpressionAst or() {
            int base = depth;
            ExpressionAst left = and();
            while (accept(TokenType.OR_OR) || acceptWord("or")) {
                enter();
                left = new ExpressionAst.BinaryOp(left, BinaryOperator.OR, and());
            }
            depth = base;
            return left;
        }

        private ExpressionAst and() {
            int base = depth;
            ExpressionAst left = equality();
            while (accept(TokenType.AND_AND) || acceptWord("and")) {
                enter();
                left = new ExpressionAst.BinaryOp(left, BinaryOperator.AND, equality());
            }
            depth = base;
            return left;
        }

        private ExpressionAst equality() {
            int base = depth;
            ExpressionAst left = relational();
            while (true) {
                BinaryOperator op;
                if (accept(TokenType.EQ_EQ)) {
                    op = BinaryOperator.EQUAL;
                } else if (accept(TokenType.BANG_EQ)) {
                    op = BinaryOperator.NOT_EQUAL;
                } else {
                    depth = base;
                    return left;
                }
                enter();
                left = new ExpressionAst.BinaryOp(left, op, relational());
            }
        }

        private ExpressionAst relational() {
            int base = depth;
            ExpressionAst left = additive();
            while (true) {
                BinaryOperator op;
                if (accept(TokenType.LT)) {
                    op = BinaryOperator.LESS_THAN;
                } else if (accept(TokenType.LT_EQ)) {
                    op = BinaryOperator.LESS_EQUAL;
                } else if (accept(TokenType.GT)) {
                    op = BinaryOperator.GREATER_THAN;
                } else if (accept(TokenType.GT_EQ)) {
                    op = BinaryOperator.GREATER_EQUAL;
                } else if (acceptWord("contains")) {
                    op = BinaryOperator.CONTAINS;
                } else if (acceptWord("startsWith")) {
                    op = BinaryOperator.STARTS_WITH;
                } else if (acceptWord("endsWith")) {
                    op = BinaryOperator.ENDS_WITH;
                } else {
                    depth = base;
                    return left;
                }
                enter();
                left = new ExpressionAst.BinaryOp(left, op, additive());
            }
        }

        private ExpressionAst additive() {
            int base = depth;
            ExpressionAst left = multiplicative();
            while (true) {
                BinaryOperator op;
                if (accept(TokenType.PLUS)) {
                    op = BinaryOperator.ADD;
                } else if (accept(TokenType.MINUS)) {
                    op = BinaryOperator.SUBTRACT;
                } else {
                    depth = base;
                    return left;
                }
                enter();
                left = new ExpressionAst.BinaryOp(left, op, multiplicative());
            }
        }

        private ExpressionAst multiplicative() {
            int base = depth;
            ExpressionAst left = unary();
            while (true) {
                BinaryOperator op;
                if (accept(TokenType.STAR)) {
                    op = BinaryOperator.MULTIPLY;
                } else if (accept(TokenType.SLASH)) {
                    op = BinaryOperator.DIVIDE;
                } else if (accept(TokenType.PERCENT)) {
                    op = BinaryOperator.MODULO;
                } else {
                    depth = base;
                    return left;
                }
                enter();
                left = new ExpressionAst.BinaryOp(left, op, unary());
            }
        }

        private ExpressionAst unary() {
            if (accept(TokenType.BANG) || acceptWord("not")) {
                enter();
                ExpressionAst operand = unary();
                depth--;
                return new ExpressionAst.UnaryOp(UnaryOperator.NOT, operand);
            }
            if (accept(TokenType.MINUS)) {
                Token next = peek();
                // fold "-<number>" into a negative literal so that Long.MIN_VALUE is expressible
                if (next.is(TokenType.INTEGER) || next.is(TokenType.FLOAT)) {
                    index++;
                    return new ExpressionAst.Literal(number(next, "-" + next.text()));
                }
                enter();
                ExpressionAst operand = unary();
                depth--;
                return new ExpressionAst.UnaryOp(UnaryOperator.MINUS, operand);
            }
            return primary();
        }

        // ── Primary ──

        private ExpressionAst primary() {
            Token token = peek();
            switch (token.type()) {
                case INTEGER:
                case FLOAT:
                    index++;
                    return new ExpressionAst.Literal(number(token, token.text()));
                case STRING:
                    index++;
                    return new ExpressionAst.Literal(Value.of(token.text()));
                case SOURCE:
                    index++;
                    return dataAccess(token);
                case LPAREN: {
                    index++;
                    ExpressionAst inner = expression();
                    expect(TokenType.RPAREN, "Expected ')'");
                    return inner;
                }
                case IDENTIFIER:
                    return word(token);
                case EOF:
                    throw error("Unexpected end of expression", token);
                default:
                    throw error("Unknown literal type: " + token, token);
            }
        }

        private ExpressionAst word(Token token) {
            switch (token.text()) {
                case "null":
                    index++;
                    return new ExpressionAst.Literal(Value.NULL);
                case "true":
                    index++;
                    return new ExpressionAst.Literal(Value.TRUE);
                case "false":
                    index++;
                    return new ExpressionAst.Literal(Value.FALSE);
                default:
                    break;
            }
            if (!peekAt(1).is(TokenType.LPAREN)) {
                throw error("Unknown literal type: " + token, token);
            }
            index++;
            List<ExpressionAst> args = arguments();
            if (token.text().equals("if")) {
                if (args.size() < 2 || args.size() > 3) {
                    throw error("If function requires 2 or 3 arguments", token);
                }
                return new ExpressionAst.IfFunction(args.get(0), args.get(1), args.size() == 3 ? args.get(2) : null);
            }
            return new ExpressionAst.FunctionCall(token.text(), args);
        }

        private List<ExpressionAst> arguments() {
            expect(TokenType.LPAREN, "Expected '('");
            List<ExpressionAst> args = new ArrayList<>();
            if (accept(TokenType.RPAREN)) {
                return args;
            }
            do {
                args.add(expression());
            } while (accept(TokenType.COMMA));
            expect(TokenType.RPAREN, "Expected ',' or ')' in argument list");
            return args;
        }

        private Value number(Token token, String text) {
            if (token.is(TokenType.FLOAT)) {
                return Value.of(Double.parseDouble(text));
            }
            BigInteger value = new BigInteger(text);
            // integers beyond 64 bits degrade to floats
            return value.bitLength() < 64 ? Value.of(value.longValue()) : Value.of(value.doubleValue());
        }

        // ── Data access ──

        private ExpressionAst dataAccess(Token source) {
            switch (source.text()) {
                case "$input":
                    return new ExpressionAst.DataAccess(DataSource.INPUT, path());
                case "$node": {
                    expect(TokenType.LPAREN, "Expected '(' after $node");
                    Token id = expect(TokenType.STRING, "Expected quoted node id in $node(...)");
                    expect(TokenType.RPAREN, "Expected ')' after node id");
                    String path = path();
                    if (path.startsWith("json.")) {
                        path = path.substring("json.".length());
                    }
                    return new ExpressionAst.DataAccess(DataSource.node(id.text()), path);
                }
                case "$env": {
                    String name = path();
                    if (name.isEmpty()) {
                        throw error("Expected environment variable name after $env", source);
                    }
                    return new ExpressionAst.DataAccess(DataSource.ENVIRONMENT, name);
                }
                case "$system":
                    return new ExpressionAst.DataAccess(DataSource.SYSTEM, path());
                case "$execution":
                    return new ExpressionAst.DataAccess(DataSource.EXECUTION, path());
                case "$workflow":
                    return new ExpressionAst.DataAccess(DataSource.WORKFLOW, path());
                default:
                    throw error("Unknown data source: " + source.text(), source);
            }
        }

        /**
         * Reads {@code (.segment)*}; returns the segments joined by dots, or {@code ""}. A segment is
         * an identifier or integer, optionally joined to further words by hyphens written without
         * spaces ({@code content-type}), or a quoted key ({@code .'first name'}).
         */
        private String path() {
            StringBuilder path = new StringBuilder();
            while (accept(TokenType.DOT)) {
                Token segment = peek();
                String text;
                if (segment.is(TokenType.STRING)) {
                    text = segment.text();
                    if (text.isEmpty() || text.indexOf('.') >= 0) {
                        throw error("Quoted path segment must be non-empty and contain no '.', found " + segment, segment);
                    }
                    index++;
                } else if (isSegmentWord(segment)) {
                    index++;
                    text = segment.text() + hyphenatedTail(segment);
                } else {
                    throw error("Invalid path segment " + segment, segment);
                }
                if (path.length() > 0) {
                    path.append('.');
                }
                path.append(text);
            }
            return path.toString();
        }

        private boolean isSegmentWord(Token token) {
            // "items.0.1" lexes its last two segments as one number
            return token.is(TokenType.IDENTIFIER)
                    || token.is(TokenType.INTEGER)
                    || (token.is(TokenType.FLOAT) && token.text().matches("\\d+\\.\\d+"));
        }

        /** Consumes {@code -word} pieces that touch {@code previous} and each other; {@code a - 1} stays a subtraction. */
        private String hyphenatedTail(Token previous) {
            StringBuilder tail = new StringBuilder();
            Token last = previous;
            while (peek().is(TokenType.MINUS)
                    && peek().start() == end(last)
                    && isSegmentWord(peekAt(1))
                    && peekAt(1).start() == peek().start() + 1) {
                last = peekAt(1);
                tail.append('-').append(last.text());
                index += 2;
            }
            return tail.toString();
        }

        private int end(Token token) {
            return token.start() + token.text().length();
        }

        // ── Token helpers ──

        private void enter() {
            if (++depth > maxDepth) {
                throw error("Expression nesting exceeds maximum depth of " + maxDepth, peek());
            }
        }

        Token peek() {
            return tokens.get(index);
        }

        private Token peekAt(int ahead) {
            return tokens.get(Math.min(index + ahead, tokens.size() - 1));
        }

        private boolean accept(TokenType type) {
            if (peek().is(type)) {
                index++;
                return true;
            }
            return false;
        }

        private boolean acceptWord(String word) {
            if (peek().isWord(word)) {
                index++;
                return true;
            }
            return false;
        }

        private Token expect(TokenType type, String reason) {
            Token token = peek();
            if (!token.is(type)) {
                throw error(reason + ", found " + token, token);
            }
            index++;
            return token;
        }

        ParseException error(String reason, Token at) {
            return ParseException.atChar(reason, offset + at.start(), template);
        }
    }
}

package io.flowtemplate.core.parser;

import io.flowtemplate.core.error.ParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits one expression into tokens. The token list always ends with {@link TokenType#EOF}.
 *
 * <p>
 * Errors are reported against the enclosing template: {@code offset} is the char index at which
 * the expression starts inside {@code template}.
 */
public final class Lexer {

    private final String text;
    private final String template;
    private final int offset;
    private int pos;

    public Lexer(String expression) {
        this(expression, expression, 0);
    }

    public Lexer(String expression, String template, int offset) {
        this.text = expression;
        this.template = template;
        this.offset = offset;
    }

    /**
     * Tokenizes the whole expression.
     *
     * @throws ParseException on an unterminated string, a bad escape or an unexpected character
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= text.length()) {
                tokens.add(new Token(TokenType.EOF, "", pos));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() {
        int start = pos;
        char c = text.charAt(pos);

        if (isIdentifierStart(c)) {
            return new Token(TokenType.IDENTIFIER, scanWord(), start);
        }
        if (c == '$') {
            pos++;
            if (pos >= text.length() || !isIdentifierStart(text.charAt(pos))) {
                throw error("Expected data source name after '$'", start);
            }
            return new Token(TokenType.SOURCE, "$" + scanWord(), start);
        }
        if (isDigit(c)) {
            return scanNumber();
        }
        if (c == '\'' || c == '"') {
            return scanString(c);
        }

        pos++;
        switch (c) {
            case '(':
                return new Token(TokenType.LPAREN, "(", start);
            case ')':
                return new Token(TokenType.RPAREN, ")", start);
            case ',':
                return new Token(TokenType.COMMA, ",", start);
            case '.':
                return new Token(TokenType.DOT, ".", start);
            case '?':
                return new Token(TokenType.QUESTION, "?", start);
            case ':':
                return new Token(TokenType.COLON, ":", start);
            case '+':
                return new Token(TokenType.PLUS, "+", start);
            case '-':
                return new Token(TokenType.MINUS, "-", start);
            case '*':
                return new Token(TokenType.STAR, "*", start);
            case '/':
                return new Token(TokenType.SLASH, "/", start);
            case '%':
                return new Token(TokenType.PERCENT, "%", start);
            case '|':
                return match('|') ? new Token(TokenType.OR_OR, "||", start) : new Token(TokenType.PIPE, "|", start);
            case '&':
                if (match('&')) {
                    return new Token(TokenType.AND_AND, "&&", start);
                }
                break;
            case '=':
                if (match('=')) {
                    return new Token(TokenType.EQ_EQ, "==", start);
                }
                break;
            case '!':
                return match('=') ? new Token(TokenType.BANG_EQ, "!=", start) : new Token(TokenType.BANG, "!", start);
            case '<':
                return match('=') ? new Token(TokenType.LT_EQ, "<=", start) : new Token(TokenType.LT, "<", start);
            case '>':
                return match('=') ? new Token(TokenType.GT_EQ, ">=", start) : new Token(TokenType.GT, ">", start);
            default:
                break;
        }
        throw error("Unexpected character '" + c + "'", start);
    }

    private String scanWord() {
        int start = pos;
        while (pos < text.length() && isIdentifierPart(text.charAt(pos))) {
            pos++;
        }
        return text.substring(start, pos);
    }

    private Token scanNumber() {
        int start = pos;
        boolean decimal = false;
        skipDigits();
        if (pos + 1 < text.length() && text.charAt(pos) == '.' && isDigit(text.charAt(pos + 1))) {
            decimal = true;
            pos++;
            skipDigits();
        }
        if (pos < text.length() && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
            int exponent = pos + 1;
            if (exponent < text.length() && (text.charAt(exponent) == '+' || text.charAt(exponent) == '-')) {
                exponent++;
            }
            if (exponent < text.length() && isDigit(text.charAt(exponent))) {
                decimal = true;
                pos = exponent;
                skipDigits();
            }
        }
        return new Token(decimal ? TokenType.FLOAT : TokenType.INTEGER, text.substring(start, pos), start);
    }

    private Token scanString(char quote) {
        int start = pos;
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == quote) {
                pos++;
                return new Token(TokenType.STRING, sb.toString(), start);
            }
            if (c == '\\') {
                if (pos + 1 >= text.length()) {
                    break;
                }
                char escaped = text.charAt(pos + 1);
                switch (escaped) {
                    case '\\', '\'', '"' -> sb.append(escaped);
                    case 'n' -> sb.append('\n');
                    case 'r' -> sb.append('\r');
                    case 't' -> sb.append('\t');
                    default -> throw error("Invalid escape sequence '\\" + escaped + "'", pos);
                }
                pos += 2;
                continue;
            }
            sb.append(c);
            pos++;
        }
        throw error("Unterminated string literal", start);
    }

    private void skipDigits() {
        while (pos < text.length() && isDigit(text.charAt(pos))) {
            pos++;
        }
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    private boolean match(char expected) {
        if (pos < text.length() && text.charAt(pos) == expected) {
            pos++;
            return true;
        }
        return false;
    }

    private ParseException error(String reason, int at) {
        return ParseException.atChar(reason, offset + at, template);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}

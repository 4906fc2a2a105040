package io.flowtemplate.core.parser;

/**
 * One lexical token.
 *
 * @param type  the token kind
 * @param text  the raw source text, except for {@link TokenType#STRING} where it is the unescaped
 *              content
 * @param start char index of the first character within the expression
 */
public record Token(TokenType type, String text, int start) {

    /** True for an identifier spelled exactly {@code word}. */
    public boolean isWord(String word) {
        return type == TokenType.IDENTIFIER && text.equals(word);
    }

    public boolean is(TokenType other) {
        return type == other;
    }

    @Override
    public String toString() {
        return type == TokenType.EOF ? "end of expression" : "'" + text + "'";
    }
}

package io.flowtemplate.core.parser;

/** Kinds of lexical tokens in an expression. */
public enum TokenType {
    IDENTIFIER,
    /** {@code $} followed by a name: {@code $input}, {@code $node}, ... */
    SOURCE,
    INTEGER,
    FLOAT,
    STRING,

    LPAREN,
    RPAREN,
    COMMA,
    DOT,
    PIPE,
    QUESTION,
    COLON,

    PLUS,
    MINUS,
    STAR,
    SLASH,
    PERCENT,
    BANG,
    EQ_EQ,
    BANG_EQ,
    LT,
    LT_EQ,
    GT,
    GT_EQ,
    AND_AND,
    OR_OR,

    EOF
}

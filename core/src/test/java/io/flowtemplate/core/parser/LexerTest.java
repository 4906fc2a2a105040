package io.flowtemplate.core.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.flowtemplate.core.error.ParseException;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link Lexer}. */
class LexerTest {

    private static List<TokenType> types(String expression) {
        return new Lexer(expression).tokenize().stream().map(Token::type).toList();
    }

    @Test
    void emptyInputYieldsOnlyEof() {
        assertThat(types("   ")).containsExactly(TokenType.EOF);
    }

    @Test
    void dataAccessTokens() {
        assertThat(types("$node('x').body.0"))
                .containsExactly(
                        TokenType.SOURCE,
                        TokenType.LPAREN,
                        TokenType.STRING,
                        TokenType.RPAREN,
                        TokenType.DOT,
                        TokenType.IDENTIFIER,
                        TokenType.DOT,
                        TokenType.INTEGER,
                        TokenType.EOF);
    }

    @Test
    void operators() {
        assertThat(types("+ - * / % ! == != < <= > >= && || | ? : , ( )"))
                .containsExactly(
                        TokenType.PLUS,
                        TokenType.MINUS,
                        TokenType.STAR,
                        TokenType.SLASH,
                        TokenType.PERCENT,
                        TokenType.BANG,
                        TokenType.EQ_EQ,
                        TokenType.BANG_EQ,
                        TokenType.LT,
                        TokenType.LT_EQ,
                        TokenType.GT,
                        TokenType.GT_EQ,
                        TokenType.AND_AND,
                        TokenType.OR_OR,
                        TokenType.PIPE,
                        TokenType.QUESTION,
                        TokenType.COLON,
                        TokenType.COMMA,
                        TokenType.LPAREN,
                        TokenType.RPAREN,
                        TokenType.EOF);
    }

    @Test
    void numbers() {
        List<Token> tokens = new Lexer("42 3.14 1e3 2.5E-2 7.").tokenize();

        assertThat(tokens).extracting(Token::type)
                .containsExactly(
                        TokenType.INTEGER,
                        TokenType.FLOAT,
                        TokenType.FLOAT,
                        TokenType.FLOAT,
                        TokenType.INTEGER,
                        TokenType.DOT,
                        TokenType.EOF);
        assertThat(tokens.get(3).text()).isEqualTo("2.5E-2");
    }

    @Test
    void stringsAreUnescaped() {
        List<Token> tokens = new Lexer("'it\\'s' \"a\\tb\\n\" '}}'").tokenize();

        assertThat(tokens.get(0).text()).isEqualTo("it's");
        assertThat(tokens.get(1).text()).isEqualTo("a\tb\n");
        assertThat(tokens.get(2).text()).isEqualTo("}}");
    }

    @Test
    void tokensRecordTheirStart() {
        List<Token> tokens = new Lexer("  $input . name").tokenize();

        assertThat(tokens).extracting(Token::start).containsExactly(2, 9, 11, 15);
    }

    @Test
    void unterminatedString() {
        assertThatThrownBy(() -> new Lexer("'abc").tokenize())
                .isInstanceOfSatisfying(ParseException.class, ex -> {
                    assertThat(ex.detail()).isEqualTo("Unterminated string literal");
                    assertThat(ex.position()).isZero();
                });
    }

    @Test
    void invalidEscape() {
        assertThatThrownBy(() -> new Lexer("'a\\q'").tokenize())
                .isInstanceOfSatisfying(ParseException.class, ex -> assertThat(ex.position()).isEqualTo(2));
    }

    @Test
    void unexpectedCharacterReportsTemplatePosition() {
        String template = "Hi {{ 1 = 2 }}";

        assertThatThrownBy(() -> new Lexer("1 = 2", template, 6).tokenize())
                .isInstanceOfSatisfying(ParseException.class, ex -> {
                    assertThat(ex.detail()).isEqualTo("Unexpected character '='");
                    assertThat(ex.position()).isEqualTo(8);
                    assertThat(ex.template()).isEqualTo(template);
                });
    }

    @Test
    void bareDollarIsRejected() {
        assertThatThrownBy(() -> new Lexer("$ 1").tokenize()).isInstanceOf(ParseException.class);
    }
}

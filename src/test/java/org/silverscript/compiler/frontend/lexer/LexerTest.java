package org.silverscript.compiler.frontend.lexer;

import org.silverscript.compiler.api.CompilerErrorCode;
import org.silverscript.compiler.diagnostics.DiagnosticsEngine;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the {@link Lexer}: token kinds, literal values, positions and lexical errors.
 */
@Tag("unit")
class LexerTest {

    private static List<Token> scan(String source, DiagnosticsEngine diagnostics) {
        return new Lexer(source, diagnostics).scanTokens();
    }

    /**
     * Keywords are recognized, everything else alphanumeric is an identifier, including
     * names like {@code const} and sized type names.
     */
    @Test
    void scansKeywordsAndIdentifiers() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        List<Token> tokens = scan("entrypoint function main(bytes4 const) { require(true); }", diagnostics);

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.ENTRYPOINT, TokenType.FUNCTION, TokenType.IDENTIFIER, TokenType.LEFT_PAREN,
                TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.RIGHT_PAREN, TokenType.LEFT_BRACE,
                TokenType.REQUIRE, TokenType.LEFT_PAREN, TokenType.TRUE, TokenType.RIGHT_PAREN,
                TokenType.SEMICOLON, TokenType.RIGHT_BRACE, TokenType.END_OF_FILE);
        assertThat(tokens.get(4).text()).isEqualTo("bytes4");
        assertThat(tokens.get(5).text()).isEqualTo("const");
    }

    /**
     * Number, hex and string literals carry their decoded value.
     */
    @Test
    void decodesLiteralValues() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        List<Token> tokens = scan("42 0x0aff \"a\\nb\"", diagnostics);

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens.get(0).value()).isEqualTo(42L);
        assertThat((byte[]) tokens.get(1).value()).containsExactly(0x0a, 0xff);
        assertThat(tokens.get(2).value()).isEqualTo("a\nb");
    }

    /**
     * Comments are skipped and positions are 1-based lines and columns.
     */
    @Test
    void skipsCommentsAndTracksPositions() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        List<Token> tokens = scan("// header\n/* block\n comment */ x >= 1", diagnostics);

        assertThat(tokens).extracting(Token::type)
                .containsExactly(TokenType.IDENTIFIER, TokenType.GREATER_EQUAL, TokenType.NUMBER, TokenType.END_OF_FILE);
        Token x = tokens.get(0);
        assertThat(x.line()).isEqualTo(3);
        assertThat(x.column()).isEqualTo(13);
    }

    /**
     * Malformed literals and stray characters are reported with their error code.
     */
    @Test
    void reportsLexicalErrors() {
        DiagnosticsEngine hex = new DiagnosticsEngine();
        scan("0xabc", hex);
        assertThat(hex.firstError().orElseThrow().code()).isEqualTo(CompilerErrorCode.INVALID_NUMBER);

        DiagnosticsEngine string = new DiagnosticsEngine();
        scan("\"open", string);
        assertThat(string.firstError().orElseThrow().code()).isEqualTo(CompilerErrorCode.UNTERMINATED_STRING);

        DiagnosticsEngine stray = new DiagnosticsEngine();
        scan("a # b", stray);
        assertThat(stray.firstError().orElseThrow().code()).isEqualTo(CompilerErrorCode.UNEXPECTED_CHARACTER);
    }
}

package org.silverscript.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Single-character tokens.
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE, LEFT_BRACKET, RIGHT_BRACKET,
    COMMA, DOT, SEMICOLON, PLUS, MINUS, STAR, SLASH, PERCENT, CARET, TILDE,

    // One or two character tokens.
    BANG, BANG_EQUAL,
    EQUAL, EQUAL_EQUAL,
    GREATER, GREATER_EQUAL,
    LESS, LESS_EQUAL,
    AND_AND, OR_OR,

    // Literals.
    /** An identifier, such as a variable, function or type name. */
    IDENTIFIER,
    /** A decimal integer literal; the value is a {@link Long}. */
    NUMBER,
    /** A {@code 0x} byte literal; the value is a {@code byte[]}. */
    HEX,
    /** A string literal; the value is the unescaped text. */
    STRING,

    // Keywords.
    PRAGMA, CONTRACT, FUNCTION, ENTRYPOINT, REQUIRE, IF, ELSE, TRUE, FALSE,

    /** Represents the end of the source text. */
    END_OF_FILE
}

package org.silverscript.compiler.frontend.lexer;

import org.silverscript.compiler.api.CompilerErrorCode;
import org.silverscript.compiler.api.SourceSpan;
import org.silverscript.compiler.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 */
public class Lexer {

    private static final Map<String, TokenType> KEYWORDS = Map.of(
            "pragma", TokenType.PRAGMA,
            "contract", TokenType.CONTRACT,
            "function", TokenType.FUNCTION,
            "entrypoint", TokenType.ENTRYPOINT,
            "require", TokenType.REQUIRE,
            "if", TokenType.IF,
            "else", TokenType.ELSE,
            "true", TokenType.TRUE,
            "false", TokenType.FALSE);

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this.source = source;
        this.diagnostics = diagnostics;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return A list of the recognized tokens, terminated by {@link TokenType#END_OF_FILE}.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, line, column));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case '[': addToken(TokenType.LEFT_BRACKET); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case '.': addToken(TokenType.DOT); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(TokenType.MINUS); break;
            case '*': addToken(TokenType.STAR); break;
            case '%': addToken(TokenType.PERCENT); break;
            case '^': addToken(TokenType.CARET); break;
            case '~': addToken(TokenType.TILDE); break;
            case '!': addToken(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG); break;
            case '=': addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL); break;
            case '<': addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS); break;
            case '>': addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER); break;
            case '&':
                if (match('&')) addToken(TokenType.AND_AND);
                else error(CompilerErrorCode.UNEXPECTED_CHARACTER, "Unexpected character: &");
                break;
            case '|':
                if (match('|')) addToken(TokenType.OR_OR);
                else error(CompilerErrorCode.UNEXPECTED_CHARACTER, "Unexpected character: |");
                break;
            case '/':
                if (match('/')) {
                    // A comment goes until the end of the line.
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else if (match('*')) {
                    blockComment();
                } else {
                    addToken(TokenType.SLASH);
                }
                break;
            case '"', '\'': string(c); break;
            // Ignore whitespace
            case ' ', '\r', '\t', '\n':
                break;
            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    error(CompilerErrorCode.UNEXPECTED_CHARACTER, "Unexpected character: " + c);
                }
                break;
        }
    }

    private void blockComment() {
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                return;
            }
            advance();
        }
        error(CompilerErrorCode.UNEXPECTED_CHARACTER, "Unterminated block comment");
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        addToken(KEYWORDS.getOrDefault(text, TokenType.IDENTIFIER));
    }

    private void number() {
        if (source.charAt(start) == '0' && (peek() == 'x' || peek() == 'X')) {
            advance();
            while (isAlphaNumeric(peek())) advance();
            String digits = source.substring(start + 2, current);
            if (digits.length() % 2 != 0 || !digits.chars().allMatch(ch -> Character.digit(ch, 16) >= 0)) {
                error(CompilerErrorCode.INVALID_NUMBER, "Invalid hex literal: " + source.substring(start, current));
                return;
            }
            addToken(TokenType.HEX, HexFormat.of().parseHex(digits));
            return;
        }
        while (isDigit(peek())) advance();
        if (isAlpha(peek())) {
            while (isAlphaNumeric(peek())) advance();
            error(CompilerErrorCode.INVALID_NUMBER, "Invalid number: " + source.substring(start, current));
            return;
        }
        String text = source.substring(start, current);
        try {
            addToken(TokenType.NUMBER, Long.parseLong(text));
        } catch (NumberFormatException e) {
            error(CompilerErrorCode.INVALID_NUMBER, "Number out of range: " + text);
        }
    }

    private void string(char quote) {
        StringBuilder value = new StringBuilder();
        while (peek() != quote) {
            if (isAtEnd() || peek() == '\n') {
                error(CompilerErrorCode.UNTERMINATED_STRING, "Unterminated string");
                return;
            }
            char c = advance();
            if (c == '\\' && !isAtEnd() && peek() != '\n') {
                char escaped = advance();
                value.append(switch (escaped) {
                    case 'n' -> '\n';
                    case 't' -> '\t';
                    default -> escaped;
                });
            } else {
                value.append(c);
            }
        }
        advance();
        addToken(TokenType.STRING, value.toString());
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(current);
    }

    private char peekNext() {
        return current + 1 >= source.length() ? '\0' : source.charAt(current + 1);
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        tokens.add(new Token(type, source.substring(start, current), literal, startLine, startColumn));
    }

    private void error(CompilerErrorCode code, String message) {
        diagnostics.reportError(code, message, new SourceSpan(startLine, startColumn, line, column));
    }
}

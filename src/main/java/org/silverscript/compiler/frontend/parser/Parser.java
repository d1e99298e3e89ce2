package org.silverscript.compiler.frontend.parser;

import org.silverscript.compiler.api.CompilerErrorCode;
import org.silverscript.compiler.api.SourceSpan;
import org.silverscript.compiler.diagnostics.DiagnosticsEngine;
import org.silverscript.compiler.frontend.lexer.Token;
import org.silverscript.compiler.frontend.lexer.TokenType;
import org.silverscript.compiler.frontend.parser.ast.AssignmentNode;
import org.silverscript.compiler.frontend.parser.ast.BinaryNode;
import org.silverscript.compiler.frontend.parser.ast.BinaryOperator;
import org.silverscript.compiler.frontend.parser.ast.BlockNode;
import org.silverscript.compiler.frontend.parser.ast.BoolLiteralNode;
import org.silverscript.compiler.frontend.parser.ast.CallNode;
import org.silverscript.compiler.frontend.parser.ast.CallStatementNode;
import org.silverscript.compiler.frontend.parser.ast.ContractNode;
import org.silverscript.compiler.frontend.parser.ast.ExpressionNode;
import org.silverscript.compiler.frontend.parser.ast.FunctionNode;
import org.silverscript.compiler.frontend.parser.ast.HexLiteralNode;
import org.silverscript.compiler.frontend.parser.ast.IdentifierNode;
import org.silverscript.compiler.frontend.parser.ast.IfNode;
import org.silverscript.compiler.frontend.parser.ast.IntLiteralNode;
import org.silverscript.compiler.frontend.parser.ast.LengthNode;
import org.silverscript.compiler.frontend.parser.ast.ParamNode;
import org.silverscript.compiler.frontend.parser.ast.RequireNode;
import org.silverscript.compiler.frontend.parser.ast.StatementNode;
import org.silverscript.compiler.frontend.parser.ast.StringLiteralNode;
import org.silverscript.compiler.frontend.parser.ast.TypeNode;
import org.silverscript.compiler.frontend.parser.ast.UnaryNode;
import org.silverscript.compiler.frontend.parser.ast.VariableDeclarationNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Recursive-descent parser turning a token stream into a {@link ContractNode}.
 * Parsing stops at the first syntax error, which is reported to the diagnostics engine.
 */
public class Parser {

    private static final Map<TokenType, BinaryOperator> EQUALITY = Map.of(
            TokenType.EQUAL_EQUAL, BinaryOperator.EQUAL,
            TokenType.BANG_EQUAL, BinaryOperator.NOT_EQUAL);
    private static final Map<TokenType, BinaryOperator> RELATIONAL = Map.of(
            TokenType.LESS, BinaryOperator.LESS,
            TokenType.LESS_EQUAL, BinaryOperator.LESS_EQUAL,
            TokenType.GREATER, BinaryOperator.GREATER,
            TokenType.GREATER_EQUAL, BinaryOperator.GREATER_EQUAL);
    private static final Map<TokenType, BinaryOperator> ADDITIVE = Map.of(
            TokenType.PLUS, BinaryOperator.ADD,
            TokenType.MINUS, BinaryOperator.SUBTRACT);
    private static final Map<TokenType, BinaryOperator> MULTIPLICATIVE = Map.of(
            TokenType.STAR, BinaryOperator.MULTIPLY,
            TokenType.SLASH, BinaryOperator.DIVIDE,
            TokenType.PERCENT, BinaryOperator.MODULO);

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private int current = 0;

    /**
     * @param tokens The tokens produced by the lexer, ending with {@link TokenType#END_OF_FILE}.
     * @param diagnostics The engine for reporting errors.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
    }

    /**
     * Parses a complete source file.
     * @return The contract, or {@code null} if a syntax error was reported.
     */
    public ContractNode parse() {
        try {
            if (match(TokenType.PRAGMA)) {
                pragma();
            }
            ContractNode contract = contract();
            consume(TokenType.END_OF_FILE, "Expected end of input after contract");
            return contract;
        } catch (ParseError e) {
            return null;
        }
    }

    private void pragma() {
        Token name = consume(TokenType.IDENTIFIER, "Expected language name after 'pragma'");
        if (!name.text().equals("silverscript")) {
            throw error(name, "Unsupported pragma '" + name.text() + "'");
        }
        while (!check(TokenType.SEMICOLON)) {
            if (isAtEnd()) {
                throw error(peek(), "Expected ';' after pragma");
            }
            advance();
        }
        advance();
    }

    private ContractNode contract() {
        consume(TokenType.CONTRACT, "Expected 'contract'");
        Token name = consume(TokenType.IDENTIFIER, "Expected contract name");
        List<ParamNode> params = parameters();
        consume(TokenType.LEFT_BRACE, "Expected '{' before contract body");
        List<FunctionNode> functions = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            functions.add(function());
        }
        consume(TokenType.RIGHT_BRACE, "Expected '}' after contract body");
        return new ContractNode(name.text(), params, functions, name.span());
    }

    private FunctionNode function() {
        boolean entrypoint = match(TokenType.ENTRYPOINT);
        consume(TokenType.FUNCTION, entrypoint ? "Expected 'function' after 'entrypoint'" : "Expected function declaration");
        Token name = consume(TokenType.IDENTIFIER, "Expected function name");
        List<ParamNode> params = parameters();
        BlockNode body = block();
        return new FunctionNode(name.text(), entrypoint, params, body, name.span());
    }

    private List<ParamNode> parameters() {
        consume(TokenType.LEFT_PAREN, "Expected '(' before parameter list");
        List<ParamNode> params = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                TypeNode type = type();
                Token name = consume(TokenType.IDENTIFIER, "Expected parameter name");
                params.add(new ParamNode(type, name.text(), SourceSpan.covering(type.span(), name.span())));
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expected ')' after parameter list");
        return params;
    }

    private TypeNode type() {
        Token name = consume(TokenType.IDENTIFIER, "Expected type name");
        if (match(TokenType.LEFT_BRACKET)) {
            Token close = consume(TokenType.RIGHT_BRACKET, "Expected ']' after '['");
            return new TypeNode(name.text(), true, SourceSpan.covering(name.span(), close.span()));
        }
        return new TypeNode(name.text(), false, name.span());
    }

    private BlockNode block() {
        Token open = consume(TokenType.LEFT_BRACE, "Expected '{'");
        List<StatementNode> statements = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            statements.add(statement());
        }
        Token close = consume(TokenType.RIGHT_BRACE, "Expected '}' after block");
        return new BlockNode(statements, SourceSpan.covering(open.span(), close.span()));
    }

    private StatementNode statement() {
        if (match(TokenType.REQUIRE)) return requireStatement();
        if (match(TokenType.IF)) return ifStatement();
        if (check(TokenType.IDENTIFIER)) {
            if (checkNext(TokenType.IDENTIFIER) || checkNext(TokenType.LEFT_BRACKET)) return declaration();
            if (checkNext(TokenType.EQUAL)) return assignment();
            if (checkNext(TokenType.LEFT_PAREN)) {
                Token start = peek();
                CallNode call = call(advance());
                Token end = consume(TokenType.SEMICOLON, "Expected ';' after call");
                return new CallStatementNode(call, SourceSpan.covering(start.span(), end.span()));
            }
        }
        throw error(peek(), "Expected statement but found '" + peek().text() + "'");
    }

    private StatementNode declaration() {
        TypeNode type = type();
        Token name = consume(TokenType.IDENTIFIER, "Expected variable name");
        consume(TokenType.EQUAL, "Expected '=' after variable name");
        ExpressionNode init = expression();
        Token end = consume(TokenType.SEMICOLON, "Expected ';' after variable declaration");
        return new VariableDeclarationNode(type, name.text(), init, SourceSpan.covering(type.span(), end.span()));
    }

    private StatementNode assignment() {
        Token name = advance();
        advance();
        ExpressionNode value = expression();
        Token end = consume(TokenType.SEMICOLON, "Expected ';' after assignment");
        return new AssignmentNode(name.text(), value, SourceSpan.covering(name.span(), end.span()));
    }

    private StatementNode requireStatement() {
        Token keyword = previous();
        consume(TokenType.LEFT_PAREN, "Expected '(' after 'require'");
        ExpressionNode condition = expression();
        String message = null;
        if (match(TokenType.COMMA)) {
            message = (String) consume(TokenType.STRING, "Expected message string").value();
        }
        consume(TokenType.RIGHT_PAREN, "Expected ')' after require condition");
        Token end = consume(TokenType.SEMICOLON, "Expected ';' after require");
        return new RequireNode(condition, message, SourceSpan.covering(keyword.span(), end.span()));
    }

    private IfNode ifStatement() {
        Token keyword = previous();
        consume(TokenType.LEFT_PAREN, "Expected '(' after 'if'");
        ExpressionNode condition = expression();
        Token close = consume(TokenType.RIGHT_PAREN, "Expected ')' after if condition");
        BlockNode thenBranch = body();
        BlockNode elseBranch = null;
        if (match(TokenType.ELSE)) {
            if (match(TokenType.IF)) {
                IfNode nested = ifStatement();
                elseBranch = new BlockNode(List.of(nested), nested.span());
            } else {
                elseBranch = body();
            }
        }
        return new IfNode(condition, thenBranch, elseBranch, SourceSpan.covering(keyword.span(), close.span()));
    }

    private BlockNode body() {
        if (check(TokenType.LEFT_BRACE)) {
            return block();
        }
        StatementNode single = statement();
        return new BlockNode(List.of(single), single.span());
    }

    // --- Expressions, lowest precedence first ---

    private ExpressionNode expression() {
        return or();
    }

    private ExpressionNode or() {
        ExpressionNode expr = and();
        while (match(TokenType.OR_OR)) {
            expr = binary(BinaryOperator.OR, expr, and());
        }
        return expr;
    }

    private ExpressionNode and() {
        ExpressionNode expr = equality();
        while (match(TokenType.AND_AND)) {
            expr = binary(BinaryOperator.AND, expr, equality());
        }
        return expr;
    }

    private ExpressionNode equality() {
        return binaryLevel(EQUALITY, this::relational);
    }

    private ExpressionNode relational() {
        return binaryLevel(RELATIONAL, this::additive);
    }

    private ExpressionNode additive() {
        return binaryLevel(ADDITIVE, this::multiplicative);
    }

    private ExpressionNode multiplicative() {
        return binaryLevel(MULTIPLICATIVE, this::unary);
    }

    private ExpressionNode binaryLevel(Map<TokenType, BinaryOperator> operators,
                                       Supplier<ExpressionNode> operand) {
        ExpressionNode expr = operand.get();
        while (operators.containsKey(peek().type())) {
            BinaryOperator op = operators.get(advance().type());
            expr = binary(op, expr, operand.get());
        }
        return expr;
    }

    private ExpressionNode unary() {
        if (match(TokenType.BANG, TokenType.MINUS)) {
            Token op = previous();
            ExpressionNode operand = unary();
            return new UnaryNode(op.type() == TokenType.MINUS, operand, SourceSpan.covering(op.span(), operand.span()));
        }
        return postfix();
    }

    private ExpressionNode postfix() {
        ExpressionNode expr = primary();
        while (match(TokenType.DOT)) {
            Token member = consume(TokenType.IDENTIFIER, "Expected member name after '.'");
            if (!member.text().equals("length")) {
                throw error(member, "Unknown member '" + member.text() + "', only 'length' is supported");
            }
            expr = new LengthNode(expr, SourceSpan.covering(expr.span(), member.span()));
        }
        return expr;
    }

    private ExpressionNode primary() {
        if (isAtEnd()) {
            throw error(peek(), "Expected expression");
        }
        Token token = advance();
        switch (token.type()) {
            case NUMBER: return new IntLiteralNode((Long) token.value(), token.span());
            case HEX: return new HexLiteralNode((byte[]) token.value(), token.span());
            case STRING: return new StringLiteralNode((String) token.value(), token.span());
            case TRUE: return new BoolLiteralNode(true, token.span());
            case FALSE: return new BoolLiteralNode(false, token.span());
            case IDENTIFIER:
                if (check(TokenType.LEFT_PAREN)) {
                    return call(token);
                }
                return new IdentifierNode(token.text(), token.span());
            case LEFT_PAREN: {
                ExpressionNode inner = expression();
                consume(TokenType.RIGHT_PAREN, "Expected ')' after expression");
                return inner;
            }
            default:
                throw error(token, "Unexpected token while parsing expression: '" + token.text() + "'");
        }
    }

    private CallNode call(Token name) {
        consume(TokenType.LEFT_PAREN, "Expected '(' after function name");
        List<ExpressionNode> args = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                args.add(expression());
            } while (match(TokenType.COMMA));
        }
        Token close = consume(TokenType.RIGHT_PAREN, "Expected ')' after arguments");
        return new CallNode(name.text(), args, SourceSpan.covering(name.span(), close.span()));
    }

    private static BinaryNode binary(BinaryOperator op, ExpressionNode left, ExpressionNode right) {
        return new BinaryNode(op, left, right, SourceSpan.covering(left.span(), right.span()));
    }

    // --- Token stream helpers ---

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean checkNext(TokenType type) {
        if (current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    private Token consume(TokenType type, String errorMessage) {
        if (check(type)) return advance();
        throw error(peek(), errorMessage);
    }

    private ParseError error(Token token, String message) {
        String found = token.type() == TokenType.END_OF_FILE ? "end of input" : "'" + token.text() + "'";
        diagnostics.reportError(CompilerErrorCode.UNEXPECTED_TOKEN, message + " (found " + found + ")", token.span());
        return new ParseError();
    }

    private static final class ParseError extends RuntimeException {
        ParseError() {
            super(null, null, false, false);
        }
    }
}

package org.silverscript.compiler.frontend.parser;

import org.silverscript.compiler.api.CompilationException;
import org.silverscript.compiler.api.CompilerErrorCode;
import org.silverscript.compiler.api.SourceSpan;
import org.silverscript.compiler.diagnostics.DiagnosticsEngine;
import org.silverscript.compiler.frontend.lexer.Lexer;
import org.silverscript.compiler.frontend.parser.ast.BinaryNode;
import org.silverscript.compiler.frontend.parser.ast.BinaryOperator;
import org.silverscript.compiler.frontend.parser.ast.CallStatementNode;
import org.silverscript.compiler.frontend.parser.ast.ContractNode;
import org.silverscript.compiler.frontend.parser.ast.FunctionNode;
import org.silverscript.compiler.frontend.parser.ast.IfNode;
import org.silverscript.compiler.frontend.parser.ast.IntLiteralNode;
import org.silverscript.compiler.frontend.parser.ast.LengthNode;
import org.silverscript.compiler.frontend.parser.ast.RequireNode;
import org.silverscript.compiler.frontend.parser.ast.UnaryNode;
import org.silverscript.compiler.frontend.parser.ast.VariableDeclarationNode;
import org.silverscript.compiler.Compiler;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Tests for the {@link Parser}: contract structure, statement forms, precedence and syntax errors.
 */
@Tag("unit")
class ParserTest {

    private static ContractNode parse(String source) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        ContractNode contract = new Parser(new Lexer(source, diagnostics).scanTokens(), diagnostics).parse();
        assertThat(diagnostics.hasErrors()).as(diagnostics.summary()).isFalse();
        return contract;
    }

    /**
     * A contract keeps its constructor parameters and distinguishes entrypoints from helpers,
     * preserving declaration order.
     */
    @Test
    void parsesContractStructure() {
        ContractNode contract = parse("""
                pragma silverscript ^0.1.0;
                contract Vault(pubkey owner, int limit) {
                    function helper(int x) { require(x > 0); }
                    entrypoint function spend(sig s) { require(checkSig(s, owner)); }
                    entrypoint function refund() { require(limit >= 0); }
                }
                """);

        assertThat(contract.name()).isEqualTo("Vault");
        assertThat(contract.params()).extracting(p -> p.name()).containsExactly("owner", "limit");
        assertThat(contract.functions()).extracting(FunctionNode::name).containsExactly("helper", "spend", "refund");
        assertThat(contract.entrypoints()).extracting(FunctionNode::name).containsExactly("spend", "refund");
        assertThat(contract.span()).isEqualTo(new SourceSpan(2, 10, 2, 15));
    }

    /**
     * Declarations, calls, {@code if/else if/else} and requirements with messages all parse
     * into their node types, with spans covering the whole statement.
     */
    @Test
    void parsesStatements() {
        ContractNode contract = parse("""
                contract C() {
                    function h(int v) { require(v != 0); }
                    entrypoint function main(int a, bytes data) {
                        int n = data.length;
                        h(a);
                        if (a < 0) { require(false, "negative"); } else if (a == 0) require(true); else { a = -a; }
                        require(n >= a);
                    }
                }
                """);

        var body = contract.entrypoints().get(0).body().statements();
        assertThat(body.get(0)).isInstanceOf(VariableDeclarationNode.class);
        assertThat(((VariableDeclarationNode) body.get(0)).initializer()).isInstanceOf(LengthNode.class);
        assertThat(body.get(0).span()).isEqualTo(new SourceSpan(4, 9, 4, 29));
        assertThat(body.get(1)).isInstanceOf(CallStatementNode.class);

        IfNode ifNode = (IfNode) body.get(2);
        assertThat(((RequireNode) ifNode.thenBranch().statements().get(0)).message()).isEqualTo("negative");
        assertThat(ifNode.elseBranch().statements().get(0)).isInstanceOf(IfNode.class);
        IfNode nested = (IfNode) ifNode.elseBranch().statements().get(0);
        assertThat(nested.elseBranch()).isNotNull();
    }

    /**
     * Multiplication binds tighter than addition, comparison is looser than both, and unary
     * minus applies to its operand only.
     */
    @Test
    void respectsOperatorPrecedence() {
        ContractNode contract = parse("""
                contract C() {
                    entrypoint function main(int a) { require(-a + 2 * 3 > 1 && true); }
                }
                """);

        RequireNode require = (RequireNode) contract.entrypoints().get(0).body().statements().get(0);
        BinaryNode and = (BinaryNode) require.condition();
        assertThat(and.operator()).isEqualTo(BinaryOperator.AND);
        BinaryNode greater = (BinaryNode) and.left();
        assertThat(greater.operator()).isEqualTo(BinaryOperator.GREATER);
        BinaryNode sum = (BinaryNode) greater.left();
        assertThat(sum.operator()).isEqualTo(BinaryOperator.ADD);
        assertThat(sum.left()).isInstanceOf(UnaryNode.class);
        BinaryNode product = (BinaryNode) sum.right();
        assertThat(product.operator()).isEqualTo(BinaryOperator.MULTIPLY);
        assertThat(product.left()).isEqualTo(new IntLiteralNode(2L, new SourceSpan(2, 52, 2, 53)));
    }

    /**
     * A syntax error yields no tree and an {@code UNEXPECTED_TOKEN} diagnostic at the offending token.
     */
    @Test
    void reportsSyntaxErrors() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        ContractNode contract = new Parser(new Lexer("contract C() { entrypoint function main() { require(true) } }",
                diagnostics).scanTokens(), diagnostics).parse();

        assertNull(contract);
        assertThat(diagnostics.firstError().orElseThrow().code()).isEqualTo(CompilerErrorCode.UNEXPECTED_TOKEN);
        assertThat(diagnostics.firstError().orElseThrow().span().line()).isEqualTo(1);
    }

    /**
     * The compiler surfaces syntax errors as {@link CompilationException.Kind#PARSE} failures.
     */
    @Test
    void compilerReportsParseKind() {
        assertThatThrownBy(() -> new Compiler().parse("pragma other ^1.0; contract C() {}"))
                .isInstanceOfSatisfying(CompilationException.class, e -> {
                    assertThat(e.kind()).isEqualTo(CompilationException.Kind.PARSE);
                    assertThat(e.code()).isEqualTo(CompilerErrorCode.UNEXPECTED_TOKEN);
                    assertThat(e.span()).isPresent();
                });
    }
}

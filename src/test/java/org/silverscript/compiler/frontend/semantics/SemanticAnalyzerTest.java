package org.silverscript.compiler.frontend.semantics;

import org.silverscript.compiler.Compiler;
import org.silverscript.compiler.api.CompilationException;
import org.silverscript.compiler.api.CompilerErrorCode;
import org.silverscript.compiler.api.TypedValue;
import org.silverscript.compiler.api.ValueType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Tests for the {@link SemanticAnalyzer}, driven through the compiler so that each case
 * checks the error code the caller finally sees.
 */
@Tag("unit")
class SemanticAnalyzerTest {

    private static CompilerErrorCode errorOf(String source, TypedValue... ctorArgs) {
        CompilationException e = catchThrowableOfType(
                () -> new Compiler().compile(source, List.of(ctorArgs)), CompilationException.class);
        assertThat(e).as("expected a compilation error").isNotNull();
        assertThat(e.kind()).isEqualTo(CompilationException.Kind.COMPILE);
        return e.code();
    }

    private static String entry(String body) {
        return "contract C() { entrypoint function main(int a, bytes b) { " + body + " } }";
    }

    /**
     * Well-typed code with helpers, builtins, shadow-free blocks and byte operations is accepted.
     */
    @Test
    void acceptsValidContract() {
        String source = """
                contract Ok(pubkey owner, int limit) {
                    function check(int v) { require(within(v, 0, limit)); }
                    entrypoint function spend(sig s, int amount, bytes data) {
                        check(amount);
                        bytes32 digest = sha256(data + 0x00);
                        require(digest.length == 32);
                        require(checkSig(s, owner) || max(amount, 1) > abs(-limit));
                    }
                }
                """;
        assertThatCode(() -> new Compiler().compile(source,
                List.of(new TypedValue(ValueType.PUBKEY, new byte[32]), TypedValue.ofInt(10))))
                .doesNotThrowAnyException();
    }

    @Test
    void rejectsUnknownNames() {
        assertThat(errorOf(entry("require(c > 0);"))).isEqualTo(CompilerErrorCode.UNRESOLVED_IDENTIFIER);
        assertThat(errorOf(entry("missing(a);"))).isEqualTo(CompilerErrorCode.UNKNOWN_FUNCTION);
        assertThat(errorOf(entry("quad x = 1;"))).isEqualTo(CompilerErrorCode.UNKNOWN_TYPE);
    }

    @Test
    void rejectsTypeErrors() {
        assertThat(errorOf(entry("int x = true;"))).isEqualTo(CompilerErrorCode.TYPE_MISMATCH);
        assertThat(errorOf(entry("require(a);"))).isEqualTo(CompilerErrorCode.TYPE_MISMATCH);
        assertThat(errorOf(entry("require(a + b > 0);"))).isEqualTo(CompilerErrorCode.TYPE_MISMATCH);
        assertThat(errorOf(entry("require(!a);"))).isEqualTo(CompilerErrorCode.TYPE_MISMATCH);
        assertThat(errorOf(entry("require(a.length > 0);"))).isEqualTo(CompilerErrorCode.TYPE_MISMATCH);
    }

    @Test
    void rejectsDuplicateDeclarations() {
        assertThat(errorOf(entry("int a = 1;"))).isEqualTo(CompilerErrorCode.DUPLICATE_VARIABLE);
        assertThat(errorOf("contract C() { function f() { require(true); } function f() { require(true); }"
                + " entrypoint function main() { f(); } }")).isEqualTo(CompilerErrorCode.DUPLICATE_FUNCTION);
    }

    /**
     * Helpers may call helpers, but cycles cannot be inlined and are rejected.
     */
    @Test
    void rejectsRecursion() {
        String source = """
                contract R() {
                    function ping(int n) { pong(n); }
                    function pong(int n) { ping(n); }
                    entrypoint function main(int a) { ping(a); }
                }
                """;
        assertThat(errorOf(source)).isEqualTo(CompilerErrorCode.RECURSIVE_CALL);
    }

    @Test
    void rejectsCallsToEntrypointsAndWrongArity() {
        assertThat(errorOf("contract C() { entrypoint function a() { b(); } entrypoint function b() { require(true); } }"))
                .isEqualTo(CompilerErrorCode.ENTRYPOINT_NOT_CALLABLE);
        assertThat(errorOf("contract C() { function h(int x) { require(x > 0); } entrypoint function main() { h(1, 2); } }"))
                .isEqualTo(CompilerErrorCode.ARITY_MISMATCH);
    }

    @Test
    void rejectsAssignmentToConstructorParameter() {
        assertThat(errorOf("contract C(int k) { entrypoint function main() { k = 2; } }", TypedValue.ofInt(1)))
                .isEqualTo(CompilerErrorCode.ASSIGNMENT_TO_CONSTANT);
    }

    @Test
    void rejectsMismatchedConstructorArguments() {
        assertThat(errorOf("contract C(int k) { entrypoint function main() { require(k > 0); } }"))
                .isEqualTo(CompilerErrorCode.CONSTRUCTOR_ARGUMENT_MISMATCH);
        assertThat(errorOf("contract C(int k) { entrypoint function main() { require(k > 0); } }", TypedValue.ofBool(true)))
                .isEqualTo(CompilerErrorCode.CONSTRUCTOR_ARGUMENT_MISMATCH);
    }

    @Test
    void rejectsContractWithoutEntrypoint() {
        assertThat(errorOf("contract C() { function f() { require(true); } }")).isEqualTo(CompilerErrorCode.MISSING_ENTRYPOINT);
    }
}

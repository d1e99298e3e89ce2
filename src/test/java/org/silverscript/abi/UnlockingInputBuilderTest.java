package org.silverscript.abi;

import org.silverscript.ContractHarness;
import org.silverscript.compiler.api.CompiledProgram;
import org.silverscript.compiler.api.TypedValue;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.HexFormat;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link UnlockingInputBuilder}.
 */
@Tag("unit")
class UnlockingInputBuilderTest {

    private static final String TWO_FUNCTIONS = """
            contract Pair() {
                entrypoint function first(int a, bool b) { require(b); }
                entrypoint function second(int x) { require(x == 1); }
            }
            """;

    private static final String ONE_FUNCTION = """
            contract Single() {
                entrypoint function main(int a, int b) { require(a < b); }
            }
            """;

    @Test
    void pushesArgumentsThenSelector() throws Exception {
        CompiledProgram program = ContractHarness.compile(TWO_FUNCTIONS);

        byte[] first = UnlockingInputBuilder.build(program, "first", List.of(TypedValue.ofInt(200), TypedValue.ofBool(true)));
        byte[] second = UnlockingInputBuilder.build(program, "second", List.of(TypedValue.ofInt(1)));

        assertThat(HexFormat.of().formatHex(first)).isEqualTo("02c800" + "51" + "00");
        assertThat(HexFormat.of().formatHex(second)).isEqualTo("51" + "51");
    }

    @Test
    void omitsSelectorForSingleEntrypoint() throws Exception {
        CompiledProgram program = ContractHarness.compile(ONE_FUNCTION);

        byte[] input = UnlockingInputBuilder.build(program, "main", List.of(TypedValue.ofInt(1), TypedValue.ofInt(2)));

        assertThat(HexFormat.of().formatHex(input)).isEqualTo("5152");
    }

    /**
     * Unknown functions, wrong counts and mistyped values are all argument errors.
     */
    @Test
    void rejectsBadCalls() throws Exception {
        CompiledProgram program = ContractHarness.compile(ONE_FUNCTION);

        assertThatThrownBy(() -> UnlockingInputBuilder.build(program, "other", List.of()))
                .isInstanceOf(ArgumentException.class)
                .hasMessage("function 'other' not found");
        assertThatThrownBy(() -> UnlockingInputBuilder.build(program, "main", List.of(TypedValue.ofInt(1))))
                .hasMessageContaining("expects 2 arguments, got 1");
        assertThatThrownBy(() -> UnlockingInputBuilder.build(program, "main",
                List.of(TypedValue.ofInt(1), TypedValue.ofBool(true))))
                .hasMessageContaining("argument #1 (int b)");
    }
}

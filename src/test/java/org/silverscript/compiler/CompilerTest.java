package org.silverscript.compiler;

import org.silverscript.ContractHarness;
import org.silverscript.compiler.api.CompiledProgram;
import org.silverscript.compiler.api.FunctionSignature;
import org.silverscript.compiler.api.ParamInfo;
import org.silverscript.compiler.api.TypedValue;
import org.silverscript.compiler.api.ValueType;
import org.silverscript.debug.DebugMapping;
import org.silverscript.debug.DebugTable;
import org.silverscript.debug.FrameInfo;
import org.silverscript.debug.VariableOrigin;
import org.silverscript.debug.VariableSlot;
import org.silverscript.runtime.ScriptExecutionException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * End-to-end tests for the {@link Compiler}: emitted bytecode, debug tables, selector dispatch,
 * helper inlining, constant folding and the behaviour of the compiled code on the script engine.
 */
@Tag("unit")
class CompilerTest {

    private static final String SINGLE = """
            contract Single() {
                entrypoint function main(int a) {
                    require(a == 1);
                }
            }
            """;

    /**
     * A single entrypoint compiles without dispatch: the body reads its parameter with
     * {@code PICK}, and the unmapped epilogue drops it and leaves {@code 1}.
     */
    @Test
    void compilesSingleEntrypoint() throws Exception {
        CompiledProgram program = ContractHarness.compile(SINGLE);

        // OP_0 OP_PICK OP_1 OP_NUMEQUAL OP_VERIFY | OP_DROP OP_1
        assertEquals("0079519c697551", program.bytecodeHex());
        assertThat(program.withoutSelector()).isTrue();
        assertThat(program.abi()).containsExactly(
                new FunctionSignature("main", List.of(new ParamInfo("a", ValueType.INT)), null));
    }

    /**
     * Every mapped instruction of a statement shares its span; only the first is a boundary. The
     * scope lists the parameter at its absolute stack slot.
     */
    @Test
    void recordsDebugMappings() throws Exception {
        DebugTable table = ContractHarness.compile(SINGLE).debugInfo();

        assertThat(table.mappings()).extracting(DebugMapping::byteOffset).containsExactly(0, 1, 2, 3, 4);
        assertThat(table.mappings()).extracting(DebugMapping::sequence).containsExactly(0, 1, 2, 3, 4);
        assertThat(table.mappings()).extracting(DebugMapping::statementBoundary).containsExactly(true, false, false, false, false);
        assertThat(table.mappings()).extracting(DebugMapping::span).containsOnly(table.mappings().get(0).span());
        assertThat(table.mappingAt(5)).isEmpty();

        DebugMapping first = table.mappings().get(0);
        assertThat(first.span().line()).isEqualTo(3);
        assertThat(first.frameId()).isZero();
        assertThat(first.callDepth()).isZero();
        assertThat(first.scope()).containsExactly(
                VariableSlot.onStack("a", VariableOrigin.FUNCTION_PARAMETER, ValueType.INT, 0));
        assertThat(table.frames()).containsExactly(new FrameInfo(0, "main", 0, null, null, "main"));
    }

    /**
     * With several entrypoints each body is guarded by a selector test, an unknown selector
     * reaches {@code OP_RETURN}, and the guards carry no mapping.
     */
    @Test
    void compilesSelectorDispatch() throws Exception {
        CompiledProgram program = ContractHarness.compile("""
                contract Two() {
                    entrypoint function first() { require(true); }
                    entrypoint function second() { require(true); }
                }
                """);

        // per branch: OP_DUP <i> OP_NUMEQUAL OP_IF OP_DROP | OP_1 OP_VERIFY | OP_1 OP_ELSE
        assertEquals("76009c637551695167" + "76519c637551695167" + "6a6868", program.bytecodeHex());
        assertThat(program.withoutSelector()).isFalse();
        assertThat(program.abi()).extracting(FunctionSignature::selectorIndex).containsExactly(0, 1);
        assertThat(program.debugInfo().mappings()).extracting(DebugMapping::byteOffset).containsExactly(5, 6, 14, 15);
        assertThat(program.debugInfo().mappings()).extracting(DebugMapping::frameId).containsExactly(0, 0, 0, 0);
        assertThat(program.debugInfo().mappings()).extracting(DebugMapping::entrypoint)
                .containsExactly("first", "first", "second", "second");

        assertThatCode(() -> ContractHarness.run(program, "second")).doesNotThrowAnyException();
        assertThatCode(() -> ContractHarness.run(program, "first")).doesNotThrowAnyException();
    }

    /**
     * A selector outside the entrypoint range falls through every guard into {@code OP_RETURN}.
     */
    @Test
    void unknownSelectorFails() throws Exception {
        CompiledProgram program = ContractHarness.compile("""
                contract Two() {
                    entrypoint function first() { require(true); }
                    entrypoint function second() { require(true); }
                }
                """);
        var engine = ContractHarness.engine(program, new byte[]{0x52});

        assertThatThrownBy(() -> {
            while (!engine.isDone()) {
                engine.step();
            }
        }).isInstanceOf(ScriptExecutionException.class);
        assertThat(engine.lastOpcode().orElseThrow().name()).isEqualTo("OP_RETURN");
    }

    /**
     * Each inlined call gets its own frame, numbered after the entrypoint body, with the
     * caller as parent and the call statement as call site. Nested calls go one level deeper.
     */
    @Test
    void inlinesHelpersIntoFrames() throws Exception {
        CompiledProgram program = ContractHarness.compile("""
                contract Calls() {
                    function leaf(int x) { require(x >= 0); }
                    function inner(int y) { leaf(y); }
                    entrypoint function main(int a) {
                        inner(a);
                        leaf(a);
                    }
                }
                """);

        List<FrameInfo> frames = program.debugInfo().frames();
        assertThat(frames).extracting(FrameInfo::frameId).containsExactly(0, 1, 2, 3);
        assertThat(frames).extracting(FrameInfo::functionName).containsExactly("main", "inner", "leaf", "leaf");
        assertThat(frames).extracting(FrameInfo::callDepth).containsExactly(0, 1, 2, 1);
        assertThat(frames).extracting(FrameInfo::parentFrameId).containsExactly(null, 0, 1, 0);
        assertThat(frames.get(1).callSite().line()).isEqualTo(5);
        assertThat(frames.get(3).callSite().line()).isEqualTo(6);
        assertThat(program.debugInfo().frameChain("main", 2)).extracting(FrameInfo::functionName)
                .containsExactly("main", "inner", "leaf");

        assertThatCode(() -> ContractHarness.run(program, "main", TypedValue.ofInt(4))).doesNotThrowAnyException();
        assertThatThrownBy(() -> ContractHarness.run(program, "main", TypedValue.ofInt(-4)))
                .isInstanceOf(ScriptExecutionException.class);
    }

    /**
     * Frame numbering restarts in every dispatch branch: each entrypoint body is frame 0 and the
     * helpers it inlines count from 1, so the chain is resolved within the owning entrypoint.
     */
    @Test
    void numbersFramesPerEntrypoint() throws Exception {
        CompiledProgram program = ContractHarness.compile("""
                contract Pair() {
                    function h(int x) { require(x > 0); }
                    entrypoint function first(int a) { h(a); }
                    entrypoint function second(int b) {
                        require(b < 10);
                        h(b);
                    }
                }
                """);
        DebugTable table = program.debugInfo();

        assertThat(table.frames()).containsExactly(
                new FrameInfo(0, "first", 0, null, null, "first"),
                new FrameInfo(1, "h", 1, 0, table.frames().get(1).callSite(), "first"),
                new FrameInfo(0, "second", 0, null, null, "second"),
                new FrameInfo(1, "h", 1, 0, table.frames().get(3).callSite(), "second"));
        assertThat(table.frames().get(3).callSite().line()).isEqualTo(6);
        assertThat(table.frameChain("second", 1)).extracting(FrameInfo::functionName).containsExactly("second", "h");
        assertThat(table.frameChain("second", 0)).extracting(FrameInfo::functionName).containsExactly("second");
        assertThat(table.frameChain("third", 0)).isEmpty();

        List<DebugMapping> second = table.mappings().stream().filter(m -> m.entrypoint().equals("second")).toList();
        assertThat(second).filteredOn(m -> m.callDepth() == 0).extracting(DebugMapping::frameId).containsOnly(0);
        assertThat(second).filteredOn(m -> m.callDepth() == 1).extracting(DebugMapping::frameId).containsOnly(1);

        assertThatCode(() -> ContractHarness.run(program, "second", TypedValue.ofInt(4))).doesNotThrowAnyException();
    }

    /**
     * A call that lowers to no instructions still leaves one mapped boundary, so stepping stops on it.
     */
    @Test
    void emptyCallKeepsAStatementBoundary() throws Exception {
        CompiledProgram program = ContractHarness.compile("""
                contract Empty() {
                    function noop() { }
                    entrypoint function main(int a) {
                        noop();
                        require(a == 1);
                    }
                }
                """);
        DebugTable table = program.debugInfo();

        // OP_NOP | OP_0 OP_PICK OP_1 OP_NUMEQUAL OP_VERIFY | OP_DROP OP_1
        assertEquals("610079519c697551", program.bytecodeHex());
        DebugMapping call = table.mappingAt(0).orElseThrow();
        assertThat(call.statementBoundary()).isTrue();
        assertThat(call.span().line()).isEqualTo(4);
        assertThat(call.frameId()).isZero();
        assertThat(call.callDepth()).isZero();
        assertThat(table.mappings()).filteredOn(DebugMapping::statementBoundary)
                .extracting(m -> m.span().line()).containsExactly(4, 5);

        assertThatCode(() -> ContractHarness.run(program, "main", TypedValue.ofInt(1))).doesNotThrowAnyException();
    }

    /**
     * Integer and boolean expressions over literals and constructor arguments collapse to one push.
     */
    @Test
    void foldsConstantExpressions() throws Exception {
        CompiledProgram program = ContractHarness.compile("""
                contract Fold(int k) {
                    entrypoint function main() { require(2 * 3 + k == max(7, -1)); }
                }
                """, TypedValue.ofInt(1));

        // OP_1 OP_VERIFY | OP_1
        assertEquals("516951", program.bytecodeHex());
    }

    /**
     * Folding gives up on division by zero and leaves the failure to run time.
     */
    @Test
    void doesNotFoldDivisionByZero() throws Exception {
        CompiledProgram program = ContractHarness.compile("""
                contract Div() {
                    entrypoint function main() { require(1 / 0 == 0); }
                }
                """);

        // OP_1 OP_0 OP_DIV OP_0 OP_NUMEQUAL OP_VERIFY | OP_1
        assertEquals("510096009c6951", program.bytecodeHex());
        assertThatThrownBy(() -> ContractHarness.run(program, "main")).isInstanceOf(ScriptExecutionException.class);
    }

    /**
     * Assignment rewrites the variable's slot in place, both for the slot directly below the new
     * value and for deeper slots.
     */
    @Test
    void assignsThroughStackSlots() throws Exception {
        CompiledProgram program = ContractHarness.compile("""
                contract Assign() {
                    entrypoint function main(int a, int b) {
                        int c = 0;
                        a = b;
                        c = a + 1;
                        if (c > 5) {
                            b = 10;
                        } else {
                            b = 20;
                        }
                        require(a == 5 && c == 6 && b == 10);
                    }
                }
                """);

        assertThatCode(() -> ContractHarness.run(program, "main", TypedValue.ofInt(1), TypedValue.ofInt(5)))
                .doesNotThrowAnyException();
        assertThatThrownBy(() -> ContractHarness.run(program, "main", TypedValue.ofInt(1), TypedValue.ofInt(4)))
                .isInstanceOf(ScriptExecutionException.class);
    }

    /**
     * Constructor arguments are embedded as literals and listed first in every scope.
     */
    @Test
    void embedsConstructorArguments() throws Exception {
        CompiledProgram program = ContractHarness.compile("""
                contract Const(bytes4 tag) {
                    entrypoint function main(bytes4 t) { require(t == tag); }
                }
                """, new TypedValue(ValueType.bytes(4), new byte[]{1, 2, 3, 4}));

        assertThat(program.bytecodeHex()).contains("0401020304");
        VariableSlot tag = program.debugInfo().mappings().get(0).scope().get(0);
        assertThat(tag.isConstant()).isTrue();
        assertThat(tag.origin()).isEqualTo(VariableOrigin.CONSTRUCTOR_PARAMETER);
        assertThat(tag.type()).isEqualTo(ValueType.bytes(4));
        assertArrayEquals(new byte[]{1, 2, 3, 4}, tag.constantValue());
    }

    /**
     * Compiling the same source twice gives identical bytecode and debug tables.
     */
    @Test
    void isDeterministic() throws Exception {
        String source = """
                contract Det() {
                    function h(int x) { int y = x * 2; require(y > x); }
                    entrypoint function main(int a) { h(a); }
                    entrypoint function other() { require(true); }
                }
                """;
        CompiledProgram one = ContractHarness.compile(source);
        CompiledProgram two = ContractHarness.compile(source);

        assertArrayEquals(one.bytecode(), two.bytecode());
        assertEquals(one.debugInfo().mappings(), two.debugInfo().mappings());
        assertEquals(one.debugInfo().frames(), two.debugInfo().frames());
    }
}

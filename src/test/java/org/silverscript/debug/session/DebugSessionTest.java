package org.silverscript.debug.session;

import org.silverscript.ContractHarness;
import org.silverscript.compiler.api.CompiledProgram;
import org.silverscript.compiler.api.TypedValue;
import org.silverscript.debug.DebugMapping;
import org.silverscript.debug.DebugTable;
import org.silverscript.debug.DebugVariable;
import org.silverscript.runtime.ScriptExecutionException;
import org.silverscript.runtime.spi.IScriptEngine;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

/**
 * Tests for {@link DebugSession} on the bundled example contract: opcode and statement stepping,
 * helper frames, variable resolution, failure handling and the step ceiling.
 */
@Tag("unit")
@ExtendWith(MockitoExtension.class)
class DebugSessionTest {

    private static String source;
    private static CompiledProgram program;

    @Mock
    private IScriptEngine usedEngine;

    @Mock
    private IScriptEngine freshEngine;

    @BeforeAll
    static void compileExample() throws Exception {
        source = ContractHarness.exampleContract();
        program = ContractHarness.compile(source, TypedValue.ofInt(0));
    }

    private static DebugSession open(long maxSteps, long a, long b) throws Exception {
        byte[] input = ContractHarness.input(program, "main", TypedValue.ofInt(a), TypedValue.ofInt(b));
        return DebugSession.open(ContractHarness.engine(program, input), input, program.bytecode(), source,
                program.debugInfo(), maxSteps);
    }

    /**
     * Statement stepping visits every statement once, entering both helpers, and ends completed
     * with the program counter past the last instruction.
     */
    @Test
    void stepsThroughStatementsIntoHelpers() throws Exception {
        DebugSession session = open(1_000, 1, 2);

        List<DebugMapping> visited = new ArrayList<>();
        visited.add(session.runToFirstExecutedStatement());
        Optional<DebugMapping> next;
        while ((next = session.stepInto()).isPresent()) {
            visited.add(next.get());
        }

        assertThat(visited).extracting(DebugMapping::callDepth).containsExactly(0, 0, 1, 1, 1, 0, 1, 1, 0, 0);
        assertThat(visited).extracting(m -> m.span().line()).containsExactly(16, 17, 10, 11, 12, 18, 5, 6, 19, 20);
        assertThat(visited).extracting(DebugMapping::sequence).isSorted();
        assertEquals(SessionState.COMPLETED, session.sessionState());

        ExecutionState state = session.state();
        assertFalse(state.executing());
        assertThat(state.mapping()).isNull();
        assertEquals(session.opcodeMetas().size(), state.pc());
        assertEquals(program.bytecode().length, session.currentByteOffset());
        assertThat(session.failure()).isEmpty();
        assertThat(session.stepInto()).isEmpty();
        assertThat(session.stepOpcode()).isEmpty();
    }

    @Test
    void resolvesHelperFrameVariables() throws Exception {
        DebugSession session = open(1_000, 1, 2);
        session.runToFirstExecutedStatement();
        session.stepInto();
        DebugMapping inHelper = session.stepInto().orElseThrow();

        assertThat(session.callStack()).containsExactly("main", "check_pair");
        List<DebugVariable> variables = session.listVariables();
        assertThat(variables).extracting(DebugVariable::name).containsExactly("const", "leftInput", "rightInput");
        assertThat(variables).extracting(v -> session.formatValue(v.type(), v.rawValue())).containsExactly("0", "1", "2");
        assertThat(session.listVariablesAtSequence(inHelper.sequence(), inHelper.frameId() + 1)).isEmpty();
    }

    @Test
    void exposesUnlockedArgumentsBeforeFirstStep() throws Exception {
        DebugSession session = open(1_000, 1, 2);

        assertThat(session.stacksSnapshot().mainStack()).containsExactly("01", "02");
        assertThat(session.stacksSnapshot().altStack()).isEmpty();
        assertTrue(session.isExecuting());
        assertThat(session.state().lastOpcode()).isNull();
        assertThat(session.unlockingInput()).containsExactly(0x51, 0x52);
    }

    /**
     * A failing requirement stops the session on the failing instruction; further stepping is a no-op.
     */
    @Test
    void stopsOnFailedRequirement() throws Exception {
        DebugSession session = open(1_000, -5, 2);
        session.runToFirstExecutedStatement();

        assertThatThrownBy(() -> {
            while (session.stepInto().isPresent()) {
                // keep stepping until the failure surfaces
            }
        }).isInstanceOf(ScriptExecutionException.class);

        assertEquals(SessionState.FAILED, session.sessionState());
        assertThat(session.failure()).isPresent();
        assertThat(session.state().lastOpcode()).isEqualTo("OP_VERIFY");
        assertFalse(session.state().executing());
        assertThat(session.callStack()).containsExactly("main", "check_pair");
        assertThat(session.stepOpcode()).isEmpty();
        assertThatThrownBy(session::runToFirstExecutedStatement).isInstanceOf(ScriptExecutionException.class);
    }

    @Test
    void enforcesStepCeiling() throws Exception {
        DebugSession session = open(3, 1, 2);
        for (int i = 0; i < 3; i++) {
            assertThat(session.stepOpcode()).isPresent();
        }

        assertThatThrownBy(session::stepOpcode).hasMessage("step limit of 3 instructions exceeded");
        assertEquals(SessionState.FAILED, session.sessionState());
    }

    @Test
    void reportsUnlockingFailureOnOpen() throws Exception {
        byte[] input = {0x51, 0x76};
        DebugSession session = DebugSession.open(ContractHarness.engine(program, input), input, program.bytecode(),
                source, program.debugInfo(), 1_000);

        assertEquals(SessionState.FAILED, session.sessionState());
        assertThat(session.failure()).hasValueSatisfying(m -> assertThat(m).startsWith("unlocking script failed"));
        assertThatThrownBy(session::runToFirstExecutedStatement).isInstanceOf(ScriptExecutionException.class);
    }

    @Test
    void describesEveryInstruction() throws Exception {
        DebugSession session = open(1_000, 1, 2);

        List<OpcodeMeta> metas = session.opcodeMetas();

        assertThat(metas).extracting(OpcodeMeta::index).isSorted();
        assertThat(metas.get(0).byteOffset()).isZero();
        assertThat(metas.get(0).mapping()).isNotNull();
        // epilogue leaves the success value
        assertThat(metas.get(metas.size() - 1).display()).isEqualTo("OP_1");
        assertThat(metas.get(metas.size() - 1).mapping()).isNull();
    }

    /**
     * Sessions are opened on engines that have not run yet, and need a positive step ceiling.
     */
    @Test
    void rejectsMisuse() {
        when(usedEngine.isDone()).thenReturn(true);
        DebugTable table = program.debugInfo();

        assertThatThrownBy(() -> DebugSession.open(usedEngine, new byte[0], program.bytecode(), source, table, 10))
                .isInstanceOf(DebugSessionException.class)
                .hasMessageContaining("fresh engine");
        assertThatThrownBy(() -> DebugSession.open(freshEngine, new byte[0], program.bytecode(), source, table, 0))
                .isInstanceOf(DebugSessionException.class)
                .hasMessageContaining("maxSteps");
    }
}

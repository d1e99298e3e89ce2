package org.silverscript.debug.session;

import org.silverscript.compiler.api.ValueType;
import org.silverscript.debug.DebugMapping;
import org.silverscript.debug.DebugTable;
import org.silverscript.debug.DebugVariable;
import org.silverscript.debug.FrameInfo;
import org.silverscript.debug.VariableSlot;
import org.silverscript.runtime.ParsedOpcode;
import org.silverscript.runtime.ScriptExecutionException;
import org.silverscript.runtime.ScriptParser;
import org.silverscript.runtime.spi.ExecutionPhase;
import org.silverscript.runtime.spi.IScriptEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Drives one script engine through a compiled locking script and answers source-level questions
 * about the current execution point using the compiler's {@link DebugTable}.
 * <p>
 * The session is a state machine over {@link SessionState}. Opening it executes the unlocking
 * script, so every step afterwards is a locking-script instruction. Both stepping granularities
 * share a single advance primitive, {@link #stepOpcode()}: statement stepping just repeats it
 * until a predicate on the current mapping holds.
 * <p>
 * The "current" point is the instruction at the program counter, i.e. the next one to execute.
 * Its mapping, variables and call stack describe the state before that instruction runs. After a
 * failure the program counter stays on the failing instruction.
 * <p>
 * A session exclusively owns its engine and is not thread-safe.
 */
public final class DebugSession {

    private static final Logger LOG = LoggerFactory.getLogger(DebugSession.class);
    private static final HexFormat HEX = HexFormat.of();

    private final IScriptEngine engine;
    private final byte[] unlockingInput;
    private final byte[] lockingScript;
    private final List<ParsedOpcode> instructions;
    private final String source;
    private final DebugTable debugTable;
    private final long maxSteps;

    private SessionState state = SessionState.RUNNING;
    private String failure;
    private ParsedOpcode lastOpcode;
    private long steps;

    private DebugSession(IScriptEngine engine, byte[] unlockingInput, byte[] lockingScript,
                         List<ParsedOpcode> instructions, String source, DebugTable debugTable, long maxSteps) {
        this.engine = engine;
        this.unlockingInput = unlockingInput.clone();
        this.lockingScript = lockingScript.clone();
        this.instructions = instructions;
        this.source = source;
        this.debugTable = debugTable;
        this.maxSteps = maxSteps;
    }

    /**
     * Opens a session and runs the unlocking script. If the unlocking script fails the session
     * starts out {@link SessionState#FAILED}.
     *
     * @param engine A fresh engine bound to {@code unlockingInput} and {@code lockingScript}.
     * @param unlockingInput The unlocking script the engine was created with.
     * @param lockingScript The compiled bytecode the engine was created with.
     * @param source The contract source text.
     * @param debugTable The debug table of {@code lockingScript}.
     * @param maxSteps The maximum number of locking-script instructions to execute.
     * @return The session, positioned before the first locking-script instruction.
     * @throws ScriptExecutionException if the locking script cannot be decoded.
     * @throws DebugSessionException if the engine has already executed instructions or {@code maxSteps} is not positive.
     */
    public static DebugSession open(IScriptEngine engine, byte[] unlockingInput, byte[] lockingScript, String source,
                                    DebugTable debugTable, long maxSteps) throws ScriptExecutionException {
        if (engine.isDone() || engine.lastOpcode().isPresent()) {
            throw new DebugSessionException("debug sessions must be opened on a fresh engine");
        }
        if (maxSteps <= 0) {
            throw new DebugSessionException("maxSteps must be positive, got " + maxSteps);
        }
        List<ParsedOpcode> instructions = ScriptParser.parse(lockingScript);
        DebugSession session = new DebugSession(engine, unlockingInput, lockingScript, instructions,
                source, debugTable, maxSteps);
        session.runUnlockingScript();
        return session;
    }

    private void runUnlockingScript() {
        try {
            while (!engine.isDone() && engine.phase() == ExecutionPhase.UNLOCKING) {
                engine.step();
            }
        } catch (ScriptExecutionException e) {
            fail("unlocking script failed: " + e.getMessage());
        }
    }

    // --- Stepping ---

    /**
     * Executes exactly one locking-script instruction.
     *
     * @return The executed instruction, or empty if the session had already completed or failed.
     * @throws ScriptExecutionException if the instruction fails, the final verification fails or the
     *         step limit is exceeded; the session is {@link SessionState#FAILED} afterwards.
     */
    public Optional<ParsedOpcode> stepOpcode() throws ScriptExecutionException {
        if (state != SessionState.RUNNING) {
            return Optional.empty();
        }
        if (steps >= maxSteps) {
            String message = "step limit of " + maxSteps + " instructions exceeded";
            fail(message);
            throw new ScriptExecutionException(message);
        }
        ParsedOpcode executed;
        try {
            executed = engine.step();
        } catch (ScriptExecutionException e) {
            steps++;
            engine.lastOpcode().ifPresent(op -> lastOpcode = op);
            fail(e.getMessage());
            throw e;
        }
        steps++;
        lastOpcode = executed;
        if (engine.isDone()) {
            state = SessionState.COMPLETED;
            LOG.debug("Session completed after {} instruction(s)", steps);
        }
        return Optional.of(executed);
    }

    /**
     * Executes at least one instruction, then continues until the next statement boundary inside
     * an executing branch. Inlined helper bodies are part of the instruction stream, so this steps
     * into helper calls.
     *
     * @return The mapping of the statement about to execute, or empty if the program completed first.
     * @throws ScriptExecutionException if an instruction fails on the way.
     */
    public Optional<DebugMapping> stepInto() throws ScriptExecutionException {
        if (state != SessionState.RUNNING) {
            return Optional.empty();
        }
        stepOpcode();
        return advanceUntil(DebugMapping::statementBoundary);
    }

    /**
     * Executes the unmapped dispatch code until the first mapped instruction inside an executing branch.
     *
     * @return The mapping of the first statement.
     * @throws ScriptExecutionException if the program fails or finishes before reaching mapped code.
     */
    public DebugMapping runToFirstExecutedStatement() throws ScriptExecutionException {
        if (state == SessionState.FAILED) {
            throw new ScriptExecutionException(failure);
        }
        return advanceUntil(m -> true).orElseThrow(() ->
                new ScriptExecutionException("program finished before executing any source statement"));
    }

    private Optional<DebugMapping> advanceUntil(Predicate<DebugMapping> stopAt) throws ScriptExecutionException {
        while (state == SessionState.RUNNING) {
            Optional<DebugMapping> mapping = currentMapping();
            if (mapping.isPresent() && engine.isBranchExecuting() && stopAt.test(mapping.get())) {
                return mapping;
            }
            stepOpcode();
        }
        return Optional.empty();
    }

    private void fail(String message) {
        state = SessionState.FAILED;
        failure = message;
        LOG.debug("Session failed at pc {}: {}", engine.pc(), message);
    }

    // --- Current point ---

    /**
     * @return The mapping of the instruction at the program counter, if it has one.
     */
    public Optional<DebugMapping> currentMapping() {
        if (engine.phase() != ExecutionPhase.LOCKING || engine.pc() >= instructions.size()) {
            return Optional.empty();
        }
        return debugTable.mappingAt(instructions.get(engine.pc()).offset());
    }

    public ExecutionState state() {
        return new ExecutionState(pc(), lastOpcode == null ? null : lastOpcode.name(),
                currentMapping().orElse(null), isExecuting());
    }

    public SessionState sessionState() {
        return state;
    }

    /**
     * @return The failure message once {@link SessionState#FAILED}.
     */
    public Optional<String> failure() {
        return Optional.ofNullable(failure);
    }

    private int pc() {
        return engine.phase() == ExecutionPhase.LOCKING ? engine.pc() : 0;
    }

    /**
     * @return The byte offset of the instruction at the program counter; the script length once completed.
     */
    public int currentByteOffset() {
        int pc = pc();
        return pc < instructions.size() ? instructions.get(pc).offset() : lockingScript.length;
    }

    public boolean isExecuting() {
        return state == SessionState.RUNNING;
    }

    // --- Variables, stacks, frames ---

    /**
     * Resolves the variables visible at a mapped instruction against the current stack. Slots that
     * the stack does not reach are left out.
     *
     * @param sequence The mapping sequence number.
     * @param frameId The frame the caller expects the mapping to belong to.
     * @return The variables in scope order, or an empty list if no such mapping exists in that frame.
     */
    public List<DebugVariable> listVariablesAtSequence(int sequence, int frameId) {
        Optional<DebugMapping> mapping = debugTable.mappingForSequence(sequence).filter(m -> m.frameId() == frameId);
        if (mapping.isEmpty()) {
            return Collections.emptyList();
        }
        List<byte[]> stack = engine.mainStack();
        List<DebugVariable> out = new ArrayList<>();
        for (VariableSlot slot : mapping.get().scope()) {
            if (slot.isConstant()) {
                out.add(new DebugVariable(slot.name(), slot.origin(), slot.type(), slot.constantValue()));
            } else if (slot.stackIndex() < stack.size()) {
                out.add(new DebugVariable(slot.name(), slot.origin(), slot.type(), stack.get(slot.stackIndex())));
            }
        }
        return out;
    }

    /**
     * @return The variables visible at the current point, empty outside mapped code.
     */
    public List<DebugVariable> listVariables() {
        return currentMapping()
                .map(m -> listVariablesAtSequence(m.sequence(), m.frameId()))
                .orElse(Collections.emptyList());
    }

    /**
     * @return The function names of the active frames, outermost first; empty outside mapped code.
     */
    public List<String> callStack() {
        return currentMapping()
                .map(m -> debugTable.frameChain(m.entrypoint(), m.frameId()).stream().map(FrameInfo::functionName).toList())
                .orElse(Collections.emptyList());
    }

    public StackSnapshot stacksSnapshot() {
        return new StackSnapshot(hex(engine.mainStack()), hex(engine.altStack()));
    }

    private static List<String> hex(List<byte[]> stack) {
        return stack.stream().map(HEX::formatHex).toList();
    }

    /**
     * @param type The declared type.
     * @param bytes The encoded value.
     * @return The value for display; never throws.
     */
    public String formatValue(ValueType type, byte[] bytes) {
        return ValueFormatter.format(type, bytes);
    }

    // --- Static program description ---

    /**
     * @return One entry per locking-script instruction, independent of execution.
     */
    public List<OpcodeMeta> opcodeMetas() {
        List<OpcodeMeta> metas = new ArrayList<>(instructions.size());
        for (ParsedOpcode op : instructions) {
            metas.add(new OpcodeMeta(op.index(), op.offset(), op.toString(), debugTable.mappingAt(op.offset()).orElse(null)));
        }
        return metas;
    }

    public String source() {
        return source;
    }

    public byte[] unlockingInput() {
        return unlockingInput.clone();
    }

    public DebugTable debugTable() {
        return debugTable;
    }
}

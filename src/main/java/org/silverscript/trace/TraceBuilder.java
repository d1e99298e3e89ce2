package org.silverscript.trace;

import org.silverscript.compiler.api.CompiledProgram;
import org.silverscript.compiler.api.ICompiler;
import org.silverscript.config.DebuggerOptions;
import org.silverscript.debug.DebugMapping;
import org.silverscript.debug.DebugVariable;
import org.silverscript.debug.session.DebugSession;
import org.silverscript.debug.session.ExecutionState;
import org.silverscript.debug.session.OpcodeMeta;
import org.silverscript.runtime.ScriptEngine;
import org.silverscript.runtime.ScriptExecutionException;
import org.silverscript.trace.model.MappingView;
import org.silverscript.trace.model.OpcodeView;
import org.silverscript.trace.model.OutlineView;
import org.silverscript.trace.model.StacksView;
import org.silverscript.trace.model.StepSnapshot;
import org.silverscript.trace.model.Trace;
import org.silverscript.trace.model.TraceMeta;
import org.silverscript.trace.model.UnlockingInputView;
import org.silverscript.trace.model.VarSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;

/**
 * Produces the artifacts a presentation layer consumes: full traces, unlocking inputs and outlines.
 * <p>
 * A trace runs the call twice in fresh sessions, once instruction by instruction and once
 * statement by statement. Execution errors end the affected step list with a snapshot carrying
 * the error; they never fail the request.
 */
public final class TraceBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(TraceBuilder.class);
    private static final HexFormat HEX = HexFormat.of();

    private final ContractResolver resolver;
    private final DebuggerOptions options;
    private final Clock clock;

    public TraceBuilder(ICompiler compiler, DebuggerOptions options) {
        this(compiler, options, Clock.systemUTC());
    }

    /**
     * @param compiler The compiler.
     * @param options The step ceiling and canonical transaction.
     * @param clock The source of {@code generated_at_unix_ms}.
     */
    public TraceBuilder(ICompiler compiler, DebuggerOptions options, Clock clock) {
        this.resolver = new ContractResolver(compiler, options);
        this.options = options;
        this.clock = clock;
    }

    /**
     * @param source The contract source.
     * @return The outline of the contract.
     * @throws TraceException if the source does not parse or has no entrypoint.
     */
    public OutlineView outline(String source) throws TraceException {
        return OutlineView.of(resolver.outline(source));
    }

    /**
     * @param request The call to prepare.
     * @return The unlocking input of the call.
     * @throws TraceException for parse, compile and argument errors.
     */
    public UnlockingInputView buildUnlockingInput(TraceRequest request) throws TraceException {
        ResolvedContract r = resolver.resolve(request);
        byte[] input = r.unlockingInput();
        return new UnlockingInputView(r.program().contractName(), r.function().name(), r.function().selectorIndex(),
                HEX.formatHex(input), input.length, r.program().withoutSelector());
    }

    /**
     * @param request The call to trace.
     * @return The trace.
     * @throws TraceException for parse, compile and argument errors, or if the scripts cannot be decoded.
     */
    public Trace buildTrace(TraceRequest request) throws TraceException {
        ResolvedContract r = resolver.resolve(request);
        CompiledProgram program = r.program();

        DebugSession opcodeSession = openSession(r, request.source());
        List<OpcodeMeta> opcodes = opcodeSession.opcodeMetas();
        List<StepSnapshot> opcodeSteps = opcodeSteps(opcodeSession);
        List<StepSnapshot> sourceSteps = sourceSteps(openSession(r, request.source()));
        LOG.debug("Traced {}.{}: {} opcode step(s), {} source step(s)", program.contractName(), r.function().name(),
                opcodeSteps.size(), sourceSteps.size());

        byte[] input = r.unlockingInput();
        TraceMeta meta = new TraceMeta(
                program.contractName(),
                r.function().name(),
                r.function().selectorIndex(),
                r.rawCtorArgs(),
                r.signedArgs(),
                program.withoutSelector(),
                HEX.formatHex(input),
                input.length,
                program.bytecode().length,
                opcodes.size(),
                opcodeSteps.size(),
                sourceSteps.size(),
                clock.millis());
        return new Trace(meta, request.source(), opcodes.stream().map(OpcodeView::of).toList(),
                opcodeSteps, opcodeSteps, sourceSteps);
    }

    private DebugSession openSession(ResolvedContract r, String source) throws TraceException {
        byte[] bytecode = r.program().bytecode();
        byte[] input = r.unlockingInput();
        try {
            ScriptEngine engine = new ScriptEngine(options.transaction(bytecode), input, bytecode);
            return DebugSession.open(engine, input, bytecode, source, r.program().debugInfo(), options.maxSteps());
        } catch (ScriptExecutionException e) {
            throw new TraceException(TraceException.Kind.EXECUTION, e.getMessage(), null, e);
        }
    }

    private static List<StepSnapshot> opcodeSteps(DebugSession session) {
        List<StepSnapshot> steps = new ArrayList<>();
        steps.add(snapshot(session, session.failure().orElse(null), false));
        while (session.isExecuting()) {
            try {
                if (session.stepOpcode().isEmpty()) {
                    break;
                }
                steps.add(snapshot(session, null, false));
            } catch (ScriptExecutionException e) {
                steps.add(snapshot(session, e.getMessage(), false));
                break;
            }
        }
        return steps;
    }

    private static List<StepSnapshot> sourceSteps(DebugSession session) {
        List<StepSnapshot> steps = new ArrayList<>();
        try {
            session.runToFirstExecutedStatement();
        } catch (ScriptExecutionException e) {
            steps.add(snapshot(session, e.getMessage(), true));
            return steps;
        }
        steps.add(snapshot(session, null, true));
        while (true) {
            try {
                if (session.stepInto().isPresent()) {
                    steps.add(snapshot(session, null, true));
                    continue;
                }
            } catch (ScriptExecutionException e) {
                steps.add(snapshot(session, e.getMessage(), true));
                return steps;
            }
            StepSnapshot terminal = snapshot(session, null, true);
            if (!terminal.samePointAs(steps.get(steps.size() - 1))) {
                steps.add(terminal);
            }
            return steps;
        }
    }

    private static StepSnapshot snapshot(DebugSession session, String error, boolean includeCallStack) {
        ExecutionState state = session.state();
        Optional<DebugMapping> mapping = Optional.ofNullable(state.mapping());
        List<DebugVariable> variables = mapping
                .map(m -> session.listVariablesAtSequence(m.sequence(), m.frameId()))
                .orElseGet(session::listVariables);
        List<VarSnapshot> vars = variables.stream()
                .map(v -> new VarSnapshot(v.name(), v.origin().label(), v.type().name(),
                        session.formatValue(v.type(), v.rawValue())))
                .toList();
        return new StepSnapshot(
                state.pc(),
                session.currentByteOffset(),
                state.lastOpcode(),
                MappingView.of(state.mapping()),
                mapping.map(DebugMapping::sequence).orElse(null),
                mapping.map(DebugMapping::frameId).orElse(null),
                mapping.map(DebugMapping::callDepth).orElse(null),
                includeCallStack ? session.callStack() : Collections.emptyList(),
                session.isExecuting(),
                StacksView.of(session.stacksSnapshot()),
                vars,
                error);
    }
}

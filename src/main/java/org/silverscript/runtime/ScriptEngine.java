package org.silverscript.runtime;

import org.silverscript.runtime.internal.ExecutionContext;
import org.silverscript.runtime.isa.InstructionSet;
import org.silverscript.runtime.spi.ExecutionPhase;
import org.silverscript.runtime.spi.IScriptEngine;
import org.silverscript.runtime.tx.TransactionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Interprets an unlocking script followed by a locking script against one transaction input.
 * <p>
 * The unlocking script must consist of pushes only; its resulting main stack is handed to the
 * locking script while the alt stack is cleared. Instructions inside non-executing branches are
 * stepped over without effect, except for the conditionals that keep the branch nesting balanced.
 * After the last locking instruction the main stack must hold exactly one true element.
 */
public class ScriptEngine implements IScriptEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ScriptEngine.class);

    private final List<ParsedOpcode> unlocking;
    private final List<ParsedOpcode> locking;
    private final ExecutionContext context;

    private ExecutionPhase phase = ExecutionPhase.UNLOCKING;
    private int pc = 0;
    private ParsedOpcode lastOpcode;
    private boolean done = false;

    /**
     * Creates an engine positioned before the first unlocking instruction.
     *
     * @param transaction The transaction the signatures are checked against.
     * @param unlockingScript The push-only unlocking input.
     * @param lockingScript The contract bytecode.
     * @throws ScriptExecutionException if either script is malformed or the locking script is empty.
     */
    public ScriptEngine(TransactionContext transaction, byte[] unlockingScript, byte[] lockingScript)
            throws ScriptExecutionException {
        this.unlocking = ScriptParser.parse(unlockingScript);
        this.locking = ScriptParser.parse(lockingScript);
        if (locking.isEmpty()) {
            throw new ScriptExecutionException("locking script is empty");
        }
        this.context = new ExecutionContext(transaction);
        if (unlocking.isEmpty()) {
            phase = ExecutionPhase.LOCKING;
        }
    }

    @Override
    public ParsedOpcode step() throws ScriptExecutionException {
        if (done) {
            throw new IllegalStateException("script engine has finished executing");
        }
        ParsedOpcode op = current().get(pc);
        try {
            execute(op);
        } catch (ScriptExecutionException e) {
            done = true;
            lastOpcode = op;
            LOG.debug("{} failed at {} #{}: {}", op.name(), phase, op.index(), e.getMessage());
            throw e;
        }
        lastOpcode = op;
        pc++;
        if (pc == current().size()) {
            finishPhase();
        }
        return op;
    }

    private void execute(ParsedOpcode op) throws ScriptExecutionException {
        if (phase == ExecutionPhase.UNLOCKING && !op.isPush()) {
            throw new ScriptExecutionException("unlocking script must be push-only, found " + op.name()
                    + " at offset " + op.offset());
        }
        boolean conditional = op.opcode().map(o -> o.isConditional()).orElse(false);
        if (!context.conditions().isExecuting() && !conditional) {
            return;
        }
        InstructionSet.resolve(op).execute(op, context);
    }

    private void finishPhase() throws ScriptExecutionException {
        if (!context.conditions().isEmpty()) {
            done = true;
            throw new ScriptExecutionException("unbalanced conditional: missing OP_ENDIF at end of "
                    + phase.name().toLowerCase() + " script");
        }
        if (phase == ExecutionPhase.UNLOCKING) {
            context.altStack().clear();
            phase = ExecutionPhase.LOCKING;
            pc = 0;
            LOG.trace("unlocking script done, {} element(s) handed to locking script", context.mainStack().size());
            return;
        }
        done = true;
        ExecutionStack stack = context.mainStack();
        if (stack.size() != 1) {
            throw new ScriptExecutionException("script finished with " + stack.size()
                    + " stack element(s), expected exactly 1");
        }
        if (!ScriptNumber.castToBool(stack.peek(0))) {
            throw new ScriptExecutionException("script finished with a false top stack element");
        }
    }

    private List<ParsedOpcode> current() {
        return phase == ExecutionPhase.UNLOCKING ? unlocking : locking;
    }

    @Override
    public boolean isDone() {
        return done;
    }

    @Override
    public ExecutionPhase phase() {
        return phase;
    }

    @Override
    public int pc() {
        return pc;
    }

    @Override
    public Optional<ParsedOpcode> lastOpcode() {
        return Optional.ofNullable(lastOpcode);
    }

    @Override
    public List<byte[]> mainStack() {
        return context.mainStack().snapshot();
    }

    @Override
    public List<byte[]> altStack() {
        return context.altStack().snapshot();
    }

    @Override
    public boolean isBranchExecuting() {
        return context.conditions().isExecuting();
    }

    /**
     * @return The decoded locking script.
     */
    public List<ParsedOpcode> lockingInstructions() {
        return locking;
    }
}

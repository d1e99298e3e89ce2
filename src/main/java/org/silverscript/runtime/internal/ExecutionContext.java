package org.silverscript.runtime.internal;

import org.silverscript.runtime.ConditionStack;
import org.silverscript.runtime.ExecutionStack;
import org.silverscript.runtime.tx.TransactionContext;

/**
 * Encapsulates the state an instruction operates on. Created once per engine and
 * passed to the instruction families to avoid global access.
 */
public class ExecutionContext {

    private final ExecutionStack mainStack = new ExecutionStack("main");
    private final ExecutionStack altStack = new ExecutionStack("alt");
    private final ConditionStack conditions = new ConditionStack();
    private final TransactionContext transaction;

    /**
     * @param transaction The transaction signatures are checked against.
     */
    public ExecutionContext(TransactionContext transaction) {
        this.transaction = transaction;
    }

    public ExecutionStack mainStack() {
        return mainStack;
    }

    public ExecutionStack altStack() {
        return altStack;
    }

    public ConditionStack conditions() {
        return conditions;
    }

    public TransactionContext transaction() {
        return transaction;
    }
}

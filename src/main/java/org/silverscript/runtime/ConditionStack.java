package org.silverscript.runtime;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Tracks nested IF/ELSE/ENDIF branches and whether the current branch executes.
 */
public class ConditionStack {

    private enum Branch { TRUE, FALSE, SKIP }

    private final Deque<Branch> branches = new ArrayDeque<>();

    /**
     * @return {@code true} if every enclosing branch is taken.
     */
    public boolean isExecuting() {
        for (Branch b : branches) {
            if (b != Branch.TRUE) return false;
        }
        return true;
    }

    /**
     * Opens a branch.
     * @param condition The evaluated condition; ignored when the enclosing branch is not executing.
     */
    public void open(boolean condition) {
        if (!isExecuting()) {
            branches.push(Branch.SKIP);
        } else {
            branches.push(condition ? Branch.TRUE : Branch.FALSE);
        }
    }

    /**
     * Switches to the else part of the innermost branch.
     * @throws ScriptExecutionException if no branch is open.
     */
    public void toggle() throws ScriptExecutionException {
        Branch top = branches.poll();
        if (top == null) {
            throw new ScriptExecutionException("OP_ELSE without matching OP_IF");
        }
        branches.push(switch (top) {
            case TRUE -> Branch.FALSE;
            case FALSE -> Branch.TRUE;
            case SKIP -> Branch.SKIP;
        });
    }

    /**
     * Closes the innermost branch.
     * @throws ScriptExecutionException if no branch is open.
     */
    public void close() throws ScriptExecutionException {
        if (branches.poll() == null) {
            throw new ScriptExecutionException("OP_ENDIF without matching OP_IF");
        }
    }

    public boolean isEmpty() {
        return branches.isEmpty();
    }

    public void clear() {
        branches.clear();
    }
}

package org.silverscript.runtime.spi;

import org.silverscript.runtime.ParsedOpcode;
import org.silverscript.runtime.ScriptExecutionException;

import java.util.List;
import java.util.Optional;

/**
 * The single-step view of a script interpreter that the debug session drives.
 * Implementations are single-threaded and bound to one transaction context.
 */
public interface IScriptEngine {

    /**
     * Executes the instruction at the current program counter.
     *
     * @return The instruction that was executed.
     * @throws ScriptExecutionException if the instruction or the final verification fails.
     * @throws IllegalStateException if the engine is already done.
     */
    ParsedOpcode step() throws ScriptExecutionException;

    /**
     * @return {@code true} once the last instruction has executed or an instruction has failed.
     */
    boolean isDone();

    /**
     * @return The script the program counter points into.
     */
    ExecutionPhase phase();

    /**
     * @return The index of the next instruction within the current phase's script.
     */
    int pc();

    /**
     * @return The instruction executed by the most recent {@link #step()}, empty before the first step.
     */
    Optional<ParsedOpcode> lastOpcode();

    /**
     * @return Copies of the main stack elements, bottom first.
     */
    List<byte[]> mainStack();

    /**
     * @return Copies of the alt stack elements, bottom first.
     */
    List<byte[]> altStack();

    /**
     * @return {@code true} if the instruction at the program counter lies in a taken branch.
     */
    boolean isBranchExecuting();
}

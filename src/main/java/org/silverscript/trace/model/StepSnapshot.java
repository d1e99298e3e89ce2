package org.silverscript.trace.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * The state of a session between two steps.
 *
 * @param pc The index of the next instruction.
 * @param byteOffset Its byte offset, or the script length once finished.
 * @param lastOpcode The instruction executed last, absent before the first step.
 * @param mapping The mapping of the next instruction, if any.
 * @param sequence The mapping's sequence number.
 * @param frameId The mapping's frame.
 * @param callDepth The mapping's call depth.
 * @param callStack Function names outermost first; only filled for source steps.
 * @param isExecuting {@code false} once the script completed or failed.
 * @param stacks The stack contents.
 * @param vars The variables visible at the mapping.
 * @param error The execution error that ended the trace at this step.
 */
public record StepSnapshot(
        int pc,
        int byteOffset,
        String lastOpcode,
        MappingView mapping,
        Integer sequence,
        Integer frameId,
        Integer callDepth,
        List<String> callStack,
        @JsonProperty("is_executing") boolean isExecuting,
        StacksView stacks,
        List<VarSnapshot> vars,
        String error
) {
    public StepSnapshot {
        callStack = List.copyOf(callStack);
        vars = List.copyOf(vars);
    }

    /**
     * @param other Another snapshot.
     * @return {@code true} if both describe the same execution point.
     */
    public boolean samePointAs(StepSnapshot other) {
        return pc == other.pc
                && byteOffset == other.byteOffset
                && isExecuting == other.isExecuting
                && Objects.equals(sequence, other.sequence)
                && Objects.equals(frameId, other.frameId);
    }
}

package org.silverscript.trace.model;

import java.util.List;

/**
 * The complete record of one contract call, at opcode and at source granularity.
 *
 * @param meta The summary.
 * @param source The contract source.
 * @param opcodes The instructions of the locking script.
 * @param steps The opcode steps again, for consumers that predate the split.
 * @param opcodeSteps One initial snapshot plus one per executed instruction.
 * @param sourceSteps One snapshot per statement reached.
 */
public record Trace(
        TraceMeta meta,
        String source,
        List<OpcodeView> opcodes,
        List<StepSnapshot> steps,
        List<StepSnapshot> opcodeSteps,
        List<StepSnapshot> sourceSteps
) {
    public Trace {
        opcodes = List.copyOf(opcodes);
        steps = List.copyOf(steps);
        opcodeSteps = List.copyOf(opcodeSteps);
        sourceSteps = List.copyOf(sourceSteps);
    }
}

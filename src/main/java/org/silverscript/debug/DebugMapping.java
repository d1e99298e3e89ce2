package org.silverscript.debug;

import org.silverscript.compiler.api.SourceSpan;

import java.util.List;

/**
 * Associates one emitted instruction with the source statement it was compiled from.
 *
 * @param byteOffset The position of the instruction in the bytecode.
 * @param sequence The emission order of mapped instructions; strictly increasing with the offset.
 * @param frameId The frame the instruction belongs to.
 * @param entrypoint The entrypoint owning that frame; frame ids are only unique within it.
 * @param callDepth The inlining depth of that frame.
 * @param span The source statement.
 * @param statementBoundary {@code true} for the first instruction of the statement.
 * @param scope The variables visible before the instruction executes.
 */
public record DebugMapping(
        int byteOffset,
        int sequence,
        int frameId,
        String entrypoint,
        int callDepth,
        SourceSpan span,
        boolean statementBoundary,
        List<VariableSlot> scope
) {
    public DebugMapping {
        scope = List.copyOf(scope);
    }
}

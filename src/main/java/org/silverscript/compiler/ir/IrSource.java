package org.silverscript.compiler.ir;

import org.silverscript.compiler.api.SourceSpan;
import org.silverscript.debug.VariableSlot;

import java.util.List;

/**
 * The source attribution of a mapped IR item.
 *
 * @param span The statement the item was lowered from.
 * @param frameId The frame the item belongs to.
 * @param entrypoint The entrypoint owning that frame.
 * @param callDepth The inlining depth of the frame.
 * @param statementBoundary {@code true} for the first item of a statement.
 * @param scope The variables visible before the item executes.
 */
public record IrSource(SourceSpan span, int frameId, String entrypoint, int callDepth, boolean statementBoundary, List<VariableSlot> scope) {

    public IrSource {
        scope = List.copyOf(scope);
    }
}

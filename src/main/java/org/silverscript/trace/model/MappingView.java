package org.silverscript.trace.model;

import org.silverscript.debug.DebugMapping;

/**
 * Wire form of a debug mapping. The scope is left out; resolved variables travel in the step instead.
 */
public record MappingView(int byteOffset, int sequence, int frameId, String entrypoint, int callDepth,
                          SpanView span, boolean statementBoundary) {

    public static MappingView of(DebugMapping mapping) {
        if (mapping == null) {
            return null;
        }
        return new MappingView(mapping.byteOffset(), mapping.sequence(), mapping.frameId(), mapping.entrypoint(),
                mapping.callDepth(), SpanView.of(mapping.span()), mapping.statementBoundary());
    }
}

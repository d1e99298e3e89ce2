package org.silverscript.debug;

import org.silverscript.compiler.api.SourceSpan;

/**
 * One concrete instantiation of a function body in the bytecode: an entrypoint body or one
 * inlined call site of a helper.
 *
 * @param frameId The frame identifier, 0 for the entrypoint body and numbered from 1 in call order
 *                within each entrypoint.
 * @param functionName The function whose body the frame holds.
 * @param callDepth 0 for entrypoint bodies, the caller's depth plus one for inlined calls.
 * @param parentFrameId The calling frame, or {@code null} for entrypoint bodies.
 * @param callSite The span of the call statement, or {@code null} for entrypoint bodies.
 * @param entrypoint The entrypoint whose dispatch branch holds the frame.
 */
public record FrameInfo(int frameId, String functionName, int callDepth, Integer parentFrameId, SourceSpan callSite,
                        String entrypoint) {

    public boolean isEntrypoint() {
        return parentFrameId == null;
    }
}

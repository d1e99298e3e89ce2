package org.silverscript.debug.session;

import org.silverscript.debug.DebugMapping;

/**
 * The position of a session between two instructions.
 *
 * @param pc The index of the next locking-script instruction; the instruction count once completed.
 * @param lastOpcode The display name of the most recently executed instruction, {@code null} before the first step.
 * @param mapping The debug mapping of the instruction at {@code pc}, {@code null} if it has none.
 * @param executing {@code true} until the session completes or fails.
 */
public record ExecutionState(int pc, String lastOpcode, DebugMapping mapping, boolean executing) {
}

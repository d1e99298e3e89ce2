package org.silverscript.debug.session;

/**
 * Lifecycle of a {@link DebugSession}. {@code COMPLETED} and {@code FAILED} are terminal.
 */
public enum SessionState {
    /** Instructions remain to be executed. */
    RUNNING,
    /** The last instruction executed and the script succeeded. */
    COMPLETED,
    /** An instruction, the final verification or the step limit failed. */
    FAILED
}

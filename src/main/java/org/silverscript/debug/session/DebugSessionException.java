package org.silverscript.debug.session;

/**
 * Signals misuse of a {@link DebugSession}, such as opening it on an engine that has already run.
 * Script failures are reported as {@link org.silverscript.runtime.ScriptExecutionException} instead.
 */
public class DebugSessionException extends RuntimeException {

    public DebugSessionException(String message) {
        super(message);
    }
}

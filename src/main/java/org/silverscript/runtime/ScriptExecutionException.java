package org.silverscript.runtime;

/**
 * Raised by the script engine when an instruction fails or the script ends in a failing state.
 * It carries only a message; there is no source location at the engine level.
 */
public class ScriptExecutionException extends Exception {

    /**
     * @param message The failure description.
     */
    public ScriptExecutionException(String message) {
        super(message);
    }

    /**
     * @param message The failure description.
     * @param cause The underlying cause.
     */
    public ScriptExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}

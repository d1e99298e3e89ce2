package org.silverscript.abi;

/**
 * Thrown when call arguments cannot be parsed, filled in or encoded for a function.
 */
public class ArgumentException extends Exception {

    public ArgumentException(String message) {
        super(message);
    }

    public ArgumentException(String message, Throwable cause) {
        super(message, cause);
    }
}

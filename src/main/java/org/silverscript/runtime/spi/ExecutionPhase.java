package org.silverscript.runtime.spi;

/**
 * The script an engine is currently executing.
 */
public enum ExecutionPhase {
    /** The push-only unlocking input. */
    UNLOCKING,
    /** The contract bytecode. */
    LOCKING
}

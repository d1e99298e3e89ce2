package org.silverscript.compiler.ir;

/**
 * Marker interface for all IR elements emitted by the frontend and consumed by the emitter.
 * Items lowered from source carry an {@link IrSource}; dispatch and epilogue items carry none.
 */
public interface IrItem {

    /**
     * @return The source attribution, or {@code null} for compiler-generated glue.
     */
    IrSource source();
}

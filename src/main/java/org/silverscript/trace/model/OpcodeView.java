package org.silverscript.trace.model;

import org.silverscript.debug.session.OpcodeMeta;

/**
 * One instruction of the locking script.
 */
public record OpcodeView(int index, int byteOffset, String display, MappingView mapping) {

    public static OpcodeView of(OpcodeMeta meta) {
        return new OpcodeView(meta.index(), meta.byteOffset(), meta.display(), MappingView.of(meta.mapping()));
    }
}

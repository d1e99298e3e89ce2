package org.silverscript.compiler.ir;

import java.util.HexFormat;

/**
 * A data push; the emitter chooses the shortest encoding.
 *
 * @param data The pushed bytes.
 * @param source The source attribution, or {@code null}.
 */
public record IrPush(byte[] data, IrSource source) implements IrItem {

    public IrPush {
        data = data.clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    @Override
    public String toString() {
        return "PUSH 0x" + HexFormat.of().formatHex(data);
    }
}

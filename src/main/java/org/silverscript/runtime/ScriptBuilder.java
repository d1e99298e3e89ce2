package org.silverscript.runtime;

import org.silverscript.runtime.isa.Opcode;

import java.io.ByteArrayOutputStream;

/**
 * Assembles script bytes. Data pushes always use the shortest encoding: small integers and
 * the empty string become their dedicated opcodes, everything else the smallest push form.
 */
public final class ScriptBuilder {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    public ScriptBuilder addOp(Opcode opcode) {
        out.write(opcode.code());
        return this;
    }

    /**
     * Appends the minimal push of {@code data}.
     * @param data The bytes to push.
     * @return This builder.
     */
    public ScriptBuilder addData(byte[] data) {
        int n = data.length;
        if (n == 0) {
            return addOp(Opcode.OP_0);
        }
        if (n == 1 && data[0] >= 1 && data[0] <= 16) {
            return addOp(Opcode.smallInteger(data[0]).orElseThrow());
        }
        if (n == 1 && (data[0] & 0xff) == 0x81) {
            return addOp(Opcode.OP_1NEGATE);
        }
        if (n <= Opcode.MAX_DIRECT_PUSH) {
            out.write(n);
        } else if (n <= 0xff) {
            out.write(Opcode.OP_PUSHDATA1.code());
            out.write(n);
        } else if (n <= 0xffff) {
            out.write(Opcode.OP_PUSHDATA2.code());
            out.write(n & 0xff);
            out.write((n >>> 8) & 0xff);
        } else {
            out.write(Opcode.OP_PUSHDATA4.code());
            out.write(n & 0xff);
            out.write((n >>> 8) & 0xff);
            out.write((n >>> 16) & 0xff);
            out.write((n >>> 24) & 0xff);
        }
        out.write(data, 0, n);
        return this;
    }

    /**
     * Appends the minimal push of a script number.
     * @param value The number.
     * @return This builder.
     */
    public ScriptBuilder addNumber(long value) {
        return addData(ScriptNumber.encode(value));
    }

    /**
     * @return The number of bytes written so far, i.e. the offset of the next item.
     */
    public int size() {
        return out.size();
    }

    public byte[] build() {
        return out.toByteArray();
    }
}

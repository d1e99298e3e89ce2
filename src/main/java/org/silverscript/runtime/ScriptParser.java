package org.silverscript.runtime;

import org.silverscript.runtime.isa.Opcode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Splits raw script bytes into {@link ParsedOpcode}s. Parsing is purely structural;
 * unassigned opcode bytes are accepted here and rejected only when executed.
 */
public final class ScriptParser {

    private ScriptParser() {}

    /**
     * Parses a script.
     *
     * @param script The raw script bytes.
     * @return The instructions in script order.
     * @throws ScriptExecutionException if a push runs past the end of the script.
     */
    public static List<ParsedOpcode> parse(byte[] script) throws ScriptExecutionException {
        List<ParsedOpcode> out = new ArrayList<>();
        int pos = 0;
        while (pos < script.length) {
            int offset = pos;
            int code = script[pos++] & 0xff;
            int dataLength;
            if (Opcode.isDirectPush(code)) {
                dataLength = code;
            } else if (code == Opcode.OP_PUSHDATA1.code()) {
                requireBytes(script, pos, 1, offset);
                dataLength = script[pos] & 0xff;
                pos += 1;
            } else if (code == Opcode.OP_PUSHDATA2.code()) {
                requireBytes(script, pos, 2, offset);
                dataLength = (script[pos] & 0xff) | (script[pos + 1] & 0xff) << 8;
                pos += 2;
            } else if (code == Opcode.OP_PUSHDATA4.code()) {
                requireBytes(script, pos, 4, offset);
                long len = (script[pos] & 0xffL) | (script[pos + 1] & 0xffL) << 8
                        | (script[pos + 2] & 0xffL) << 16 | (script[pos + 3] & 0xffL) << 24;
                if (len > Integer.MAX_VALUE) {
                    throw new ScriptExecutionException("push length " + len + " at offset " + offset + " is too large");
                }
                dataLength = (int) len;
                pos += 4;
            } else {
                dataLength = 0;
            }
            requireBytes(script, pos, dataLength, offset);
            byte[] data = Arrays.copyOfRange(script, pos, pos + dataLength);
            pos += dataLength;
            out.add(new ParsedOpcode(out.size(), offset, code, data, pos - offset));
        }
        return out;
    }

    private static void requireBytes(byte[] script, int pos, int count, int offset) throws ScriptExecutionException {
        if (pos + count > script.length) {
            throw new ScriptExecutionException("malformed push at offset " + offset + ": script ends before "
                    + count + " more byte(s)");
        }
    }
}

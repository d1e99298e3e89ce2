package org.silverscript.runtime;

import org.silverscript.runtime.isa.Opcode;

import java.util.HexFormat;
import java.util.Optional;

/**
 * A single decoded instruction of a script.
 *
 * @param index The position of the instruction among the script's instructions.
 * @param offset The byte offset of the opcode within the script.
 * @param code The raw opcode byte.
 * @param data The pushed data for push instructions, empty otherwise.
 * @param length The encoded length in bytes, including length prefixes and data.
 */
public record ParsedOpcode(int index, int offset, int code, byte[] data, int length) {

    /**
     * @return The named opcode, or empty for direct pushes and unassigned bytes.
     */
    public Optional<Opcode> opcode() {
        return Opcode.fromCode(code);
    }

    /**
     * @return {@code true} if executing this instruction only pushes data.
     */
    public boolean isPush() {
        return Opcode.isDirectPush(code) || opcode().map(Opcode::isPush).orElse(false);
    }

    /**
     * @return A display name such as {@code OP_ADD} or {@code OP_DATA_5}.
     */
    public String name() {
        if (Opcode.isDirectPush(code)) {
            return "OP_DATA_" + code;
        }
        return opcode().map(Opcode::name).orElse(String.format("OP_UNKNOWN_0x%02x", code));
    }

    /**
     * @return The pushed data as lower-case hex, or {@code null} if the instruction pushes no bytes.
     */
    public String dataHex() {
        return data.length == 0 ? null : HexFormat.of().formatHex(data);
    }

    @Override
    public String toString() {
        String hex = dataHex();
        return hex == null ? name() : name() + " 0x" + hex;
    }
}

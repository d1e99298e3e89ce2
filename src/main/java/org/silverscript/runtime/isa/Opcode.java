package org.silverscript.runtime.isa;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The named opcodes of the script machine. Direct data pushes ({@code 0x01..0x4b}) carry
 * their length in the opcode byte and are not listed here; see {@link #isDirectPush(int)}.
 */
public enum Opcode {
    // region Push
    OP_0(0x00, Category.PUSH),
    OP_PUSHDATA1(0x4c, Category.PUSH),
    OP_PUSHDATA2(0x4d, Category.PUSH),
    OP_PUSHDATA4(0x4e, Category.PUSH),
    OP_1NEGATE(0x4f, Category.PUSH),
    OP_1(0x51, Category.PUSH),
    OP_2(0x52, Category.PUSH),
    OP_3(0x53, Category.PUSH),
    OP_4(0x54, Category.PUSH),
    OP_5(0x55, Category.PUSH),
    OP_6(0x56, Category.PUSH),
    OP_7(0x57, Category.PUSH),
    OP_8(0x58, Category.PUSH),
    OP_9(0x59, Category.PUSH),
    OP_10(0x5a, Category.PUSH),
    OP_11(0x5b, Category.PUSH),
    OP_12(0x5c, Category.PUSH),
    OP_13(0x5d, Category.PUSH),
    OP_14(0x5e, Category.PUSH),
    OP_15(0x5f, Category.PUSH),
    OP_16(0x60, Category.PUSH),
    // endregion

    // region Flow control
    OP_NOP(0x61, Category.FLOW),
    OP_IF(0x63, Category.FLOW),
    OP_NOTIF(0x64, Category.FLOW),
    OP_ELSE(0x67, Category.FLOW),
    OP_ENDIF(0x68, Category.FLOW),
    OP_VERIFY(0x69, Category.FLOW),
    OP_RETURN(0x6a, Category.FLOW),
    // endregion

    // region Stack
    OP_TOALTSTACK(0x6b, Category.STACK),
    OP_FROMALTSTACK(0x6c, Category.STACK),
    OP_2DROP(0x6d, Category.STACK),
    OP_2DUP(0x6e, Category.STACK),
    OP_IFDUP(0x73, Category.STACK),
    OP_DEPTH(0x74, Category.STACK),
    OP_DROP(0x75, Category.STACK),
    OP_DUP(0x76, Category.STACK),
    OP_NIP(0x77, Category.STACK),
    OP_OVER(0x78, Category.STACK),
    OP_PICK(0x79, Category.STACK),
    OP_ROLL(0x7a, Category.STACK),
    OP_ROT(0x7b, Category.STACK),
    OP_SWAP(0x7c, Category.STACK),
    OP_TUCK(0x7d, Category.STACK),
    // endregion

    // region Data
    OP_CAT(0x7e, Category.DATA),
    OP_SIZE(0x82, Category.DATA),
    OP_EQUAL(0x87, Category.DATA),
    OP_EQUALVERIFY(0x88, Category.DATA),
    // endregion

    // region Arithmetic
    OP_1ADD(0x8b, Category.ARITHMETIC),
    OP_1SUB(0x8c, Category.ARITHMETIC),
    OP_NEGATE(0x8f, Category.ARITHMETIC),
    OP_ABS(0x90, Category.ARITHMETIC),
    OP_NOT(0x91, Category.ARITHMETIC),
    OP_0NOTEQUAL(0x92, Category.ARITHMETIC),
    OP_ADD(0x93, Category.ARITHMETIC),
    OP_SUB(0x94, Category.ARITHMETIC),
    OP_MUL(0x95, Category.ARITHMETIC),
    OP_DIV(0x96, Category.ARITHMETIC),
    OP_MOD(0x97, Category.ARITHMETIC),
    OP_BOOLAND(0x9a, Category.ARITHMETIC),
    OP_BOOLOR(0x9b, Category.ARITHMETIC),
    OP_NUMEQUAL(0x9c, Category.ARITHMETIC),
    OP_NUMEQUALVERIFY(0x9d, Category.ARITHMETIC),
    OP_NUMNOTEQUAL(0x9e, Category.ARITHMETIC),
    OP_LESSTHAN(0x9f, Category.ARITHMETIC),
    OP_GREATERTHAN(0xa0, Category.ARITHMETIC),
    OP_LESSTHANOREQUAL(0xa1, Category.ARITHMETIC),
    OP_GREATERTHANOREQUAL(0xa2, Category.ARITHMETIC),
    OP_MIN(0xa3, Category.ARITHMETIC),
    OP_MAX(0xa4, Category.ARITHMETIC),
    OP_WITHIN(0xa5, Category.ARITHMETIC),
    // endregion

    // region Crypto
    OP_SHA256(0xa8, Category.CRYPTO),
    OP_BLAKE2B(0xaa, Category.CRYPTO),
    OP_CHECKSIG(0xac, Category.CRYPTO),
    OP_CHECKSIGVERIFY(0xad, Category.CRYPTO);
    // endregion

    /**
     * Groups opcodes by the instruction family that executes them.
     */
    public enum Category { PUSH, FLOW, STACK, DATA, ARITHMETIC, CRYPTO }

    /** Largest opcode value that pushes its own value as data length. */
    public static final int MAX_DIRECT_PUSH = 0x4b;

    private static final Map<Integer, Opcode> BY_CODE = new HashMap<>();

    static {
        for (Opcode op : values()) {
            BY_CODE.put(op.code, op);
        }
    }

    private final int code;
    private final Category category;

    Opcode(int code, Category category) {
        this.code = code;
        this.category = category;
    }

    /**
     * @return The byte value of this opcode.
     */
    public int code() {
        return code;
    }

    /**
     * @return The instruction family this opcode belongs to.
     */
    public Category category() {
        return category;
    }

    /**
     * @return {@code true} for opcodes that only push data onto the stack.
     */
    public boolean isPush() {
        return category == Category.PUSH;
    }

    /**
     * @return {@code true} for the conditional opcodes that are evaluated even inside non-executing branches.
     */
    public boolean isConditional() {
        return this == OP_IF || this == OP_NOTIF || this == OP_ELSE || this == OP_ENDIF;
    }

    /**
     * Looks up a named opcode by its byte value.
     * @param code The opcode byte (0..255).
     * @return The opcode, or empty for direct pushes and unassigned values.
     */
    public static Optional<Opcode> fromCode(int code) {
        return Optional.ofNullable(BY_CODE.get(code));
    }

    /**
     * @param code The opcode byte.
     * @return {@code true} if the byte is a direct push of {@code code} data bytes.
     */
    public static boolean isDirectPush(int code) {
        return code >= 0x01 && code <= MAX_DIRECT_PUSH;
    }

    /**
     * Returns the small-integer opcode for the given value, if one exists.
     * @param value A value in {@code -1..16}.
     * @return {@code OP_1NEGATE}, {@code OP_0} or {@code OP_1..OP_16}, or empty.
     */
    public static Optional<Opcode> smallInteger(long value) {
        if (value == -1) return Optional.of(OP_1NEGATE);
        if (value == 0) return Optional.of(OP_0);
        if (value >= 1 && value <= 16) return fromCode(OP_1.code + (int) value - 1);
        return Optional.empty();
    }

    /**
     * @return The integer value pushed by {@code OP_1NEGATE}, {@code OP_0} or {@code OP_1..OP_16}.
     * @throws IllegalStateException if this opcode is not a small-integer push.
     */
    public int smallIntegerValue() {
        if (this == OP_1NEGATE) return -1;
        if (this == OP_0) return 0;
        if (code >= OP_1.code && code <= OP_16.code) return code - OP_1.code + 1;
        throw new IllegalStateException(name() + " is not a small-integer push");
    }
}

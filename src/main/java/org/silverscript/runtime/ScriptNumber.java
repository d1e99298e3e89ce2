package org.silverscript.runtime;

import java.math.BigInteger;

/**
 * Encoding of integers on the script stack: little-endian sign-magnitude with the sign in the
 * most significant bit of the last byte. Zero is the empty byte string.
 */
public final class ScriptNumber {

    /** Maximum byte length of an arithmetic operand. */
    public static final int MAX_LENGTH = 8;

    private ScriptNumber() {}

    /**
     * Encodes a value minimally.
     * @param value The value.
     * @return The encoded bytes, empty for zero.
     */
    public static byte[] encode(long value) {
        if (value == 0) {
            return new byte[0];
        }
        boolean negative = value < 0;
        // Long.MIN_VALUE has no positive counterpart, go through BigInteger.
        BigInteger magnitude = BigInteger.valueOf(value).abs();
        byte[] be = magnitude.toByteArray();
        int start = be[0] == 0 ? 1 : 0;
        int len = be.length - start;
        byte[] le = new byte[len];
        for (int i = 0; i < len; i++) {
            le[i] = be[be.length - 1 - i];
        }
        if ((le[len - 1] & 0x80) != 0) {
            byte[] extended = new byte[len + 1];
            System.arraycopy(le, 0, extended, 0, len);
            extended[len] = (byte) (negative ? 0x80 : 0x00);
            return extended;
        }
        if (negative) {
            le[len - 1] |= (byte) 0x80;
        }
        return le;
    }

    /**
     * Decodes an arithmetic operand.
     *
     * @param bytes The stack element.
     * @param maxLength The maximum permitted length.
     * @return The decoded value.
     * @throws ScriptExecutionException if the element is too long, not minimally encoded or out of range.
     */
    public static long decode(byte[] bytes, int maxLength) throws ScriptExecutionException {
        if (bytes.length > maxLength) {
            throw new ScriptExecutionException("numeric value encoded as " + bytes.length
                    + " bytes exceeds the limit of " + maxLength);
        }
        if (!isMinimal(bytes)) {
            throw new ScriptExecutionException("numeric value is not minimally encoded");
        }
        BigInteger value = toBigInteger(bytes);
        if (value.bitLength() > 63) {
            throw new ScriptExecutionException("numeric value out of range");
        }
        return value.longValue();
    }

    /**
     * Decodes an element of any length without validation. Used for display.
     * @param bytes The stack element.
     * @return The decoded value.
     */
    public static BigInteger toBigInteger(byte[] bytes) {
        if (bytes.length == 0) {
            return BigInteger.ZERO;
        }
        byte[] be = new byte[bytes.length];
        for (int i = 0; i < bytes.length; i++) {
            be[i] = bytes[bytes.length - 1 - i];
        }
        boolean negative = (be[0] & 0x80) != 0;
        be[0] &= 0x7f;
        BigInteger magnitude = new BigInteger(1, be);
        return negative ? magnitude.negate() : magnitude;
    }

    /**
     * @param bytes A stack element.
     * @return {@code true} if the element has no superfluous trailing zero byte.
     */
    public static boolean isMinimal(byte[] bytes) {
        if (bytes.length == 0) {
            return true;
        }
        if ((bytes[bytes.length - 1] & 0x7f) != 0) {
            return true;
        }
        return bytes.length > 1 && (bytes[bytes.length - 2] & 0x80) != 0;
    }

    /**
     * Interprets a stack element as a boolean: false for all-zero bytes or negative zero.
     * @param bytes The stack element.
     * @return The truth value.
     */
    public static boolean castToBool(byte[] bytes) {
        for (int i = 0; i < bytes.length; i++) {
            if (bytes[i] != 0) {
                return !(i == bytes.length - 1 && bytes[i] == (byte) 0x80);
            }
        }
        return false;
    }

    /**
     * @param value A truth value.
     * @return {@code [0x01]} for true, the empty element for false.
     */
    public static byte[] fromBool(boolean value) {
        return value ? new byte[] {1} : new byte[0];
    }
}

package org.silverscript.compiler.api;

import org.silverscript.runtime.ScriptNumber;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * A value together with its declared type, held in its stack encoding: ints as minimal script
 * numbers, bools as {@code 0x01} or empty, strings as UTF-8, byte types verbatim and arrays as
 * the concatenation of their fixed-size elements.
 *
 * @param type The declared type.
 * @param bytes The encoded value.
 */
public record TypedValue(ValueType type, byte[] bytes) {

    public TypedValue {
        Objects.requireNonNull(type, "type");
        bytes = bytes.clone();
    }

    public static TypedValue ofInt(long value) {
        return new TypedValue(ValueType.INT, ScriptNumber.encode(value));
    }

    public static TypedValue ofBool(boolean value) {
        return new TypedValue(ValueType.BOOL, ScriptNumber.fromBool(value));
    }

    public static TypedValue ofString(String value) {
        return new TypedValue(ValueType.STRING, value.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public byte[] bytes() {
        return bytes.clone();
    }

    /**
     * @return The integer value of an {@code int}.
     * @throws IllegalStateException if this is not an int or does not fit in a long.
     */
    public long asLong() {
        if (type.kind() != ValueType.Kind.INT) {
            throw new IllegalStateException("not an int: " + type);
        }
        return ScriptNumber.toBigInteger(bytes).longValueExact();
    }

    /**
     * @return The truth value of a {@code bool}.
     */
    public boolean asBool() {
        if (type.kind() != ValueType.Kind.BOOL) {
            throw new IllegalStateException("not a bool: " + type);
        }
        return ScriptNumber.castToBool(bytes);
    }

    public String hex() {
        return HexFormat.of().formatHex(bytes);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TypedValue other && type.equals(other.type) && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return type + ":0x" + hex();
    }
}

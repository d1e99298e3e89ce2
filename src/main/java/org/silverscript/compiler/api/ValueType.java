package org.silverscript.compiler.api;

import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A SilverScript value type.
 *
 * @param kind The type constructor.
 * @param size The byte size of a {@code bytesN} type, 0 otherwise.
 * @param element The element type of an array, {@code null} otherwise.
 */
public record ValueType(Kind kind, int size, ValueType element) {

    /** Largest N accepted in {@code bytesN}. */
    public static final int MAX_BYTES_SIZE = 520;

    private static final Pattern BYTES_N = Pattern.compile("bytes([0-9]+)");

    public static final ValueType INT = new ValueType(Kind.INT, 0, null);
    public static final ValueType BOOL = new ValueType(Kind.BOOL, 0, null);
    public static final ValueType STRING = new ValueType(Kind.STRING, 0, null);
    public static final ValueType BYTES = new ValueType(Kind.BYTES, 0, null);
    public static final ValueType BYTE = new ValueType(Kind.BYTE, 0, null);
    public static final ValueType PUBKEY = new ValueType(Kind.PUBKEY, 0, null);
    public static final ValueType SIG = new ValueType(Kind.SIG, 0, null);
    public static final ValueType DATASIG = new ValueType(Kind.DATASIG, 0, null);

    /**
     * The type constructors of the language.
     */
    public enum Kind { INT, BOOL, STRING, BYTES, BYTE, BYTES_N, PUBKEY, SIG, DATASIG, ARRAY }

    /**
     * @param n The byte size, {@code 1..520}.
     * @return The {@code bytesN} type.
     */
    public static ValueType bytes(int n) {
        if (n < 1 || n > MAX_BYTES_SIZE) {
            throw new IllegalArgumentException("bytes size must be within 1.." + MAX_BYTES_SIZE + ", got " + n);
        }
        return new ValueType(Kind.BYTES_N, n, null);
    }

    /**
     * @param element A fixed-size element type.
     * @return The array type.
     */
    public static ValueType arrayOf(ValueType element) {
        if (element.elementSize().isEmpty()) {
            throw new IllegalArgumentException("array elements must have a fixed size, got " + element);
        }
        return new ValueType(Kind.ARRAY, 0, element);
    }

    /**
     * Parses a type name such as {@code int}, {@code bytes32} or {@code pubkey[]}.
     * @param name The type name as written in source.
     * @return The type, or empty if the name is not a valid type.
     */
    public static Optional<ValueType> parse(String name) {
        String trimmed = name.trim();
        if (trimmed.endsWith("[]")) {
            return parse(trimmed.substring(0, trimmed.length() - 2))
                    .filter(e -> e.elementSize().isPresent())
                    .map(ValueType::arrayOf);
        }
        switch (trimmed) {
            case "int": return Optional.of(INT);
            case "bool": return Optional.of(BOOL);
            case "string": return Optional.of(STRING);
            case "bytes": return Optional.of(BYTES);
            case "byte": return Optional.of(BYTE);
            case "pubkey": return Optional.of(PUBKEY);
            case "sig": return Optional.of(SIG);
            case "datasig": return Optional.of(DATASIG);
            default:
                Matcher m = BYTES_N.matcher(trimmed);
                if (!m.matches() || m.group(1).length() > 3) {
                    return Optional.empty();
                }
                int n = Integer.parseInt(m.group(1));
                return n >= 1 && n <= MAX_BYTES_SIZE ? Optional.of(bytes(n)) : Optional.empty();
        }
    }

    /**
     * @return The type name as written in source.
     */
    public String name() {
        return switch (kind) {
            case BYTES_N -> "bytes" + size;
            case ARRAY -> element.name() + "[]";
            default -> kind.name().toLowerCase();
        };
    }

    public boolean isArray() {
        return kind == Kind.ARRAY;
    }

    /**
     * @return {@code true} for the byte-string types, excluding {@code string}.
     */
    public boolean isByteLike() {
        return switch (kind) {
            case BYTES, BYTE, BYTES_N, PUBKEY, SIG, DATASIG -> true;
            default -> false;
        };
    }

    /**
     * @return The exact byte length of a fixed-size byte type.
     */
    public OptionalInt byteLength() {
        return switch (kind) {
            case BYTE -> OptionalInt.of(1);
            case BYTES_N -> OptionalInt.of(size);
            case PUBKEY -> OptionalInt.of(32);
            case SIG -> OptionalInt.of(65);
            case DATASIG -> OptionalInt.of(64);
            default -> OptionalInt.empty();
        };
    }

    /**
     * @return The encoded size of this type as an array element; empty if it cannot be one.
     */
    public OptionalInt elementSize() {
        return switch (kind) {
            case INT -> OptionalInt.of(8);
            case BOOL -> OptionalInt.of(1);
            case BYTE, BYTES_N, PUBKEY, SIG, DATASIG -> byteLength();
            default -> OptionalInt.empty();
        };
    }

    /**
     * Decides whether a value of {@code source} type may be stored where this type is expected.
     * Byte types convert into {@code bytes} and between fixed-size types of equal length.
     *
     * @param source The type of the value.
     * @return {@code true} if the value is accepted.
     */
    public boolean isAssignableFrom(ValueType source) {
        if (equals(source)) {
            return true;
        }
        if (!isByteLike() || !source.isByteLike()) {
            return false;
        }
        if (kind == Kind.BYTES) {
            return true;
        }
        OptionalInt target = byteLength();
        OptionalInt actual = source.byteLength();
        return (kind == Kind.BYTES_N || source.kind == Kind.BYTES_N)
                && target.isPresent() && actual.isPresent() && target.getAsInt() == actual.getAsInt();
    }

    /**
     * @param other Another operand type.
     * @return {@code true} if {@code ==} and {@code !=} may compare the two types.
     */
    public boolean isComparableWith(ValueType other) {
        return equals(other) || (isByteLike() && other.isByteLike());
    }

    @Override
    public String toString() {
        return name();
    }
}

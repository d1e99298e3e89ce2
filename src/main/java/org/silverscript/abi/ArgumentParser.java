package org.silverscript.abi;

import org.silverscript.compiler.api.TypedValue;
import org.silverscript.compiler.api.ValueType;
import org.silverscript.runtime.ScriptNumber;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.OptionalInt;

/**
 * Parses raw textual arguments, as typed on a command line or sent in a trace request, into
 * machine-encoded values of a declared type.
 * <ul>
 *   <li>{@code int}: decimal or {@code 0x} hexadecimal, optionally negative</li>
 *   <li>{@code bool}: {@code true} or {@code false}</li>
 *   <li>{@code string}: the text, with one pair of surrounding quotes removed</li>
 *   <li>byte types: hex with or without {@code 0x}; fixed-size types must match their length,
 *       except {@code sig} and {@code datasig}, whose content is left to signature checking</li>
 *   <li>arrays: {@code [a, b, ...]} of fixed-size elements; ints become 8-byte little-endian
 *       two's complement, bools a single byte</li>
 * </ul>
 */
public final class ArgumentParser {

    private static final HexFormat HEX = HexFormat.of();

    private ArgumentParser() {}

    /**
     * @param type The declared type.
     * @param raw The raw text.
     * @return The encoded value, typed as {@code type}.
     * @throws ArgumentException if the text does not denote a value of that type.
     */
    public static TypedValue parse(ValueType type, String raw) throws ArgumentException {
        String text = raw == null ? "" : raw.trim();
        return switch (type.kind()) {
            case INT -> TypedValue.ofInt(parseInt(text));
            case BOOL -> TypedValue.ofBool(parseBool(text));
            case STRING -> TypedValue.ofString(unquote(text));
            case ARRAY -> new TypedValue(type, parseArray(type.element(), text));
            default -> new TypedValue(type, parseBytes(type, text));
        };
    }

    static long parseInt(String text) throws ArgumentException {
        boolean negative = text.startsWith("-");
        String digits = negative ? text.substring(1) : text;
        BigInteger value;
        try {
            if (digits.startsWith("0x") || digits.startsWith("0X")) {
                value = new BigInteger(digits.substring(2), 16);
            } else {
                value = new BigInteger(digits);
            }
        } catch (NumberFormatException e) {
            throw new ArgumentException("malformed integer '" + text + "'", e);
        }
        if (negative) {
            value = value.negate();
        }
        if (value.bitLength() > 63 || value.longValue() == Long.MIN_VALUE) {
            throw new ArgumentException("integer " + text + " does not fit in " + ScriptNumber.MAX_LENGTH + " bytes");
        }
        return value.longValue();
    }

    private static boolean parseBool(String text) throws ArgumentException {
        if (text.equalsIgnoreCase("true")) return true;
        if (text.equalsIgnoreCase("false")) return false;
        throw new ArgumentException("expected true or false, got '" + text + "'");
    }

    private static String unquote(String text) {
        if (text.length() >= 2) {
            char first = text.charAt(0);
            char last = text.charAt(text.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return text.substring(1, text.length() - 1);
            }
        }
        return text;
    }

    /**
     * Decodes hex text, with or without a {@code 0x} prefix.
     * @param text The hex text.
     * @return The bytes.
     * @throws ArgumentException for odd length or non-hex characters.
     */
    public static byte[] decodeHex(String text) throws ArgumentException {
        String hex = text.startsWith("0x") || text.startsWith("0X") ? text.substring(2) : text;
        try {
            return HEX.parseHex(hex);
        } catch (IllegalArgumentException e) {
            throw new ArgumentException("malformed hex '" + text + "'", e);
        }
    }

    private static byte[] parseBytes(ValueType type, String text) throws ArgumentException {
        byte[] bytes = decodeHex(text);
        OptionalInt expected = type.byteLength();
        boolean signature = type.kind() == ValueType.Kind.SIG || type.kind() == ValueType.Kind.DATASIG;
        if (!signature && expected.isPresent() && bytes.length != expected.getAsInt()) {
            throw new ArgumentException(type + " expects " + expected.getAsInt() + " bytes, got " + bytes.length);
        }
        return bytes;
    }

    private static byte[] parseArray(ValueType element, String text) throws ArgumentException {
        if (!text.startsWith("[") || !text.endsWith("]")) {
            throw new ArgumentException("expected an array literal like [a, b], got '" + text + "'");
        }
        String body = text.substring(1, text.length() - 1).trim();
        List<String> items = new ArrayList<>();
        if (!body.isEmpty()) {
            for (String item : body.split(",")) {
                items.add(item.trim());
            }
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (String item : items) {
            byte[] encoded = switch (element.kind()) {
                case INT -> ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN).putLong(parseInt(item)).array();
                case BOOL -> new byte[]{(byte) (parseBool(item) ? 1 : 0)};
                default -> {
                    byte[] bytes = decodeHex(item);
                    int size = element.elementSize().orElseThrow();
                    if (bytes.length != size) {
                        throw new ArgumentException(element + " element expects " + size + " bytes, got " + bytes.length);
                    }
                    yield bytes;
                }
            };
            out.writeBytes(encoded);
        }
        return out.toByteArray();
    }
}

package org.silverscript.debug.session;

import org.silverscript.compiler.api.ValueType;
import org.silverscript.runtime.ScriptNumber;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;

/**
 * Renders machine-encoded values for display. Formatting never fails: bytes that do not decode
 * under the declared type render as a placeholder that still shows the raw hex.
 */
public final class ValueFormatter {

    private static final HexFormat HEX = HexFormat.of();

    private ValueFormatter() {}

    /**
     * @param typeName A type name as written in source.
     * @param bytes The encoded value.
     * @return The display text.
     */
    public static String format(String typeName, byte[] bytes) {
        return ValueType.parse(typeName == null ? "" : typeName)
                .map(type -> format(type, bytes))
                .orElseGet(() -> placeholder(typeName, bytes));
    }

    /**
     * @param type The declared type.
     * @param bytes The encoded value.
     * @return The display text: ints in decimal, bools as {@code true}/{@code false}, strings quoted,
     *         byte strings as {@code 0x} hex, arrays as {@code [a, b]}.
     */
    public static String format(ValueType type, byte[] bytes) {
        if (type == null || bytes == null) {
            return placeholder(type == null ? null : type.name(), bytes);
        }
        try {
            return switch (type.kind()) {
                case INT -> ScriptNumber.toBigInteger(bytes).toString();
                case BOOL -> Boolean.toString(ScriptNumber.castToBool(bytes));
                case STRING -> "\"" + decodeUtf8(bytes) + "\"";
                case ARRAY -> array(type, bytes);
                default -> fixedBytes(type, bytes);
            };
        } catch (CharacterCodingException | RuntimeException e) {
            return placeholder(type.name(), bytes);
        }
    }

    private static String fixedBytes(ValueType type, byte[] bytes) {
        if (type.kind() != ValueType.Kind.SIG && type.byteLength().isPresent()
                && type.byteLength().getAsInt() != bytes.length) {
            return placeholder(type.name(), bytes);
        }
        return "0x" + HEX.formatHex(bytes);
    }

    private static String array(ValueType type, byte[] bytes) {
        ValueType element = type.element();
        int size = element.elementSize().orElseThrow();
        if (bytes.length % size != 0) {
            return placeholder(type.name(), bytes);
        }
        List<String> items = new ArrayList<>();
        for (int i = 0; i < bytes.length; i += size) {
            byte[] item = Arrays.copyOfRange(bytes, i, i + size);
            items.add(switch (element.kind()) {
                case INT -> Long.toString(ByteBuffer.wrap(item).order(ByteOrder.LITTLE_ENDIAN).getLong());
                case BOOL -> Boolean.toString(item[0] != 0);
                default -> "0x" + HEX.formatHex(item);
            });
        }
        return "[" + String.join(", ", items) + "]";
    }

    private static String decodeUtf8(byte[] bytes) throws CharacterCodingException {
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
    }

    private static String placeholder(String typeName, byte[] bytes) {
        String hex = bytes == null ? "null" : "0x" + HEX.formatHex(bytes);
        return "<invalid " + (typeName == null || typeName.isBlank() ? "value" : typeName) + ": " + hex + ">";
    }
}

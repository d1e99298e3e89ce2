package org.silverscript.abi;

import org.silverscript.compiler.api.ValueType;

import java.util.ArrayList;
import java.util.List;

/**
 * Supplies canonical zero values for arguments the caller left out or left blank.
 */
public final class ArgumentDefaults {

    private ArgumentDefaults() {}

    /**
     * @param type A declared type.
     * @return The raw text of its zero value: {@code 0}, {@code false}, the empty string, {@code 0x},
     *         an all-zero byte string of the fixed size, or {@code []} for arrays.
     */
    public static String defaultRaw(ValueType type) {
        return switch (type.kind()) {
            case ARRAY -> "[]";
            case INT -> "0";
            case BOOL -> "false";
            case STRING -> "";
            case BYTES -> "0x";
            case SIG, DATASIG -> zeros(64);
            default -> zeros(type.byteLength().orElse(0));
        };
    }

    /**
     * Fills missing or blank raw arguments with their defaults.
     *
     * @param types The declared parameter types, in order.
     * @param raw The supplied raw arguments; may be shorter than {@code types}.
     * @return One trimmed raw argument per parameter.
     * @throws ArgumentException if more arguments than parameters were supplied.
     */
    public static List<String> fill(List<ValueType> types, List<String> raw) throws ArgumentException {
        if (raw.size() > types.size()) {
            throw new ArgumentException("expects " + types.size() + " arguments, got " + raw.size());
        }
        List<String> out = new ArrayList<>(types.size());
        for (int i = 0; i < types.size(); i++) {
            String current = i < raw.size() && raw.get(i) != null ? raw.get(i).trim() : "";
            out.add(current.isEmpty() ? defaultRaw(types.get(i)) : current);
        }
        return out;
    }

    private static String zeros(int size) {
        return "0x" + "00".repeat(size);
    }
}

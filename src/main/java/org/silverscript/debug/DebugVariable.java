package org.silverscript.debug;

import org.silverscript.compiler.api.ValueType;

import java.util.HexFormat;

/**
 * A variable binding resolved against the current machine state.
 *
 * @param name The variable name.
 * @param origin The kind of declaration.
 * @param type The declared type.
 * @param rawValue The encoded value.
 */
public record DebugVariable(String name, VariableOrigin origin, ValueType type, byte[] rawValue) {

    public DebugVariable {
        rawValue = rawValue.clone();
    }

    @Override
    public byte[] rawValue() {
        return rawValue.clone();
    }

    public String rawHex() {
        return HexFormat.of().formatHex(rawValue);
    }
}

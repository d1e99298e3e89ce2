package org.silverscript.debug;

import org.silverscript.compiler.api.ValueType;

import java.util.Arrays;
import java.util.Objects;

/**
 * Describes where the value of one visible variable can be found. Constructor parameters are
 * compiled into the bytecode and carry their value; every other variable lives in a main-stack
 * slot addressed from the bottom of the stack.
 *
 * @param name The variable name.
 * @param origin The kind of declaration.
 * @param type The declared type.
 * @param stackIndex The slot index from the stack bottom, or -1 for constants.
 * @param constantValue The encoded value of a constant, {@code null} for stack slots.
 */
public record VariableSlot(String name, VariableOrigin origin, ValueType type, int stackIndex, byte[] constantValue) {

    public VariableSlot {
        Objects.requireNonNull(name, "name");
        if ((stackIndex < 0) == (constantValue == null)) {
            throw new IllegalArgumentException("a slot is either a stack index or a constant: " + name);
        }
        constantValue = constantValue == null ? null : constantValue.clone();
    }

    public static VariableSlot onStack(String name, VariableOrigin origin, ValueType type, int stackIndex) {
        return new VariableSlot(name, origin, type, stackIndex, null);
    }

    public static VariableSlot constant(String name, ValueType type, byte[] value) {
        return new VariableSlot(name, VariableOrigin.CONSTRUCTOR_PARAMETER, type, -1, value);
    }

    public boolean isConstant() {
        return constantValue != null;
    }

    @Override
    public byte[] constantValue() {
        return constantValue == null ? null : constantValue.clone();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof VariableSlot other
                && name.equals(other.name)
                && origin == other.origin
                && type.equals(other.type)
                && stackIndex == other.stackIndex
                && Arrays.equals(constantValue, other.constantValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, origin, type, stackIndex) * 31 + Arrays.hashCode(constantValue);
    }

    @Override
    public String toString() {
        return origin.label() + " " + type + " " + name + (isConstant() ? " (const)" : " @" + stackIndex);
    }
}

package org.silverscript.compiler.frontend.semantics;

import org.silverscript.compiler.api.ValueType;
import org.silverscript.runtime.isa.Opcode;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * The built-in functions. Each one compiles to a single opcode applied to its arguments
 * pushed in order.
 */
public enum Builtin {
    CHECK_SIG("checkSig", ValueType.BOOL, Opcode.OP_CHECKSIG, ValueType.SIG, ValueType.PUBKEY),
    SHA256("sha256", ValueType.bytes(32), Opcode.OP_SHA256, ValueType.BYTES),
    BLAKE2B("blake2b", ValueType.bytes(32), Opcode.OP_BLAKE2B, ValueType.BYTES),
    ABS("abs", ValueType.INT, Opcode.OP_ABS, ValueType.INT),
    MIN("min", ValueType.INT, Opcode.OP_MIN, ValueType.INT, ValueType.INT),
    MAX("max", ValueType.INT, Opcode.OP_MAX, ValueType.INT, ValueType.INT),
    WITHIN("within", ValueType.BOOL, Opcode.OP_WITHIN, ValueType.INT, ValueType.INT, ValueType.INT);

    private final String functionName;
    private final ValueType result;
    private final Opcode opcode;
    private final List<ValueType> parameters;

    Builtin(String functionName, ValueType result, Opcode opcode, ValueType... parameters) {
        this.functionName = functionName;
        this.result = result;
        this.opcode = opcode;
        this.parameters = Arrays.asList(parameters);
    }

    public String functionName() {
        return functionName;
    }

    public ValueType result() {
        return result;
    }

    public Opcode opcode() {
        return opcode;
    }

    public List<ValueType> parameters() {
        return parameters;
    }

    /**
     * @param index The argument position.
     * @param type The argument type.
     * @return {@code true} if the argument is accepted; the hash functions also take strings.
     */
    public boolean accepts(int index, ValueType type) {
        ValueType expected = parameters.get(index);
        if (expected.equals(ValueType.BYTES) && type.equals(ValueType.STRING)) {
            return true;
        }
        return expected.isAssignableFrom(type);
    }

    /**
     * @param name A function name as written in source.
     * @return The builtin of that name, if any.
     */
    public static Optional<Builtin> lookup(String name) {
        for (Builtin b : values()) {
            if (b.functionName.equals(name)) return Optional.of(b);
        }
        return Optional.empty();
    }
}

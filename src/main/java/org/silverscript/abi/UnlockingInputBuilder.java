package org.silverscript.abi;

import org.silverscript.compiler.api.CompiledProgram;
import org.silverscript.compiler.api.FunctionSignature;
import org.silverscript.compiler.api.ParamInfo;
import org.silverscript.compiler.api.TypedValue;
import org.silverscript.runtime.ScriptBuilder;

import java.util.List;

/**
 * Builds the push-only unlocking script that calls one entrypoint of a compiled program.
 * <p>
 * Arguments are pushed in declaration order, so the first parameter ends up deepest on the
 * stack. When the program dispatches on a selector, the function's selector index is pushed
 * last, on top of the arguments.
 */
public final class UnlockingInputBuilder {

    private UnlockingInputBuilder() {}

    /**
     * @param program The compiled program.
     * @param functionName The entrypoint to call.
     * @param args The argument values, one per parameter.
     * @return The unlocking script.
     * @throws ArgumentException for an unknown function, a wrong argument count or a value of the wrong type.
     */
    public static byte[] build(CompiledProgram program, String functionName, List<TypedValue> args)
            throws ArgumentException {
        FunctionSignature function = program.function(functionName)
                .orElseThrow(() -> new ArgumentException("function '" + functionName + "' not found"));
        List<ParamInfo> params = function.parameters();
        if (args.size() != params.size()) {
            throw new ArgumentException("function '" + functionName + "' expects " + params.size()
                    + " arguments, got " + args.size());
        }
        ScriptBuilder script = new ScriptBuilder();
        for (int i = 0; i < params.size(); i++) {
            ParamInfo param = params.get(i);
            TypedValue value = args.get(i);
            if (!param.type().isAssignableFrom(value.type())) {
                throw new ArgumentException("argument #" + i + " (" + param.type() + " " + param.name()
                        + ") cannot take a value of type " + value.type());
            }
            script.addData(value.bytes());
        }
        if (!program.withoutSelector()) {
            script.addNumber(function.selectorIndex());
        }
        return script.build();
    }
}

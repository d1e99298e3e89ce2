package org.silverscript;

import org.silverscript.abi.ArgumentException;
import org.silverscript.abi.UnlockingInputBuilder;
import org.silverscript.compiler.Compiler;
import org.silverscript.compiler.api.CompilationException;
import org.silverscript.compiler.api.CompiledProgram;
import org.silverscript.compiler.api.TypedValue;
import org.silverscript.config.DebuggerOptions;
import org.silverscript.runtime.ScriptEngine;
import org.silverscript.runtime.ScriptExecutionException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * Shared helpers for tests that compile contracts and run them to completion.
 */
public final class ContractHarness {

    private ContractHarness() {}

    /**
     * @return The example contract bundled with the command line interface.
     */
    public static String exampleContract() throws IOException {
        try (InputStream in = ContractHarness.class.getResourceAsStream("/contracts/default-contract.sil")) {
            if (in == null) {
                throw new IOException("example contract missing from the classpath");
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    public static CompiledProgram compile(String source, TypedValue... ctorArgs) throws CompilationException {
        return new Compiler().compile(source, Arrays.asList(ctorArgs));
    }

    public static byte[] input(CompiledProgram program, String function, TypedValue... args) throws ArgumentException {
        return UnlockingInputBuilder.build(program, function, List.of(args));
    }

    public static ScriptEngine engine(CompiledProgram program, byte[] input) throws ScriptExecutionException {
        return new ScriptEngine(DebuggerOptions.defaults().transaction(program.bytecode()), input, program.bytecode());
    }

    /**
     * Executes both scripts to the end.
     *
     * @throws ScriptExecutionException if any instruction or the final check fails.
     */
    public static void run(CompiledProgram program, String function, TypedValue... args) throws Exception {
        ScriptEngine engine = engine(program, input(program, function, args));
        while (!engine.isDone()) {
            engine.step();
        }
    }
}

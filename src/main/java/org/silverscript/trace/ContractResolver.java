package org.silverscript.trace;

import org.silverscript.abi.ArgumentDefaults;
import org.silverscript.abi.ArgumentException;
import org.silverscript.abi.ArgumentParser;
import org.silverscript.abi.AutoSigner;
import org.silverscript.abi.UnlockingInputBuilder;
import org.silverscript.compiler.api.CompilationException;
import org.silverscript.compiler.api.CompiledProgram;
import org.silverscript.compiler.api.ContractOutline;
import org.silverscript.compiler.api.FunctionSignature;
import org.silverscript.compiler.api.ICompiler;
import org.silverscript.compiler.api.ParamInfo;
import org.silverscript.compiler.api.TypedValue;
import org.silverscript.compiler.frontend.parser.ast.ContractNode;
import org.silverscript.config.DebuggerOptions;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a request into a compiled program and a ready unlocking input: parse, fill and parse
 * constructor arguments, compile, select the entrypoint, fill function arguments, sign, build.
 */
public final class ContractResolver {

    private final ICompiler compiler;
    private final DebuggerOptions options;

    public ContractResolver(ICompiler compiler, DebuggerOptions options) {
        this.compiler = compiler;
        this.options = options;
    }

    /**
     * @param source The contract source.
     * @return The outline of the contract.
     * @throws TraceException if the source does not parse or has no entrypoint.
     */
    public ContractOutline outline(String source) throws TraceException {
        try {
            return ContractOutline.of(compiler.parse(source));
        } catch (CompilationException e) {
            throw TraceException.from(e);
        }
    }

    /**
     * @param request The request.
     * @return The compiled contract and prepared call.
     * @throws TraceException for parse, compile and argument errors.
     */
    public ResolvedContract resolve(TraceRequest request) throws TraceException {
        try {
            ContractNode contract = compiler.parse(request.source());
            ContractOutline outline = ContractOutline.of(contract);
            if (request.expectNoSelector() && !outline.withoutSelector()) {
                throw new TraceException(TraceException.Kind.ARGUMENT,
                        "--no-selector requires exactly one entrypoint function");
            }

            List<ParamInfo> ctorParams = outline.constructorParams();
            List<String> rawCtorArgs = fill(ctorParams, request.ctorArgs(), "constructor");
            List<TypedValue> ctorValues = parseAll(ctorParams, rawCtorArgs, "constructor");
            CompiledProgram program = compiler.compile(contract, ctorValues);

            String name = request.function() == null || request.function().isBlank()
                    ? program.abi().get(0).name()
                    : request.function().trim();
            FunctionSignature function = program.function(name).orElseThrow(() ->
                    new TraceException(TraceException.Kind.ARGUMENT, "function '" + name + "' not found"));

            List<String> rawArgs = fill(function.parameters(), request.args(), "function");
            List<String> signedArgs = AutoSigner.sign(function.parameters(), rawArgs,
                    options.transaction(program.bytecode()));
            List<TypedValue> values = parseAll(function.parameters(), signedArgs, "function");
            byte[] input = UnlockingInputBuilder.build(program, function.name(), values);
            return new ResolvedContract(program, function, rawCtorArgs, signedArgs, input);
        } catch (CompilationException e) {
            throw TraceException.from(e);
        } catch (ArgumentException e) {
            throw new TraceException(TraceException.Kind.ARGUMENT, e.getMessage(), null, e);
        }
    }

    private static List<String> fill(List<ParamInfo> params, List<String> raw, String context) throws TraceException {
        try {
            return ArgumentDefaults.fill(params.stream().map(ParamInfo::type).toList(), raw);
        } catch (ArgumentException e) {
            throw new TraceException(TraceException.Kind.ARGUMENT, context + " " + e.getMessage(), null, e);
        }
    }

    private static List<TypedValue> parseAll(List<ParamInfo> params, List<String> raw, String context)
            throws TraceException {
        List<TypedValue> out = new ArrayList<>(params.size());
        for (int i = 0; i < params.size(); i++) {
            ParamInfo p = params.get(i);
            try {
                out.add(ArgumentParser.parse(p.type(), raw.get(i)));
            } catch (ArgumentException e) {
                throw new TraceException(TraceException.Kind.ARGUMENT, "invalid " + context + " arg #" + i
                        + " (" + p.type() + " " + p.name() + "): " + e.getMessage(), null, e);
            }
        }
        return out;
    }
}

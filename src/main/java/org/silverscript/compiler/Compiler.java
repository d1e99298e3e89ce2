package org.silverscript.compiler;

import org.silverscript.compiler.api.CompilationException;
import org.silverscript.compiler.api.CompiledProgram;
import org.silverscript.compiler.api.ContractOutline;
import org.silverscript.compiler.api.ICompiler;
import org.silverscript.compiler.api.ParamInfo;
import org.silverscript.compiler.api.TypedValue;
import org.silverscript.compiler.backend.emit.Emission;
import org.silverscript.compiler.backend.emit.Emitter;
import org.silverscript.compiler.diagnostics.CompilerLogger;
import org.silverscript.compiler.diagnostics.DiagnosticsEngine;
import org.silverscript.compiler.frontend.irgen.IrConverterRegistry;
import org.silverscript.compiler.frontend.irgen.IrGenerator;
import org.silverscript.compiler.frontend.lexer.Lexer;
import org.silverscript.compiler.frontend.lexer.Token;
import org.silverscript.compiler.frontend.parser.Parser;
import org.silverscript.compiler.frontend.parser.ast.ContractNode;
import org.silverscript.compiler.frontend.semantics.SemanticAnalyzer;
import org.silverscript.compiler.ir.IrProgram;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The main compiler implementation. This class orchestrates the pipeline from source text to a
 * {@link CompiledProgram}: lexing and parsing, semantic analysis, IR generation with helper
 * inlining and constant folding, and emission of bytecode with its debug table.
 * <p>
 * Every call uses fresh diagnostics, so one instance may compile several contracts.
 */
public class Compiler implements ICompiler {

    @Override
    public ContractNode parse(String source) throws CompilationException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        long start = System.nanoTime();

        // Phase 1: Lexical Analysis
        Lexer lexer = new Lexer(source, diagnostics);
        List<Token> tokens = lexer.scanTokens();
        diagnostics.throwIfErrors(CompilationException.Kind.PARSE);

        // Phase 2: Parsing (builds AST)
        Parser parser = new Parser(tokens, diagnostics);
        ContractNode contract = parser.parse();
        diagnostics.throwIfErrors(CompilationException.Kind.PARSE);
        CompilerLogger.phase("parse", contract.name(), start);
        return contract;
    }

    @Override
    public CompiledProgram compile(ContractNode contract, List<TypedValue> constructorArgs) throws CompilationException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Phase 3: Semantic Analysis (name resolution, typing, recursion)
        long start = System.nanoTime();
        SemanticAnalyzer analyzer = new SemanticAnalyzer(diagnostics);
        analyzer.analyze(contract, constructorArgs);
        diagnostics.throwIfErrors(CompilationException.Kind.COMPILE);
        ContractOutline outline = ContractOutline.of(contract);
        CompilerLogger.phase("analysis", contract.name(), start);

        // Constructor arguments take the declared parameter type, e.g. a bytes value for a bytes32 parameter.
        Map<String, TypedValue> constants = new LinkedHashMap<>();
        List<ParamInfo> params = outline.constructorParams();
        for (int i = 0; i < params.size(); i++) {
            constants.put(params.get(i).name(), new TypedValue(params.get(i).type(), constructorArgs.get(i).bytes()));
        }

        // Phase 4: IR Generation (dispatch, inlining, folding)
        start = System.nanoTime();
        IrGenerator irGenerator = new IrGenerator(IrConverterRegistry.initializeWithDefaults());
        IrProgram ir = irGenerator.generate(contract, analyzer, constants);
        CompilerLogger.phase("irgen", contract.name(), start);

        // Phase 5: Emission (bytecode and debug table)
        start = System.nanoTime();
        Emission emission = new Emitter().emit(ir);
        CompilerLogger.phase("emit", contract.name(), start);
        CompilerLogger.debug("Compiled '{}': {} bytes, {} mapped instructions, {} frames", contract.name(),
                emission.bytecode().length, emission.debugTable().mappings().size(), ir.frames().size());

        return new CompiledProgram(contract.name(), emission.bytecode(), outline.functions(),
                outline.withoutSelector(), emission.debugTable(), params);
    }
}

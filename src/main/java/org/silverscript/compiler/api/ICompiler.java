package org.silverscript.compiler.api;

import org.silverscript.compiler.frontend.parser.ast.ContractNode;

import java.util.List;

/**
 * Defines the public interface of the SilverScript compiler.
 */
public interface ICompiler {

    /**
     * Parses source text into a syntax tree without compiling it.
     *
     * @param source The contract source.
     * @return The contract syntax tree.
     * @throws CompilationException with kind {@code PARSE} if the source is malformed.
     */
    ContractNode parse(String source) throws CompilationException;

    /**
     * Compiles a parsed contract.
     *
     * @param contract The syntax tree.
     * @param constructorArgs Concrete values for the constructor parameters, in order.
     * @return The compiled program.
     * @throws CompilationException if the contract violates the language rules.
     */
    CompiledProgram compile(ContractNode contract, List<TypedValue> constructorArgs) throws CompilationException;

    /**
     * Parses and compiles source text.
     *
     * @param source The contract source.
     * @param constructorArgs Concrete values for the constructor parameters, in order.
     * @return The compiled program.
     * @throws CompilationException if the source cannot be parsed or compiled.
     */
    default CompiledProgram compile(String source, List<TypedValue> constructorArgs) throws CompilationException {
        return compile(parse(source), constructorArgs);
    }
}

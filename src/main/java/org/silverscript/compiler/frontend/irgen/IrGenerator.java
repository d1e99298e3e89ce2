package org.silverscript.compiler.frontend.irgen;

import org.silverscript.compiler.api.ParamInfo;
import org.silverscript.compiler.api.TypedValue;
import org.silverscript.compiler.frontend.parser.ast.ContractNode;
import org.silverscript.compiler.frontend.parser.ast.FunctionNode;
import org.silverscript.compiler.frontend.semantics.SemanticAnalyzer;
import org.silverscript.compiler.ir.IrProgram;
import org.silverscript.runtime.isa.Opcode;

import java.util.List;
import java.util.Map;

/**
 * Phase: Generates IR from a validated AST by delegating statements to converters
 * resolved via the {@link IrConverterRegistry}.
 * <p>
 * Each entrypoint body is preceded by its dispatch test and followed by an epilogue that
 * clears the parameters and leaves a single {@code 1}. With one entrypoint there is no
 * dispatch; with several, the selector pushed last by the unlocking script picks the branch
 * and an unknown selector reaches {@code OP_RETURN}. Dispatch and epilogue carry no source mapping.
 * Every entrypoint body is frame 0 of its own branch.
 */
public final class IrGenerator {

    private final IrConverterRegistry registry;

    /**
     * @param registry The converter registry.
     */
    public IrGenerator(IrConverterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Generates the linear IR program of a contract.
     *
     * @param contract The semantically validated contract.
     * @param semantics The completed analysis of {@code contract}.
     * @param constants The constructor arguments by parameter name, in declaration order.
     * @return The generated IR program.
     */
    public IrProgram generate(ContractNode contract, SemanticAnalyzer semantics, Map<String, TypedValue> constants) {
        List<FunctionNode> entrypoints = contract.entrypoints();
        IrGenContext ctx = new IrGenContext(contract.name(), semantics, registry, constants);
        if (entrypoints.size() == 1) {
            FunctionNode only = entrypoints.get(0);
            ctx.resetStack(only.params().size());
            body(ctx, only);
            return ctx.build();
        }
        for (int i = 0; i < entrypoints.size(); i++) {
            FunctionNode f = entrypoints.get(i);
            ctx.unmapped();
            ctx.resetStack(f.params().size() + 1);
            ctx.emit(Opcode.OP_DUP);
            ctx.emitNumber(i);
            ctx.emit(Opcode.OP_NUMEQUAL);
            ctx.emit(Opcode.OP_IF);
            ctx.emit(Opcode.OP_DROP);
            body(ctx, f);
            ctx.emit(Opcode.OP_ELSE);
        }
        ctx.emit(Opcode.OP_RETURN);
        for (int i = 0; i < entrypoints.size(); i++) {
            ctx.emit(Opcode.OP_ENDIF);
        }
        return ctx.build();
    }

    private static void body(IrGenContext ctx, FunctionNode function) {
        List<ParamInfo> params = function.params().stream()
                .map(p -> new ParamInfo(p.name(), ctx.semantics().typeOf(p.type())))
                .toList();
        ctx.beginEntrypoint(function.name());
        ctx.declareParameters(params);
        ctx.convert(function.body());
        ctx.endFrame();
        ctx.unmapped();
        ctx.emitDrops(params.size());
        ctx.emitNumber(1);
    }
}

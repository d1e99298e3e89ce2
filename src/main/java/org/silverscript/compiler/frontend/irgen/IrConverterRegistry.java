package org.silverscript.compiler.frontend.irgen;

import org.silverscript.compiler.frontend.irgen.converters.AssignmentNodeConverter;
import org.silverscript.compiler.frontend.irgen.converters.BlockNodeConverter;
import org.silverscript.compiler.frontend.irgen.converters.CallStatementNodeConverter;
import org.silverscript.compiler.frontend.irgen.converters.IfNodeConverter;
import org.silverscript.compiler.frontend.irgen.converters.RequireNodeConverter;
import org.silverscript.compiler.frontend.irgen.converters.VariableDeclarationNodeConverter;
import org.silverscript.compiler.frontend.parser.ast.AssignmentNode;
import org.silverscript.compiler.frontend.parser.ast.AstNode;
import org.silverscript.compiler.frontend.parser.ast.BlockNode;
import org.silverscript.compiler.frontend.parser.ast.CallStatementNode;
import org.silverscript.compiler.frontend.parser.ast.IfNode;
import org.silverscript.compiler.frontend.parser.ast.RequireNode;
import org.silverscript.compiler.frontend.parser.ast.VariableDeclarationNode;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping statement node classes to converter instances.
 * <p>
 * Provides explicit registration and a default converter fallback. The {@link #resolve(AstNode)} method
 * walks the class hierarchy to find the nearest registered converter.
 */
public final class IrConverterRegistry {

    private final Map<Class<? extends AstNode>, IAstNodeToIrConverter<? extends AstNode>> byClass = new HashMap<>();
    private final IAstNodeToIrConverter<AstNode> defaultConverter;

    private IrConverterRegistry(IAstNodeToIrConverter<AstNode> defaultConverter) {
        this.defaultConverter = defaultConverter;
    }

    /**
     * Registers a converter for the given AST node class.
     *
     * @param nodeType  The concrete AST node class.
     * @param converter The converter instance handling that class.
     * @param <T>       Concrete AST type parameter.
     */
    public <T extends AstNode> void register(Class<T> nodeType, IAstNodeToIrConverter<T> converter) {
        byClass.put(nodeType, converter);
    }

    /**
     * Retrieves the converter strictly registered for the given class (no hierarchy search).
     *
     * @param nodeType The AST node class to look up.
     * @return Optional converter if present.
     */
    public Optional<IAstNodeToIrConverter<? extends AstNode>> get(Class<? extends AstNode> nodeType) {
        return Optional.ofNullable(byClass.get(nodeType));
    }

    /**
     * Resolves a converter for the given node by searching the node's concrete class,
     * then its interfaces. Falls back to the default converter.
     *
     * @param node The AST node instance to resolve a converter for.
     * @return A non-null converter to handle the node.
     */
    @SuppressWarnings("unchecked")
    public IAstNodeToIrConverter<AstNode> resolve(AstNode node) {
        Class<?> c = node.getClass();
        while (c != null && AstNode.class.isAssignableFrom(c)) {
            IAstNodeToIrConverter<?> found = byClass.get(c);
            if (found != null) return (IAstNodeToIrConverter<AstNode>) found;
            for (Class<?> i : c.getInterfaces()) {
                if (AstNode.class.isAssignableFrom(i)) {
                    found = byClass.get(i.asSubclass(AstNode.class));
                    if (found != null) return (IAstNodeToIrConverter<AstNode>) found;
                }
            }
            c = c.getSuperclass();
        }
        return defaultConverter;
    }

    /**
     * Creates a registry with the given fallback and no specific converters.
     *
     * @param defaultConverter The fallback converter used for unknown node types.
     * @return A new registry instance.
     */
    public static IrConverterRegistry initialize(IAstNodeToIrConverter<AstNode> defaultConverter) {
        return new IrConverterRegistry(defaultConverter);
    }

    /**
     * Initializes a registry with the default converter and registers the converters of every statement kind.
     *
     * @return A registry pre-populated with the standard converters.
     */
    public static IrConverterRegistry initializeWithDefaults() {
        IrConverterRegistry reg = initialize(new DefaultAstNodeToIrConverter());
        reg.register(BlockNode.class, new BlockNodeConverter());
        reg.register(VariableDeclarationNode.class, new VariableDeclarationNodeConverter());
        reg.register(AssignmentNode.class, new AssignmentNodeConverter());
        reg.register(RequireNode.class, new RequireNodeConverter());
        reg.register(IfNode.class, new IfNodeConverter());
        reg.register(CallStatementNode.class, new CallStatementNodeConverter());
        return reg;
    }
}

package org.silverscript.compiler.frontend.semantics;

import org.silverscript.compiler.api.CompilerErrorCode;
import org.silverscript.compiler.api.SourceSpan;
import org.silverscript.compiler.api.TypedValue;
import org.silverscript.compiler.api.ValueType;
import org.silverscript.compiler.diagnostics.DiagnosticsEngine;
import org.silverscript.compiler.frontend.parser.ast.AssignmentNode;
import org.silverscript.compiler.frontend.parser.ast.BinaryNode;
import org.silverscript.compiler.frontend.parser.ast.BlockNode;
import org.silverscript.compiler.frontend.parser.ast.BoolLiteralNode;
import org.silverscript.compiler.frontend.parser.ast.CallNode;
import org.silverscript.compiler.frontend.parser.ast.CallStatementNode;
import org.silverscript.compiler.frontend.parser.ast.ContractNode;
import org.silverscript.compiler.frontend.parser.ast.ExpressionNode;
import org.silverscript.compiler.frontend.parser.ast.FunctionNode;
import org.silverscript.compiler.frontend.parser.ast.HexLiteralNode;
import org.silverscript.compiler.frontend.parser.ast.IdentifierNode;
import org.silverscript.compiler.frontend.parser.ast.IfNode;
import org.silverscript.compiler.frontend.parser.ast.IntLiteralNode;
import org.silverscript.compiler.frontend.parser.ast.LengthNode;
import org.silverscript.compiler.frontend.parser.ast.ParamNode;
import org.silverscript.compiler.frontend.parser.ast.RequireNode;
import org.silverscript.compiler.frontend.parser.ast.StatementNode;
import org.silverscript.compiler.frontend.parser.ast.StringLiteralNode;
import org.silverscript.compiler.frontend.parser.ast.TypeNode;
import org.silverscript.compiler.frontend.parser.ast.UnaryNode;
import org.silverscript.compiler.frontend.parser.ast.VariableDeclarationNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Performs semantic analysis on the contract AST: name resolution, typing, call checking and
 * recursion detection. Problems are reported to the diagnostics engine; the expression types
 * computed here are consumed by IR generation.
 */
public class SemanticAnalyzer {

    private final DiagnosticsEngine diagnostics;
    private final SymbolTable symbols = new SymbolTable();
    private final Map<ExpressionNode, ValueType> expressionTypes = new IdentityHashMap<>();
    private final Map<TypeNode, ValueType> declaredTypes = new IdentityHashMap<>();
    private final Map<String, FunctionNode> functions = new LinkedHashMap<>();
    private final Map<String, List<CallNode>> callsByFunction = new HashMap<>();
    private List<CallNode> currentCalls;

    /**
     * Constructs a new semantic analyzer.
     * @param diagnostics The diagnostics engine for reporting errors.
     */
    public SemanticAnalyzer(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Analyzes a contract against the constructor arguments it will be compiled with.
     *
     * @param contract The contract.
     * @param constructorArgs The constructor arguments.
     */
    public void analyze(ContractNode contract, List<TypedValue> constructorArgs) {
        collectFunctions(contract);
        defineConstructorParams(contract, constructorArgs);
        for (FunctionNode function : functions.values()) {
            currentCalls = new ArrayList<>();
            callsByFunction.put(function.name(), currentCalls);
            symbols.enterScope();
            for (ParamNode p : function.params()) {
                declare(p.name(), Symbol.Kind.PARAMETER, resolveType(p.type()), p, p.span());
            }
            block(function.body());
            symbols.leaveScope();
        }
        detectRecursion();
    }

    /**
     * @param expression An analyzed expression.
     * @return Its type, or {@code null} if it did not type-check.
     */
    public ValueType typeOf(ExpressionNode expression) {
        return expressionTypes.get(expression);
    }

    /**
     * @param type An analyzed type reference.
     * @return The resolved type, or {@code null} if unknown.
     */
    public ValueType typeOf(TypeNode type) {
        return declaredTypes.get(type);
    }

    /**
     * @return The functions by name, in declaration order.
     */
    public Map<String, FunctionNode> functions() {
        return functions;
    }

    private void collectFunctions(ContractNode contract) {
        for (FunctionNode f : contract.functions()) {
            if (functions.putIfAbsent(f.name(), f) != null) {
                diagnostics.reportError(CompilerErrorCode.DUPLICATE_FUNCTION,
                        "function '" + f.name() + "' is already declared", f.span());
            }
            if (Builtin.lookup(f.name()).isPresent()) {
                diagnostics.reportError(CompilerErrorCode.DUPLICATE_FUNCTION,
                        "function '" + f.name() + "' shadows a builtin", f.span());
            }
        }
        if (contract.entrypoints().isEmpty()) {
            diagnostics.reportError(CompilerErrorCode.MISSING_ENTRYPOINT,
                    "contract '" + contract.name() + "' has no entrypoint functions", contract.span());
        }
    }

    private void defineConstructorParams(ContractNode contract, List<TypedValue> args) {
        List<ParamNode> params = contract.params();
        if (args.size() != params.size()) {
            diagnostics.reportError(CompilerErrorCode.CONSTRUCTOR_ARGUMENT_MISMATCH,
                    "contract '" + contract.name() + "' expects " + params.size()
                            + " constructor argument(s), got " + args.size(), contract.span());
        }
        for (int i = 0; i < params.size(); i++) {
            ParamNode p = params.get(i);
            ValueType type = resolveType(p.type());
            declare(p.name(), Symbol.Kind.CONSTANT, type, p, p.span());
            if (type != null && i < args.size() && !type.isAssignableFrom(args.get(i).type())) {
                diagnostics.reportError(CompilerErrorCode.CONSTRUCTOR_ARGUMENT_MISMATCH,
                        "constructor argument '" + p.name() + "' expects " + type + ", got " + args.get(i).type(),
                        p.span());
            }
        }
    }

    private ValueType resolveType(TypeNode node) {
        Optional<ValueType> type = ValueType.parse(node.text());
        if (type.isEmpty()) {
            diagnostics.reportError(CompilerErrorCode.UNKNOWN_TYPE, "unknown type '" + node.text() + "'", node.span());
            return null;
        }
        declaredTypes.put(node, type.get());
        return type.get();
    }

    private void declare(String name, Symbol.Kind kind, ValueType type, ParamNode node, SourceSpan span) {
        if (!symbols.define(new Symbol(name, kind, type, node))) {
            diagnostics.reportError(CompilerErrorCode.DUPLICATE_VARIABLE, "'" + name + "' is already declared", span);
        }
    }

    // --- Statements ---

    private void block(BlockNode block) {
        symbols.enterScope();
        for (StatementNode s : block.statements()) {
            statement(s);
        }
        symbols.leaveScope();
    }

    private void statement(StatementNode node) {
        if (node instanceof BlockNode b) {
            block(b);
        } else if (node instanceof VariableDeclarationNode d) {
            ValueType declared = resolveType(d.type());
            ValueType actual = expression(d.initializer());
            expectAssignable(declared, actual, d.initializer().span());
            if (!symbols.define(new Symbol(d.name(), Symbol.Kind.LOCAL, declared, d))) {
                diagnostics.reportError(CompilerErrorCode.DUPLICATE_VARIABLE,
                        "'" + d.name() + "' is already declared", d.span());
            }
        } else if (node instanceof AssignmentNode a) {
            ValueType actual = expression(a.value());
            Optional<Symbol> target = symbols.resolve(a.name());
            if (target.isEmpty()) {
                diagnostics.reportError(CompilerErrorCode.UNRESOLVED_IDENTIFIER, "unknown variable '" + a.name() + "'", a.span());
            } else if (target.get().kind() == Symbol.Kind.CONSTANT) {
                diagnostics.reportError(CompilerErrorCode.ASSIGNMENT_TO_CONSTANT,
                        "cannot assign to constructor parameter '" + a.name() + "'", a.span());
            } else {
                expectAssignable(target.get().type(), actual, a.value().span());
            }
        } else if (node instanceof RequireNode r) {
            expectAssignable(ValueType.BOOL, expression(r.condition()), r.condition().span());
        } else if (node instanceof IfNode i) {
            expectAssignable(ValueType.BOOL, expression(i.condition()), i.condition().span());
            block(i.thenBranch());
            if (i.elseBranch() != null) {
                block(i.elseBranch());
            }
        } else if (node instanceof CallStatementNode c) {
            callStatement(c.call());
        }
    }

    private void callStatement(CallNode call) {
        FunctionNode target = functions.get(call.name());
        if (target == null) {
            String detail = Builtin.lookup(call.name()).isPresent()
                    ? "builtin '" + call.name() + "' cannot be used as a statement"
                    : "unknown function '" + call.name() + "'";
            diagnostics.reportError(CompilerErrorCode.UNKNOWN_FUNCTION, detail, call.span());
            call.arguments().forEach(this::expression);
            return;
        }
        if (target.entrypoint()) {
            diagnostics.reportError(CompilerErrorCode.ENTRYPOINT_NOT_CALLABLE,
                    "entrypoint function '" + call.name() + "' cannot be called", call.span());
        }
        currentCalls.add(call);
        List<ParamNode> params = target.params();
        if (params.size() != call.arguments().size()) {
            diagnostics.reportError(CompilerErrorCode.ARITY_MISMATCH, "function '" + call.name() + "' expects "
                    + params.size() + " argument(s), got " + call.arguments().size(), call.span());
        }
        for (int i = 0; i < call.arguments().size(); i++) {
            ValueType actual = expression(call.arguments().get(i));
            if (i < params.size()) {
                ValueType expected = ValueType.parse(params.get(i).type().text()).orElse(null);
                expectAssignable(expected, actual, call.arguments().get(i).span());
            }
        }
    }

    private void expectAssignable(ValueType expected, ValueType actual, SourceSpan span) {
        if (expected != null && actual != null && !expected.isAssignableFrom(actual)) {
            diagnostics.reportError(CompilerErrorCode.TYPE_MISMATCH, "expected " + expected + ", got " + actual, span);
        }
    }

    // --- Expressions ---

    private ValueType expression(ExpressionNode node) {
        ValueType type = computeType(node);
        if (type != null) {
            expressionTypes.put(node, type);
        }
        return type;
    }

    private ValueType computeType(ExpressionNode node) {
        if (node instanceof IntLiteralNode) return ValueType.INT;
        if (node instanceof BoolLiteralNode) return ValueType.BOOL;
        if (node instanceof StringLiteralNode) return ValueType.STRING;
        if (node instanceof HexLiteralNode h) {
            int n = h.value().length;
            return n == 0 || n > ValueType.MAX_BYTES_SIZE ? ValueType.BYTES : ValueType.bytes(n);
        }
        if (node instanceof IdentifierNode id) {
            Optional<Symbol> symbol = symbols.resolve(id.name());
            if (symbol.isEmpty()) {
                diagnostics.reportError(CompilerErrorCode.UNRESOLVED_IDENTIFIER, "unknown identifier '" + id.name() + "'", id.span());
                return null;
            }
            return symbol.get().type();
        }
        if (node instanceof UnaryNode u) {
            ValueType operand = expression(u.operand());
            ValueType expected = u.negate() ? ValueType.INT : ValueType.BOOL;
            if (operand == null) return null;
            if (!operand.equals(expected)) {
                diagnostics.reportError(CompilerErrorCode.TYPE_MISMATCH, "operator '" + (u.negate() ? "-" : "!")
                        + "' expects " + expected + ", got " + operand, u.span());
                return null;
            }
            return expected;
        }
        if (node instanceof BinaryNode b) return binary(b);
        if (node instanceof LengthNode l) {
            ValueType target = expression(l.target());
            if (target == null) return null;
            if (!target.isByteLike() && !target.equals(ValueType.STRING) && !target.isArray()) {
                diagnostics.reportError(CompilerErrorCode.TYPE_MISMATCH, "'.length' is not defined for " + target, l.span());
                return null;
            }
            return ValueType.INT;
        }
        if (node instanceof CallNode c) return call(c);
        throw new IllegalStateException("Unhandled expression node " + node.getClass().getSimpleName());
    }

    private ValueType binary(BinaryNode b) {
        ValueType left = expression(b.left());
        ValueType right = expression(b.right());
        if (left == null || right == null) return null;
        ValueType result = switch (b.operator()) {
            case ADD -> {
                if (left.equals(ValueType.INT) && right.equals(ValueType.INT)) yield ValueType.INT;
                if (left.equals(ValueType.STRING) && right.equals(ValueType.STRING)) yield ValueType.STRING;
                if (left.isByteLike() && right.isByteLike()) yield ValueType.BYTES;
                yield null;
            }
            case SUBTRACT, MULTIPLY, DIVIDE, MODULO ->
                    left.equals(ValueType.INT) && right.equals(ValueType.INT) ? ValueType.INT : null;
            case LESS, LESS_EQUAL, GREATER, GREATER_EQUAL ->
                    left.equals(ValueType.INT) && right.equals(ValueType.INT) ? ValueType.BOOL : null;
            case EQUAL, NOT_EQUAL -> left.isComparableWith(right) ? ValueType.BOOL : null;
            case AND, OR -> left.equals(ValueType.BOOL) && right.equals(ValueType.BOOL) ? ValueType.BOOL : null;
        };
        if (result == null) {
            diagnostics.reportError(CompilerErrorCode.TYPE_MISMATCH, "operator '" + b.operator().symbol()
                    + "' is not defined for " + left + " and " + right, b.span());
        }
        return result;
    }

    private ValueType call(CallNode c) {
        List<ValueType> argTypes = new ArrayList<>();
        for (ExpressionNode arg : c.arguments()) {
            argTypes.add(expression(arg));
        }
        Optional<Builtin> builtin = Builtin.lookup(c.name());
        if (builtin.isEmpty()) {
            if (functions.containsKey(c.name())) {
                diagnostics.reportError(CompilerErrorCode.TYPE_MISMATCH,
                        "function '" + c.name() + "' does not return a value", c.span());
            } else {
                diagnostics.reportError(CompilerErrorCode.UNKNOWN_FUNCTION, "unknown function '" + c.name() + "'", c.span());
            }
            return null;
        }
        Builtin fn = builtin.get();
        if (argTypes.size() != fn.parameters().size()) {
            diagnostics.reportError(CompilerErrorCode.ARITY_MISMATCH, "builtin '" + c.name() + "' expects "
                    + fn.parameters().size() + " argument(s), got " + argTypes.size(), c.span());
            return null;
        }
        for (int i = 0; i < argTypes.size(); i++) {
            ValueType actual = argTypes.get(i);
            if (actual != null && !fn.accepts(i, actual)) {
                diagnostics.reportError(CompilerErrorCode.TYPE_MISMATCH, "argument " + (i + 1) + " of '" + c.name()
                        + "' expects " + fn.parameters().get(i) + ", got " + actual, c.arguments().get(i).span());
            }
        }
        return fn.result();
    }

    // --- Call graph ---

    private void detectRecursion() {
        Set<String> done = new HashSet<>();
        for (String name : functions.keySet()) {
            visit(name, new ArrayList<>(), done);
        }
    }

    private void visit(String name, List<String> path, Set<String> done) {
        if (done.contains(name)) return;
        path.add(name);
        for (CallNode call : callsByFunction.getOrDefault(name, List.of())) {
            if (path.contains(call.name())) {
                diagnostics.reportError(CompilerErrorCode.RECURSIVE_CALL, "recursive call of '" + call.name()
                        + "' via " + String.join(" -> ", path) + " -> " + call.name(), call.span());
            } else {
                visit(call.name(), path, done);
            }
        }
        path.remove(path.size() - 1);
        done.add(name);
    }
}

package org.silverscript.compiler.frontend.irgen;

import org.silverscript.compiler.api.TypedValue;
import org.silverscript.compiler.api.ValueType;
import org.silverscript.compiler.frontend.parser.ast.BinaryNode;
import org.silverscript.compiler.frontend.parser.ast.BinaryOperator;
import org.silverscript.compiler.frontend.parser.ast.BoolLiteralNode;
import org.silverscript.compiler.frontend.parser.ast.CallNode;
import org.silverscript.compiler.frontend.parser.ast.ExpressionNode;
import org.silverscript.compiler.frontend.parser.ast.HexLiteralNode;
import org.silverscript.compiler.frontend.parser.ast.IdentifierNode;
import org.silverscript.compiler.frontend.parser.ast.IntLiteralNode;
import org.silverscript.compiler.frontend.parser.ast.LengthNode;
import org.silverscript.compiler.frontend.parser.ast.StringLiteralNode;
import org.silverscript.compiler.frontend.parser.ast.UnaryNode;
import org.silverscript.compiler.frontend.semantics.Builtin;
import org.silverscript.debug.VariableSlot;
import org.silverscript.runtime.isa.Opcode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Lowers expressions to stack code that leaves exactly one value on top of the stack.
 * <p>
 * Integer and boolean sub-expressions whose leaves are literals or constructor arguments are
 * folded to a single push. Booleans fold to 0 or 1. A fold is abandoned, and the expression
 * lowered to opcodes instead, when it would divide by zero, overflow, or produce
 * {@link Long#MIN_VALUE}.
 */
final class ExpressionLowerer {

    private final IrGenContext ctx;

    ExpressionLowerer(IrGenContext ctx) {
        this.ctx = ctx;
    }

    void lower(ExpressionNode node) {
        OptionalLong folded = fold(node);
        if (folded.isPresent()) {
            ctx.emitNumber(folded.getAsLong());
            return;
        }
        if (node instanceof StringLiteralNode s) {
            ctx.emitPush(s.value().getBytes(StandardCharsets.UTF_8));
        } else if (node instanceof HexLiteralNode h) {
            ctx.emitPush(h.value());
        } else if (node instanceof IdentifierNode id) {
            identifier(id);
        } else if (node instanceof UnaryNode u) {
            lower(u.operand());
            ctx.emit(u.negate() ? Opcode.OP_NEGATE : Opcode.OP_NOT);
        } else if (node instanceof BinaryNode b) {
            binary(b);
        } else if (node instanceof LengthNode l) {
            length(l);
        } else if (node instanceof CallNode c) {
            Builtin builtin = Builtin.lookup(c.name())
                    .orElseThrow(() -> new IllegalStateException("not a builtin: " + c.name()));
            c.arguments().forEach(this::lower);
            ctx.emit(builtin.opcode());
        } else {
            throw new IllegalStateException("Unhandled expression node " + node.getClass().getSimpleName());
        }
    }

    private void identifier(IdentifierNode id) {
        VariableSlot slot = ctx.lookup(id.name())
                .orElseThrow(() -> new IllegalStateException("unresolved identifier survived analysis: " + id.name()));
        if (slot.isConstant()) {
            ctx.emitPush(slot.constantValue());
            return;
        }
        ctx.emitNumber(ctx.depthOf(slot));
        ctx.emit(Opcode.OP_PICK);
    }

    private void binary(BinaryNode b) {
        boolean intOperands = ValueType.INT.equals(ctx.semantics().typeOf(b.left()));
        lower(b.left());
        lower(b.right());
        switch (b.operator()) {
            case ADD -> ctx.emit(intOperands ? Opcode.OP_ADD : Opcode.OP_CAT);
            case SUBTRACT -> ctx.emit(Opcode.OP_SUB);
            case MULTIPLY -> ctx.emit(Opcode.OP_MUL);
            case DIVIDE -> ctx.emit(Opcode.OP_DIV);
            case MODULO -> ctx.emit(Opcode.OP_MOD);
            case LESS -> ctx.emit(Opcode.OP_LESSTHAN);
            case LESS_EQUAL -> ctx.emit(Opcode.OP_LESSTHANOREQUAL);
            case GREATER -> ctx.emit(Opcode.OP_GREATERTHAN);
            case GREATER_EQUAL -> ctx.emit(Opcode.OP_GREATERTHANOREQUAL);
            case EQUAL -> ctx.emit(intOperands ? Opcode.OP_NUMEQUAL : Opcode.OP_EQUAL);
            case NOT_EQUAL -> {
                if (intOperands) {
                    ctx.emit(Opcode.OP_NUMNOTEQUAL);
                } else {
                    ctx.emit(Opcode.OP_EQUAL);
                    ctx.emit(Opcode.OP_NOT);
                }
            }
            case AND -> ctx.emit(Opcode.OP_BOOLAND);
            case OR -> ctx.emit(Opcode.OP_BOOLOR);
        }
    }

    private void length(LengthNode l) {
        lower(l.target());
        ctx.emit(Opcode.OP_SIZE);
        ctx.emit(Opcode.OP_NIP);
        ValueType target = ctx.semantics().typeOf(l.target());
        if (target != null && target.isArray()) {
            int elementSize = target.element().elementSize().orElse(1);
            if (elementSize > 1) {
                ctx.emitNumber(elementSize);
                ctx.emit(Opcode.OP_DIV);
            }
        }
    }

    // --- Folding ---

    /**
     * @param node An expression.
     * @return Its value if it is a foldable int or bool expression; booleans are 0 or 1.
     */
    OptionalLong fold(ExpressionNode node) {
        ValueType type = ctx.semantics().typeOf(node);
        if (!ValueType.INT.equals(type) && !ValueType.BOOL.equals(type)) {
            return OptionalLong.empty();
        }
        try {
            OptionalLong value = evaluate(node);
            if (value.isPresent() && value.getAsLong() == Long.MIN_VALUE) {
                return OptionalLong.empty();
            }
            return value;
        } catch (ArithmeticException overflowOrDivisionByZero) {
            return OptionalLong.empty();
        }
    }

    private OptionalLong evaluate(ExpressionNode node) {
        if (node instanceof IntLiteralNode i) return OptionalLong.of(i.value());
        if (node instanceof BoolLiteralNode b) return OptionalLong.of(b.value() ? 1 : 0);
        if (node instanceof IdentifierNode id) return constantValue(id.name());
        if (node instanceof UnaryNode u) {
            OptionalLong operand = fold(u.operand());
            if (operand.isEmpty()) return operand;
            return OptionalLong.of(u.negate() ? Math.negateExact(operand.getAsLong()) : truth(operand.getAsLong() == 0));
        }
        if (node instanceof BinaryNode b) {
            OptionalLong left = fold(b.left());
            OptionalLong right = fold(b.right());
            if (left.isEmpty() || right.isEmpty()) return OptionalLong.empty();
            return OptionalLong.of(apply(b.operator(), left.getAsLong(), right.getAsLong()));
        }
        if (node instanceof CallNode c) return builtin(c);
        return OptionalLong.empty();
    }

    private OptionalLong constantValue(String name) {
        Optional<TypedValue> constant = ctx.constant(name);
        if (constant.isEmpty()) return OptionalLong.empty();
        TypedValue value = constant.get();
        if (value.type().equals(ValueType.INT)) return OptionalLong.of(value.asLong());
        if (value.type().equals(ValueType.BOOL)) return OptionalLong.of(truth(value.asBool()));
        return OptionalLong.empty();
    }

    private static long apply(BinaryOperator op, long l, long r) {
        return switch (op) {
            case ADD -> Math.addExact(l, r);
            case SUBTRACT -> Math.subtractExact(l, r);
            case MULTIPLY -> Math.multiplyExact(l, r);
            case DIVIDE -> {
                if (r == 0) throw new ArithmeticException("division by zero");
                yield l / r;
            }
            case MODULO -> {
                if (r == 0) throw new ArithmeticException("modulo by zero");
                yield l % r;
            }
            case LESS -> truth(l < r);
            case LESS_EQUAL -> truth(l <= r);
            case GREATER -> truth(l > r);
            case GREATER_EQUAL -> truth(l >= r);
            case EQUAL -> truth(l == r);
            case NOT_EQUAL -> truth(l != r);
            case AND -> truth(l != 0 && r != 0);
            case OR -> truth(l != 0 || r != 0);
        };
    }

    private OptionalLong builtin(CallNode c) {
        Optional<Builtin> builtin = Builtin.lookup(c.name());
        if (builtin.isEmpty()) return OptionalLong.empty();
        List<Long> args = new ArrayList<>();
        for (ExpressionNode arg : c.arguments()) {
            OptionalLong v = fold(arg);
            if (v.isEmpty()) return OptionalLong.empty();
            args.add(v.getAsLong());
        }
        return switch (builtin.get()) {
            case ABS -> OptionalLong.of(Math.absExact(args.get(0)));
            case MIN -> OptionalLong.of(Math.min(args.get(0), args.get(1)));
            case MAX -> OptionalLong.of(Math.max(args.get(0), args.get(1)));
            case WITHIN -> OptionalLong.of(truth(args.get(0) >= args.get(1) && args.get(0) < args.get(2)));
            default -> OptionalLong.empty();
        };
    }

    private static long truth(boolean value) {
        return value ? 1 : 0;
    }
}

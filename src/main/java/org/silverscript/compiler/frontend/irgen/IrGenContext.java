package org.silverscript.compiler.frontend.irgen;

import org.silverscript.compiler.api.ParamInfo;
import org.silverscript.compiler.api.SourceSpan;
import org.silverscript.compiler.api.TypedValue;
import org.silverscript.compiler.api.ValueType;
import org.silverscript.compiler.frontend.parser.ast.AstNode;
import org.silverscript.compiler.frontend.parser.ast.ExpressionNode;
import org.silverscript.compiler.frontend.semantics.SemanticAnalyzer;
import org.silverscript.compiler.ir.IrInstruction;
import org.silverscript.compiler.ir.IrItem;
import org.silverscript.compiler.ir.IrProgram;
import org.silverscript.compiler.ir.IrPush;
import org.silverscript.compiler.ir.IrSource;
import org.silverscript.debug.FrameInfo;
import org.silverscript.debug.VariableOrigin;
import org.silverscript.debug.VariableSlot;
import org.silverscript.runtime.ScriptNumber;
import org.silverscript.runtime.isa.Opcode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable state of one lowering run, passed to the converters.
 * <p>
 * Besides collecting IR items it models the main stack at compile time: every variable owns a
 * fixed slot counted from the stack bottom, and every emitted opcode adjusts the modelled depth
 * by its net stack effect. It also owns the frame-id allocator and the source attribution that
 * is stamped onto each item.
 */
public final class IrGenContext {

    private final String contractName;
    private final SemanticAnalyzer semantics;
    private final IrConverterRegistry registry;
    private final Map<String, TypedValue> constants;
    private final List<IrItem> out = new ArrayList<>();
    private final List<FrameInfo> frames = new ArrayList<>();
    private final Deque<FrameState> frameStack = new ArrayDeque<>();
    private final ExpressionLowerer expressions = new ExpressionLowerer(this);

    private int nextFrameId;
    private int stackSize = 0;

    private SourceSpan attributedSpan;
    private List<VariableSlot> attributedScope;
    private boolean boundaryPending;

    private static final class FrameState {
        final FrameInfo info;
        final Deque<LinkedHashMap<String, VariableSlot>> blocks = new ArrayDeque<>();

        FrameState(FrameInfo info) {
            this.info = info;
            blocks.push(new LinkedHashMap<>());
        }
    }

    /**
     * @param contractName The contract being lowered.
     * @param semantics The completed semantic analysis.
     * @param registry The converter registry.
     * @param constants The constructor arguments by parameter name, in declaration order.
     */
    public IrGenContext(String contractName, SemanticAnalyzer semantics, IrConverterRegistry registry,
                        Map<String, TypedValue> constants) {
        this.contractName = contractName;
        this.semantics = semantics;
        this.registry = registry;
        this.constants = constants;
    }

    /**
     * Converts the given AST node by resolving and invoking the appropriate converter.
     * @param node The node to convert.
     */
    public void convert(AstNode node) {
        registry.resolve(node).convert(node, this);
    }

    /**
     * Lowers an expression so that its value ends up on top of the stack.
     * @param expression The expression.
     */
    public void lower(ExpressionNode expression) {
        expressions.lower(expression);
    }

    public SemanticAnalyzer semantics() {
        return semantics;
    }

    // --- Frames and variables ---

    /**
     * Opens the frame of an entrypoint body as frame 0. Inlined calls inside it are numbered from 1.
     * @param entrypoint The entrypoint name.
     */
    public void beginEntrypoint(String entrypoint) {
        nextFrameId = 1;
        beginFrame(new FrameInfo(0, entrypoint, 0, null, null, entrypoint));
    }

    /**
     * @return A fresh frame id for an inlined call within the current entrypoint.
     */
    public int allocateFrameId() {
        return nextFrameId++;
    }

    /**
     * Makes a frame current. Variables of enclosing frames are not visible inside it.
     * @param frame The frame.
     */
    public void beginFrame(FrameInfo frame) {
        frames.add(frame);
        frameStack.push(new FrameState(frame));
    }

    /**
     * Returns to the calling frame.
     */
    public void endFrame() {
        frameStack.pop();
    }

    /**
     * @return The current frame.
     */
    public FrameInfo frame() {
        return frameStack.peek().info;
    }

    public void enterBlock() {
        frameStack.peek().blocks.push(new LinkedHashMap<>());
    }

    /**
     * @return The number of variables declared in the innermost block.
     */
    public int blockVariableCount() {
        return frameStack.peek().blocks.peek().size();
    }

    public void leaveBlock() {
        frameStack.peek().blocks.pop();
    }

    /**
     * Binds the value on top of the stack to a new variable.
     * @param name The variable name.
     * @param origin The kind of declaration.
     * @param type The declared type.
     */
    public void declareTop(String name, VariableOrigin origin, ValueType type) {
        frameStack.peek().blocks.peek().put(name, VariableSlot.onStack(name, origin, type, stackSize - 1));
    }

    /**
     * Binds the topmost {@code params.size()} stack values to parameters, the first parameter lowest.
     * @param params The parameters.
     */
    public void declareParameters(List<ParamInfo> params) {
        int base = stackSize - params.size();
        for (int i = 0; i < params.size(); i++) {
            ParamInfo p = params.get(i);
            frameStack.peek().blocks.peek().put(p.name(),
                    VariableSlot.onStack(p.name(), VariableOrigin.FUNCTION_PARAMETER, p.type(), base + i));
        }
    }

    /**
     * Resolves a name in the current frame, then among the constructor parameters.
     * @param name The name.
     * @return The slot, if visible.
     */
    public Optional<VariableSlot> lookup(String name) {
        for (Map<String, VariableSlot> block : frameStack.peek().blocks) {
            VariableSlot slot = block.get(name);
            if (slot != null) return Optional.of(slot);
        }
        TypedValue constant = constants.get(name);
        return constant == null ? Optional.empty() : Optional.of(VariableSlot.constant(name, constant.type(), constant.bytes()));
    }

    /**
     * @param name A name.
     * @return The constructor argument bound to it, if the name is a constructor parameter not shadowed locally.
     */
    public Optional<TypedValue> constant(String name) {
        return lookup(name).filter(VariableSlot::isConstant).map(s -> constants.get(name));
    }

    /**
     * @return The visible variables: constructor parameters, then the current frame's outermost to innermost.
     */
    public List<VariableSlot> scope() {
        List<VariableSlot> scope = new ArrayList<>();
        constants.forEach((name, value) -> scope.add(VariableSlot.constant(name, value.type(), value.bytes())));
        if (!frameStack.isEmpty()) {
            Iterator<LinkedHashMap<String, VariableSlot>> outermostFirst = frameStack.peek().blocks.descendingIterator();
            while (outermostFirst.hasNext()) {
                scope.addAll(outermostFirst.next().values());
            }
        }
        return scope;
    }

    /**
     * @param slot A stack slot.
     * @return Its distance from the top of the modelled stack.
     */
    public int depthOf(VariableSlot slot) {
        return stackSize - 1 - slot.stackIndex();
    }

    public int stackSize() {
        return stackSize;
    }

    /**
     * Overrides the modelled stack depth, used at the start of each dispatch branch.
     * @param size The depth.
     */
    public void resetStack(int size) {
        this.stackSize = size;
    }

    // --- Source attribution ---

    /**
     * Attributes the following items to a statement; the first one becomes its boundary.
     * @param span The statement.
     */
    public void beginStatement(SourceSpan span) {
        attribute(span);
        boundaryPending = true;
    }

    /**
     * Attributes the following items to a statement without marking a boundary.
     * @param span The statement or block.
     */
    public void continueStatement(SourceSpan span) {
        attribute(span);
        boundaryPending = false;
    }

    /**
     * Emits the following items without source attribution.
     */
    public void unmapped() {
        attributedSpan = null;
        attributedScope = null;
        boundaryPending = false;
    }

    private void attribute(SourceSpan span) {
        attributedSpan = span;
        attributedScope = scope();
    }

    private IrSource nextSource() {
        if (attributedSpan == null) {
            return null;
        }
        FrameInfo f = frame();
        IrSource source = new IrSource(attributedSpan, f.frameId(), f.entrypoint(), f.callDepth(), boundaryPending, attributedScope);
        boundaryPending = false;
        return source;
    }

    // --- Emission ---

    public void emit(Opcode opcode) {
        out.add(new IrInstruction(opcode, nextSource()));
        stackSize += stackEffect(opcode);
    }

    public void emitPush(byte[] data) {
        out.add(new IrPush(data, nextSource()));
        stackSize++;
    }

    public void emitNumber(long value) {
        emitPush(ScriptNumber.encode(value));
    }

    /**
     * Emits {@code count} drops.
     * @param count The number of elements to remove from the top.
     */
    public void emitDrops(int count) {
        for (int i = 0; i < count; i++) {
            emit(Opcode.OP_DROP);
        }
    }

    /**
     * @return The number of IR items emitted so far.
     */
    public int emittedCount() {
        return out.size();
    }

    /**
     * @return The program built so far; frames are listed per entrypoint in id order.
     */
    public IrProgram build() {
        return new IrProgram(contractName, out, frames);
    }

    /**
     * Net change of the stack depth when the opcode executes in a taken branch.
     */
    static int stackEffect(Opcode opcode) {
        return switch (opcode) {
            case OP_2DUP -> 2;
            case OP_DUP, OP_OVER, OP_SIZE, OP_TUCK, OP_DEPTH, OP_FROMALTSTACK -> 1;
            case OP_PICK, OP_NOP, OP_ELSE, OP_ENDIF, OP_RETURN, OP_NEGATE, OP_ABS, OP_NOT, OP_0NOTEQUAL,
                    OP_1ADD, OP_1SUB, OP_SHA256, OP_BLAKE2B, OP_SWAP, OP_ROT, OP_IFDUP -> 0;
            case OP_WITHIN, OP_2DROP, OP_EQUALVERIFY, OP_NUMEQUALVERIFY, OP_CHECKSIGVERIFY -> -2;
            default -> opcode.isPush() ? 1 : -1;
        };
    }
}

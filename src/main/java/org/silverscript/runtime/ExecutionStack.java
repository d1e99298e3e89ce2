package org.silverscript.runtime;

import java.util.ArrayList;
import java.util.List;

/**
 * A script stack. Elements are stored bottom-first; depth 0 is the top.
 */
public class ExecutionStack {

    private final String name;
    private final List<byte[]> elements = new ArrayList<>();

    /**
     * @param name The name used in error messages (e.g. "main", "alt").
     */
    public ExecutionStack(String name) {
        this.name = name;
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public void push(byte[] element) {
        elements.add(element.clone());
    }

    public void pushNumber(long value) {
        elements.add(ScriptNumber.encode(value));
    }

    public void pushBool(boolean value) {
        elements.add(ScriptNumber.fromBool(value));
    }

    /**
     * Removes and returns the top element.
     * @return The former top element.
     * @throws ScriptExecutionException on an empty stack.
     */
    public byte[] pop() throws ScriptExecutionException {
        requireDepth(1);
        return elements.remove(elements.size() - 1);
    }

    public long popNumber() throws ScriptExecutionException {
        return ScriptNumber.decode(pop(), ScriptNumber.MAX_LENGTH);
    }

    public boolean popBool() throws ScriptExecutionException {
        return ScriptNumber.castToBool(pop());
    }

    /**
     * Returns the element at the given depth without removing it.
     * @param depth 0 for the top element.
     * @return A copy of the element.
     * @throws ScriptExecutionException if the stack is not deep enough.
     */
    public byte[] peek(int depth) throws ScriptExecutionException {
        requireDepth(depth + 1);
        return elements.get(elements.size() - 1 - depth).clone();
    }

    /**
     * Removes the element at the given depth.
     * @param depth 0 for the top element.
     * @return The removed element.
     * @throws ScriptExecutionException if the stack is not deep enough.
     */
    public byte[] remove(int depth) throws ScriptExecutionException {
        requireDepth(depth + 1);
        return elements.remove(elements.size() - 1 - depth);
    }

    /**
     * Inserts an element so that it ends up at the given depth.
     * @param depth 0 pushes on top.
     * @param element The element.
     * @throws ScriptExecutionException if the stack is not deep enough.
     */
    public void insert(int depth, byte[] element) throws ScriptExecutionException {
        requireDepth(depth);
        elements.add(elements.size() - depth, element.clone());
    }

    public void clear() {
        elements.clear();
    }

    /**
     * @return Copies of all elements, bottom first.
     */
    public List<byte[]> snapshot() {
        List<byte[]> copy = new ArrayList<>(elements.size());
        for (byte[] e : elements) {
            copy.add(e.clone());
        }
        return copy;
    }

    private void requireDepth(int depth) throws ScriptExecutionException {
        if (elements.size() < depth) {
            throw new ScriptExecutionException(name + " stack underflow: need " + depth
                    + " element(s), have " + elements.size());
        }
    }
}

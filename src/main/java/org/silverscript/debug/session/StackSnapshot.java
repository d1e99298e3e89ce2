package org.silverscript.debug.session;

import java.util.List;

/**
 * A copy of both execution stacks, bottom first, each element as lower-case hex.
 *
 * @param mainStack The main (data) stack.
 * @param altStack The alternative stack.
 */
public record StackSnapshot(List<String> mainStack, List<String> altStack) {

    public StackSnapshot {
        mainStack = List.copyOf(mainStack);
        altStack = List.copyOf(altStack);
    }
}

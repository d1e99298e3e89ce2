package org.silverscript.trace.model;

import org.silverscript.debug.session.StackSnapshot;

import java.util.List;

/**
 * Both stacks, bottom first, as hex.
 *
 * @param dstack The main (data) stack.
 * @param astack The alt stack.
 */
public record StacksView(List<String> dstack, List<String> astack) {

    public static StacksView of(StackSnapshot snapshot) {
        return new StacksView(snapshot.mainStack(), snapshot.altStack());
    }
}

package org.silverscript.trace;

import java.util.List;

/**
 * What to compile and run.
 *
 * @param source The contract source text.
 * @param function The entrypoint to call; {@code null} or blank selects the first one.
 * @param ctorArgs Raw constructor arguments; missing or blank ones take their default.
 * @param args Raw function arguments; missing or blank ones take their default.
 * @param expectNoSelector Reject contracts with more than one entrypoint.
 */
public record TraceRequest(String source, String function, List<String> ctorArgs, List<String> args,
                           boolean expectNoSelector) {

    public TraceRequest {
        ctorArgs = ctorArgs == null ? List.of() : List.copyOf(ctorArgs);
        args = args == null ? List.of() : List.copyOf(args);
    }

    /**
     * @param source The contract source text.
     * @return A request for the first entrypoint with all arguments defaulted.
     */
    public static TraceRequest of(String source) {
        return new TraceRequest(source, null, List.of(), List.of(), false);
    }
}

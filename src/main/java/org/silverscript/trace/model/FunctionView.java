package org.silverscript.trace.model;

import org.silverscript.compiler.api.FunctionSignature;

import java.util.List;

/**
 * An entrypoint.
 *
 * @param name The function name.
 * @param selectorIndex Its selector, absent without dispatch.
 * @param inputs Its parameters.
 */
public record FunctionView(String name, Integer selectorIndex, List<ParamView> inputs) {

    public static FunctionView of(FunctionSignature function) {
        return new FunctionView(function.name(), function.selectorIndex(),
                function.parameters().stream().map(ParamView::of).toList());
    }
}

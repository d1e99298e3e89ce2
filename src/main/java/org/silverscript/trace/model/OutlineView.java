package org.silverscript.trace.model;

import org.silverscript.compiler.api.ContractOutline;

import java.util.List;

/**
 * The callable surface of a contract.
 */
public record OutlineView(String contractName, List<ParamView> constructorParams, List<FunctionView> functions,
                          boolean withoutSelector) {

    public static OutlineView of(ContractOutline outline) {
        return new OutlineView(outline.contractName(),
                outline.constructorParams().stream().map(ParamView::of).toList(),
                outline.functions().stream().map(FunctionView::of).toList(),
                outline.withoutSelector());
    }
}

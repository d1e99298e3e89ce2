package org.silverscript.trace.model;

import org.silverscript.compiler.api.ParamInfo;

public record ParamView(String name, String typeName) {

    public static ParamView of(ParamInfo param) {
        return new ParamView(param.name(), param.type().name());
    }
}

package org.silverscript.cli.commands;

import org.silverscript.trace.TraceBuilder;
import org.silverscript.trace.TraceException;
import org.silverscript.trace.TraceRequest;
import picocli.CommandLine.Command;

@Command(name = "outline", description = "Prints the constructor parameters and entrypoints of a contract.")
public class OutlineCommand extends ContractCommand {

    @Override
    protected Object run(TraceBuilder builder, TraceRequest request) throws TraceException {
        return builder.outline(request.source());
    }
}

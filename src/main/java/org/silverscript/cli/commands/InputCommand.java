package org.silverscript.cli.commands;

import org.silverscript.trace.TraceBuilder;
import org.silverscript.trace.TraceException;
import org.silverscript.trace.TraceRequest;
import picocli.CommandLine.Command;

@Command(name = "input", description = "Prints the unlocking input for one call without executing it.")
public class InputCommand extends ContractCommand {

    @Override
    protected Object run(TraceBuilder builder, TraceRequest request) throws TraceException {
        return builder.buildUnlockingInput(request);
    }
}

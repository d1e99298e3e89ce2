package org.silverscript.cli.commands;

import org.silverscript.config.DebuggerOptions;
import org.silverscript.trace.TraceBuilder;
import org.silverscript.trace.TraceException;
import org.silverscript.trace.TraceRequest;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "trace", description = "Compiles a contract, runs one call and prints the full execution trace.")
public class TraceCommand extends ContractCommand {

    @Option(names = "--max-steps", description = "Instructions to execute before giving up (default: from configuration).")
    private Long maxSteps;

    @Override
    protected Object run(TraceBuilder builder, TraceRequest request) throws TraceException {
        return builder.buildTrace(request);
    }

    @Override
    protected DebuggerOptions adjust(DebuggerOptions options) {
        return maxSteps == null ? options : options.withMaxSteps(maxSteps);
    }
}

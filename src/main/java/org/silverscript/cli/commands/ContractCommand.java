package org.silverscript.cli.commands;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.typesafe.config.Config;
import org.silverscript.cli.CommandLineInterface;
import org.silverscript.compiler.Compiler;
import org.silverscript.config.DebuggerOptions;
import org.silverscript.trace.TraceBuilder;
import org.silverscript.trace.TraceException;
import org.silverscript.trace.TraceJson;
import org.silverscript.trace.TraceRequest;
import org.silverscript.trace.model.ErrorView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Options and plumbing shared by the commands that work on a contract source.
 * <p>
 * Results go to standard output as JSON. Request failures go to standard error as an
 * {@link ErrorView} and exit with status 1.
 */
abstract class ContractCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(ContractCommand.class);
    static final String DEFAULT_CONTRACT = "contracts/default-contract.sil";

    @Parameters(index = "0", arity = "0..1",
            description = "The contract source file (default: the bundled DebugPoC contract).")
    private File file;

    @Option(names = {"-f", "--function"}, description = "The entrypoint to call (default: the first one).")
    private String function;

    @Option(names = "--ctor-arg", description = "A constructor argument; repeat for each parameter.")
    private List<String> ctorArgs = new ArrayList<>();

    @Option(names = {"-a", "--arg"}, description = "A function argument; repeat for each parameter.")
    private List<String> args = new ArrayList<>();

    @Option(names = "--no-selector", description = "Require a contract with a single entrypoint.")
    private boolean noSelector;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        Config config = parent.getConfig();
        DebuggerOptions options = DebuggerOptions.from(config);
        boolean pretty = config.getBoolean("silverscript.cli.pretty-print");
        String source;
        try {
            source = readSource();
        } catch (IOException e) {
            LOG.error("Could not read contract source: {}", e.getMessage());
            return 2;
        }
        TraceRequest request = new TraceRequest(source, function, ctorArgs, args, noSelector);
        try {
            Object result = run(new TraceBuilder(new Compiler(), adjust(options)), request);
            spec.commandLine().getOut().println(json(result, pretty));
            return 0;
        } catch (TraceException e) {
            LOG.debug("Request failed: {}", e.getMessage());
            spec.commandLine().getErr().println(json(ErrorView.of(e), pretty));
            return 1;
        }
    }

    /**
     * @param builder A builder configured from the loaded options.
     * @param request The request built from the command line.
     * @return The value written as JSON.
     * @throws TraceException if the request fails.
     */
    protected abstract Object run(TraceBuilder builder, TraceRequest request) throws TraceException;

    /**
     * Hook for commands that override configured options.
     */
    protected DebuggerOptions adjust(DebuggerOptions options) {
        return options;
    }

    private String readSource() throws IOException {
        if (file != null) {
            if (!file.exists()) {
                throw new IOException("file not found: " + file.getAbsolutePath());
            }
            return Files.readString(file.toPath(), StandardCharsets.UTF_8);
        }
        try (InputStream in = ContractCommand.class.getClassLoader().getResourceAsStream(DEFAULT_CONTRACT)) {
            if (in == null) {
                throw new IOException("bundled contract " + DEFAULT_CONTRACT + " is missing");
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    static String json(Object value, boolean pretty) throws JsonProcessingException {
        return TraceJson.mapper(pretty).writeValueAsString(value);
    }
}

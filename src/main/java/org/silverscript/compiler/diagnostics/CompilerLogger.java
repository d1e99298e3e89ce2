package org.silverscript.compiler.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs compiler phase progress through SLF4J under the {@code org.silverscript.compiler} category,
 * so the CLI can raise or silence compiler output through the logging configuration alone.
 */
public final class CompilerLogger {

    private static final Logger LOG = LoggerFactory.getLogger("org.silverscript.compiler");

    private CompilerLogger() {}

    /**
     * Logs the completion of a phase.
     * @param phase The phase name.
     * @param contract The contract being compiled.
     * @param startNanos The {@link System#nanoTime()} at which the phase started.
     */
    public static void phase(String phase, String contract, long startNanos) {
        if (LOG.isDebugEnabled()) {
            LOG.debug("{} of '{}' finished in {} us", phase, contract, (System.nanoTime() - startNanos) / 1000);
        }
    }

    public static void info(String msg, Object... args) {
        LOG.info(msg, args);
    }

    public static void debug(String msg, Object... args) {
        LOG.debug(msg, args);
    }

    public static void trace(String msg, Object... args) {
        LOG.trace(msg, args);
    }

    public static void warn(String msg, Object... args) {
        LOG.warn(msg, args);
    }
}

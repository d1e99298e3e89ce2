package org.silverscript.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.silverscript.runtime.tx.TransactionContext;

import java.util.HexFormat;

/**
 * Typed view of the {@code silverscript} configuration block: the step ceiling of debug sessions
 * and the canonical transaction that contracts are executed and signed against.
 *
 * @param maxSteps The maximum number of instructions a debug session executes.
 * @param txVersion The transaction version.
 * @param previousTxId The 32-byte id of the spent transaction.
 * @param outpointIndex The index of the spent output.
 * @param inputSequence The input sequence number.
 * @param sigOpCount The declared signature operation count.
 * @param value The amount of the spent and of the created output.
 * @param lockTime The transaction lock time.
 */
public record DebuggerOptions(
        long maxSteps,
        int txVersion,
        byte[] previousTxId,
        int outpointIndex,
        long inputSequence,
        int sigOpCount,
        long value,
        long lockTime
) {
    private static final String ROOT = "silverscript";

    public DebuggerOptions {
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("max-steps must be positive, got " + maxSteps);
        }
        previousTxId = previousTxId.clone();
    }

    @Override
    public byte[] previousTxId() {
        return previousTxId.clone();
    }

    /**
     * Reads the options from a resolved configuration.
     *
     * @param config The configuration, typically from {@link ConfigLoader#load()}.
     * @return The options.
     * @throws ConfigException if a setting is missing or malformed.
     */
    public static DebuggerOptions from(Config config) {
        Config root = config.getConfig(ROOT);
        Config tx = root.getConfig("transaction");
        String txId = tx.getString("previous-tx-id");
        byte[] previousTxId;
        try {
            previousTxId = HexFormat.of().parseHex(txId);
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(tx.origin(), "previous-tx-id", "not a hex string: " + txId, e);
        }
        if (previousTxId.length != 32) {
            throw new ConfigException.BadValue(tx.origin(), "previous-tx-id", "expected 32 bytes, got " + previousTxId.length);
        }
        return new DebuggerOptions(
                root.getLong("debugger.max-steps"),
                tx.getInt("version"),
                previousTxId,
                tx.getInt("outpoint-index"),
                tx.getLong("input-sequence"),
                tx.getInt("sig-op-count"),
                tx.getLong("value"),
                tx.getLong("lock-time"));
    }

    /**
     * @return The options of the bundled {@code reference.conf}.
     */
    public static DebuggerOptions defaults() {
        return from(ConfigFactory.parseResources("reference.conf").resolve());
    }

    /**
     * @param maxSteps A different step ceiling.
     * @return A copy with that ceiling.
     */
    public DebuggerOptions withMaxSteps(long maxSteps) {
        return new DebuggerOptions(maxSteps, txVersion, previousTxId, outpointIndex, inputSequence, sigOpCount, value, lockTime);
    }

    /**
     * @param lockingScript The contract bytecode.
     * @return The canonical transaction spending and re-creating an output locked by that script.
     */
    public TransactionContext transaction(byte[] lockingScript) {
        return new TransactionContext(txVersion, previousTxId, outpointIndex, inputSequence, sigOpCount, value,
                lockingScript, lockTime);
    }
}

package org.silverscript.runtime.tx;

/**
 * The single-input, single-output transaction a contract is executed against. The locking
 * script of the spent output and of the created output are both the compiled contract.
 *
 * @param version The transaction version.
 * @param previousTxId The 32-byte id of the transaction holding the spent output.
 * @param outpointIndex The index of the spent output.
 * @param inputSequence The input sequence number.
 * @param sigOpCount The declared signature operation count of the input.
 * @param value The amount held by the spent output and paid to the new output.
 * @param lockingScript The contract bytecode.
 * @param lockTime The transaction lock time.
 */
public record TransactionContext(
        int version,
        byte[] previousTxId,
        int outpointIndex,
        long inputSequence,
        int sigOpCount,
        long value,
        byte[] lockingScript,
        long lockTime
) {
    public TransactionContext {
        if (previousTxId.length != 32) {
            throw new IllegalArgumentException("previous transaction id must be 32 bytes, got " + previousTxId.length);
        }
        previousTxId = previousTxId.clone();
        lockingScript = lockingScript.clone();
    }
}

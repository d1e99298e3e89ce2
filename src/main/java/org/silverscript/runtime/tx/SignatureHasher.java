package org.silverscript.runtime.tx;

import org.bouncycastle.crypto.digests.Blake2bDigest;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Computes the canonical digest a contract signature commits to. The digest does not cover the
 * unlocking input, so signatures can be produced before the input is assembled.
 */
public final class SignatureHasher {

    private static final byte[] DOMAIN_KEY = "TransactionSigningHash".getBytes(StandardCharsets.US_ASCII);
    private static final int DIGEST_LENGTH = 32;
    private static final int SCRIPT_VERSION = 0;

    private SignatureHasher() {}

    /**
     * @param tx The transaction.
     * @param hashType The hash type appended to the signature.
     * @return The 32-byte digest.
     */
    public static byte[] hash(TransactionContext tx, SigHashType hashType) {
        byte[] script = tx.lockingScript();
        ByteBuffer buf = ByteBuffer.allocate(128 + 2 * script.length).order(ByteOrder.LITTLE_ENDIAN);
        buf.putShort((short) tx.version());
        buf.put(tx.previousTxId());
        buf.putInt(tx.outpointIndex());
        buf.putLong(tx.inputSequence());
        buf.put((byte) tx.sigOpCount());
        // spent output
        buf.putLong(tx.value());
        buf.putShort((short) SCRIPT_VERSION);
        buf.putLong(script.length);
        buf.put(script);
        // created output
        buf.putLong(tx.value());
        buf.putShort((short) SCRIPT_VERSION);
        buf.putLong(script.length);
        buf.put(script);
        buf.putLong(tx.lockTime());
        buf.put(hashType.toByte());

        Blake2bDigest digest = new Blake2bDigest(DOMAIN_KEY, DIGEST_LENGTH, null, null);
        digest.update(buf.array(), 0, buf.position());
        byte[] out = new byte[DIGEST_LENGTH];
        digest.doFinal(out, 0);
        return out;
    }
}

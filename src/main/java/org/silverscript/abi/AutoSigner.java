package org.silverscript.abi;

import org.silverscript.compiler.api.ParamInfo;
import org.silverscript.compiler.api.ValueType;
import org.silverscript.runtime.tx.SchnorrSigner;
import org.silverscript.runtime.tx.SigHashType;
import org.silverscript.runtime.tx.SignatureHasher;
import org.silverscript.runtime.tx.TransactionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Replaces secret keys given for signature parameters with real signatures.
 * <p>
 * A {@code sig} or {@code datasig} argument whose raw hex is exactly 32 bytes is taken as a
 * secp256k1 secret key. It is replaced by the Schnorr signature over the transaction's
 * {@link SigHashType#ALL} digest followed by the hash-type byte. Any other value, including a
 * 32-byte value that is not a valid key, passes through unchanged. The digest does not cover the
 * unlocking input, so signing before the input exists is sound.
 */
public final class AutoSigner {

    private static final Logger LOG = LoggerFactory.getLogger(AutoSigner.class);
    private static final HexFormat HEX = HexFormat.of();

    private AutoSigner() {}

    /**
     * @param params The function parameters.
     * @param raw The filled raw arguments, one per parameter.
     * @param transaction The transaction the contract will be executed in.
     * @return The raw arguments with secret keys replaced by {@code 0x}-prefixed 65-byte signatures.
     */
    public static List<String> sign(List<ParamInfo> params, List<String> raw, TransactionContext transaction) {
        List<String> out = new ArrayList<>(raw);
        byte[] digest = null;
        for (int i = 0; i < params.size() && i < raw.size(); i++) {
            ValueType.Kind kind = params.get(i).type().kind();
            if (kind != ValueType.Kind.SIG && kind != ValueType.Kind.DATASIG) {
                continue;
            }
            byte[] secret;
            try {
                secret = ArgumentParser.decodeHex(raw.get(i).trim());
            } catch (ArgumentException notHex) {
                continue;
            }
            if (secret.length != SchnorrSigner.KEY_LENGTH) {
                continue;
            }
            if (digest == null) {
                digest = SignatureHasher.hash(transaction, SigHashType.ALL);
            }
            byte[] signature;
            try {
                signature = SchnorrSigner.sign(digest, secret);
            } catch (IllegalArgumentException invalidKey) {
                LOG.debug("Argument '{}' is 32 bytes but not a valid secret key; passing it through", params.get(i).name());
                continue;
            }
            out.set(i, "0x" + HEX.formatHex(signature) + HEX.toHexDigits(SigHashType.ALL.toByte()));
            LOG.debug("Signed argument '{}' with the supplied secret key", params.get(i).name());
        }
        return out;
    }
}

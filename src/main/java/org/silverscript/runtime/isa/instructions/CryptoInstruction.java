package org.silverscript.runtime.isa.instructions;

import org.bouncycastle.crypto.digests.Blake2bDigest;
import org.silverscript.runtime.ExecutionStack;
import org.silverscript.runtime.ParsedOpcode;
import org.silverscript.runtime.ScriptExecutionException;
import org.silverscript.runtime.internal.ExecutionContext;
import org.silverscript.runtime.isa.Instruction;
import org.silverscript.runtime.isa.Opcode;
import org.silverscript.runtime.tx.SchnorrSigner;
import org.silverscript.runtime.tx.SigHashType;
import org.silverscript.runtime.tx.SignatureHasher;

import java.util.Arrays;
import java.util.Optional;

/**
 * Handles hashing and signature verification.
 */
public class CryptoInstruction extends Instruction {

    @Override
    public void execute(ParsedOpcode op, ExecutionContext context) throws ScriptExecutionException {
        Opcode opcode = require(op);
        ExecutionStack stack = context.mainStack();
        switch (opcode) {
            case OP_SHA256 -> stack.push(SchnorrSigner.sha256(stack.pop()));
            case OP_BLAKE2B -> stack.push(blake2b(stack.pop()));
            case OP_CHECKSIG -> stack.pushBool(checkSig(context));
            case OP_CHECKSIGVERIFY -> {
                if (!checkSig(context)) {
                    throw new ScriptExecutionException("OP_CHECKSIGVERIFY failed: signature does not verify");
                }
            }
            default -> throw unsupported(opcode);
        }
    }

    private static boolean checkSig(ExecutionContext context) throws ScriptExecutionException {
        byte[] publicKey = context.mainStack().pop();
        byte[] signature = context.mainStack().pop();
        if (publicKey.length != SchnorrSigner.KEY_LENGTH) {
            throw new ScriptExecutionException("invalid public key length " + publicKey.length + ", expected 32");
        }
        if (signature.length != SchnorrSigner.SIGNATURE_LENGTH + 1) {
            return false;
        }
        Optional<SigHashType> hashType = SigHashType.fromByte(signature[SchnorrSigner.SIGNATURE_LENGTH]);
        if (hashType.isEmpty()) {
            throw new ScriptExecutionException(String.format("unsupported signature hash type 0x%02x",
                    signature[SchnorrSigner.SIGNATURE_LENGTH] & 0xff));
        }
        byte[] digest = SignatureHasher.hash(context.transaction(), hashType.get());
        return SchnorrSigner.verify(digest, publicKey, Arrays.copyOf(signature, SchnorrSigner.SIGNATURE_LENGTH));
    }

    private static byte[] blake2b(byte[] data) {
        Blake2bDigest digest = new Blake2bDigest(256);
        digest.update(data, 0, data.length);
        byte[] out = new byte[32];
        digest.doFinal(out, 0);
        return out;
    }
}

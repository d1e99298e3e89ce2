package org.silverscript.cli.commands;

import org.silverscript.abi.ArgumentException;
import org.silverscript.abi.ArgumentParser;
import org.silverscript.runtime.tx.KeyPair;
import org.silverscript.runtime.tx.SchnorrSigner;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.concurrent.Callable;

/**
 * Prints a key pair usable as a signing key for {@code sig} arguments.
 */
@Command(name = "keygen", description = "Generates a secp256k1 key pair, or derives one from --secret-key.")
public class KeygenCommand implements Callable<Integer> {

    @Option(names = {"-k", "--secret-key"}, description = "Derive the pair from this 32-byte hex secret key.")
    private String secretKey;

    @Spec
    private CommandSpec spec;

    public record KeyPairView(String secretKey, String publicKey, String publicKeyHash) {}

    @Override
    public Integer call() throws Exception {
        KeyPair pair;
        if (secretKey == null) {
            pair = KeyPair.generate(new SecureRandom());
        } else {
            try {
                byte[] key = ArgumentParser.decodeHex(secretKey);
                if (key.length != SchnorrSigner.KEY_LENGTH) {
                    throw new ArgumentException("expected " + SchnorrSigner.KEY_LENGTH + " bytes, got " + key.length);
                }
                pair = KeyPair.fromSecretKey(key);
            } catch (ArgumentException | IllegalArgumentException e) {
                spec.commandLine().getErr().println("invalid secret key: " + e.getMessage());
                return 1;
            }
        }
        HexFormat hex = HexFormat.of();
        KeyPairView view = new KeyPairView("0x" + hex.formatHex(pair.secretKey()), "0x" + hex.formatHex(pair.publicKey()),
                "0x" + hex.formatHex(pair.publicKeyHash()));
        spec.commandLine().getOut().println(ContractCommand.json(view, true));
        return 0;
    }
}

package org.silverscript.runtime.tx;

import org.bouncycastle.crypto.digests.Blake2bDigest;

import java.security.SecureRandom;

/**
 * A secp256k1 key pair with its x-only public key and public key hash.
 *
 * @param secretKey The 32-byte secret key.
 * @param publicKey The 32-byte x-only public key.
 * @param publicKeyHash BLAKE2b-256 of the public key.
 */
public record KeyPair(byte[] secretKey, byte[] publicKey, byte[] publicKeyHash) {

    /**
     * Generates a fresh key pair, retrying until the random bytes form a valid secret key.
     * @param random The randomness source.
     * @return The key pair.
     */
    public static KeyPair generate(SecureRandom random) {
        byte[] secret = new byte[SchnorrSigner.KEY_LENGTH];
        while (true) {
            random.nextBytes(secret);
            try {
                return fromSecretKey(secret);
            } catch (IllegalArgumentException outOfRange) {
                // zero or >= n; draw again
            }
        }
    }

    /**
     * @param secretKey A 32-byte secret key.
     * @return The key pair.
     * @throws IllegalArgumentException if the key is invalid.
     */
    public static KeyPair fromSecretKey(byte[] secretKey) {
        byte[] pub = SchnorrSigner.publicKey(secretKey);
        Blake2bDigest digest = new Blake2bDigest(256);
        digest.update(pub, 0, pub.length);
        byte[] pkh = new byte[32];
        digest.doFinal(pkh, 0);
        return new KeyPair(secretKey.clone(), pub, pkh);
    }
}

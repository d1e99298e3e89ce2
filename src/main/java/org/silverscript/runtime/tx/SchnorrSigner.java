package org.silverscript.runtime.tx;

import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.util.Arrays;
import org.bouncycastle.util.BigIntegers;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

/**
 * BIP-340 Schnorr signatures over secp256k1 with x-only public keys.
 * Signing uses all-zero auxiliary randomness, so signatures are deterministic.
 */
public final class SchnorrSigner {

    private static final X9ECParameters CURVE = CustomNamedCurves.getByName("secp256k1");
    private static final BigInteger N = CURVE.getN();
    private static final BigInteger P = CURVE.getCurve().getField().getCharacteristic();
    private static final ECPoint G = CURVE.getG();
    private static final byte[] ZERO_AUX = new byte[32];

    /** Length of a signature without the hash-type byte. */
    public static final int SIGNATURE_LENGTH = 64;
    /** Length of secret keys, x-only public keys and messages. */
    public static final int KEY_LENGTH = 32;

    private SchnorrSigner() {}

    /**
     * Derives the x-only public key.
     * @param secretKey A 32-byte secret key.
     * @return The 32-byte x coordinate of the public point.
     * @throws IllegalArgumentException if the key is not in {@code [1, n-1]}.
     */
    public static byte[] publicKey(byte[] secretKey) {
        BigInteger d = secretScalar(secretKey);
        return bytes32(G.multiply(d).normalize().getAffineXCoord().toBigInteger());
    }

    /**
     * Signs a 32-byte message.
     * @param message The message digest.
     * @param secretKey The 32-byte secret key.
     * @return The 64-byte signature {@code R.x || s}.
     * @throws IllegalArgumentException for an invalid key or message length.
     */
    public static byte[] sign(byte[] message, byte[] secretKey) {
        if (message.length != KEY_LENGTH) {
            throw new IllegalArgumentException("message must be 32 bytes, got " + message.length);
        }
        BigInteger d0 = secretScalar(secretKey);
        ECPoint pub = G.multiply(d0).normalize();
        BigInteger d = hasEvenY(pub) ? d0 : N.subtract(d0);
        byte[] px = bytes32(pub.getAffineXCoord().toBigInteger());

        byte[] t = bytes32(d);
        byte[] auxHash = taggedHash("BIP0340/aux", ZERO_AUX);
        for (int i = 0; i < t.length; i++) {
            t[i] ^= auxHash[i];
        }
        BigInteger k0 = new BigInteger(1, taggedHash("BIP0340/nonce", Arrays.concatenate(t, px, message))).mod(N);
        if (k0.signum() == 0) {
            throw new IllegalArgumentException("derived nonce is zero");
        }
        ECPoint r = G.multiply(k0).normalize();
        BigInteger k = hasEvenY(r) ? k0 : N.subtract(k0);
        byte[] rx = bytes32(r.getAffineXCoord().toBigInteger());
        BigInteger e = new BigInteger(1, taggedHash("BIP0340/challenge", Arrays.concatenate(rx, px, message))).mod(N);
        byte[] s = bytes32(k.add(e.multiply(d)).mod(N));
        return Arrays.concatenate(rx, s);
    }

    /**
     * Verifies a signature. Malformed inputs verify as false.
     * @param message The 32-byte message digest.
     * @param publicKey The 32-byte x-only public key.
     * @param signature The 64-byte signature.
     * @return {@code true} if the signature is valid.
     */
    public static boolean verify(byte[] message, byte[] publicKey, byte[] signature) {
        if (message.length != KEY_LENGTH || publicKey.length != KEY_LENGTH || signature.length != SIGNATURE_LENGTH) {
            return false;
        }
        ECPoint pub = liftX(new BigInteger(1, publicKey));
        if (pub == null) {
            return false;
        }
        byte[] rBytes = Arrays.copyOfRange(signature, 0, 32);
        BigInteger r = new BigInteger(1, rBytes);
        BigInteger s = new BigInteger(1, Arrays.copyOfRange(signature, 32, 64));
        if (r.compareTo(P) >= 0 || s.compareTo(N) >= 0) {
            return false;
        }
        BigInteger e = new BigInteger(1, taggedHash("BIP0340/challenge", Arrays.concatenate(rBytes, publicKey, message))).mod(N);
        ECPoint point = G.multiply(s).add(pub.multiply(N.subtract(e))).normalize();
        if (point.isInfinity() || !hasEvenY(point)) {
            return false;
        }
        return point.getAffineXCoord().toBigInteger().equals(r);
    }

    private static BigInteger secretScalar(byte[] secretKey) {
        if (secretKey.length != KEY_LENGTH) {
            throw new IllegalArgumentException("secret key must be 32 bytes, got " + secretKey.length);
        }
        BigInteger d = new BigInteger(1, secretKey);
        if (d.signum() == 0 || d.compareTo(N) >= 0) {
            throw new IllegalArgumentException("secret key is out of range");
        }
        return d;
    }

    private static ECPoint liftX(BigInteger x) {
        if (x.compareTo(P) >= 0) {
            return null;
        }
        try {
            return CURVE.getCurve().decodePoint(Arrays.prepend(bytes32(x), (byte) 0x02)).normalize();
        } catch (IllegalArgumentException notOnCurve) {
            return null;
        }
    }

    private static boolean hasEvenY(ECPoint point) {
        return !point.getAffineYCoord().toBigInteger().testBit(0);
    }

    private static byte[] bytes32(BigInteger value) {
        return BigIntegers.asUnsignedByteArray(KEY_LENGTH, value);
    }

    static byte[] taggedHash(String tag, byte[] data) {
        byte[] tagHash = sha256(tag.getBytes(StandardCharsets.UTF_8));
        return sha256(Arrays.concatenate(tagHash, tagHash, data));
    }

    /**
     * @param data Input bytes.
     * @return The SHA-256 digest.
     */
    public static byte[] sha256(byte[] data) {
        SHA256Digest digest = new SHA256Digest();
        digest.update(data, 0, data.length);
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return out;
    }
}

package org.silverscript.runtime.tx;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.HexFormat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SchnorrSigner} against the BIP-340 reference vectors.
 */
@Tag("unit")
class SchnorrSignerTest {

    private static final HexFormat HEX = HexFormat.of();

    /**
     * Vector 0 of BIP-340 uses an all-zero auxiliary random value, which is what the signer uses.
     */
    @Test
    void matchesBip340Vector0() {
        byte[] secret = HEX.parseHex("0000000000000000000000000000000000000000000000000000000000000003");
        byte[] message = new byte[32];

        byte[] publicKey = SchnorrSigner.publicKey(secret);
        byte[] signature = SchnorrSigner.sign(message, secret);

        assertThat(HEX.formatHex(publicKey))
                .isEqualToIgnoringCase("F9308A019258C31049344F85F89D5229B531C845836F99B08601F113BCE036F9");
        assertThat(HEX.formatHex(signature)).isEqualToIgnoringCase(
                "E907831F80848D1069A5371B402410364BDF1C5F8307B0084C55F1CE2DCA8215"
                        + "25F66A4A85EA8B71E482A74F382D2CE5EBEEE8FDB2172F477DF4900D310536C0");
        assertThat(SchnorrSigner.verify(message, publicKey, signature)).isTrue();
    }

    /**
     * Vector 5 of BIP-340: a public key that is not on the curve never verifies.
     */
    @Test
    void rejectsPublicKeyNotOnCurve() {
        byte[] publicKey = HEX.parseHex("EEFDEA4CDB677750A420FEE807EACF21EB9898AE79B9768766E4FAA04A2D4A34");
        byte[] message = HEX.parseHex("243F6A8885A308D313198A2E03707344A4093822299F31D0082EFA98EC4E6C89");
        byte[] signature = HEX.parseHex("6CFF5C3BA86C69EA4B7376F31A9BCB4F74C1976089B2D9963DA2E5543E177769"
                + "69E89B4C5564D00349106B8497785DD7D1D713A8AE82B32FA79D5F7FC407D39B");

        assertThat(SchnorrSigner.verify(message, publicKey, signature)).isFalse();
    }

    @Test
    void rejectsInvalidSecretKeys() {
        assertThatThrownBy(() -> SchnorrSigner.publicKey(new byte[32])).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> KeyPair.fromSecretKey(HEX.parseHex(
                "FFFFFFFFFFFFFFFFFFFFFFFFFFFFFFFEBAAEDCE6AF48A03BBFD25E8CD0364141")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void derivesPublicKeyHash() {
        KeyPair pair = KeyPair.fromSecretKey(HEX.parseHex(
                "0000000000000000000000000000000000000000000000000000000000000001"));
        assertThat(HEX.formatHex(pair.publicKey()))
                .isEqualTo("79be667ef9dcbbac55a06295ce870b07029bfcdb2dce28d959f2815b16f81798");
        assertThat(pair.publicKeyHash()).hasSize(32);
    }
}

package org.silverscript.runtime;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.HexFormat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ScriptNumber}: minimal sign-magnitude encoding, strict decoding and truthiness.
 */
@Tag("unit")
class ScriptNumberTest {

    private static String hex(long value) {
        return HexFormat.of().formatHex(ScriptNumber.encode(value));
    }

    @Test
    void encodesMinimally() {
        assertThat(hex(0)).isEmpty();
        assertThat(hex(1)).isEqualTo("01");
        assertThat(hex(-1)).isEqualTo("81");
        assertThat(hex(127)).isEqualTo("7f");
        assertThat(hex(128)).isEqualTo("8000");
        assertThat(hex(-128)).isEqualTo("8080");
        assertThat(hex(255)).isEqualTo("ff00");
        assertThat(hex(256)).isEqualTo("0001");
        assertThat(hex(Long.MAX_VALUE)).isEqualTo("ffffffffffffff7f");
    }

    @Test
    void decodesWhatItEncodes() throws Exception {
        for (long v : new long[]{0, 1, -1, 127, -128, 32768, -8388608, Long.MAX_VALUE, -Long.MAX_VALUE}) {
            assertThat(ScriptNumber.decode(ScriptNumber.encode(v), ScriptNumber.MAX_LENGTH)).isEqualTo(v);
        }
    }

    /**
     * Operands that are too long or carry a redundant sign byte are rejected.
     */
    @Test
    void rejectsNonMinimalOrOversizedOperands() {
        assertThatThrownBy(() -> ScriptNumber.decode(new byte[]{0x01, 0x00}, 8)).isInstanceOf(ScriptExecutionException.class);
        assertThatThrownBy(() -> ScriptNumber.decode(new byte[]{0x00}, 8)).isInstanceOf(ScriptExecutionException.class);
        assertThatThrownBy(() -> ScriptNumber.decode(new byte[9], 8)).hasMessageContaining("exceeds the limit");
        assertThat(ScriptNumber.isMinimal(new byte[]{(byte) 0xff, 0x00})).isTrue();
    }

    /**
     * Zero and negative zero in any length are false; anything else is true.
     */
    @Test
    void castsToBool() {
        assertThat(ScriptNumber.castToBool(new byte[0])).isFalse();
        assertThat(ScriptNumber.castToBool(new byte[]{0x00, 0x00})).isFalse();
        assertThat(ScriptNumber.castToBool(new byte[]{0x00, (byte) 0x80})).isFalse();
        assertThat(ScriptNumber.castToBool(new byte[]{0x00, 0x01})).isTrue();
        assertThat(ScriptNumber.fromBool(true)).containsExactly(1);
        assertThat(ScriptNumber.fromBool(false)).isEmpty();
    }
}

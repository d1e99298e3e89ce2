package org.silverscript.runtime;

import org.silverscript.runtime.isa.Opcode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.HexFormat;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ScriptBuilder} push encodings and their decoding by {@link ScriptParser}.
 */
@Tag("unit")
class ScriptBuilderTest {

    private static String hex(ScriptBuilder builder) {
        return HexFormat.of().formatHex(builder.build());
    }

    @Test
    void usesSmallIntegerOpcodes() {
        assertThat(hex(new ScriptBuilder().addNumber(0))).isEqualTo("00");
        assertThat(hex(new ScriptBuilder().addNumber(-1))).isEqualTo("4f");
        assertThat(hex(new ScriptBuilder().addNumber(1))).isEqualTo("51");
        assertThat(hex(new ScriptBuilder().addNumber(16))).isEqualTo("60");
        assertThat(hex(new ScriptBuilder().addNumber(17))).isEqualTo("0111");
    }

    /**
     * Lengths up to 75 are pushed directly, longer data uses the PUSHDATA forms with a
     * little-endian length.
     */
    @Test
    void picksShortestPushForm() {
        assertThat(new ScriptBuilder().addData(new byte[75]).size()).isEqualTo(76);
        byte[] pushdata1 = new ScriptBuilder().addData(new byte[76]).build();
        assertThat(pushdata1[0] & 0xff).isEqualTo(Opcode.OP_PUSHDATA1.code());
        assertThat(pushdata1[1] & 0xff).isEqualTo(76);
        byte[] pushdata2 = new ScriptBuilder().addData(new byte[300]).build();
        assertThat(pushdata2[0] & 0xff).isEqualTo(Opcode.OP_PUSHDATA2.code());
        assertThat(pushdata2[1] & 0xff).isEqualTo(0x2c);
        assertThat(pushdata2[2] & 0xff).isEqualTo(0x01);
    }

    /**
     * The parser recovers offsets, lengths and data of every instruction.
     */
    @Test
    void parsesBackInstructions() throws Exception {
        byte[] script = new ScriptBuilder()
                .addNumber(5)
                .addData(new byte[]{0x0a, 0x0b})
                .addData(new byte[80])
                .addOp(Opcode.OP_ADD)
                .build();

        List<ParsedOpcode> ops = ScriptParser.parse(script);

        assertThat(ops).extracting(ParsedOpcode::offset).containsExactly(0, 1, 4, 86);
        assertThat(ops).extracting(ParsedOpcode::name).containsExactly("OP_5", "OP_DATA_2", "OP_PUSHDATA1", "OP_ADD");
        assertThat(ops.get(1).toString()).isEqualTo("OP_DATA_2 0x0a0b");
        assertThat(ops.get(2).data()).hasSize(80);
    }

    @Test
    void rejectsTruncatedPush() {
        assertThatThrownBy(() -> ScriptParser.parse(new byte[]{0x03, 0x01}))
                .isInstanceOf(ScriptExecutionException.class);
    }
}

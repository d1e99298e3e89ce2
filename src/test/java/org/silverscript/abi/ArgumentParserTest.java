package org.silverscript.abi;

import org.silverscript.compiler.api.TypedValue;
import org.silverscript.compiler.api.ValueType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ArgumentParser}.
 */
@Tag("unit")
class ArgumentParserTest {

    @Test
    void parsesIntegers() throws Exception {
        assertThat(ArgumentParser.parse(ValueType.INT, "42")).isEqualTo(TypedValue.ofInt(42));
        assertThat(ArgumentParser.parse(ValueType.INT, " -7 ")).isEqualTo(TypedValue.ofInt(-7));
        assertThat(ArgumentParser.parse(ValueType.INT, "0x10").asLong()).isEqualTo(16);
        assertThat(ArgumentParser.parse(ValueType.INT, "-0xff").asLong()).isEqualTo(-255);
    }

    /**
     * Integers outside the eight-byte operand range are rejected, including the one value whose
     * negation does not exist.
     */
    @Test
    void rejectsIntegersOutOfRange() {
        assertThatThrownBy(() -> ArgumentParser.parse(ValueType.INT, "9223372036854775808"))
                .isInstanceOf(ArgumentException.class)
                .hasMessageContaining("does not fit");
        assertThatThrownBy(() -> ArgumentParser.parse(ValueType.INT, "-9223372036854775808"))
                .isInstanceOf(ArgumentException.class);
        assertThatThrownBy(() -> ArgumentParser.parse(ValueType.INT, "12abc"))
                .hasMessageContaining("malformed integer");
    }

    @Test
    void parsesBoolsAndStrings() throws Exception {
        assertThat(ArgumentParser.parse(ValueType.BOOL, "TRUE").asBool()).isTrue();
        assertThat(ArgumentParser.parse(ValueType.BOOL, "false").bytes()).isEmpty();
        assertThat(ArgumentParser.parse(ValueType.STRING, "\"hi\"")).isEqualTo(TypedValue.ofString("hi"));
        assertThat(ArgumentParser.parse(ValueType.STRING, "'it'")).isEqualTo(TypedValue.ofString("it"));
        assertThatThrownBy(() -> ArgumentParser.parse(ValueType.BOOL, "yes"))
                .hasMessageContaining("expected true or false");
    }

    @Test
    void checksFixedByteLengths() throws Exception {
        assertThat(ArgumentParser.parse(ValueType.bytes(2), "0xabcd").bytes()).containsExactly(0xab, 0xcd);
        assertThat(ArgumentParser.parse(ValueType.BYTES, "abcdef").bytes()).hasSize(3);
        assertThatThrownBy(() -> ArgumentParser.parse(ValueType.bytes(4), "0x00"))
                .hasMessage("bytes4 expects 4 bytes, got 1");
        assertThatThrownBy(() -> ArgumentParser.parse(ValueType.PUBKEY, "0x1234"))
                .isInstanceOf(ArgumentException.class);
        assertThatThrownBy(() -> ArgumentParser.parse(ValueType.BYTES, "0xabc"))
                .hasMessageContaining("malformed hex");
    }

    /**
     * Signature content is not validated here: a wrong-length signature only fails the signature check.
     */
    @Test
    void acceptsSignaturesOfAnyLength() throws Exception {
        assertThat(ArgumentParser.parse(ValueType.SIG, "0x0102").bytes()).hasSize(2);
    }

    @Test
    void encodesArrays() throws Exception {
        TypedValue ints = ArgumentParser.parse(ValueType.arrayOf(ValueType.INT), "[1, -1]");
        assertThat(ints.hex()).isEqualTo("0100000000000000" + "ffffffffffffffff");

        TypedValue bools = ArgumentParser.parse(ValueType.arrayOf(ValueType.BOOL), "[true,false]");
        assertThat(bools.bytes()).containsExactly(1, 0);

        assertThat(ArgumentParser.parse(ValueType.arrayOf(ValueType.INT), "[]").bytes()).isEmpty();
        assertThatThrownBy(() -> ArgumentParser.parse(ValueType.arrayOf(ValueType.bytes(2)), "[0x01]"))
                .hasMessageContaining("element expects 2 bytes");
        assertThatThrownBy(() -> ArgumentParser.parse(ValueType.arrayOf(ValueType.INT), "1, 2"))
                .hasMessageContaining("array literal");
    }
}

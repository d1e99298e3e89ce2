package org.silverscript.runtime.tx;

import java.util.Optional;

/**
 * Signature hash types. The byte is appended to every signature and selects what the digest covers.
 */
public enum SigHashType {
    ALL(0x01);

    private final int value;

    SigHashType(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    public byte toByte() {
        return (byte) value;
    }

    /**
     * @param value A trailing signature byte.
     * @return The matching hash type, or empty if unsupported.
     */
    public static Optional<SigHashType> fromByte(byte value) {
        for (SigHashType t : values()) {
            if (t.value == (value & 0xff)) return Optional.of(t);
        }
        return Optional.empty();
    }
}

package io.scalex.bridge.canonical.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of a cross-chain bridge message.
 *
 * The wire code is the first byte of an encoded message body.
 */
public enum MessageKind {
    DEPOSIT("DEPOSIT", (byte) 1),
    RELEASE("RELEASE", (byte) 2);

    private final String value;
    private final byte code;

    MessageKind(String value, byte code) {
        this.value = value;
        this.code = code;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public byte getCode() {
        return code;
    }

    /**
     * Resolve a kind from its wire code.
     *
     * @param code first byte of an encoded body
     * @return matching kind, or null if the code is unknown
     */
    public static MessageKind fromCode(byte code) {
        for (MessageKind kind : values()) {
            if (kind.code == code) {
                return kind;
            }
        }
        return null;
    }
}

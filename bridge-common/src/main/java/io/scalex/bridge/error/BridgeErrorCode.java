package io.scalex.bridge.error;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Error taxonomy shared by gateways and the hub ledger.
 */
public enum BridgeErrorCode {
    /** Wrong owner, wrong minter, or a delivery not made by the configured transport. */
    UNAUTHORIZED("UNAUTHORIZED", true),
    /** Message origin or sender does not match a registered, active endpoint. */
    UNTRUSTED_ORIGIN("UNTRUSTED_ORIGIN", true),
    NOT_WHITELISTED("NOT_WHITELISTED", false),
    /** Replay of an applied message. Reported as a no-op success, never thrown to callers. */
    ALREADY_PROCESSED("ALREADY_PROCESSED", false),
    UNMAPPED_TOKEN("UNMAPPED_TOKEN", false),
    INSUFFICIENT_BALANCE("INSUFFICIENT_BALANCE", false),
    INSUFFICIENT_FUNDS("INSUFFICIENT_FUNDS", false),
    MALFORMED_MESSAGE("MALFORMED_MESSAGE", false),
    INVALID_MESSAGE_KIND("INVALID_MESSAGE_KIND", false),
    INVALID_AMOUNT("INVALID_AMOUNT", false),
    ZERO_ADDRESS("ZERO_ADDRESS", false),
    CHAIN_NOT_FOUND("CHAIN_NOT_FOUND", false),
    SYNTHETIC_NOT_FOUND("SYNTHETIC_NOT_FOUND", false),
    SYNTHETIC_ALREADY_EXISTS("SYNTHETIC_ALREADY_EXISTS", false),
    TOKEN_ALREADY_WHITELISTED("TOKEN_ALREADY_WHITELISTED", false),
    NOT_CONFIGURED("NOT_CONFIGURED", false),
    DISPATCH_FAILED("DISPATCH_FAILED", false);

    private final String value;
    private final boolean authorization;

    BridgeErrorCode(String value, boolean authorization) {
        this.value = value;
        this.authorization = authorization;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * True for codes raised by caller or origin authentication.
     */
    public boolean isAuthorization() {
        return authorization;
    }
}

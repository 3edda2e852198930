package io.scalex.bridge.error;

/**
 * Failure of a bridge operation.
 * 
 * Every failure leaves the component's state exactly as it was before the call.
 */
public class BridgeException extends RuntimeException {

    private final BridgeErrorCode code;

    public BridgeException(BridgeErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public BridgeException(BridgeErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public BridgeErrorCode getCode() {
        return code;
    }

    public static BridgeException unauthorized(String caller, String action) {
        return new BridgeException(BridgeErrorCode.UNAUTHORIZED,
            String.format("Caller %s is not authorized to %s", caller, action));
    }

    public static BridgeException untrustedOrigin(int originDomain, String sender) {
        return new BridgeException(BridgeErrorCode.UNTRUSTED_ORIGIN,
            String.format("Untrusted origin: domain=%d sender=%s", originDomain, sender));
    }

    public static BridgeException invalidAmount(Object amount) {
        return new BridgeException(BridgeErrorCode.INVALID_AMOUNT,
            "Amount must be positive: " + amount);
    }

    public static BridgeException zeroAddress(String field) {
        return new BridgeException(BridgeErrorCode.ZERO_ADDRESS, field + " must not be the zero address");
    }

    public static BridgeException malformed(String reason) {
        return new BridgeException(BridgeErrorCode.MALFORMED_MESSAGE, "Malformed message body: " + reason);
    }

    @Override
    public String toString() {
        return "BridgeException[" + code.getValue() + "]: " + getMessage();
    }
}

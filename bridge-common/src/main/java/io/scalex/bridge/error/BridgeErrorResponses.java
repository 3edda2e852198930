package io.scalex.bridge.error;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

/**
 * HTTP translation of bridge failures for the REST controllers.
 */
public final class BridgeErrorResponses {

    private BridgeErrorResponses() {
    }

    public static HttpStatus statusOf(BridgeErrorCode code) {
        switch (code) {
            case UNAUTHORIZED:
            case UNTRUSTED_ORIGIN:
                return HttpStatus.FORBIDDEN;
            case CHAIN_NOT_FOUND:
            case SYNTHETIC_NOT_FOUND:
            case UNMAPPED_TOKEN:
                return HttpStatus.NOT_FOUND;
            case INSUFFICIENT_BALANCE:
            case INSUFFICIENT_FUNDS:
            case NOT_WHITELISTED:
            case TOKEN_ALREADY_WHITELISTED:
            case SYNTHETIC_ALREADY_EXISTS:
                return HttpStatus.CONFLICT;
            case NOT_CONFIGURED:
            case DISPATCH_FAILED:
                return HttpStatus.SERVICE_UNAVAILABLE;
            default:
                return HttpStatus.BAD_REQUEST;
        }
    }

    public static ResponseEntity<Map<String, String>> of(BridgeException e) {
        return ResponseEntity.status(statusOf(e.getCode()))
            .body(Map.of(
                "error", e.getCode().getValue(),
                "message", e.getMessage() != null ? e.getMessage() : ""
            ));
    }
}

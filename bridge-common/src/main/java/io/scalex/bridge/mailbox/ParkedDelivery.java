package io.scalex.bridge.mailbox;

import io.scalex.bridge.error.BridgeErrorCode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A delivery the local recipient rejected, kept for operator retry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParkedDelivery {

    private String parkId;

    private MailboxEnvelope envelope;

    private BridgeErrorCode errorCode;

    private String errorMessage;

    private int attempts;

    /**
     * ISO 8601 timestamp of the first failed attempt.
     */
    private String firstFailedAt;

    /**
     * ISO 8601 timestamp of the last attempt.
     */
    private String lastAttemptAt;

    private ParkStatus status;

    public enum ParkStatus {
        PARKED,     // Waiting for a retry
        DELIVERED   // Retried successfully; no longer stored
    }
}

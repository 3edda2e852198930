package io.scalex.bridge.mailbox;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A dispatched message in transit between two domains.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MailboxEnvelope {
    @NotBlank
    private String messageId;

    private int originDomain;

    @NotBlank
    private String sender;

    private int destinationDomain;

    @NotBlank
    private String recipient;

    /**
     * Opaque message body (base64 in JSON).
     */
    @NotNull
    private byte[] body;

    /**
     * Dispatch time, ISO 8601 in JSON.
     */
    private Instant dispatchedAt;
}

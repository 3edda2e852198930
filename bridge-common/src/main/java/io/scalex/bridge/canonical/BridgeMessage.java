package io.scalex.bridge.canonical;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.scalex.bridge.canonical.enums.MessageKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Canonical cross-chain bridge message body.
 * 
 * Carried as the opaque body of a mailbox envelope. The sender of a message is
 * not part of the body; it is attested by the transport.
 * 
 * Amounts are expressed in the sending token's native precision and are never
 * rescaled in transit.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BridgeMessage {
    /**
     * DEPOSIT (source to hub) or RELEASE (hub to source).
     */
    @NotNull
    private MessageKind kind;

    /**
     * Token address. Source token for DEPOSIT, synthetic asset for RELEASE.
     */
    @NotBlank
    private String token;

    /**
     * Account credited on the receiving side.
     */
    @NotBlank
    private String recipient;

    /**
     * Amount in base units.
     */
    @NotNull
    private BigInteger amount;

    /**
     * Domain of the network that built the message.
     */
    private int originDomain;

    /**
     * Per-user sequence number assigned by the sender.
     */
    @NotNull
    private BigInteger sequence;
}

package io.scalex.bridge.canonical;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cross-chain configuration of a gateway or of the hub ledger.
 * 
 * The hub leaves the destination fields unset; its destinations come from the
 * chain registry.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CrossChainConfig {
    /**
     * Address of the only transport allowed to deliver messages.
     */
    private String transportAddress;

    /**
     * Domain of the network this component runs on.
     */
    private int localDomain;

    /**
     * Domain messages are dispatched to (gateways only).
     */
    private Integer destinationDomain;

    /**
     * Trusted counterpart on the destination domain (gateways only).
     */
    private String destinationGateway;
}

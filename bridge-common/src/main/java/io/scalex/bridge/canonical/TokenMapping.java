package io.scalex.bridge.canonical;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Synthetic asset a source token is minted as on the target domain.
 * 
 * Decimals are recorded for auditing and display only. No amount conversion is
 * ever applied between source and synthetic precision.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TokenMapping {
    private int sourceDomain;

    private String sourceToken;

    private int targetDomain;

    private String syntheticToken;

    private int syntheticDecimals;

    private boolean active;

    /**
     * ISO 8601 timestamp of first registration.
     */
    private String registeredAt;

    /**
     * ISO 8601 timestamp of the last overwrite or status change.
     */
    private String updatedAt;

    public TokenMappingKey key() {
        return new TokenMappingKey(sourceDomain, sourceToken, targetDomain);
    }
}

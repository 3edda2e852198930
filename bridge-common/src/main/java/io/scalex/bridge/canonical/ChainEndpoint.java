package io.scalex.bridge.canonical;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.scalex.bridge.canonical.enums.ChainStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Registered remote network and the single gateway trusted on it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChainEndpoint {
    private int domain;

    private String gatewayAddress;

    /**
     * Human readable chain name (optional).
     */
    private String name;

    private ChainStatus status;

    /**
     * ISO 8601 timestamp of the last registration or update.
     */
    private String updatedAt;

    @JsonIgnore
    public boolean isActive() {
        return status == ChainStatus.ACTIVE;
    }
}

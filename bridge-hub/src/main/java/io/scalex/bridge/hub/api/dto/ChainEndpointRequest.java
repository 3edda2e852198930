package io.scalex.bridge.hub.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChainEndpointRequest {

    @NotBlank
    private String gatewayAddress;

    private String name;

    /** Null leaves the status unchanged (new endpoints start active). */
    private Boolean active;
}

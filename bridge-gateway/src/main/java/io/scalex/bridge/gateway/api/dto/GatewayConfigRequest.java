package io.scalex.bridge.gateway.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GatewayConfigRequest {

    @NotNull
    private Integer localDomain;

    @NotNull
    private Integer destinationDomain;

    @NotBlank
    private String destinationGateway;
}

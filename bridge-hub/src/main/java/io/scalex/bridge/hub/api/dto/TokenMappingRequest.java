package io.scalex.bridge.hub.api.dto;

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
public class TokenMappingRequest {

    @NotNull
    private Integer sourceDomain;

    @NotBlank
    private String sourceToken;

    /** Defaults to the hub domain. */
    private Integer targetDomain;

    @NotBlank
    private String syntheticToken;

    @NotNull
    private Integer syntheticDecimals;

    private Boolean active;
}

package io.scalex.bridge.hub.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WithdrawRequest {

    @NotBlank
    private String user;

    @NotBlank
    private String syntheticToken;

    @NotNull
    private BigInteger amount;

    @NotNull
    private Integer targetDomain;

    /** Defaults to the user. */
    private String recipient;
}

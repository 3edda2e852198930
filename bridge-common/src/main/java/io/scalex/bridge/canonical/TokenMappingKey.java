package io.scalex.bridge.canonical;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Key of a token mapping: a source token on a source domain, bridged to a
 * target domain.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TokenMappingKey {
    private int sourceDomain;
    private String sourceToken;
    private int targetDomain;
}

package io.scalex.bridge.canonical.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Registration status of a remote chain endpoint.
 */
public enum ChainStatus {
    ACTIVE("ACTIVE"),
    INACTIVE("INACTIVE");

    private final String value;

    ChainStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}

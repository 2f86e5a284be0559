package com.centralbot.entity;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle state carried by a registry row. A device without a row is
 * unknown or evicted; there is no retained offline state.
 */
public enum DeviceState {
    ONLINE("online");

    private final String wireName;

    DeviceState(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}

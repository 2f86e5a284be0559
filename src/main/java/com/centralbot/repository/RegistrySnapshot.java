package com.centralbot.repository;

import com.centralbot.entity.DeviceStatus;

import java.util.Map;

/**
 * Point-in-time copy of the device registry, ordered by device id.
 */
public record RegistrySnapshot(Map<String, DeviceStatus> devices, int onlineCount) {

    public int totalCount() {
        return devices.size();
    }
}

package io.github.shangor.landrop.core.service;

import io.github.shangor.landrop.core.model.Device;

import java.util.List;

public interface DiscoveryListener {

    default void onDeviceDiscovered(Device device) {
    }

    default void onDeviceOffline(Device device) {
    }

    /**
     * Current online devices, pushed after every change and on refresh.
     */
    default void onDevicesChanged(List<Device> onlineDevices) {
    }

    /**
     * The broadcast endpoint failed and discovery has stopped. It is not restarted automatically.
     */
    default void onDiscoveryFailed(Throwable cause) {
    }
}

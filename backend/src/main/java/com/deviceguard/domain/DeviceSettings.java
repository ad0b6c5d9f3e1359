package com.deviceguard.domain;

public record DeviceSettings(int maxDevices, String blockMessage) {
}

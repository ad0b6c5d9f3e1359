package com.deviceguard.domain;

import java.time.Instant;

public record RegisteredDevice(String customerId, String deviceId, Instant lastSeen) {
}

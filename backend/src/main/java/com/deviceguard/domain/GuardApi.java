package com.deviceguard.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.annotation.Nullable;
import java.time.Instant;
import ru.tinkoff.kora.json.common.annotation.Json;
import ru.tinkoff.kora.json.common.annotation.JsonField;

public final class GuardApi {
    private GuardApi() {
    }

    @Json
    public record DeviceCheckRequest(@Nullable @JsonField("customer_id") String customerId,
                                     @Nullable @JsonField("device_id") String deviceId) {
    }

    @Json
    public record SettingsUpdateRequest(@Nullable @JsonField("max_devices") Integer maxDevices,
                                        @Nullable @JsonField("block_message") String blockMessage) {
    }

    @Json
    public record CustomerLimitRequest(@Nullable @JsonField("max_devices") Integer maxDevices) {
    }

    public record SettingsResponse(@JsonProperty("max_devices") int maxDevices,
                                   @JsonProperty("block_message") String blockMessage) {
    }

    public record DeviceCheckResponse(@JsonProperty("status") String status,
                                      @JsonProperty("reason") String reason,
                                      @JsonProperty("message") String message) {
    }

    public record CustomerLimitResponse(@JsonProperty("customer_id") String customerId,
                                        @JsonProperty("max_devices") int maxDevices,
                                        @JsonProperty("block_message") String blockMessage,
                                        @JsonProperty("source") String source) {
    }

    public record DeviceSummary(@JsonProperty("device_id") String deviceId,
                                @JsonProperty("last_seen") Instant lastSeen) {
    }

    public record OkResponse(@JsonProperty("ok") boolean ok) {
    }

    public record HealthResponse(@JsonProperty("status") String status,
                                 @JsonProperty("database") String database) {
    }
}

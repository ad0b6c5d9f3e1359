package com.deviceguard.service;

import jakarta.annotation.Nullable;
import java.util.Optional;

public interface SettingsStore {

    record SettingsRow(@Nullable Integer maxDevices, @Nullable String blockMessage) {
    }

    Optional<SettingsRow> findGlobal();

    void upsertGlobal(int maxDevices, String blockMessage);

    Optional<Integer> findCustomerLimit(String customerId);

    void upsertCustomerLimit(String customerId, int maxDevices);

    boolean deleteCustomerLimit(String customerId);
}

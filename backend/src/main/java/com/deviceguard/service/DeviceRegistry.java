package com.deviceguard.service;

import com.deviceguard.domain.RegisteredDevice;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

public interface DeviceRegistry {

    interface CustomerDevices {
        Set<String> deviceIds();

        // a failure leaves the surrounding transaction usable
        void touch(String deviceId);

        void register(String deviceId);
    }

    <T> T withCustomerLock(String customerId, Function<CustomerDevices, T> work);

    List<RegisteredDevice> listDevices(String customerId);
}

package com.deviceguard.service;

import com.deviceguard.config.AppConfig;
import com.deviceguard.domain.AdmissionDecision;
import com.deviceguard.domain.EffectiveSettings;
import com.deviceguard.domain.RegisteredDevice;
import jakarta.annotation.Nullable;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.tinkoff.kora.common.Component;

@Component
public final class DeviceAdmissionService {
    private static final Logger logger = LoggerFactory.getLogger(DeviceAdmissionService.class);

    private final SettingsService settingsService;
    private final DeviceRegistry deviceRegistry;
    private final AppConfig appConfig;

    public DeviceAdmissionService(SettingsService settingsService,
                                  DeviceRegistry deviceRegistry,
                                  AppConfig appConfig) {
        this.settingsService = settingsService;
        this.deviceRegistry = deviceRegistry;
        this.appConfig = appConfig;
    }

    public AdmissionDecision check(@Nullable String customerId, @Nullable String deviceId) {
        String customer = normalize(customerId);
        String device = normalize(deviceId);
        if (customer == null || device == null) {
            throw ApiException.badRequest("customer_id_and_device_id_required");
        }

        EffectiveSettings settings = settingsService.effectiveFor(customer);
        var messages = appConfig.admission();

        return deviceRegistry.withCustomerLock(customer, devices -> {
            if (devices.deviceIds().contains(device)) {
                try {
                    devices.touch(device);
                } catch (RuntimeException e) {
                    logger.warn("Cannot refresh last_seen for customer {} device {}: {}", customer, device, e.getMessage());
                }
                return AdmissionDecision.allowed(AdmissionDecision.Reason.ALREADY_REGISTERED, messages.alreadyRegisteredMessage());
            }

            int registered = devices.deviceIds().size();
            if (registered < settings.maxDevices()) {
                devices.register(device);
                logger.info("Device {} registered for customer {} ({}/{})", device, customer, registered + 1, settings.maxDevices());
                return AdmissionDecision.allowed(AdmissionDecision.Reason.REGISTERED, messages.registeredMessage());
            }

            logger.info("Device {} denied for customer {}: limit {} reached", device, customer, settings.maxDevices());
            return AdmissionDecision.denied(settings.blockMessage());
        });
    }

    public List<RegisteredDevice> listDevices(@Nullable String customerId) {
        String customer = normalize(customerId);
        if (customer == null) {
            throw ApiException.badRequest("customer_id_required");
        }
        return deviceRegistry.listDevices(customer);
    }

    @Nullable
    private static String normalize(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}

package com.deviceguard.service;

import com.deviceguard.config.AppConfig;
import com.deviceguard.domain.DeviceSettings;
import com.deviceguard.domain.EffectiveSettings;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.tinkoff.kora.common.Component;

@Component
public final class SettingsService {
    private static final Logger logger = LoggerFactory.getLogger(SettingsService.class);

    private final SettingsStore store;
    private final AppConfig appConfig;

    public SettingsService(SettingsStore store, AppConfig appConfig) {
        this.store = store;
        this.appConfig = appConfig;
    }

    public DeviceSettings current() {
        try {
            return resolve(store.findGlobal());
        } catch (RuntimeException e) {
            logger.warn("Settings read failed, using defaults: {}", e.getMessage());
            return defaults();
        }
    }

    public EffectiveSettings effectiveFor(String customerId) {
        try {
            Optional<SettingsStore.SettingsRow> global = store.findGlobal();
            DeviceSettings base = resolve(global);
            Optional<Integer> customerLimit = store.findCustomerLimit(customerId).filter(limit -> limit > 0);
            if (customerLimit.isPresent()) {
                return new EffectiveSettings(customerLimit.get(), base.blockMessage(), EffectiveSettings.Source.CUSTOMER);
            }
            var source = global.isPresent() ? EffectiveSettings.Source.GLOBAL : EffectiveSettings.Source.DEFAULT;
            return new EffectiveSettings(base.maxDevices(), base.blockMessage(), source);
        } catch (RuntimeException e) {
            logger.warn("Settings read for customer {} failed, using defaults: {}", customerId, e.getMessage());
            DeviceSettings fallback = defaults();
            return new EffectiveSettings(fallback.maxDevices(), fallback.blockMessage(), EffectiveSettings.Source.DEFAULT);
        }
    }

    public void update(Integer maxDevices, String blockMessage) {
        requirePositive(maxDevices);
        if (blockMessage == null || blockMessage.isBlank()) {
            throw ApiException.badRequest("block_message_required");
        }
        store.upsertGlobal(maxDevices, blockMessage);
        logger.info("Settings updated: max_devices={}", maxDevices);
    }

    public void setCustomerLimit(String customerId, Integer maxDevices) {
        String customer = requireCustomer(customerId);
        requirePositive(maxDevices);
        store.upsertCustomerLimit(customer, maxDevices);
        logger.info("Customer {} limit set to {}", customer, maxDevices);
    }

    public void clearCustomerLimit(String customerId) {
        String customer = requireCustomer(customerId);
        if (!store.deleteCustomerLimit(customer)) {
            throw ApiException.notFound("customer_limit_not_found");
        }
        logger.info("Customer {} limit cleared", customer);
    }

    public EffectiveSettings customerLimit(String customerId) {
        return effectiveFor(requireCustomer(customerId));
    }

    private DeviceSettings resolve(Optional<SettingsStore.SettingsRow> row) {
        DeviceSettings fallback = defaults();
        if (row.isEmpty()) {
            return fallback;
        }
        Integer maxDevices = row.get().maxDevices();
        String blockMessage = row.get().blockMessage();
        return new DeviceSettings(
            maxDevices == null || maxDevices <= 0 ? fallback.maxDevices() : maxDevices,
            blockMessage == null || blockMessage.isBlank() ? fallback.blockMessage() : blockMessage
        );
    }

    private DeviceSettings defaults() {
        var admission = appConfig.admission();
        return new DeviceSettings(admission.defaultMaxDevices(), admission.defaultBlockMessage());
    }

    private static void requirePositive(Integer maxDevices) {
        if (maxDevices == null || maxDevices < 1) {
            throw ApiException.badRequest("max_devices_must_be_positive");
        }
    }

    private static String requireCustomer(String customerId) {
        if (customerId == null || customerId.isBlank()) {
            throw ApiException.badRequest("customer_id_required");
        }
        return customerId.trim();
    }
}

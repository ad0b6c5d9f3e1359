package com.deviceguard.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.deviceguard.TestAppConfig;
import com.deviceguard.domain.DeviceSettings;
import com.deviceguard.domain.EffectiveSettings;
import org.junit.jupiter.api.Test;

class SettingsServiceTest {

    private final InMemorySettingsStore store = new InMemorySettingsStore();
    private final SettingsService service = new SettingsService(store, new TestAppConfig());

    @Test
    void returnsDefaultsWhenNothingStored() {
        assertThat(service.current()).isEqualTo(new DeviceSettings(2, TestAppConfig.DEFAULT_BLOCK_MESSAGE));
        assertThat(service.effectiveFor("c1").source()).isEqualTo(EffectiveSettings.Source.DEFAULT);
    }

    @Test
    void returnsStoredSettingsAfterUpdate() {
        service.update(5, "Limite atingido");

        assertThat(service.current()).isEqualTo(new DeviceSettings(5, "Limite atingido"));
        EffectiveSettings effective = service.effectiveFor("c1");
        assertThat(effective.maxDevices()).isEqualTo(5);
        assertThat(effective.source()).isEqualTo(EffectiveSettings.Source.GLOBAL);
    }

    @Test
    void blockMessageIsStoredVerbatim() {
        String message = "  Você está logado em muitos dispositivos.\n";

        service.update(2, message);

        assertThat(service.current().blockMessage()).isEqualTo(message);
        assertThat(service.effectiveFor("c1").blockMessage()).isEqualTo(message);
    }

    @Test
    void nonPositiveOrMissingStoredValuesFallBackPerField() {
        store.storeRaw(0, "custom");
        assertThat(service.current()).isEqualTo(new DeviceSettings(2, "custom"));

        store.storeRaw(4, " ");
        assertThat(service.current()).isEqualTo(new DeviceSettings(4, TestAppConfig.DEFAULT_BLOCK_MESSAGE));

        store.storeRaw(null, null);
        assertThat(service.current()).isEqualTo(new DeviceSettings(2, TestAppConfig.DEFAULT_BLOCK_MESSAGE));
    }

    @Test
    void unreachableStoreDegradesToDefaults() {
        store.unavailable();

        assertThat(service.current()).isEqualTo(new DeviceSettings(2, TestAppConfig.DEFAULT_BLOCK_MESSAGE));
        EffectiveSettings effective = service.effectiveFor("c1");
        assertThat(effective.maxDevices()).isEqualTo(2);
        assertThat(effective.source()).isEqualTo(EffectiveSettings.Source.DEFAULT);
    }

    @Test
    void updateValidatesInput() {
        assertThatThrownBy(() -> service.update(0, "msg"))
            .isInstanceOf(ApiException.class)
            .hasMessageContaining("max_devices_must_be_positive");
        assertThatThrownBy(() -> service.update(null, "msg")).isInstanceOf(ApiException.class);
        assertThatThrownBy(() -> service.update(2, " "))
            .isInstanceOf(ApiException.class)
            .hasMessageContaining("block_message_required");
    }

    @Test
    void customerLimitKeepsGlobalBlockMessage() {
        service.update(1, "blocked");
        service.setCustomerLimit(" vip ", 4);

        EffectiveSettings vip = service.customerLimit("vip");
        assertThat(vip.maxDevices()).isEqualTo(4);
        assertThat(vip.blockMessage()).isEqualTo("blocked");
        assertThat(vip.source()).isEqualTo(EffectiveSettings.Source.CUSTOMER);
    }

    @Test
    void clearingCustomerLimitRestoresGlobal() {
        service.update(3, "blocked");
        service.setCustomerLimit("vip", 10);

        service.clearCustomerLimit("vip");

        assertThat(service.customerLimit("vip").maxDevices()).isEqualTo(3);
        assertThatThrownBy(() -> service.clearCustomerLimit("vip"))
            .isInstanceOf(ApiException.class)
            .satisfies(e -> assertThat(((ApiException) e).status()).isEqualTo(404));
    }

    @Test
    void customerLimitValidatesInput() {
        assertThatThrownBy(() -> service.setCustomerLimit("", 2))
            .isInstanceOf(ApiException.class)
            .hasMessageContaining("customer_id_required");
        assertThatThrownBy(() -> service.setCustomerLimit("c1", -1))
            .isInstanceOf(ApiException.class)
            .hasMessageContaining("max_devices_must_be_positive");
    }
}

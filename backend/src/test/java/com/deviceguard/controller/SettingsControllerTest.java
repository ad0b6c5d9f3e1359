package com.deviceguard.controller;

import static org.assertj.core.api.Assertions.assertThat;

import com.deviceguard.TestAppConfig;
import com.deviceguard.domain.GuardApi;
import com.deviceguard.service.InMemorySettingsStore;
import com.deviceguard.service.SettingsService;
import org.junit.jupiter.api.Test;

class SettingsControllerTest {

    private final InMemorySettingsStore store = new InMemorySettingsStore();
    private final RecordingResponseFactory responses = new RecordingResponseFactory();
    private final SettingsController controller = new SettingsController(
        new SettingsService(store, new TestAppConfig()), responses);

    @Test
    void updateReturnsOkAndIsVisibleOnRead() {
        controller.update(new GuardApi.SettingsUpdateRequest(4, "blocked"));

        assertThat(responses.status()).isEqualTo(200);
        assertThat(responses.body()).isEqualTo("{\"ok\":true}");

        controller.get();

        assertThat(responses.status()).isEqualTo(200);
        assertThat(responses.body()).isEqualTo("{\"block_message\":\"blocked\",\"max_devices\":4}");
    }

    @Test
    void readReturnsDefaultsWhenStoreIsDown() {
        store.unavailable();

        controller.get();

        assertThat(responses.status()).isEqualTo(200);
        assertThat(responses.body()).contains("\"max_devices\":2");
    }

    @Test
    void invalidUpdatesAreBadRequests() {
        controller.update(new GuardApi.SettingsUpdateRequest(0, "blocked"));
        assertThat(responses.status()).isEqualTo(400);
        assertThat(responses.body()).isEqualTo("{\"error\":\"max_devices_must_be_positive\"}");

        controller.update(new GuardApi.SettingsUpdateRequest(null, "blocked"));
        assertThat(responses.status()).isEqualTo(400);

        controller.update(new GuardApi.SettingsUpdateRequest(3, "   "));
        assertThat(responses.status()).isEqualTo(400);
        assertThat(responses.body()).isEqualTo("{\"error\":\"block_message_required\"}");

        controller.update(null);
        assertThat(responses.status()).isEqualTo(400);
        assertThat(responses.body()).isEqualTo("{\"error\":\"request_body_required\"}");
    }

    @Test
    void storeFailureOnUpdateIsInternalError() {
        store.unavailable();

        controller.update(new GuardApi.SettingsUpdateRequest(3, "blocked"));

        assertThat(responses.status()).isEqualTo(500);
        assertThat(responses.body()).isEqualTo("{\"error\":\"internal_error\"}");
    }
}

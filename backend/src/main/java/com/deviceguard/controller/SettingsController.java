package com.deviceguard.controller;

import com.deviceguard.domain.DeviceSettings;
import com.deviceguard.domain.GuardApi;
import com.deviceguard.service.ApiException;
import com.deviceguard.service.SettingsService;
import com.deviceguard.util.HttpResponseFactory;
import jakarta.annotation.Nullable;
import ru.tinkoff.kora.common.Component;
import ru.tinkoff.kora.http.common.HttpMethod;
import ru.tinkoff.kora.http.common.annotation.HttpRoute;
import ru.tinkoff.kora.http.server.common.HttpServerResponse;
import ru.tinkoff.kora.http.server.common.annotation.HttpController;
import ru.tinkoff.kora.json.common.annotation.Json;

@Component
@HttpController
public final class SettingsController {
    private final SettingsService settingsService;
    private final HttpResponseFactory responses;

    public SettingsController(SettingsService settingsService, HttpResponseFactory responses) {
        this.settingsService = settingsService;
        this.responses = responses;
    }

    @HttpRoute(method = HttpMethod.GET, path = "/api/settings")
    public HttpServerResponse get() {
        try {
            DeviceSettings settings = settingsService.current();
            return responses.json(200, new GuardApi.SettingsResponse(settings.maxDevices(), settings.blockMessage()));
        } catch (Exception e) {
            return responses.internalError(e);
        }
    }

    @HttpRoute(method = HttpMethod.POST, path = "/api/settings")
    public HttpServerResponse update(@Nullable @Json GuardApi.SettingsUpdateRequest request) {
        try {
            if (request == null) {
                throw ApiException.badRequest("request_body_required");
            }
            settingsService.update(request.maxDevices(), request.blockMessage());
            return responses.json(200, new GuardApi.OkResponse(true));
        } catch (ApiException e) {
            return responses.fromException(e);
        } catch (Exception e) {
            return responses.internalError(e);
        }
    }
}

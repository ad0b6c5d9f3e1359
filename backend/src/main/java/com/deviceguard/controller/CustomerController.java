package com.deviceguard.controller;

import com.deviceguard.domain.EffectiveSettings;
import com.deviceguard.domain.GuardApi;
import com.deviceguard.service.ApiException;
import com.deviceguard.service.DeviceAdmissionService;
import com.deviceguard.service.SettingsService;
import com.deviceguard.util.HttpResponseFactory;
import jakarta.annotation.Nullable;
import java.util.List;
import ru.tinkoff.kora.common.Component;
import ru.tinkoff.kora.http.common.HttpMethod;
import ru.tinkoff.kora.http.common.annotation.HttpRoute;
import ru.tinkoff.kora.http.common.annotation.Path;
import ru.tinkoff.kora.http.server.common.HttpServerResponse;
import ru.tinkoff.kora.http.server.common.annotation.HttpController;
import ru.tinkoff.kora.json.common.annotation.Json;

@Component
@HttpController
public final class CustomerController {
    private final DeviceAdmissionService admissionService;
    private final SettingsService settingsService;
    private final HttpResponseFactory responses;

    public CustomerController(DeviceAdmissionService admissionService,
                              SettingsService settingsService,
                              HttpResponseFactory responses) {
        this.admissionService = admissionService;
        this.settingsService = settingsService;
        this.responses = responses;
    }

    @HttpRoute(method = HttpMethod.GET, path = "/api/customers/{customerId}/devices")
    public HttpServerResponse listDevices(@Path("customerId") String customerId) {
        try {
            List<GuardApi.DeviceSummary> devices = admissionService.listDevices(customerId).stream()
                .map(device -> new GuardApi.DeviceSummary(device.deviceId(), device.lastSeen()))
                .toList();
            return responses.json(200, devices);
        } catch (ApiException e) {
            return responses.fromException(e);
        } catch (Exception e) {
            return responses.internalError(e);
        }
    }

    @HttpRoute(method = HttpMethod.GET, path = "/api/customers/{customerId}/limit")
    public HttpServerResponse getLimit(@Path("customerId") String customerId) {
        try {
            EffectiveSettings settings = settingsService.customerLimit(customerId);
            return responses.json(200, new GuardApi.CustomerLimitResponse(
                customerId.trim(),
                settings.maxDevices(),
                settings.blockMessage(),
                settings.source().code()
            ));
        } catch (ApiException e) {
            return responses.fromException(e);
        } catch (Exception e) {
            return responses.internalError(e);
        }
    }

    @HttpRoute(method = HttpMethod.PUT, path = "/api/customers/{customerId}/limit")
    public HttpServerResponse setLimit(@Path("customerId") String customerId,
                                       @Nullable @Json GuardApi.CustomerLimitRequest request) {
        try {
            if (request == null) {
                throw ApiException.badRequest("request_body_required");
            }
            settingsService.setCustomerLimit(customerId, request.maxDevices());
            return responses.json(200, new GuardApi.OkResponse(true));
        } catch (ApiException e) {
            return responses.fromException(e);
        } catch (Exception e) {
            return responses.internalError(e);
        }
    }

    @HttpRoute(method = HttpMethod.DELETE, path = "/api/customers/{customerId}/limit")
    public HttpServerResponse clearLimit(@Path("customerId") String customerId) {
        try {
            settingsService.clearCustomerLimit(customerId);
            return responses.json(200, new GuardApi.OkResponse(true));
        } catch (ApiException e) {
            return responses.fromException(e);
        } catch (Exception e) {
            return responses.internalError(e);
        }
    }
}

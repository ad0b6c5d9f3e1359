package com.deviceguard.controller;

import com.deviceguard.domain.AdmissionDecision;
import com.deviceguard.domain.GuardApi;
import com.deviceguard.service.ApiException;
import com.deviceguard.service.DeviceAdmissionService;
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
public final class DeviceCheckController {
    private final DeviceAdmissionService admissionService;
    private final HttpResponseFactory responses;

    public DeviceCheckController(DeviceAdmissionService admissionService, HttpResponseFactory responses) {
        this.admissionService = admissionService;
        this.responses = responses;
    }

    @HttpRoute(method = HttpMethod.POST, path = "/api/device-check")
    public HttpServerResponse check(@Nullable @Json GuardApi.DeviceCheckRequest request) {
        try {
            if (request == null) {
                throw ApiException.badRequest("request_body_required");
            }
            AdmissionDecision decision = admissionService.check(request.customerId(), request.deviceId());
            if (!decision.allowed()) {
                return responses.error(403, decision.message());
            }
            return responses.json(200, new GuardApi.DeviceCheckResponse("ok", decision.reason().code(), decision.message()));
        } catch (ApiException e) {
            return responses.fromException(e);
        } catch (Exception e) {
            return responses.internalError(e);
        }
    }
}

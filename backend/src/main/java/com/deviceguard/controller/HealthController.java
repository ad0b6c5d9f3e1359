package com.deviceguard.controller;

import com.deviceguard.dao.DbClient;
import com.deviceguard.domain.GuardApi;
import com.deviceguard.util.HttpResponseFactory;
import ru.tinkoff.kora.common.Component;
import ru.tinkoff.kora.http.common.HttpMethod;
import ru.tinkoff.kora.http.common.annotation.HttpRoute;
import ru.tinkoff.kora.http.server.common.HttpServerResponse;
import ru.tinkoff.kora.http.server.common.annotation.HttpController;

@Component
@HttpController
public final class HealthController {
    private final DbClient dbClient;
    private final HttpResponseFactory responses;

    public HealthController(DbClient dbClient, HttpResponseFactory responses) {
        this.dbClient = dbClient;
        this.responses = responses;
    }

    @HttpRoute(method = HttpMethod.GET, path = "/api/health")
    public HttpServerResponse health() {
        if (dbClient.healthCheck()) {
            return responses.json(200, new GuardApi.HealthResponse("ok", "up"));
        }
        return responses.json(503, new GuardApi.HealthResponse("degraded", "down"));
    }
}

package com.deviceguard.util;

import com.deviceguard.service.ApiException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.tinkoff.kora.common.Component;
import ru.tinkoff.kora.http.common.body.HttpBody;
import ru.tinkoff.kora.http.common.header.HttpHeaders;
import ru.tinkoff.kora.http.server.common.HttpServerResponse;
import ru.tinkoff.kora.http.server.common.SimpleHttpServerResponse;

@Component
public class HttpResponseFactory {
    private static final Logger logger = LoggerFactory.getLogger(HttpResponseFactory.class);

    public HttpServerResponse json(int statusCode, Object value) {
        return new SimpleHttpServerResponse(
            statusCode,
            HttpHeaders.of("Content-Type", "application/json; charset=utf-8"),
            HttpBody.plaintext(Jsons.stringify(value))
        );
    }

    public HttpServerResponse error(int statusCode, String message) {
        return json(statusCode, Map.of("error", message));
    }

    public HttpServerResponse fromException(ApiException e) {
        return error(e.status(), e.publicMessage());
    }

    public HttpServerResponse internalError(Exception e) {
        logger.error("Unhandled server error", e);
        return error(500, "internal_error");
    }
}

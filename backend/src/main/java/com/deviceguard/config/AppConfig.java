package com.deviceguard.config;

import ru.tinkoff.kora.config.common.annotation.ConfigSource;
import ru.tinkoff.kora.config.common.annotation.ConfigValueExtractor;

@ConfigSource("app")
@ConfigValueExtractor
public interface AppConfig {
    AdmissionConfig admission();

    @ConfigValueExtractor
    interface AdmissionConfig {
        int defaultMaxDevices();
        String defaultBlockMessage();
        String registeredMessage();
        String alreadyRegisteredMessage();
    }
}

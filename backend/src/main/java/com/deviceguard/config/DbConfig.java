package com.deviceguard.config;

import java.time.Duration;
import ru.tinkoff.kora.config.common.annotation.ConfigSource;
import ru.tinkoff.kora.config.common.annotation.ConfigValueExtractor;

@ConfigSource("db")
@ConfigValueExtractor
public interface DbConfig {
    String jdbcUrl();
    String username();
    String password();
    int maxPoolSize();
    String poolName();
    Duration connectionTimeout();
    Duration idleTimeout();
    Duration validationTimeout();

    int connectRetries();

    // attempt n waits n * retryDelay
    Duration retryDelay();
}

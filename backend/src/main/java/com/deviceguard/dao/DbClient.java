package com.deviceguard.dao;

import com.deviceguard.config.DbConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.tinkoff.kora.common.Component;

@Component
public final class DbClient implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(DbClient.class);

    private final HikariDataSource dataSource;
    private final int connectRetries;
    private final Duration retryDelay;
    private final int validationTimeoutSec;

    public DbClient(DbConfig dbConfig) {
        var cfg = new HikariConfig();
        cfg.setJdbcUrl(dbConfig.jdbcUrl());
        cfg.setUsername(dbConfig.username());
        cfg.setPassword(dbConfig.password());
        cfg.setMaximumPoolSize(dbConfig.maxPoolSize());
        cfg.setPoolName(dbConfig.poolName());
        cfg.setConnectionTimeout(dbConfig.connectionTimeout().toMillis());
        cfg.setIdleTimeout(dbConfig.idleTimeout().toMillis());
        cfg.setValidationTimeout(dbConfig.validationTimeout().toMillis());
        // connectivity is verified by open(), not by the pool constructor
        cfg.setInitializationFailTimeout(-1);
        cfg.setAutoCommit(true);
        this.dataSource = new HikariDataSource(cfg);
        this.connectRetries = Math.max(0, dbConfig.connectRetries());
        this.retryDelay = dbConfig.retryDelay();
        this.validationTimeoutSec = (int) Math.max(1, dbConfig.validationTimeout().toSeconds());
    }

    public void open() {
        if (dataSource.isClosed()) {
            throw new IllegalStateException("Connection pool " + dataSource.getPoolName() + " is closed");
        }

        int attempts = connectRetries + 1;
        SQLException last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                ping();
                logger.info("Database connection established (pool {})", dataSource.getPoolName());
                return;
            } catch (SQLException e) {
                last = e;
                if (attempt < attempts) {
                    long delayMs = retryDelay.toMillis() * attempt;
                    logger.warn("Database connection attempt {}/{} failed: {}. Retrying in {} ms",
                        attempt, attempts, e.getMessage(), delayMs);
                    sleep(delayMs);
                }
            }
        }

        logger.error("Failed to initialize database connection after {} attempts: {} ({})",
            attempts, last.getMessage(), diagnose(last));
        throw new DatabaseUnavailableException("Database unavailable after " + attempts + " attempts", last);
    }

    public boolean healthCheck() {
        if (dataSource.isClosed()) {
            return false;
        }
        try {
            ping();
            return true;
        } catch (SQLException e) {
            logger.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public DataSource dataSource() {
        return dataSource;
    }

    @Override
    public void close() {
        dataSource.close();
        logger.info("Database connection pool {} closed", dataSource.getPoolName());
    }

    private void ping() throws SQLException {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement st = connection.prepareStatement("SELECT 1")) {
            st.setQueryTimeout(validationTimeoutSec);
            try (ResultSet rs = st.executeQuery()) {
                rs.next();
            }
        }
    }

    static String diagnose(SQLException e) {
        String state = sqlState(e);
        if (state == null) {
            return "check database server logs for more information";
        }
        return switch (state) {
            case "28P01", "28000" -> "authentication failed, check username/password";
            case "3D000" -> "database does not exist";
            case "08001", "08006", "08004" -> "database server is down or not accepting connections";
            default -> "SQL state " + state + ", check database server logs for more information";
        };
    }

    private static String sqlState(SQLException e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof SQLException sql && sql.getSQLState() != null) {
                return sql.getSQLState();
            }
            current = current.getCause();
        }
        return null;
    }

    private static void sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DatabaseUnavailableException("Interrupted while waiting to reconnect", e);
        }
    }
}

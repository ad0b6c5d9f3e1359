package com.deviceguard.service;

import com.deviceguard.dao.DbClient;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.tinkoff.kora.common.Component;
import ru.tinkoff.kora.common.annotation.Root;

@Component
@Root
public final class MigrationRunner {
    private static final Logger logger = LoggerFactory.getLogger(MigrationRunner.class);

    private static final List<String> REQUIRED_TABLES = List.of("settings", "customers", "devices", "customer_limits");
    private static final String SCHEMA_SCRIPT = "/db/migration/V1__init.sql";

    public MigrationRunner(DbClient dbClient) {
        dbClient.open();

        var flyway = Flyway.configure()
            .dataSource(dbClient.dataSource())
            .locations("classpath:db/migration")
            .load();

        int executed = 0;
        try {
            var result = flyway.migrate();
            executed = result.migrationsExecuted;
        } catch (Exception e) {
            logger.warn("Flyway migration execution failed, fallback SQL migrator will be used: {}", e.getMessage());
        }
        logger.info("Flyway migrations executed: {}", executed);

        List<String> missing = missingTables(dbClient);
        if (!missing.isEmpty()) {
            logger.warn("Tables {} missing after Flyway run, applying fallback schema script", missing);
            runSqlScript(dbClient, SCHEMA_SCRIPT);
        }
    }

    private List<String> missingTables(DbClient dbClient) {
        String sql = """
            SELECT 1
            FROM information_schema.tables
            WHERE table_schema = current_schema AND table_name = ?
            """;
        List<String> missing = new ArrayList<>();
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = connection.prepareStatement(sql)) {
            for (String table : REQUIRED_TABLES) {
                st.setString(1, table);
                try (ResultSet rs = st.executeQuery()) {
                    if (!rs.next()) {
                        missing.add(table);
                    }
                }
            }
            return missing;
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot verify schema tables", e);
        }
    }

    private void runSqlScript(DbClient dbClient, String resourcePath) {
        String script;
        try (var in = MigrationRunner.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new IllegalStateException("Missing schema script: " + resourcePath);
            }
            script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read schema script: " + resourcePath, e);
        }

        // the schema script holds plain DDL only, so splitting on ';' is safe
        String[] statements = script.replaceAll("(?m)^\\s*--.*$", "").split(";");

        try (Connection connection = dbClient.getConnection()) {
            connection.setAutoCommit(false);
            for (String raw : statements) {
                String sql = raw.trim();
                if (sql.isEmpty()) {
                    continue;
                }
                try (PreparedStatement st = connection.prepareStatement(sql)) {
                    st.execute();
                }
            }
            connection.commit();
            logger.info("Fallback schema script {} applied", resourcePath);
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot apply fallback schema script " + resourcePath, e);
        }
    }
}

package com.deviceguard.dao;

import com.deviceguard.service.SettingsStore;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.tinkoff.kora.common.Component;

@Component
public final class JdbcSettingsStore implements SettingsStore {
    private static final Logger logger = LoggerFactory.getLogger(JdbcSettingsStore.class);

    private final DbClient dbClient;

    public JdbcSettingsStore(DbClient dbClient) {
        this.dbClient = dbClient;
    }

    @Override
    public Optional<SettingsRow> findGlobal() {
        String sql = "SELECT max_devices, block_message FROM settings LIMIT 1";
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = connection.prepareStatement(sql);
             ResultSet rs = st.executeQuery()) {
            if (!rs.next()) {
                return Optional.empty();
            }
            int maxDevices = rs.getInt("max_devices");
            Integer resolvedMax = rs.wasNull() ? null : maxDevices;
            return Optional.of(new SettingsRow(resolvedMax, rs.getString("block_message")));
        } catch (SQLException e) {
            throw fail("findGlobalSettings", e);
        }
    }

    @Override
    public void upsertGlobal(int maxDevices, String blockMessage) {
        String update = "UPDATE settings SET max_devices=?, block_message=?, updated_at=NOW() WHERE id=TRUE";
        String insert = """
            INSERT INTO settings(id, max_devices, block_message, updated_at)
            VALUES (TRUE, ?, ?, NOW())
            ON CONFLICT DO NOTHING
            """;
        try (Connection connection = dbClient.getConnection()) {
            upsert(connection, update, insert, st -> {
                st.setInt(1, maxDevices);
                st.setString(2, blockMessage);
            });
        } catch (SQLException e) {
            throw fail("upsertGlobalSettings", e);
        }
    }

    @Override
    public Optional<Integer> findCustomerLimit(String customerId) {
        String sql = "SELECT max_devices FROM customer_limits WHERE customer_id=?";
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = connection.prepareStatement(sql)) {
            st.setString(1, customerId);
            try (ResultSet rs = st.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(rs.getInt("max_devices"));
            }
        } catch (SQLException e) {
            throw fail("findCustomerLimit", e);
        }
    }

    @Override
    public void upsertCustomerLimit(String customerId, int maxDevices) {
        String update = "UPDATE customer_limits SET max_devices=?, updated_at=NOW() WHERE customer_id=?";
        String insert = """
            INSERT INTO customer_limits(max_devices, customer_id, updated_at)
            VALUES (?, ?, NOW())
            ON CONFLICT DO NOTHING
            """;
        try (Connection connection = dbClient.getConnection()) {
            upsert(connection, update, insert, st -> {
                st.setInt(1, maxDevices);
                st.setString(2, customerId);
            });
        } catch (SQLException e) {
            throw fail("upsertCustomerLimit", e);
        }
    }

    @Override
    public boolean deleteCustomerLimit(String customerId) {
        String sql = "DELETE FROM customer_limits WHERE customer_id=?";
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = connection.prepareStatement(sql)) {
            st.setString(1, customerId);
            return st.executeUpdate() > 0;
        } catch (SQLException e) {
            throw fail("deleteCustomerLimit", e);
        }
    }

    private interface Binder {
        void bind(PreparedStatement st) throws SQLException;
    }

    // update, else insert; a lost insert race means the row now exists, so update once more
    private void upsert(Connection connection, String update, String insert, Binder binder) throws SQLException {
        if (execute(connection, update, binder) > 0) {
            return;
        }
        if (execute(connection, insert, binder) > 0) {
            return;
        }
        execute(connection, update, binder);
    }

    private int execute(Connection connection, String sql, Binder binder) throws SQLException {
        try (PreparedStatement st = connection.prepareStatement(sql)) {
            binder.bind(st);
            return st.executeUpdate();
        }
    }

    private RuntimeException fail(String op, SQLException e) {
        logger.error("DB operation {} failed", op, e);
        return new IllegalStateException("Database error", e);
    }
}

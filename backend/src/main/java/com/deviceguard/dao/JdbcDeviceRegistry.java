package com.deviceguard.dao;

import com.deviceguard.domain.RegisteredDevice;
import com.deviceguard.service.DeviceRegistry;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.tinkoff.kora.common.Component;

@Component
public final class JdbcDeviceRegistry implements DeviceRegistry {
    private static final Logger logger = LoggerFactory.getLogger(JdbcDeviceRegistry.class);

    private final DbClient dbClient;

    public JdbcDeviceRegistry(DbClient dbClient) {
        this.dbClient = dbClient;
    }

    @Override
    public <T> T withCustomerLock(String customerId, Function<CustomerDevices, T> work) {
        try (Connection connection = dbClient.getConnection()) {
            provisionCustomer(connection, customerId);
            connection.setAutoCommit(false);
            try {
                lockCustomer(connection, customerId);
                var devices = new LockedCustomerDevices(connection, customerId, loadDeviceIds(connection, customerId));
                T result = work.apply(devices);
                connection.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(connection, e);
                throw e;
            }
        } catch (SQLException e) {
            throw fail("withCustomerLock", e);
        }
    }

    @Override
    public List<RegisteredDevice> listDevices(String customerId) {
        String sql = """
            SELECT customer_id, device_id, last_seen
            FROM devices
            WHERE customer_id=?
            ORDER BY last_seen DESC, device_id ASC
            """;
        List<RegisteredDevice> rows = new ArrayList<>();
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = connection.prepareStatement(sql)) {
            st.setString(1, customerId);
            try (ResultSet rs = st.executeQuery()) {
                while (rs.next()) {
                    Timestamp seen = rs.getTimestamp("last_seen");
                    rows.add(new RegisteredDevice(
                        rs.getString("customer_id"),
                        rs.getString("device_id"),
                        seen == null ? null : seen.toInstant()
                    ));
                }
            }
            return rows;
        } catch (SQLException e) {
            throw fail("listDevices", e);
        }
    }

    // autocommit, so the row is visible to every transaction that later locks it
    private void provisionCustomer(Connection connection, String customerId) throws SQLException {
        String sql = "INSERT INTO customers(customer_id, created_at) VALUES (?, NOW()) ON CONFLICT DO NOTHING";
        try (PreparedStatement st = connection.prepareStatement(sql)) {
            st.setString(1, customerId);
            st.executeUpdate();
        }
    }

    // row lock held until commit/rollback serializes checks for the same customer
    private void lockCustomer(Connection connection, String customerId) throws SQLException {
        String sql = "SELECT customer_id FROM customers WHERE customer_id=? FOR UPDATE";
        try (PreparedStatement st = connection.prepareStatement(sql)) {
            st.setString(1, customerId);
            try (ResultSet rs = st.executeQuery()) {
                if (!rs.next()) {
                    throw new SQLException("Customer row missing for " + customerId);
                }
            }
        }
    }

    private Set<String> loadDeviceIds(Connection connection, String customerId) throws SQLException {
        Set<String> ids = new LinkedHashSet<>();
        try (PreparedStatement st = connection.prepareStatement("SELECT device_id FROM devices WHERE customer_id=?")) {
            st.setString(1, customerId);
            try (ResultSet rs = st.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getString("device_id"));
                }
            }
        }
        return ids;
    }

    private void rollbackQuietly(Connection connection, Exception cause) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    private RuntimeException fail(String op, SQLException e) {
        logger.error("DB operation {} failed", op, e);
        return new IllegalStateException("Database error", e);
    }

    private final class LockedCustomerDevices implements CustomerDevices {
        private final Connection connection;
        private final String customerId;
        private final Set<String> deviceIds;

        private LockedCustomerDevices(Connection connection, String customerId, Set<String> deviceIds) {
            this.connection = connection;
            this.customerId = customerId;
            this.deviceIds = deviceIds;
        }

        @Override
        public Set<String> deviceIds() {
            return Collections.unmodifiableSet(deviceIds);
        }

        @Override
        public void touch(String deviceId) {
            String sql = "UPDATE devices SET last_seen=NOW() WHERE customer_id=? AND device_id=?";
            Savepoint savepoint = null;
            try {
                savepoint = connection.setSavepoint();
                try (PreparedStatement st = connection.prepareStatement(sql)) {
                    st.setString(1, customerId);
                    st.setString(2, deviceId);
                    st.executeUpdate();
                }
                connection.releaseSavepoint(savepoint);
            } catch (SQLException e) {
                if (savepoint != null) {
                    try {
                        connection.rollback(savepoint);
                    } catch (SQLException rollbackError) {
                        e.addSuppressed(rollbackError);
                    }
                }
                throw fail("touchDevice", e);
            }
        }

        @Override
        public void register(String deviceId) {
            String sql = "INSERT INTO devices(customer_id, device_id, last_seen) VALUES (?, ?, NOW())";
            try (PreparedStatement st = connection.prepareStatement(sql)) {
                st.setString(1, customerId);
                st.setString(2, deviceId);
                st.executeUpdate();
                deviceIds.add(deviceId);
            } catch (SQLException e) {
                throw fail("registerDevice", e);
            }
        }
    }
}

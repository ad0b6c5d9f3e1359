package com.deviceguard.dao;

import static org.assertj.core.api.Assertions.assertThat;

import com.deviceguard.TestAppConfig;
import com.deviceguard.TestDbConfig;
import com.deviceguard.domain.EffectiveSettings;
import com.deviceguard.service.MigrationRunner;
import com.deviceguard.service.SettingsService;
import com.deviceguard.service.SettingsStore;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JdbcSettingsStoreTest {

    private DbClient dbClient;
    private JdbcSettingsStore store;

    @BeforeEach
    void setUp() {
        dbClient = new DbClient(TestDbConfig.postgresMode("settings-" + UUID.randomUUID()));
        new MigrationRunner(dbClient);
        store = new JdbcSettingsStore(dbClient);
    }

    @AfterEach
    void tearDown() {
        dbClient.close();
    }

    @Test
    void globalSettingsAreAbsentUntilFirstUpsert() {
        assertThat(store.findGlobal()).isEmpty();

        store.upsertGlobal(3, "blocked");

        assertThat(store.findGlobal()).contains(new SettingsStore.SettingsRow(3, "blocked"));
    }

    @Test
    void secondUpsertUpdatesTheSingleRow() throws SQLException {
        store.upsertGlobal(3, "first");
        store.upsertGlobal(5, "  Você está logado em muitos dispositivos.  ");

        assertThat(store.findGlobal())
            .contains(new SettingsStore.SettingsRow(5, "  Você está logado em muitos dispositivos.  "));
        assertThat(countRows("SELECT COUNT(*) FROM settings")).isEqualTo(1);
    }

    @Test
    void nullColumnsAreReadAsNull() throws SQLException {
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = connection.prepareStatement(
                 "INSERT INTO settings(id, max_devices, block_message) VALUES (TRUE, NULL, NULL)")) {
            st.executeUpdate();
        }

        assertThat(store.findGlobal()).contains(new SettingsStore.SettingsRow(null, null));
    }

    @Test
    void customerLimitUpsertFindAndDelete() throws SQLException {
        assertThat(store.findCustomerLimit("vip")).isEmpty();

        store.upsertCustomerLimit("vip", 4);
        store.upsertCustomerLimit("vip", 6);
        store.upsertCustomerLimit("other", 1);

        assertThat(store.findCustomerLimit("vip")).contains(6);
        assertThat(store.findCustomerLimit("other")).contains(1);
        assertThat(countRows("SELECT COUNT(*) FROM customer_limits")).isEqualTo(2);

        assertThat(store.deleteCustomerLimit("vip")).isTrue();
        assertThat(store.deleteCustomerLimit("vip")).isFalse();
        assertThat(store.findCustomerLimit("vip")).isEmpty();
        assertThat(store.findCustomerLimit("other")).contains(1);
    }

    @Test
    void customerOverrideResolvesThroughSettingsService() {
        SettingsService service = new SettingsService(store, new TestAppConfig());
        service.update(2, "blocked");
        service.setCustomerLimit("vip", 5);

        EffectiveSettings vip = service.effectiveFor("vip");
        assertThat(vip.maxDevices()).isEqualTo(5);
        assertThat(vip.blockMessage()).isEqualTo("blocked");
        assertThat(vip.source()).isEqualTo(EffectiveSettings.Source.CUSTOMER);

        EffectiveSettings regular = service.effectiveFor("regular");
        assertThat(regular.maxDevices()).isEqualTo(2);
        assertThat(regular.source()).isEqualTo(EffectiveSettings.Source.GLOBAL);

        service.clearCustomerLimit("vip");
        assertThat(service.effectiveFor("vip").source()).isEqualTo(EffectiveSettings.Source.GLOBAL);
    }

    private int countRows(String sql) throws SQLException {
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = connection.prepareStatement(sql);
             ResultSet rs = st.executeQuery()) {
            rs.next();
            return rs.getInt(1);
        }
    }
}

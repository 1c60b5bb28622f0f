package com.gatewayadmin.admin.audit;

import com.gatewayadmin.admin.Fixtures;
import com.gatewayadmin.admin.model.Backend;
import com.gatewayadmin.admin.model.ConfigHistory;
import com.gatewayadmin.admin.model.ConfigType;
import com.gatewayadmin.admin.model.Operation;
import com.gatewayadmin.admin.store.InMemoryConfigStore;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AuditRecorderTest {

    private static final Instant T0 = Instant.parse("2026-01-10T10:00:00Z");

    private final InMemoryConfigStore store = new InMemoryConfigStore();
    private final AuditRecorder recorder = new AuditRecorder(store, Fixtures.OM);

    @Test
    void update_snapshotsBothSides() throws Exception {
        Backend before = new Backend(7L, "account", "127.0.0.1:50051", null, true, T0, T0);
        Backend after = new Backend(7L, "account", "127.0.0.1:9999", null, true, T0, T0.plusSeconds(5));

        assertTrue(recorder.record(ConfigType.BACKEND, 7L, Operation.UPDATE, before, after, "alice"));

        List<ConfigHistory> rows = store.allHistory();
        assertEquals(1, rows.size());
        ConfigHistory h = rows.get(0);
        assertEquals(ConfigType.BACKEND, h.configType());
        assertEquals(7L, h.configId());
        assertEquals(Operation.UPDATE, h.operation());
        assertEquals("alice", h.operator());
        assertEquals(before, Fixtures.OM.treeToValue(h.oldValue(), Backend.class));
        assertEquals(after, Fixtures.OM.treeToValue(h.newValue(), Backend.class));
    }

    @Test
    void snapshotsUseWireFieldNames() {
        Backend b = new Backend(1L, "account", "127.0.0.1:50051", null, true, T0, T0);

        recorder.created(ConfigType.BACKEND, 1L, b, null);

        ConfigHistory h = store.allHistory().get(0);
        assertNull(h.oldValue());
        assertTrue(h.newValue().has("created_at"));
        assertTrue(h.newValue().get("enabled").asBoolean());
    }

    @Test
    void delete_hasNoNewValue_andBlankOperatorIsAbsent() {
        Backend b = new Backend(1L, "account", "127.0.0.1:50051", null, true, T0, T0);

        recorder.deleted(ConfigType.BACKEND, 1L, b, "   ");

        ConfigHistory h = store.allHistory().get(0);
        assertEquals(Operation.DELETE, h.operation());
        assertNotNull(h.oldValue());
        assertNull(h.newValue());
        assertNull(h.operator());
    }

    @Test
    void storeFailure_isSwallowed() {
        store.failHistoryWrites = true;
        Backend b = new Backend(1L, "account", "127.0.0.1:50051", null, true, T0, T0);

        boolean written = assertDoesNotThrow(() ->
                recorder.record(ConfigType.BACKEND, 1L, Operation.CREATE, null, b, "bob"));

        assertFalse(written);
        assertTrue(store.allHistory().isEmpty());
    }

    @Test
    void longOperator_isCutToColumnWidth() {
        Backend b = new Backend(1L, "account", "127.0.0.1:50051", null, true, T0, T0);
        String operator = "ops-" + "x".repeat(300);

        assertTrue(recorder.record(ConfigType.BACKEND, 1L, Operation.CREATE, null, b, operator));

        String stored = store.allHistory().get(0).operator();
        assertEquals(ConfigHistory.OPERATOR_MAX_LENGTH, stored.length());
        assertTrue(operator.startsWith(stored));
    }
}

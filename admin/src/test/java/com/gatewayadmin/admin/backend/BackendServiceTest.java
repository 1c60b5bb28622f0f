package com.gatewayadmin.admin.backend;

import com.gatewayadmin.admin.Fixtures;
import com.gatewayadmin.admin.error.ConflictException;
import com.gatewayadmin.admin.error.NotFoundException;
import com.gatewayadmin.admin.error.StorageException;
import com.gatewayadmin.admin.error.ValidationException;
import com.gatewayadmin.admin.model.Backend;
import com.gatewayadmin.admin.model.ConfigHistory;
import com.gatewayadmin.admin.model.ConfigType;
import com.gatewayadmin.admin.model.Operation;
import com.gatewayadmin.admin.store.InMemoryConfigStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.gatewayadmin.admin.Fixtures.json;
import static org.junit.jupiter.api.Assertions.*;

public class BackendServiceTest {

    private InMemoryConfigStore store;
    private BackendService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryConfigStore();
        service = new Fixtures(store).backends;
    }

    private Backend createAccount() {
        return service.create(json("""
                {"name":"account","addr":"127.0.0.1:50051","description":"accounts"}
                """), "alice");
    }

    @Test
    void create_thenGet_returnsSameRecordWithAssignedFields() {
        Backend created = createAccount();

        Backend fetched = service.find("account").orElseThrow();
        assertEquals(created, fetched);
        assertNotNull(fetched.id());
        assertNotNull(fetched.createdAt());
        assertNotNull(fetched.updatedAt());
        assertEquals("127.0.0.1:50051", fetched.addr());
        assertEquals("accounts", fetched.description());
        assertTrue(fetched.enabled());
    }

    @Test
    void create_recordsOneCreateEntry() {
        Backend created = createAccount();

        List<ConfigHistory> rows = store.allHistory();
        assertEquals(1, rows.size());
        ConfigHistory h = rows.get(0);
        assertEquals(ConfigType.BACKEND, h.configType());
        assertEquals(Operation.CREATE, h.operation());
        assertEquals(created.id(), h.configId());
        assertNull(h.oldValue());
        assertEquals("account", h.newValue().get("name").asText());
        assertEquals("alice", h.operator());
    }

    @Test
    void create_duplicateName_conflictsAndLeavesExistingRow() {
        Backend original = createAccount();

        assertThrows(ConflictException.class, () -> service.create(json("""
                {"name":"account","addr":"10.0.0.1:1"}
                """), "bob"));

        assertEquals(original, service.find("account").orElseThrow());
        assertEquals(1, store.createBackendCalls);
        assertEquals(1, store.allHistory().size());
    }

    @Test
    void create_nameMatchIsCaseSensitive() {
        createAccount();

        Backend other = service.create(json("""
                {"name":"Account","addr":"10.0.0.1:1"}
                """), null);

        assertEquals("Account", other.name());
        assertEquals(2, service.list(null).size());
    }

    @Test
    void create_invalidPayload_hasNoSideEffects() {
        assertThrows(ValidationException.class, () -> service.create(json("""
                {"name":"account"}
                """), null));

        assertEquals(0, store.createBackendCalls);
        assertTrue(store.allHistory().isEmpty());
    }

    @Test
    void update_omittedEnabled_isPreserved() {
        createAccount();

        Backend updated = service.update("account", json("""
                {"addr":"127.0.0.1:9999"}
                """), null);

        assertEquals("127.0.0.1:9999", updated.addr());
        assertTrue(updated.enabled());
    }

    @Test
    void update_explicitFalse_disables() {
        createAccount();

        Backend updated = service.update("account", json("""
                {"addr":"127.0.0.1:9999","enabled":false}
                """), null);

        assertFalse(updated.enabled());
        assertFalse(service.find("account").orElseThrow().enabled());
    }

    @Test
    void update_historyHoldsBeforeAndAfter() throws Exception {
        Backend before = createAccount();

        Backend after = service.update("account", json("""
                {"addr":"127.0.0.1:9999"}
                """), "carol");

        ConfigHistory h = store.allHistory().get(1);
        assertEquals(Operation.UPDATE, h.operation());
        assertEquals(before, Fixtures.OM.treeToValue(h.oldValue(), Backend.class));
        assertEquals(after, Fixtures.OM.treeToValue(h.newValue(), Backend.class));
    }

    @Test
    void update_missingBackend_isNotFound() {
        assertThrows(NotFoundException.class, () -> service.update("ghost", json("""
                {"addr":"1.2.3.4:5"}
                """), null));
        assertTrue(store.allHistory().isEmpty());
    }

    @Test
    void delete_isSoft_andRepeatable() {
        createAccount();

        service.delete("account", "dave");
        service.delete("account", "dave");

        Backend row = service.find("account").orElseThrow();
        assertFalse(row.enabled());

        List<ConfigHistory> deletes = store.allHistory().stream()
                .filter(h -> h.operation() == Operation.DELETE)
                .toList();
        assertEquals(2, deletes.size());
        assertNull(deletes.get(0).newValue());
        assertTrue(deletes.get(0).oldValue().get("enabled").asBoolean());
    }

    @Test
    void delete_missingBackend_isNotFound() {
        assertThrows(NotFoundException.class, () -> service.delete("ghost", null));
    }

    @Test
    void historyFailure_doesNotFailTheMutation() {
        store.failHistoryWrites = true;

        Backend created = createAccount();

        assertEquals(created, service.find("account").orElseThrow());
        assertTrue(store.allHistory().isEmpty());
    }

    @Test
    void storageFailure_propagates_withoutHistory() {
        store.failMutations = true;

        assertThrows(StorageException.class, this::createAccount);
        assertTrue(store.allHistory().isEmpty());
        assertTrue(service.find("account").isEmpty());
    }

    @Test
    void list_filtersAndOrdersByName() {
        service.create(json("{\"name\":\"zeta\",\"addr\":\"z:1\"}"), null);
        service.create(json("{\"name\":\"alpha\",\"addr\":\"a:1\"}"), null);
        service.create(json("{\"name\":\"mid\",\"addr\":\"m:1\",\"enabled\":false}"), null);

        assertEquals(List.of("alpha", "mid", "zeta"), service.list(null).stream().map(Backend::name).toList());
        assertEquals(List.of("alpha", "zeta"), service.list(true).stream().map(Backend::name).toList());
        assertEquals(List.of("mid"), service.list(false).stream().map(Backend::name).toList());
    }
}

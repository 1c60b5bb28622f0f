package com.gatewayadmin.admin.history;

import com.gatewayadmin.admin.Fixtures;
import com.gatewayadmin.admin.error.ValidationException;
import com.gatewayadmin.admin.model.Backend;
import com.gatewayadmin.admin.model.ConfigHistory;
import com.gatewayadmin.admin.model.ConfigType;
import com.gatewayadmin.admin.model.HistoryPage;
import com.gatewayadmin.admin.model.Operation;
import com.gatewayadmin.admin.store.InMemoryConfigStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.gatewayadmin.admin.Fixtures.json;
import static org.junit.jupiter.api.Assertions.*;

public class HistoryServiceTest {

    private InMemoryConfigStore store;
    private Fixtures f;

    @BeforeEach
    void setUp() {
        store = new InMemoryConfigStore();
        f = new Fixtures(store);
    }

    @Test
    void filtersByTypeAndId_newestFirst_withFullTotal() {
        Backend account = f.backends.create(json("{\"name\":\"account\",\"addr\":\"a:1\"}"), null);
        Backend other = f.backends.create(json("{\"name\":\"other\",\"addr\":\"o:1\"}"), null);
        for (int i = 0; i < 12; i++) {
            f.backends.update("account", json("{\"description\":\"rev " + i + "\"}"), null);
        }
        f.backends.update("other", json("{\"description\":\"x\"}"), null);
        f.routes.create(json("""
                {"http_method":"GET","http_pattern":"/a","backend_name":"account","backend_service":"s","backend_method":"m"}
                """), null);

        HistoryPage page = f.history.query("backend", account.id(), 10, 0);

        assertEquals(13, page.total());
        assertEquals(10, page.items().size());
        assertEquals(10, page.limit());
        assertEquals(0, page.offset());
        for (ConfigHistory h : page.items()) {
            assertEquals(ConfigType.BACKEND, h.configType());
            assertEquals(account.id(), h.configId());
        }
        for (int i = 1; i < page.items().size(); i++) {
            assertTrue(page.items().get(i - 1).createdAt().isAfter(page.items().get(i).createdAt()));
        }
        assertEquals("rev 11", page.items().get(0).newValue().get("description").asText());

        HistoryPage tail = f.history.query("backend", account.id(), 10, 10);
        assertEquals(3, tail.items().size());
        assertEquals(Operation.CREATE, tail.items().get(2).operation());

        assertNotEquals(account.id(), other.id());
    }

    @Test
    void noFilters_returnsEverything() {
        f.backends.create(json("{\"name\":\"account\",\"addr\":\"a:1\"}"), null);
        f.routes.create(json("""
                {"http_method":"GET","http_pattern":"/a","backend_name":"account","backend_service":"s","backend_method":"m"}
                """), null);

        HistoryPage page = f.history.query(null, null, null, null);

        assertEquals(2, page.total());
        assertEquals(ConfigType.ROUTE, page.items().get(0).configType());
        assertEquals(50, page.limit());
    }

    @Test
    void invalidConfigType_isValidationError() {
        assertThrows(ValidationException.class, () -> f.history.query("plugin", null, null, null));
    }

    @Test
    void limitAndOffset_fallBackToDefaults() {
        HistoryService svc = f.history;

        assertEquals(50, svc.effectiveLimit(null));
        assertEquals(50, svc.effectiveLimit(0));
        assertEquals(50, svc.effectiveLimit(101));
        assertEquals(100, svc.effectiveLimit(100));
        assertEquals(7, svc.effectiveLimit(7));

        assertEquals(0, HistoryService.effectiveOffset(null));
        assertEquals(0, HistoryService.effectiveOffset(-3));
        assertEquals(20, HistoryService.effectiveOffset(20));
    }
}

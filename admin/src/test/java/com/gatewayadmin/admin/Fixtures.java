package com.gatewayadmin.admin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gatewayadmin.admin.audit.AuditRecorder;
import com.gatewayadmin.admin.backend.BackendService;
import com.gatewayadmin.admin.config.GatewayAdminProperties;
import com.gatewayadmin.admin.history.HistoryService;
import com.gatewayadmin.admin.merge.UpdateMergePolicy;
import com.gatewayadmin.admin.route.RouteService;
import com.gatewayadmin.admin.store.ConfigStore;
import com.gatewayadmin.admin.validation.ConfigValidator;
import com.gatewayadmin.admin.validation.ReferentialValidator;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

/**
 * Wires the services by hand over any {@link ConfigStore}, the same way the
 * application context does.
 */
public final class Fixtures {

    public static final ObjectMapper OM = Jackson2ObjectMapperBuilder.json().build();

    public final ConfigStore store;
    public final GatewayAdminProperties props = new GatewayAdminProperties();
    public final UpdateMergePolicy merge;
    public final AuditRecorder audit;
    public final BackendService backends;
    public final RouteService routes;
    public final HistoryService history;

    public Fixtures(ConfigStore store) {
        this.store = store;
        this.merge = new UpdateMergePolicy(new ConfigValidator(), props);
        this.audit = new AuditRecorder(store, OM);
        this.backends = new BackendService(store, merge, audit);
        this.routes = new RouteService(store, merge, new ReferentialValidator(store), audit);
        this.history = new HistoryService(store, props);
    }

    public static JsonNode json(String raw) {
        try {
            return OM.readTree(raw);
        } catch (Exception e) {
            throw new IllegalArgumentException("bad test json: " + raw, e);
        }
    }
}

package com.gatewayadmin.admin.route;

import com.fasterxml.jackson.databind.JsonNode;
import com.gatewayadmin.admin.audit.AuditRecorder;
import com.gatewayadmin.admin.error.NotFoundException;
import com.gatewayadmin.admin.merge.UpdateMergePolicy;
import com.gatewayadmin.admin.model.ConfigType;
import com.gatewayadmin.admin.model.Route;
import com.gatewayadmin.admin.store.ConfigStore;
import com.gatewayadmin.admin.validation.ReferentialValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
public class RouteService {

    private static final Logger log = LoggerFactory.getLogger(RouteService.class);

    private final ConfigStore store;
    private final UpdateMergePolicy merge;
    private final ReferentialValidator references;
    private final AuditRecorder audit;

    public RouteService(
            ConfigStore store,
            UpdateMergePolicy merge,
            ReferentialValidator references,
            AuditRecorder audit
    ) {
        this.store = store;
        this.merge = merge;
        this.references = references;
        this.audit = audit;
    }

    public List<Route> list(Boolean enabled) {
        return store.listRoutes(enabled);
    }

    public Optional<Route> find(long id) {
        return store.getRouteById(id);
    }

    public Route create(JsonNode payload, String operator) {
        Route draft = merge.newRoute(payload);
        references.checkCreate(draft);

        Route created = store.createRoute(draft);
        audit.created(ConfigType.ROUTE, created.id(), created, operator);

        log.info("created route id={} {} {} -> {}/{}.{} operator={}",
                created.id(), created.httpMethod(), created.httpPattern(),
                created.backendName(), created.backendService(), created.backendMethod(), operator);
        return created;
    }

    public Route update(long id, JsonNode payload, String operator) {
        Route existing = store.getRouteById(id)
                .orElseThrow(() -> NotFoundException.route(id));

        Route merged = merge.mergeRoute(existing, payload);
        references.checkUpdate(existing, merged);

        Route updated = store.updateRoute(id, merged);
        audit.updated(ConfigType.ROUTE, updated.id(), existing, updated, operator);

        log.info("updated route id={} enabled={} operator={}", id, updated.enabled(), operator);
        return updated;
    }

    public void delete(long id, String operator) {
        Route existing = store.getRouteById(id)
                .orElseThrow(() -> NotFoundException.route(id));

        store.deleteRoute(id);
        audit.deleted(ConfigType.ROUTE, existing.id(), existing, operator);

        log.info("disabled route id={} operator={}", id, operator);
    }
}

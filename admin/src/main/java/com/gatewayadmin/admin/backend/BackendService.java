package com.gatewayadmin.admin.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.gatewayadmin.admin.audit.AuditRecorder;
import com.gatewayadmin.admin.error.ConflictException;
import com.gatewayadmin.admin.error.NotFoundException;
import com.gatewayadmin.admin.merge.UpdateMergePolicy;
import com.gatewayadmin.admin.model.Backend;
import com.gatewayadmin.admin.model.ConfigType;
import com.gatewayadmin.admin.store.ConfigStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
public class BackendService {

    private static final Logger log = LoggerFactory.getLogger(BackendService.class);

    private final ConfigStore store;
    private final UpdateMergePolicy merge;
    private final AuditRecorder audit;

    public BackendService(ConfigStore store, UpdateMergePolicy merge, AuditRecorder audit) {
        this.store = store;
        this.merge = merge;
        this.audit = audit;
    }

    public List<Backend> list(Boolean enabled) {
        return store.listBackends(enabled);
    }

    public Optional<Backend> find(String name) {
        return store.getBackendByName(name);
    }

    public Backend create(JsonNode payload, String operator) {
        Backend draft = merge.newBackend(payload);

        if (store.getBackendByName(draft.name()).isPresent()) {
            throw new ConflictException("backend already exists: " + draft.name());
        }

        Backend created = store.createBackend(draft);
        audit.created(ConfigType.BACKEND, created.id(), created, operator);

        log.info("created backend name={} addr={} operator={}", created.name(), created.addr(), operator);
        return created;
    }

    public Backend update(String name, JsonNode payload, String operator) {
        Backend existing = store.getBackendByName(name)
                .orElseThrow(() -> NotFoundException.backend(name));

        Backend merged = merge.mergeBackend(existing, payload);
        Backend updated = store.updateBackend(name, merged);
        audit.updated(ConfigType.BACKEND, updated.id(), existing, updated, operator);

        log.info("updated backend name={} enabled={} operator={}", name, updated.enabled(), operator);
        return updated;
    }

    /** Soft delete. Repeating it on a disabled backend succeeds. */
    public void delete(String name, String operator) {
        Backend existing = store.getBackendByName(name)
                .orElseThrow(() -> NotFoundException.backend(name));

        store.deleteBackend(name);
        audit.deleted(ConfigType.BACKEND, existing.id(), existing, operator);

        log.info("disabled backend name={} operator={}", name, operator);
    }
}

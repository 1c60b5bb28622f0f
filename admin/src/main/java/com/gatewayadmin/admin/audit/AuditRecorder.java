package com.gatewayadmin.admin.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gatewayadmin.admin.model.ConfigHistory;
import com.gatewayadmin.admin.model.ConfigType;
import com.gatewayadmin.admin.model.Operation;
import com.gatewayadmin.admin.store.ConfigStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes one history row per successful mutation, after the mutation has
 * committed.
 *
 * <p>Recording is best effort: a failure is logged and dropped, never retried
 * and never reported to the caller. The primary change stays committed either
 * way, so history can have gaps.
 */
@Component
public class AuditRecorder {

    private static final Logger log = LoggerFactory.getLogger(AuditRecorder.class);

    private final ConfigStore store;
    private final ObjectMapper om;

    public AuditRecorder(ConfigStore store, ObjectMapper om) {
        this.store = store;
        this.om = om;
    }

    public void created(ConfigType type, Long configId, Object after, String operator) {
        record(type, configId, Operation.CREATE, null, after, operator);
    }

    public void updated(ConfigType type, Long configId, Object before, Object after, String operator) {
        record(type, configId, Operation.UPDATE, before, after, operator);
    }

    public void deleted(ConfigType type, Long configId, Object before, String operator) {
        record(type, configId, Operation.DELETE, before, null, operator);
    }

    /**
     * @return true if the row was written
     */
    public boolean record(
            ConfigType type,
            Long configId,
            Operation operation,
            Object before,
            Object after,
            String operator
    ) {
        try {
            ConfigHistory entry = ConfigHistory.entry(
                    type,
                    configId,
                    operation,
                    snapshot(before),
                    snapshot(after),
                    normalizeOperator(operator)
            );
            store.createHistory(entry);
            return true;
        } catch (RuntimeException e) {
            log.warn("failed to record history type={} id={} op={}: {}",
                    type.value(), configId, operation, e.getMessage(), e);
            return false;
        }
    }

    private JsonNode snapshot(Object value) {
        return value == null ? null : om.valueToTree(value);
    }

    private static String normalizeOperator(String operator) {
        if (operator == null) return null;
        String t = operator.trim();
        if (t.isEmpty()) return null;
        return t.length() > ConfigHistory.OPERATOR_MAX_LENGTH
                ? t.substring(0, ConfigHistory.OPERATOR_MAX_LENGTH)
                : t;
    }
}

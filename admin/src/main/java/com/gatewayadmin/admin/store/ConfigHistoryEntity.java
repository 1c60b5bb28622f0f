package com.gatewayadmin.admin.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.gatewayadmin.admin.error.StorageException;
import com.gatewayadmin.admin.model.ConfigHistory;
import com.gatewayadmin.admin.model.ConfigType;
import com.gatewayadmin.admin.model.Operation;
import jakarta.persistence.*;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * Append-only. Rows are inserted once and never updated or deleted.
 */
@Entity
@Immutable
@Table(
    name = "config_history",
    indexes = {
        @Index(name = "idx_history_type_id", columnList = "config_type, config_id"),
        @Index(name = "idx_history_created", columnList = "created_at")
    }
)
public class ConfigHistoryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "config_type", nullable = false, length = 16)
    private String configType; // backend | route

    // null only when the target id could not be determined
    @Column(name = "config_id")
    private Long configId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Operation operation;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "old_value")
    private JsonNode oldValue;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "new_value")
    private JsonNode newValue;

    @Column(length = ConfigHistory.OPERATOR_MAX_LENGTH)
    private String operator;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected ConfigHistoryEntity() {}

    @PrePersist
    public void prePersist() {
        if (createdAt == null) createdAt = Timestamps.now();
    }

    static ConfigHistoryEntity from(ConfigHistory h) {
        ConfigHistoryEntity e = new ConfigHistoryEntity();
        e.configType = h.configType().value();
        e.configId = h.configId();
        e.operation = h.operation();
        e.oldValue = h.oldValue();
        e.newValue = h.newValue();
        e.operator = h.operator();
        return e;
    }

    ConfigHistory toModel() {
        ConfigType type = ConfigType.parse(configType)
                .orElseThrow(() -> new StorageException("unknown config_type in history row " + id + ": " + configType, null));
        return new ConfigHistory(id, type, configId, operation, oldValue, newValue, operator, createdAt);
    }

    public Long getId() { return id; }
    public String getConfigType() { return configType; }
    public Long getConfigId() { return configId; }
    public Operation getOperation() { return operation; }
    public JsonNode getOldValue() { return oldValue; }
    public JsonNode getNewValue() { return newValue; }
    public String getOperator() { return operator; }
    public Instant getCreatedAt() { return createdAt; }
}

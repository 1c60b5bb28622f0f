package com.gatewayadmin.admin.store;

import com.gatewayadmin.admin.model.Backend;
import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(
    name = "backends",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_backends_name", columnNames = "name")
    }
)
public class BackendEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = Backend.NAME_MAX_LENGTH, updatable = false)
    private String name;

    @Column(nullable = false, length = Backend.ADDR_MAX_LENGTH)
    private String addr;

    @Column(length = Backend.DESCRIPTION_MAX_LENGTH)
    private String description;

    @Column(nullable = false)
    private boolean enabled = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected BackendEntity() {}

    @PrePersist
    public void prePersist() {
        Instant now = Timestamps.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
    }

    static BackendEntity from(Backend b) {
        BackendEntity e = new BackendEntity();
        e.name = b.name();
        e.addr = b.addr();
        e.description = b.description();
        e.enabled = b.enabled();
        return e;
    }

    /** Copies the mutable fields; name and id stay as they are. */
    void apply(Backend b) {
        this.addr = b.addr();
        this.description = b.description();
        this.enabled = b.enabled();
        touch();
    }

    Backend toModel() {
        return new Backend(id, name, addr, description, enabled, createdAt, updatedAt);
    }

    public Long getId() { return id; }
    public String getName() { return name; }
    public String getAddr() { return addr; }
    public String getDescription() { return description; }
    public boolean isEnabled() { return enabled; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    public void touch() { this.updatedAt = Timestamps.now(); }
}

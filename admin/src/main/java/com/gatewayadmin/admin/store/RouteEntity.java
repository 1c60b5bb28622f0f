package com.gatewayadmin.admin.store;

import com.gatewayadmin.admin.model.Backend;
import com.gatewayadmin.admin.model.Route;
import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(
    name = "routes",
    indexes = {
        @Index(name = "idx_routes_method_pattern", columnList = "http_method, http_pattern"),
        @Index(name = "idx_routes_backend_name", columnList = "backend_name")
    }
)
public class RouteEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "http_method", nullable = false, length = Route.HTTP_METHOD_MAX_LENGTH)
    private String httpMethod;

    @Column(name = "http_pattern", nullable = false, length = Route.HTTP_PATTERN_MAX_LENGTH)
    private String httpPattern;

    @Column(name = "backend_name", nullable = false, length = Backend.NAME_MAX_LENGTH)
    private String backendName;

    @Column(name = "backend_service", nullable = false, length = Route.BACKEND_SERVICE_MAX_LENGTH)
    private String backendService;

    @Column(name = "backend_method", nullable = false, length = Route.BACKEND_METHOD_MAX_LENGTH)
    private String backendMethod;

    @Column(name = "timeout_ms", nullable = false)
    private int timeoutMs = Route.DEFAULT_TIMEOUT_MS;

    @Column(length = Route.DESCRIPTION_MAX_LENGTH)
    private String description;

    @Column(nullable = false)
    private boolean enabled = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected RouteEntity() {}

    @PrePersist
    public void prePersist() {
        Instant now = Timestamps.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
    }

    static RouteEntity from(Route r) {
        RouteEntity e = new RouteEntity();
        e.apply(r);
        e.updatedAt = null;
        return e;
    }

    /** Copies everything except id and created_at. */
    void apply(Route r) {
        this.httpMethod = r.httpMethod();
        this.httpPattern = r.httpPattern();
        this.backendName = r.backendName();
        this.backendService = r.backendService();
        this.backendMethod = r.backendMethod();
        this.timeoutMs = r.timeoutMs();
        this.description = r.description();
        this.enabled = r.enabled();
        touch();
    }

    Route toModel() {
        return new Route(id, httpMethod, httpPattern, backendName, backendService, backendMethod,
                timeoutMs, description, enabled, createdAt, updatedAt);
    }

    public Long getId() { return id; }
    public String getHttpMethod() { return httpMethod; }
    public String getHttpPattern() { return httpPattern; }
    public String getBackendName() { return backendName; }
    public String getBackendService() { return backendService; }
    public String getBackendMethod() { return backendMethod; }
    public int getTimeoutMs() { return timeoutMs; }
    public String getDescription() { return description; }
    public boolean isEnabled() { return enabled; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    public void touch() { this.updatedAt = Timestamps.now(); }
}

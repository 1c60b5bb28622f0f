package com.gatewayadmin.admin.validation;

import com.gatewayadmin.admin.error.InvalidReferenceException;
import com.gatewayadmin.admin.model.Backend;
import com.gatewayadmin.admin.model.Route;
import com.gatewayadmin.admin.store.ConfigStore;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * A route may only point at a backend that exists and is enabled.
 *
 * <p>This is a read followed by a separate write in the caller, so a backend
 * disabled in between is not caught.
 */
@Component
public class ReferentialValidator {

    private final ConfigStore store;

    public ReferentialValidator(ConfigStore store) {
        this.store = store;
    }

    public void checkCreate(Route route) {
        requireUsableBackend(route.backendName());
    }

    /** Re-checks only when backend_name actually changes. */
    public void checkUpdate(Route existing, Route merged) {
        if (Objects.equals(existing.backendName(), merged.backendName())) return;
        requireUsableBackend(merged.backendName());
    }

    public void requireUsableBackend(String backendName) {
        boolean usable = store.getBackendByName(backendName)
                .map(Backend::enabled)
                .orElse(false);
        if (!usable) {
            throw new InvalidReferenceException(backendName);
        }
    }
}

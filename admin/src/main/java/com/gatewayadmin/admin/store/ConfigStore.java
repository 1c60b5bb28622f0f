package com.gatewayadmin.admin.store;

import com.gatewayadmin.admin.model.Backend;
import com.gatewayadmin.admin.model.ConfigHistory;
import com.gatewayadmin.admin.model.ConfigType;
import com.gatewayadmin.admin.model.HistoryPage;
import com.gatewayadmin.admin.model.Route;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage for backends, routes and their change history.
 *
 * <p>Lookups return {@link Optional#empty()} when nothing matches; that is a
 * valid result, not an error. Mutations of a missing row throw
 * {@link com.gatewayadmin.admin.error.NotFoundException}. Any failure of the
 * underlying storage surfaces as
 * {@link com.gatewayadmin.admin.error.StorageException}.
 *
 * <p>Nothing is ever physically deleted: deletes flip {@code enabled} to false.
 */
public interface ConfigStore {

    // ---- backends ----

    /** Ordered by name. A null filter returns enabled and disabled rows. */
    List<Backend> listBackends(Boolean enabled);

    Optional<Backend> getBackendByName(String name);

    /** Assigns id and timestamps. Throws ConflictException on a duplicate name. */
    Backend createBackend(Backend backend);

    /** Updates addr, description and enabled; name and id never change. */
    Backend updateBackend(String name, Backend backend);

    void deleteBackend(String name);

    // ---- routes ----

    /** Ordered by (http_method, http_pattern). */
    List<Route> listRoutes(Boolean enabled);

    Optional<Route> getRouteById(long id);

    Route createRoute(Route route);

    Route updateRoute(long id, Route route);

    void deleteRoute(long id);

    // ---- history ----

    void createHistory(ConfigHistory history);

    /** Filters combine with AND; newest first. */
    HistoryPage getHistory(ConfigType configType, Long configId, int limit, int offset);
}

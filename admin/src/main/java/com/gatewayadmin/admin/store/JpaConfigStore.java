package com.gatewayadmin.admin.store;

import com.gatewayadmin.admin.error.ConfigException;
import com.gatewayadmin.admin.error.ConflictException;
import com.gatewayadmin.admin.error.NotFoundException;
import com.gatewayadmin.admin.error.StorageException;
import com.gatewayadmin.admin.model.Backend;
import com.gatewayadmin.admin.model.ConfigHistory;
import com.gatewayadmin.admin.model.ConfigType;
import com.gatewayadmin.admin.model.HistoryPage;
import com.gatewayadmin.admin.model.Route;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link ConfigStore} over the relational database via Spring Data JPA.
 *
 * <p>Every call is its own transaction. Nothing here spans a validation read,
 * a mutation and a history insert.
 */
@Component
public class JpaConfigStore implements ConfigStore {

    private final BackendRepository backendRepo;
    private final RouteRepository routeRepo;
    private final ConfigHistoryRepository historyRepo;
    private final TransactionTemplate tx;
    private final TransactionTemplate readTx;

    public JpaConfigStore(
            BackendRepository backendRepo,
            RouteRepository routeRepo,
            ConfigHistoryRepository historyRepo,
            PlatformTransactionManager txManager
    ) {
        this.backendRepo = backendRepo;
        this.routeRepo = routeRepo;
        this.historyRepo = historyRepo;
        this.tx = new TransactionTemplate(txManager);
        this.readTx = new TransactionTemplate(txManager);
        this.readTx.setReadOnly(true);
    }

    // ---- backends ----

    @Override
    public List<Backend> listBackends(Boolean enabled) {
        return read("list backends", () -> {
            List<BackendEntity> rows = (enabled == null)
                    ? backendRepo.findAllByOrderByNameAsc()
                    : backendRepo.findByEnabledOrderByNameAsc(enabled);
            return rows.stream().map(BackendEntity::toModel).toList();
        });
    }

    @Override
    public Optional<Backend> getBackendByName(String name) {
        return read("get backend " + name, () -> backendRepo.findByName(name).map(BackendEntity::toModel));
    }

    @Override
    public Backend createBackend(Backend backend) {
        try {
            return write("create backend " + backend.name(),
                    () -> backendRepo.saveAndFlush(BackendEntity.from(backend)).toModel());
        } catch (StorageException e) {
            // unique index on name caught a concurrent insert; any other violation stays a storage error
            if (e.getCause() instanceof DataIntegrityViolationException
                    && getBackendByName(backend.name()).isPresent()) {
                throw new ConflictException("backend already exists: " + backend.name(), e.getCause());
            }
            throw e;
        }
    }

    @Override
    public Backend updateBackend(String name, Backend backend) {
        return write("update backend " + name, () -> {
            BackendEntity row = backendRepo.findByName(name)
                    .orElseThrow(() -> NotFoundException.backend(name));
            row.apply(backend);
            return backendRepo.saveAndFlush(row).toModel();
        });
    }

    @Override
    public void deleteBackend(String name) {
        write("delete backend " + name, () -> {
            if (backendRepo.softDeleteByName(name, Timestamps.now()) == 0) {
                throw NotFoundException.backend(name);
            }
            return null;
        });
    }

    // ---- routes ----

    @Override
    public List<Route> listRoutes(Boolean enabled) {
        return read("list routes", () -> {
            List<RouteEntity> rows = (enabled == null)
                    ? routeRepo.findAllByOrderByHttpMethodAscHttpPatternAsc()
                    : routeRepo.findByEnabledOrderByHttpMethodAscHttpPatternAsc(enabled);
            return rows.stream().map(RouteEntity::toModel).toList();
        });
    }

    @Override
    public Optional<Route> getRouteById(long id) {
        return read("get route " + id, () -> routeRepo.findById(id).map(RouteEntity::toModel));
    }

    @Override
    public Route createRoute(Route route) {
        return write("create route " + route.httpMethod() + " " + route.httpPattern(),
                () -> routeRepo.saveAndFlush(RouteEntity.from(route)).toModel());
    }

    @Override
    public Route updateRoute(long id, Route route) {
        return write("update route " + id, () -> {
            RouteEntity row = routeRepo.findById(id)
                    .orElseThrow(() -> NotFoundException.route(id));
            row.apply(route);
            return routeRepo.saveAndFlush(row).toModel();
        });
    }

    @Override
    public void deleteRoute(long id) {
        write("delete route " + id, () -> {
            if (routeRepo.softDeleteById(id, Timestamps.now()) == 0) {
                throw NotFoundException.route(id);
            }
            return null;
        });
    }

    // ---- history ----

    @Override
    public void createHistory(ConfigHistory history) {
        write("create history", () -> historyRepo.save(ConfigHistoryEntity.from(history)));
    }

    @Override
    public HistoryPage getHistory(ConfigType configType, Long configId, int limit, int offset) {
        String type = configType == null ? null : configType.value();
        return read("get history", () -> {
            long total = historyRepo.countMatching(type, configId);
            List<ConfigHistory> items = historyRepo.search(type, configId, limit, offset).stream()
                    .map(ConfigHistoryEntity::toModel)
                    .toList();
            return new HistoryPage(items, total, limit, offset);
        });
    }

    // ---- helpers ----

    private <T> T read(String what, Supplier<T> work) {
        return run(readTx, what, work);
    }

    private <T> T write(String what, Supplier<T> work) {
        return run(tx, what, work);
    }

    private static <T> T run(TransactionTemplate template, String what, Supplier<T> work) {
        try {
            return template.execute(status -> work.get());
        } catch (ConfigException e) {
            throw e;
        } catch (DataAccessException | TransactionException e) {
            throw new StorageException("failed to " + what, e);
        }
    }
}

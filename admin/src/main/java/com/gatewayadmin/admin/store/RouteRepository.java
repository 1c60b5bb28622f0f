package com.gatewayadmin.admin.store;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface RouteRepository extends JpaRepository<RouteEntity, Long> {

    List<RouteEntity> findAllByOrderByHttpMethodAscHttpPatternAsc();

    List<RouteEntity> findByEnabledOrderByHttpMethodAscHttpPatternAsc(boolean enabled);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        update RouteEntity r
        set r.enabled = false,
            r.updatedAt = :now
        where r.id = :id
    """)
    int softDeleteById(@Param("id") Long id, @Param("now") Instant now);
}

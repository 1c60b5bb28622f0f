package com.gatewayadmin.admin.store;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface BackendRepository extends JpaRepository<BackendEntity, Long> {

    Optional<BackendEntity> findByName(String name);

    List<BackendEntity> findAllByOrderByNameAsc();

    List<BackendEntity> findByEnabledOrderByNameAsc(boolean enabled);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        update BackendEntity b
        set b.enabled = false,
            b.updatedAt = :now
        where b.name = :name
    """)
    int softDeleteByName(@Param("name") String name, @Param("now") Instant now);
}

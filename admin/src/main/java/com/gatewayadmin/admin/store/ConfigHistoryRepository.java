package com.gatewayadmin.admin.store;

import org.springframework.data.jpa.repository.JpaRepository;

public interface ConfigHistoryRepository extends JpaRepository<ConfigHistoryEntity, Long>, ConfigHistoryQueries {
}

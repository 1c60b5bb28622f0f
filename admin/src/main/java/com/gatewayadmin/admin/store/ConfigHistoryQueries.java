package com.gatewayadmin.admin.store;

import java.util.List;

/**
 * Filtered, offset-paged history reads. A null filter matches everything.
 */
public interface ConfigHistoryQueries {

    List<ConfigHistoryEntity> search(String configType, Long configId, int limit, int offset);

    long countMatching(String configType, Long configId);
}

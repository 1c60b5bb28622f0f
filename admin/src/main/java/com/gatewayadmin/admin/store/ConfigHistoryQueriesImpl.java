package com.gatewayadmin.admin.store;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

class ConfigHistoryQueriesImpl implements ConfigHistoryQueries {

    @PersistenceContext
    private EntityManager em;

    @Override
    public List<ConfigHistoryEntity> search(String configType, Long configId, int limit, int offset) {
        Map<String, Object> params = new LinkedHashMap<>();
        String where = where(configType, configId, params);

        TypedQuery<ConfigHistoryEntity> q = em.createQuery(
                "select h from ConfigHistoryEntity h" + where + " order by h.createdAt desc, h.id desc",
                ConfigHistoryEntity.class);
        params.forEach(q::setParameter);
        return q.setFirstResult(offset)
                .setMaxResults(limit)
                .getResultList();
    }

    @Override
    public long countMatching(String configType, Long configId) {
        Map<String, Object> params = new LinkedHashMap<>();
        String where = where(configType, configId, params);

        TypedQuery<Long> q = em.createQuery(
                "select count(h) from ConfigHistoryEntity h" + where, Long.class);
        params.forEach(q::setParameter);
        return q.getSingleResult();
    }

    // filters combine with AND
    private static String where(String configType, Long configId, Map<String, Object> params) {
        StringBuilder sb = new StringBuilder();
        if (configType != null) {
            sb.append(sb.isEmpty() ? " where " : " and ").append("h.configType = :configType");
            params.put("configType", configType);
        }
        if (configId != null) {
            sb.append(sb.isEmpty() ? " where " : " and ").append("h.configId = :configId");
            params.put("configId", configId);
        }
        return sb.toString();
    }
}

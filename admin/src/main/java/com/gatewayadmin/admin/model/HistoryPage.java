package com.gatewayadmin.admin.model;

import java.util.List;

/**
 * One page of history. {@code total} counts the whole filtered set, not the page.
 */
public record HistoryPage(
        List<ConfigHistory> items,
        long total,
        int limit,
        int offset
) {}

package com.gatewayadmin.admin.history;

import com.gatewayadmin.admin.config.GatewayAdminProperties;
import com.gatewayadmin.admin.error.ValidationException;
import com.gatewayadmin.admin.model.ConfigType;
import com.gatewayadmin.admin.model.HistoryPage;
import com.gatewayadmin.admin.store.ConfigStore;
import org.springframework.stereotype.Service;

@Service
public class HistoryService {

    private final ConfigStore store;
    private final GatewayAdminProperties.History paging;

    public HistoryService(ConfigStore store, GatewayAdminProperties props) {
        this.store = store;
        this.paging = props.getHistory();
    }

    /**
     * Raw query values as they arrive; out-of-range limit/offset fall back to
     * the defaults instead of failing.
     */
    public HistoryPage query(String configType, Long configId, Integer limit, Integer offset) {
        ConfigType type = null;
        if (configType != null && !configType.isBlank()) {
            type = ConfigType.parse(configType)
                    .orElseThrow(() -> new ValidationException("invalid config_type (must be 'backend' or 'route')"));
        }
        return store.getHistory(type, configId, effectiveLimit(limit), effectiveOffset(offset));
    }

    int effectiveLimit(Integer limit) {
        if (limit == null || limit <= 0 || limit > paging.getMaxLimit()) {
            return paging.getDefaultLimit();
        }
        return limit;
    }

    static int effectiveOffset(Integer offset) {
        return (offset == null || offset < 0) ? 0 : offset;
    }
}

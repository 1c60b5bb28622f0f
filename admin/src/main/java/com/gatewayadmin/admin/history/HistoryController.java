package com.gatewayadmin.admin.history;

import com.gatewayadmin.admin.model.HistoryPage;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/history")
public class HistoryController {

    private final HistoryService service;

    public HistoryController(HistoryService service) {
        this.service = service;
    }

    // GET /api/v1/history?config_type=backend&config_id=1&limit=10&offset=0
    @GetMapping
    public HistoryPage list(
            @RequestParam(name = "config_type", required = false) String configType,
            @RequestParam(name = "config_id", required = false) Long configId,
            @RequestParam(required = false) String limit,
            @RequestParam(required = false) String offset
    ) {
        return service.query(configType, configId, parseOrNull(limit), parseOrNull(offset));
    }

    // unparsable paging values fall back to the defaults, like out-of-range ones
    static Integer parseOrNull(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return Integer.valueOf(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}

package com.gatewayadmin.admin.config;

import com.gatewayadmin.admin.model.Route;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "gateway-admin")
public class GatewayAdminProperties {

    /**
     * Request header carrying the operator identity recorded in history.
     */
    private String operatorHeader = "X-Operator";

    private History history = new History();
    private RouteDefaults route = new RouteDefaults();

    public String getOperatorHeader() { return operatorHeader; }
    public void setOperatorHeader(String operatorHeader) { this.operatorHeader = operatorHeader; }

    public History getHistory() { return history; }
    public void setHistory(History history) { this.history = history; }

    public RouteDefaults getRoute() { return route; }
    public void setRoute(RouteDefaults route) { this.route = route; }

    public static class History {
        private int defaultLimit = 50;
        private int maxLimit = 100;

        public int getDefaultLimit() { return defaultLimit; }
        public void setDefaultLimit(int defaultLimit) { this.defaultLimit = defaultLimit; }

        public int getMaxLimit() { return maxLimit; }
        public void setMaxLimit(int maxLimit) { this.maxLimit = maxLimit; }
    }

    public static class RouteDefaults {
        private int defaultTimeoutMs = Route.DEFAULT_TIMEOUT_MS;

        public int getDefaultTimeoutMs() { return defaultTimeoutMs; }
        public void setDefaultTimeoutMs(int defaultTimeoutMs) { this.defaultTimeoutMs = defaultTimeoutMs; }
    }
}
